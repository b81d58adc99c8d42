package ca.gc.cra.mimetic.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes usage text, dry-run plans and calibration results to stdout. Logging goes to stderr through
 * Logback, so this output stays machine-readable.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  public static void println(String message) {
    PrintWriter out = out();
    out.println(message);
    out.flush();
  }

  /**
   * Prints each line in order; {@code null} prints nothing.
   *
   * @param lines lines to print
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = out();
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer == null ? STDOUT : writer;
  }
}
