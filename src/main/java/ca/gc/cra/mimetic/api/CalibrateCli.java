package ca.gc.cra.mimetic.api;

import ca.gc.cra.mimetic.application.pipeline.InitializationException;
import ca.gc.cra.mimetic.application.pipeline.MimicSession;
import ca.gc.cra.mimetic.config.CompositionRoot;
import ca.gc.cra.mimetic.domain.motion.AngleOffset;
import ca.gc.cra.mimetic.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.mimetic.infrastructure.time.MonotonicClockAdapter;
import ca.gc.cra.mimetic.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures the neutral head pose and prints it. Nothing is sent to the actuators.
 *
 * @since 0.1.0
 */
public final class CalibrateCli {
  private static final Logger log = LoggerFactory.getLogger(CalibrateCli.class);
  private static final String MODE = "calibrate";
  static final String SUMMARY_USAGE =
      "usage: calibrate [config=PATH] [source=synthetic|images:DIR] [detector=synthetic|http] "
          + "[detectorEndpoint=HOST:PORT] [calibrationMs=N] [calibrationSamples=N] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      MIMETIC calibrate: measure the neutral head pose

      Usage:
        calibrate [config=PATH] [options]

      Options:
        source=synthetic|images:DIR  Camera source (default synthetic)
        detector=synthetic|http      Landmark backend (default synthetic)
        detectorEndpoint=HOST:PORT   Landmark service; required when detector=http
        calibrationMs=N              Collection window (default 2000)
        calibrationSamples=N         Stop early after N samples (default 10)
        firstFrameTimeoutMs=N        Give up when the camera is silent this long (default 5000)
        --dry-run                    Validate and print the plan without opening the camera
        --verbose                    Enable DEBUG logging
        --help                       Show this message

      Output:
        pitch=P roll=R yaw=Y          Mean angles in degrees, on stdout
      """;

  private CalibrateCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for calibrate command");
    }

    SessionCliSupport.Prepared prepared;
    try {
      prepared = SessionCliSupport.prepare(MODE, input, SUMMARY_USAGE);
    } catch (SessionCliSupport.CliAbort abort) {
      return abort.exitCode();
    }
    if (prepared.dryRun()) {
      CliPrinter.printLines(SessionCliSupport.plan(MODE, prepared));
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(prepared.telemetry())) {
      CompositionRoot root = new CompositionRoot(prepared.config(), metrics, new MonotonicClockAdapter());
      MimicSession session = root.buildSession();
      AngleOffset offset;
      try {
        session.initialize();
        offset = session.calibrate();
      } finally {
        session.stop();
      }
      CliPrinter.println(format(offset));
      return ExitCode.SUCCESS;
    } catch (InitializationException ex) {
      log.error("Calibration failed: {}", ex.getMessage());
      return ExitCode.INIT_FAILURE;
    } catch (IOException ex) {
      log.error("I/O failure during calibration", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Calibration configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Calibration interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during calibration", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static String format(AngleOffset offset) {
    return String.format(Locale.ROOT, "pitch=%.3f roll=%.3f yaw=%.3f",
        offset.pitch(), offset.roll(), offset.yaw());
  }
}
