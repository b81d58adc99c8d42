package ca.gc.cra.mimetic.infrastructure.poselog;

import ca.gc.cra.mimetic.application.port.PoseRecorder;
import ca.gc.cra.mimetic.domain.detect.Gaze;
import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import ca.gc.cra.mimetic.domain.motion.PoseRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends one JSON object per processed sample to a newline-delimited file.
 *
 * <p>Record shape: {@code {"timestamp":..,"sent":..,"axis":{"pitch":..,"roll":..,"yaw":..},
 * "actuator":{"x":..,...,"duration_ms":..},"height":..,"gaze":{"label":..,"ratio":..},"fps":..}}.
 * Unavailable numbers are written as {@code null}. Each line is flushed so the file can be tailed.</p>
 */
public final class NdjsonPoseRecorder implements PoseRecorder {
  private final JsonFactory factory = new JsonFactory();
  private final Path file;
  private final BufferedWriter writer;
  private boolean closed;

  /**
   * Opens (creating or appending to) the log file.
   *
   * @param file target file; parent directories are created
   * @throws IOException when the file cannot be opened
   */
  public NdjsonPoseRecorder(Path file) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
  }

  @Override
  public synchronized void record(PoseRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    if (closed) {
      throw new IOException("pose log " + file + " is closed");
    }
    writer.write(toJson(record));
    writer.newLine();
    writer.flush();
  }

  String toJson(PoseRecord record) throws IOException {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("timestamp", record.timestampMillis());
      gen.writeBooleanField("sent", record.sent());
      gen.writeObjectFieldStart("axis");
      writeNumber(gen, "pitch", record.pitch());
      writeNumber(gen, "roll", record.roll());
      writeNumber(gen, "yaw", record.yaw());
      gen.writeEndObject();
      ActuatorPayload payload = record.payload();
      gen.writeObjectFieldStart("actuator");
      gen.writeNumberField("x", payload.x());
      gen.writeNumberField("y", payload.y());
      gen.writeNumberField("z", payload.z());
      gen.writeNumberField("h", payload.h());
      gen.writeNumberField("ears", payload.ears());
      gen.writeNumberField("duration_ms", payload.durationMs());
      gen.writeEndObject();
      writeNumber(gen, "height", record.height());
      Gaze gaze = record.gaze();
      if (gaze == null) {
        gen.writeNullField("gaze");
      } else {
        gen.writeObjectFieldStart("gaze");
        gen.writeStringField("label", gaze.label().label());
        gen.writeNumberField("ratio", gaze.ratio());
        gen.writeEndObject();
      }
      writeNumber(gen, "fps", record.fps());
      gen.writeEndObject();
    }
    return out.toString();
  }

  private static void writeNumber(JsonGenerator gen, String name, double value) throws IOException {
    if (Double.isFinite(value)) {
      gen.writeNumberField(name, value);
    } else {
      gen.writeNullField(name);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (!closed) {
      closed = true;
      writer.close();
    }
  }
}
