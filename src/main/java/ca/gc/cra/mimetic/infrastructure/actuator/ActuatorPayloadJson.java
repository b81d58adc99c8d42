package ca.gc.cra.mimetic.infrastructure.actuator;

import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Serializes {@link ActuatorPayload} into the actuator wire format. */
public final class ActuatorPayloadJson {
  private static final JsonFactory FACTORY = new JsonFactory();

  private ActuatorPayloadJson() {}

  /**
   * Renders {@code {"x":..,"y":..,"z":..,"h":..,"ears":..,"ax":0,"ay":0,"az":-1,"duration_ms":..}}.
   *
   * @param payload command to encode
   * @return UTF-8 JSON bytes
   */
  public static byte[] encode(ActuatorPayload payload) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(160);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      write(gen, payload);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to encode actuator payload", ex);
    }
    return out.toByteArray();
  }

  static void write(JsonGenerator gen, ActuatorPayload payload) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("x", payload.x());
    gen.writeNumberField("y", payload.y());
    gen.writeNumberField("z", payload.z());
    gen.writeNumberField("h", payload.h());
    gen.writeNumberField("ears", payload.ears());
    gen.writeNumberField("ax", payload.ax());
    gen.writeNumberField("ay", payload.ay());
    gen.writeNumberField("az", payload.az());
    gen.writeNumberField("duration_ms", payload.durationMs());
    gen.writeEndObject();
  }
}
