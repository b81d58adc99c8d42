package ca.gc.cra.mimetic.infrastructure.detect;

import ca.gc.cra.mimetic.domain.detect.DetectorKind;
import ca.gc.cra.mimetic.domain.detect.FaceReadings;
import ca.gc.cra.mimetic.domain.detect.GazeClassifier;
import ca.gc.cra.mimetic.domain.detect.LandmarkReadings;
import ca.gc.cra.mimetic.domain.detect.PoseReadings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Parses landmark service replies.
 *
 * <p>Expected shape: a flat JSON object with any of {@code pitch}, {@code roll}, {@code yaw}
 * (degrees), {@code height} and {@code gazeRatio}. Missing or {@code null} members mean "not
 * detected". Unknown members, including nested ones, are skipped.</p>
 */
final class LandmarkReplyParser {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses one reply.
   *
   * @param kind detector family the reply belongs to
   * @param body raw JSON bytes
   * @param gaze classifier fed with {@code gazeRatio}; face replies only, may be {@code null}
   * @return readings for {@code kind}
   * @throws IOException when the body is not a JSON object
   */
  LandmarkReadings parse(DetectorKind kind, byte[] body, GazeClassifier gaze) throws IOException {
    Objects.requireNonNull(kind, "kind");
    double pitch = Double.NaN;
    double roll = Double.NaN;
    double yaw = Double.NaN;
    double height = Double.NaN;
    double gazeRatio = Double.NaN;
    try (JsonParser parser = factory.createParser(body)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("landmark reply is not a JSON object");
      }
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          throw new IOException("Expected field name but found " + token);
        }
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
          parser.skipChildren();
          continue;
        }
        double number = value.isNumeric() ? parser.getDoubleValue() : Double.NaN;
        switch (field) {
          case "pitch" -> pitch = number;
          case "roll" -> roll = number;
          case "yaw" -> yaw = number;
          case "height" -> height = number;
          case "gazeRatio" -> gazeRatio = number;
          default -> {
            // ignored
          }
        }
      }
    }
    if (kind == DetectorKind.POSE) {
      return new PoseReadings(height);
    }
    boolean detected = !Double.isNaN(pitch) || !Double.isNaN(roll) || !Double.isNaN(yaw);
    if (gaze == null || !detected) {
      return new FaceReadings(pitch, roll, yaw, null);
    }
    OptionalDouble ratio = Double.isFinite(gazeRatio) ? OptionalDouble.of(gazeRatio) : OptionalDouble.empty();
    synchronized (gaze) {
      return new FaceReadings(pitch, roll, yaw, gaze.update(ratio));
    }
  }
}
