package ca.gc.cra.mimetic.infrastructure.actuator;

import ca.gc.cra.mimetic.application.port.ActuatorClient;
import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import ca.gc.cra.mimetic.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts actuator payloads as JSON. Only the status code is interpreted: 2xx succeeds, anything else
 * raises {@link IOException} carrying the (truncated) response body.
 */
public final class HttpActuatorClient implements ActuatorClient {
  /** Default request timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);
  private static final int ERROR_BODY_LIMIT = 256;

  private final URI endpoint;
  private final HttpClient client;
  private final Duration timeout;

  public HttpActuatorClient(URI endpoint, HttpClient client, Duration timeout) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.client = Objects.requireNonNull(client, "client");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public void post(ActuatorPayload payload) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(ActuatorPayloadJson.encode(payload)))
        .build();
    HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new IOException("HTTP " + status + " from " + endpoint + ": "
          + Logs.truncate(response.body(), ERROR_BODY_LIMIT));
    }
  }

  @Override
  public String endpoint() {
    return endpoint.toString();
  }
}
