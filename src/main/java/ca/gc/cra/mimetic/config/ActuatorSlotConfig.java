package ca.gc.cra.mimetic.config;

import ca.gc.cra.mimetic.validation.Net;
import ca.gc.cra.mimetic.validation.Strings;
import java.net.URI;

/**
 * One named actuator output.
 *
 * @param name slot identifier ({@code [A-Za-z0-9_-]}, used in metric names)
 * @param endpoint validated {@code host:port} of the actuator controller
 * @param enabled whether the slot receives payloads from the start
 */
public record ActuatorSlotConfig(String name, String endpoint, boolean enabled) {
  /** Path the actuator controller accepts positions on. */
  public static final String POSITION_PATH = "/position";

  public ActuatorSlotConfig {
    name = Strings.requireIdentifier("actuator name", name);
    endpoint = Net.validateHostPort(endpoint);
  }

  /** @return {@code http://<endpoint>/position} */
  public URI positionUri() {
    return Net.httpUri(endpoint, POSITION_PATH);
  }
}
