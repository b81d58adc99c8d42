package ca.gc.cra.mimetic.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("robot.local:8000", Net.validateHostPort(" robot.local:8000 "));
  }

  @Test
  void validateHostPortHandlesIpv4() {
    assertEquals("127.0.0.1:8000", Net.validateHostPort("127.0.0.1:8000"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[::1]:8700", Net.validateHostPort("[::1]:8700"));
  }

  @Test
  void validateHostPortRejectsMissingOrInvalidPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:http"));
  }

  @Test
  void validateHostPortRejectsBadHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1:80"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("-bad.host:80"));
  }

  @Test
  void httpUriAppendsPath() {
    assertEquals(URI.create("http://10.0.0.7:8000/position"), Net.httpUri("10.0.0.7:8000", "/position"));
    assertThrows(IllegalArgumentException.class, () -> Net.httpUri("10.0.0.7:8000", "position"));
  }
}
