package ca.gc.cra.mimetic.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for actuator and detector addresses.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a {@code host:port} string supporting hostnames, IPv4, and bracketed IPv6 literals.
   *
   * @param value candidate endpoint
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException when the endpoint is malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    String normalizedHost;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      host = sanitized.substring(1, idx);
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
      normalizedHost = '[' + host + ']';
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        validateIpv4Octets(host);
      } else {
        validateHostname(host);
      }
      normalizedHost = host;
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return normalizedHost + ':' + port;
  }

  /**
   * Builds an HTTP URI for a validated endpoint and absolute path.
   *
   * @param hostPort endpoint accepted by {@link #validateHostPort(String)}
   * @param path absolute request path such as {@code /position}
   * @return request URI
   */
  public static URI httpUri(String hostPort, String path) {
    String normalized = validateHostPort(hostPort);
    String effectivePath = Strings.requireNonBlank("path", path);
    if (!effectivePath.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/' (was " + effectivePath + ")");
    }
    return URI.create("http://" + normalized + effectivePath);
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len);
    }
    for (String label : host.split("\\.", -1)) {
      validateLabel(label);
    }
  }

  private static void validateLabel(String label) {
    if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + label.length());
    }
    if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = 1; i < label.length() - 1; i++) {
      char c = label.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
