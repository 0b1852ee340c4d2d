package ca.gc.cra.xlog.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for bind addresses and {@code host:port} targets.
 *
 * <p>Hosts may be hostnames, IPv4 dotted quads, or bracketed IPv6 literals in {@code host:port} form. No DNS lookups
 * are performed for hostnames.</p>
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern LABEL_PATTERN = Pattern.compile("\\A[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?\\z");

  private Net() {
    // Utility
  }

  /**
   * Parsed {@code host:port}.
   *
   * @param host host without IPv6 brackets
   * @param port port in {@code 1..65535}
   */
  public record HostPort(String host, int port) {
    /**
     * Returns an unresolved socket address for this endpoint.
     *
     * @return socket address
     */
    public InetSocketAddress toSocketAddress() {
      return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
      return (host.indexOf(':') >= 0 ? '[' + host + ']' : host) + ':' + port;
    }
  }

  /**
   * Parses and validates a {@code host:port} string.
   *
   * @param value candidate such as {@code localhost:12321} or {@code [::1]:12321}
   * @return parsed endpoint
   * @throws IllegalArgumentException when the host or port is invalid
   */
  public static HostPort parseHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
    }
    int port = (int) Numbers.parseRange("port", portPart, 1, 65535);
    return new HostPort(host, port);
  }

  /**
   * Validates a bind or target host: IPv4 dotted quad, hostname, or raw IPv6 literal.
   *
   * @param host candidate host
   * @return trimmed host
   * @throws IllegalArgumentException when invalid
   */
  public static String validateHost(String host) {
    String sanitized = Strings.requireNonBlank("host", host);
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
    } else if (IPV4_PATTERN.matcher(sanitized).matches()) {
      for (String octet : sanitized.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
    } else {
      validateHostname(sanitized);
    }
    return sanitized;
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + host.length() + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException(
            "invalid hostname: label length " + label.length() + " (must be 1.." + MAX_LABEL_LENGTH + ")");
      }
      if (!LABEL_PATTERN.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname label: " + label);
      }
    }
  }

  private static void validateIpv6(String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }
}
