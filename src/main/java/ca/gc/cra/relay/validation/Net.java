package ca.gc.cra.relay.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Broker address validation utilities for RELAY.
 *
 * <p>Accepts DNS host names, dotted-quad IPv4 addresses and IPv6 literals (optionally bracketed). No name
 * resolution happens for host names; an unresolvable name is reported at connect time.</p>
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a broker host.
   *
   * @param value host name, IPv4 address, or IPv6 literal with or without brackets
   * @return trimmed host; IPv6 literals are returned without brackets
   * @throws IllegalArgumentException if the host is blank or malformed
   */
  public static String validateHost(String value) {
    String sanitized = Strings.requireNonBlank("Host", value);
    if (sanitized.startsWith("[")) {
      if (!sanitized.endsWith("]")) {
        throw new IllegalArgumentException("Host must close IPv6 literal with ']'");
      }
      String literal = sanitized.substring(1, sanitized.length() - 1);
      validateIpv6(literal);
      return literal;
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
      return sanitized;
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      return sanitized;
    }
    validateHostname(sanitized);
    return sanitized;
  }

  /**
   * Indicates whether a validated host is an IPv6 literal and needs brackets inside a URI.
   *
   * @param host host returned by {@link #validateHost(String)}
   * @return {@code true} for IPv6 literals
   */
  public static boolean isIpv6Literal(String host) {
    return host != null && host.indexOf(':') >= 0;
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    final char first = s.charAt(start);
    final char last = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-' || c == '_')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  /** Validates a raw IPv6 literal; the bracketed form keeps the JDK from falling back to DNS. */
  private static void validateIpv6(String host) {
    if (host.isEmpty()) {
      throw new IllegalArgumentException("invalid IPv6 literal: empty");
    }
    try {
      final InetAddress address = InetAddress.getByName('[' + host + ']');
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
