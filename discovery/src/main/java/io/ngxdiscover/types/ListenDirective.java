package io.ngxdiscover.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code listen} directive of a server block.
 *
 * @param address bind address; {@code *} when only a port is given
 * @param port bind port; 80 when the address carries none
 * @param backlog value of {@code backlog=N}, or {@code null}
 */
public record ListenDirective(
    String address,
    int port,
    boolean ssl,
    boolean http2,
    boolean http3,
    boolean defaultServer,
    boolean reuseport,
    Integer backlog) {

  public static final int DEFAULT_PORT = 80;

  public ListenDirective {
    Objects.requireNonNull(address, "address");
  }

  public static ListenDirective of(String address, int port) {
    return new ListenDirective(address, port, false, false, false, false, false, null);
  }

  /**
   * Interprets the arguments of a {@code listen} directive. The first argument is the address, any
   * further arguments are options; unknown options are ignored.
   *
   * @return the listen directive, or empty when there are no arguments
   */
  public static Optional<ListenDirective> fromArgs(List<String> args) {
    if (args == null || args.isEmpty()) {
      return Optional.empty();
    }
    Endpoint endpoint = parseAddress(args.get(0));
    boolean ssl = false;
    boolean http2 = false;
    boolean http3 = false;
    boolean defaultServer = false;
    boolean reuseport = false;
    Integer backlog = null;
    for (String arg : args.subList(1, args.size())) {
      switch (arg) {
        case "ssl":
          ssl = true;
          break;
        case "http2":
          http2 = true;
          break;
        case "http3":
          http3 = true;
          break;
        case "default_server":
        case "default":
          defaultServer = true;
          break;
        case "reuseport":
          reuseport = true;
          break;
        default:
          if (arg.startsWith("backlog=")) {
            backlog = parseUnsigned(arg.substring("backlog=".length()));
          }
      }
    }
    return Optional.of(
        new ListenDirective(
            endpoint.address(),
            endpoint.port(),
            ssl,
            http2,
            http3,
            defaultServer,
            reuseport,
            backlog));
  }

  /** Returns {@code address:port}, with IPv6 addresses in brackets. */
  public String endpoint() {
    boolean ipv6 = address.indexOf(':') >= 0 && !address.startsWith("unix:");
    return (ipv6 ? "[" + address + "]" : address) + ":" + port;
  }

  private record Endpoint(String address, int port) {}

  private static Endpoint parseAddress(String addr) {
    Integer bare = parsePort(addr);
    if (bare != null) {
      return new Endpoint("*", bare);
    }
    if (addr.startsWith("[")) {
      int close = addr.indexOf(']');
      if (close > 0 && addr.startsWith(":", close + 1)) {
        Integer port = parsePort(addr.substring(close + 2));
        if (port != null) {
          return new Endpoint(addr.substring(1, close), port);
        }
      }
    }
    int colon = addr.lastIndexOf(':');
    if (colon >= 0) {
      Integer port = parsePort(addr.substring(colon + 1));
      if (port != null) {
        return new Endpoint(addr.substring(0, colon), port);
      }
    }
    return new Endpoint(addr, DEFAULT_PORT);
  }

  /** Parses a TCP port number, returning {@code null} when the text is not one. */
  public static Integer parsePort(String text) {
    Integer value = parseUnsigned(text);
    return value != null && value <= 65535 ? value : null;
  }

  private static Integer parseUnsigned(String text) {
    if (text == null || text.isEmpty() || text.length() > 10) {
      return null;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        return null;
      }
    }
    long value = Long.parseLong(text);
    return value <= Integer.MAX_VALUE ? (int) value : null;
  }
}
