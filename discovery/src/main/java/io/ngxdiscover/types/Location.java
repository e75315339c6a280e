package io.ngxdiscover.types;

import java.util.List;
import java.util.Objects;

/**
 * A {@code location} block of a server.
 *
 * @param path the matched path or regex pattern, without the modifier
 * @param modifier how {@code path} is matched
 * @param root document root, or {@code null}
 * @param proxyPass upstream URL of {@code proxy_pass}, or {@code null}
 * @param accessLogs access logs declared directly in the block
 */
public record Location(
    String path,
    LocationModifier modifier,
    String root,
    String proxyPass,
    List<AccessLog> accessLogs) {

  public Location {
    Objects.requireNonNull(path, "path");
    modifier = modifier == null ? LocationModifier.NONE : modifier;
    accessLogs = accessLogs == null ? List.of() : List.copyOf(accessLogs);
  }

  /**
   * Creates a location from the arguments of a {@code location} directive. Without arguments the
   * path is {@code /}; a prefix modifier without a path also yields {@code /}, a regex modifier
   * without a pattern an empty pattern.
   */
  public static Location fromArgs(List<String> args) {
    if (args == null || args.isEmpty()) {
      return new Location("/", LocationModifier.NONE, null, null, List.of());
    }
    LocationModifier modifier = LocationModifier.fromSymbol(args.get(0));
    if (modifier == LocationModifier.NONE) {
      return new Location(args.get(0), modifier, null, null, List.of());
    }
    String fallback = modifier.isRegex() ? "" : "/";
    String path = args.size() > 1 ? args.get(1) : fallback;
    return new Location(path, modifier, null, null, List.of());
  }

  public Location withRoot(String newRoot) {
    return new Location(path, modifier, newRoot, proxyPass, accessLogs);
  }

  public Location withProxyPass(String upstream) {
    return new Location(path, modifier, root, upstream, accessLogs);
  }

  public Location withAccessLogs(List<AccessLog> logs) {
    return new Location(path, modifier, root, proxyPass, logs);
  }

  public boolean isProxy() {
    return proxyPass != null;
  }

  public boolean isStatic() {
    return root != null && proxyPass == null;
  }

  /** Returns the location as written: modifier and path. */
  public String display() {
    return modifier == LocationModifier.NONE ? path : modifier.symbol() + " " + path;
  }
}
