package io.ngxdiscover.types;

import java.util.Locale;

/** Severity threshold of an {@code error_log}, from most to least verbose. */
public enum ErrorLogLevel {
  DEBUG,
  INFO,
  NOTICE,
  WARN,
  ERROR,
  CRIT,
  ALERT,
  EMERG;

  /**
   * Maps an nginx level name to a level. Unknown names fall back to {@link #ERROR}, the level nginx
   * uses when none is given.
   */
  public static ErrorLogLevel parse(String name) {
    if (name == null) {
      return ERROR;
    }
    switch (name.toLowerCase(Locale.ROOT)) {
      case "debug":
        return DEBUG;
      case "info":
        return INFO;
      case "notice":
        return NOTICE;
      case "warn":
        return WARN;
      case "crit":
        return CRIT;
      case "alert":
        return ALERT;
      case "emerg":
        return EMERG;
      default:
        return ERROR;
    }
  }

  /** Returns the level as written in nginx configuration. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
