package io.ngxdiscover.types;

import java.util.Objects;

/** The configuration level a log directive was declared at. */
public sealed interface LogContext permits LogContext.Main, LogContext.Server, LogContext.Location {

  LogContext MAIN = new Main();

  /** Short human readable form: {@code main}, {@code server example.com}, {@code location /api}. */
  String label();

  static LogContext server(String name) {
    return new Server(name);
  }

  static LogContext location(String path) {
    return new Location(path);
  }

  /** Top level or {@code http} block. */
  record Main() implements LogContext {
    @Override
    public String label() {
      return "main";
    }
  }

  /** A {@code server} block, named by its first {@code server_name}. */
  record Server(String name) implements LogContext {
    public Server {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String label() {
      return "server " + name;
    }
  }

  /** A {@code location} block, named by its path or pattern. */
  record Location(String path) implements LogContext {
    public Location {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public String label() {
      return "location " + path;
    }
  }
}
