package io.ngxdiscover.types;

import java.util.Objects;

/** An {@code error_log} directive. */
public record ErrorLog(String path, ErrorLogLevel level, LogContext context) {

  public ErrorLog {
    Objects.requireNonNull(path, "path");
    level = level == null ? ErrorLogLevel.ERROR : level;
    context = context == null ? LogContext.MAIN : context;
  }

  public static ErrorLog of(String path) {
    return new ErrorLog(path, ErrorLogLevel.ERROR, LogContext.MAIN);
  }
}
