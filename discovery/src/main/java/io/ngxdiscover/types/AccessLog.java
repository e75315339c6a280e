package io.ngxdiscover.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code access_log} directive.
 *
 * @param path log file path
 * @param formatName name of the {@code log_format} used, or {@code null} for the default
 * @param options {@code key=value} options such as {@code buffer=32k}, in declaration order
 * @param context where the directive was declared
 */
public record AccessLog(
    String path, String formatName, Map<String, String> options, LogContext context) {

  public AccessLog {
    Objects.requireNonNull(path, "path");
    options =
        options == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    context = context == null ? LogContext.MAIN : context;
  }

  public static AccessLog of(String path) {
    return new AccessLog(path, null, Map.of(), LogContext.MAIN);
  }

  public AccessLog withFormat(String format) {
    return new AccessLog(path, format, options, context);
  }

  public AccessLog withContext(LogContext newContext) {
    return new AccessLog(path, formatName, options, newContext);
  }

  public AccessLog withOption(String key, String value) {
    Map<String, String> next = new LinkedHashMap<>(options);
    next.put(key, value);
    return new AccessLog(path, formatName, next, context);
  }

  public Optional<String> format() {
    return Optional.ofNullable(formatName);
  }
}
