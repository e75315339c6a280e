package io.ngxdiscover.extract;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.types.AccessLog;
import io.ngxdiscover.types.ErrorLog;
import io.ngxdiscover.types.ErrorLogLevel;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.LogContext;
import io.ngxdiscover.types.LogFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Collects log related directives from a parsed configuration. */
public final class LogExtractor {
  private static final Logger log = LoggerFactory.getLogger(LogExtractor.class);

  static final String UNNAMED_SERVER = "_";

  private LogExtractor() {}

  /**
   * Returns every {@code log_format} with a name and a pattern, at any depth. Multi-part patterns
   * are joined with single spaces.
   */
  public static List<LogFormat> logFormats(Config config) {
    List<LogFormat> formats = new ArrayList<>();
    for (Directive d : config.findDirectivesRecursive("log_format")) {
      List<String> args = d.argsAsStrings();
      if (args.size() < 2) {
        log.debug("Skipping log_format without pattern at {}", d.span());
        continue;
      }
      formats.add(LogFormat.of(args.get(0), String.join(" ", args.subList(1, args.size()))));
    }
    log.debug("Extracted {} log formats", formats.size());
    return formats;
  }

  /**
   * Returns the access logs of the configuration, in this order: top level and {@code http} level
   * ({@link LogContext#MAIN}), then for each server its own logs followed by the logs of its
   * locations. Disabled logs ({@code access_log off}) are skipped.
   */
  public static List<AccessLog> accessLogs(Config config) {
    List<AccessLog> logs = new ArrayList<>();
    for (Directive d : mainLevel(config, "access_log")) {
      parseAccessLog(d, LogContext.MAIN).ifPresent(logs::add);
    }
    for (Directive server : config.findDirectivesRecursive("server")) {
      LogContext serverContext = LogContext.server(serverName(server));
      for (Directive d : server.findChildren("access_log")) {
        parseAccessLog(d, serverContext).ifPresent(logs::add);
      }
      for (Directive location : server.findRecursive("location")) {
        LogContext locationContext =
            LogContext.location(Location.fromArgs(location.argsAsStrings()).path());
        for (Directive d : location.findChildren("access_log")) {
          parseAccessLog(d, locationContext).ifPresent(logs::add);
        }
      }
    }
    log.debug("Extracted {} access logs", logs.size());
    return logs;
  }

  /** Returns the top level, {@code http} level and server level error logs. */
  public static List<ErrorLog> errorLogs(Config config) {
    List<ErrorLog> logs = new ArrayList<>();
    for (Directive d : mainLevel(config, "error_log")) {
      parseErrorLog(d, LogContext.MAIN).ifPresent(logs::add);
    }
    for (Directive server : config.findDirectivesRecursive("server")) {
      LogContext context = LogContext.server(serverName(server));
      for (Directive d : server.findChildren("error_log")) {
        parseErrorLog(d, context).ifPresent(logs::add);
      }
    }
    log.debug("Extracted {} error logs", logs.size());
    return logs;
  }

  private static List<Directive> mainLevel(Config config, String name) {
    List<Directive> out = new ArrayList<>(config.findDirectives(name));
    for (Directive http : config.findDirectives("http")) {
      out.addAll(http.findChildren(name));
    }
    return out;
  }

  /** Returns the first argument of the first {@code server_name}, or {@code _}. */
  static String serverName(Directive server) {
    return server.findChildren("server_name").stream()
        .findFirst()
        .flatMap(Directive::firstArg)
        .orElse(UNNAMED_SERVER);
  }

  /**
   * Interprets an {@code access_log} directive: path, optional format name (a second argument
   * without {@code =}), then {@code key=value} options. Arguments that are neither are ignored.
   */
  static Optional<AccessLog> parseAccessLog(Directive directive, LogContext context) {
    List<String> args = directive.argsAsStrings();
    if (args.isEmpty() || args.get(0).equals("off")) {
      return Optional.empty();
    }
    AccessLog accessLog = AccessLog.of(args.get(0)).withContext(context);
    int firstOption = 1;
    if (args.size() > 1 && args.get(1).indexOf('=') < 0) {
      accessLog = accessLog.withFormat(args.get(1));
      firstOption = 2;
    }
    for (String arg : args.subList(Math.min(firstOption, args.size()), args.size())) {
      int eq = arg.indexOf('=');
      if (eq >= 0) {
        accessLog = accessLog.withOption(arg.substring(0, eq), arg.substring(eq + 1));
      }
    }
    return Optional.of(accessLog);
  }

  static Optional<ErrorLog> parseErrorLog(Directive directive, LogContext context) {
    List<String> args = directive.argsAsStrings();
    if (args.isEmpty()) {
      return Optional.empty();
    }
    ErrorLogLevel level = args.size() > 1 ? ErrorLogLevel.parse(args.get(1)) : ErrorLogLevel.ERROR;
    return Optional.of(new ErrorLog(args.get(0), level, context));
  }
}
