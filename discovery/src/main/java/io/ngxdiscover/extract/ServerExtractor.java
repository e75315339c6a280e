package io.ngxdiscover.extract;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.types.AccessLog;
import io.ngxdiscover.types.ListenDirective;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.LogContext;
import io.ngxdiscover.types.Server;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds typed {@link Server} views from the {@code server} blocks of a configuration. */
public final class ServerExtractor {
  private static final Logger log = LoggerFactory.getLogger(ServerExtractor.class);

  private ServerExtractor() {}

  /** Returns every {@code server} block at any depth, in source order. */
  public static List<Server> servers(Config config) {
    List<Server> servers = new ArrayList<>();
    for (Directive d : config.findDirectivesRecursive("server")) {
      if (d.isBlock()) {
        servers.add(server(d));
      }
    }
    log.debug("Extracted {} servers", servers.size());
    return servers;
  }

  /** Reads one {@code server} block. Directives other than the ones modelled by Server are ignored. */
  public static Server server(Directive directive) {
    Server.Builder builder = Server.builder();
    LogContext context = LogContext.server(LogExtractor.serverName(directive));
    for (Directive child : directive.children()) {
      switch (child.name()) {
        case "server_name":
          child.argsAsStrings().forEach(builder::serverName);
          break;
        case "listen":
          ListenDirective.fromArgs(child.argsAsStrings()).ifPresent(builder::listen);
          break;
        case "root":
          child.firstArg().ifPresent(builder::root);
          break;
        case "index":
          child.argsAsStrings().forEach(builder::index);
          break;
        case "access_log":
          LogExtractor.parseAccessLog(child, context).ifPresent(builder::accessLog);
          break;
        case "error_log":
          LogExtractor.parseErrorLog(child, context).ifPresent(builder::errorLog);
          break;
        case "location":
          if (child.isBlock()) {
            builder.location(location(child));
          }
          break;
        default:
          break;
      }
    }
    return builder.build();
  }

  /** Reads one {@code location} block: its path, root, proxy target and access logs. */
  public static Location location(Directive directive) {
    Location location = Location.fromArgs(directive.argsAsStrings());
    LogContext context = LogContext.location(location.path());
    List<AccessLog> logs = new ArrayList<>();
    for (Directive child : directive.children()) {
      switch (child.name()) {
        case "root":
          location = child.firstArg().map(location::withRoot).orElse(location);
          break;
        case "proxy_pass":
          location = child.firstArg().map(location::withProxyPass).orElse(location);
          break;
        case "access_log":
          LogExtractor.parseAccessLog(child, context).ifPresent(logs::add);
          break;
        default:
          break;
      }
    }
    return location.withAccessLogs(logs);
  }

  /** Returns the locations of every server, including nested locations, in source order. */
  public static List<Location> locations(Config config) {
    List<Location> out = new ArrayList<>();
    for (Directive server : config.findDirectivesRecursive("server")) {
      for (Directive d : server.findRecursive("location")) {
        if (d.isBlock()) {
          out.add(location(d));
        }
      }
    }
    return out;
  }
}
