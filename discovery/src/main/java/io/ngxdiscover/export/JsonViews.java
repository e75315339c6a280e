package io.ngxdiscover.export;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.parser.ast.Value;
import io.ngxdiscover.types.AccessLog;
import io.ngxdiscover.types.ErrorLog;
import io.ngxdiscover.types.ListenDirective;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.LogContext;
import io.ngxdiscover.types.LogFormat;
import io.ngxdiscover.types.Server;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Jackson tree models of the syntax tree and the typed views, shared by the JSON and YAML
 * exporters and the command line.
 */
public final class JsonViews {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private JsonViews() {}

  /** {@code {"directives": [...]}} with one node per top-level directive. */
  public static ObjectNode config(Config config) {
    ObjectNode root = NODES.objectNode();
    root.set("directives", directives(config.directives()));
    return root;
  }

  public static ArrayNode directives(List<Directive> directives) {
    ArrayNode array = NODES.arrayNode();
    for (Directive d : directives) {
      array.add(directive(d));
    }
    return array;
  }

  /** {@code name}, {@code args} (each with its type), {@code line} and, for blocks, {@code children}. */
  public static ObjectNode directive(Directive directive) {
    ObjectNode node = NODES.objectNode();
    node.put("name", directive.name());
    ArrayNode args = node.putArray("args");
    for (Value v : directive.args()) {
      ObjectNode arg = args.addObject();
      arg.put("type", valueType(v));
      arg.put("value", v.text());
    }
    node.put("line", directive.span().line());
    if (directive.isBlock()) {
      node.set("children", directives(directive.children()));
    }
    return node;
  }

  static String valueType(Value value) {
    if (value instanceof Value.Variable) {
      return "variable";
    } else if (value instanceof Value.SingleQuoted) {
      return "single_quoted";
    } else if (value instanceof Value.DoubleQuoted) {
      return "double_quoted";
    }
    return "literal";
  }

  public static ArrayNode servers(List<Server> servers) {
    ArrayNode array = NODES.arrayNode();
    for (Server s : servers) {
      ObjectNode node = array.addObject();
      strings(node.putArray("server_names"), s.serverNames());
      ArrayNode listen = node.putArray("listen");
      for (ListenDirective l : s.listen()) {
        listen.add(listen(l));
      }
      putNullable(node, "root", s.root());
      strings(node.putArray("index"), s.index());
      node.put("ssl", s.hasSsl());
      node.put("default_server", s.isDefaultServer());
      node.set("locations", locations(s.locations()));
      node.set("access_logs", accessLogs(s.accessLogs()));
      node.set("error_logs", errorLogs(s.errorLogs()));
    }
    return array;
  }

  public static ObjectNode listen(ListenDirective l) {
    ObjectNode node = NODES.objectNode();
    node.put("address", l.address());
    node.put("port", l.port());
    node.put("ssl", l.ssl());
    node.put("http2", l.http2());
    node.put("http3", l.http3());
    node.put("default_server", l.defaultServer());
    node.put("reuseport", l.reuseport());
    if (l.backlog() != null) {
      node.put("backlog", l.backlog());
    }
    return node;
  }

  public static ArrayNode locations(List<Location> locations) {
    ArrayNode array = NODES.arrayNode();
    for (Location l : locations) {
      ObjectNode node = array.addObject();
      node.put("path", l.path());
      node.put("modifier", l.modifier().name().toLowerCase(Locale.ROOT));
      putNullable(node, "root", l.root());
      putNullable(node, "proxy_pass", l.proxyPass());
      node.set("access_logs", accessLogs(l.accessLogs()));
    }
    return array;
  }

  public static ArrayNode accessLogs(List<AccessLog> logs) {
    ArrayNode array = NODES.arrayNode();
    for (AccessLog log : logs) {
      ObjectNode node = array.addObject();
      node.put("path", log.path());
      putNullable(node, "format", log.formatName());
      ObjectNode options = node.putObject("options");
      for (Map.Entry<String, String> e : log.options().entrySet()) {
        options.put(e.getKey(), e.getValue());
      }
      node.set("context", context(log.context()));
    }
    return array;
  }

  public static ArrayNode errorLogs(List<ErrorLog> logs) {
    ArrayNode array = NODES.arrayNode();
    for (ErrorLog log : logs) {
      ObjectNode node = array.addObject();
      node.put("path", log.path());
      node.put("level", log.level().label());
      node.set("context", context(log.context()));
    }
    return array;
  }

  public static ArrayNode logFormats(List<LogFormat> formats) {
    ArrayNode array = NODES.arrayNode();
    for (LogFormat f : formats) {
      ObjectNode node = array.addObject();
      node.put("name", f.name());
      node.put("pattern", f.pattern());
      strings(node.putArray("variables"), f.variables());
    }
    return array;
  }

  static ObjectNode context(LogContext context) {
    ObjectNode node = NODES.objectNode();
    if (context instanceof LogContext.Server server) {
      node.put("type", "server");
      node.put("name", server.name());
    } else if (context instanceof LogContext.Location location) {
      node.put("type", "location");
      node.put("path", location.path());
    } else {
      node.put("type", "main");
    }
    return node;
  }

  private static void strings(ArrayNode array, List<String> values) {
    for (String v : values) {
      array.add(v);
    }
  }

  private static void putNullable(ObjectNode node, String field, String value) {
    if (value == null) {
      node.putNull(field);
    } else {
      node.put(field, value);
    }
  }
}
