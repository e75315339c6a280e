package io.ngxdiscover.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.ngxdiscover.extract.LogExtractor;
import io.ngxdiscover.extract.ServerExtractor;
import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.error.SerializationException;
import io.ngxdiscover.types.AccessLog;
import io.ngxdiscover.types.ListenDirective;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.LogFormat;
import io.ngxdiscover.types.Server;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes a parsed configuration as JSON, YAML or a Markdown report. */
public final class Exporters {
  private static final Logger log = LoggerFactory.getLogger(Exporters.class);

  public static final String GENERATOR = "nginx-discover";

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(
          YAMLFactory.builder()
              .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
              .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
              .build());

  private Exporters() {}

  /**
   * Applies the filter of the options, if any, and writes the result in the requested format. The
   * writer is flushed but not closed.
   *
   * @throws SerializationException if the output cannot be produced or written
   */
  public static void export(Config config, Writer out, ExportOptions options) {
    Config filtered = options.filter().map(f -> f.apply(config)).orElse(config);
    log.debug(
        "Exporting {} directives as {} ({})",
        filtered.countDirectives(),
        options.format(),
        options.filter().map(Filter::toString).orElse("no filter"));
    String text;
    switch (options.format()) {
      case JSON:
        text = write(tree(filtered, options), ExportFormat.JSON, options.pretty());
        break;
      case YAML:
        text = write(tree(filtered, options), ExportFormat.YAML, true);
        break;
      case MARKDOWN:
        text = markdown(filtered, options);
        break;
      default:
        throw new IllegalStateException("Unhandled format " + options.format());
    }
    try {
      out.write(text);
      out.flush();
    } catch (IOException e) {
      throw new SerializationException("cannot write " + options.format() + " output", e);
    }
  }

  /** Exports to a string. */
  public static String exportToString(Config config, ExportOptions options) {
    StringWriter out = new StringWriter();
    export(config, out, options);
    return out.toString();
  }

  /**
   * Renders a Jackson tree as JSON or YAML, ending with a newline.
   *
   * @throws SerializationException if Jackson fails
   */
  public static String write(JsonNode node, ExportFormat format, boolean pretty) {
    try {
      switch (format) {
        case JSON:
          String json =
              pretty
                  ? JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                  : JSON_MAPPER.writeValueAsString(node);
          return json + "\n";
        case YAML:
          return YAML_MAPPER.writeValueAsString(node);
        default:
          throw new IllegalArgumentException(format + " is not a tree format");
      }
    } catch (JsonProcessingException e) {
      throw new SerializationException(e.getOriginalMessage(), e);
    }
  }

  /** Reads JSON back into a tree, for callers that post-process an export. */
  public static JsonNode readJson(String json) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SerializationException(e.getOriginalMessage(), e);
    }
  }

  static ObjectNode tree(Config config, ExportOptions options) {
    ObjectNode root = JSON_MAPPER.createObjectNode();
    if (options.includeMetadata()) {
      ObjectNode metadata = root.putObject("metadata");
      metadata.put("generator", GENERATOR);
      metadata.put("directives", config.directives().size());
      metadata.put("total_directives", config.countDirectives());
      options.filter().ifPresent(f -> metadata.put("filter", f.toString()));
    }
    root.setAll(JsonViews.config(config));
    return root;
  }

  static String markdown(Config config, ExportOptions options) {
    StringBuilder md = new StringBuilder();
    md.append("# NGINX Configuration Report\n\n");

    if (options.includeMetadata()) {
      md.append("## Metadata\n\n");
      md.append("- **Generator**: ").append(GENERATOR).append('\n');
      md.append("- **Directives**: ").append(config.directives().size()).append('\n');
      md.append("- **Total directives**: ").append(config.countDirectives()).append('\n');
      options.filter().ifPresent(f -> md.append("- **Filter**: `").append(f).append("`\n"));
      md.append('\n');
    }

    List<Server> servers = ServerExtractor.servers(config);
    md.append("## Servers (").append(servers.size()).append(" total)\n\n");
    for (int i = 0; i < servers.size(); i++) {
      Server server = servers.get(i);
      md.append("### Server ").append(i + 1).append("\n\n");
      if (!server.serverNames().isEmpty()) {
        md.append("- **Server Names**: ").append(String.join(", ", server.serverNames())).append('\n');
      }
      if (!server.listen().isEmpty()) {
        md.append("- **Listen**: ")
            .append(
                server.listen().stream()
                    .map(Exporters::describeListen)
                    .collect(Collectors.joining(", ")))
            .append('\n');
      }
      if (server.root() != null) {
        md.append("- **Root**: ").append(server.root()).append('\n');
      }
      if (!server.locations().isEmpty()) {
        md.append("- **Locations**:\n");
        for (Location l : server.locations()) {
          md.append("  - `").append(l.display()).append('`');
          if (l.isProxy()) {
            md.append(" -> ").append(l.proxyPass());
          } else if (l.root() != null) {
            md.append(" (root ").append(l.root()).append(')');
          }
          md.append('\n');
        }
      }
      md.append('\n');
    }

    List<LogFormat> formats = LogExtractor.logFormats(config);
    if (!formats.isEmpty()) {
      md.append("## Log Formats\n\n");
      for (LogFormat f : formats) {
        md.append("- **").append(f.name()).append("**: `").append(f.pattern()).append("`\n");
      }
      md.append('\n');
    }

    List<AccessLog> accessLogs = LogExtractor.accessLogs(config);
    if (!accessLogs.isEmpty()) {
      md.append("## Access Logs\n\n");
      md.append("| Path | Format | Context |\n");
      md.append("|------|--------|---------|\n");
      for (AccessLog a : accessLogs) {
        md.append("| ")
            .append(a.path())
            .append(" | ")
            .append(a.format().orElse("-"))
            .append(" | ")
            .append(a.context().label())
            .append(" |\n");
      }
      md.append('\n');
    }
    return md.toString();
  }

  private static String describeListen(ListenDirective l) {
    return l.ssl() ? l.endpoint() + " (ssl)" : l.endpoint();
  }
}
