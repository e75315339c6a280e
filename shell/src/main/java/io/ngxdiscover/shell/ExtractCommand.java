package io.ngxdiscover.shell;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ngxdiscover.NginxDiscovery;
import io.ngxdiscover.export.ExportFormat;
import io.ngxdiscover.export.Exporters;
import io.ngxdiscover.export.Filter;
import io.ngxdiscover.export.FilterType;
import io.ngxdiscover.export.JsonViews;
import io.ngxdiscover.parser.error.ConfigIoException;
import io.ngxdiscover.shell.render.TableRenderer;
import io.ngxdiscover.types.AccessLog;
import io.ngxdiscover.types.ListenDirective;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.LogFormat;
import io.ngxdiscover.types.Server;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine;

@CommandLine.Command(
    name = "extract",
    description = "Extract servers, logs or locations",
    mixinStandardHelpOptions = true,
    subcommands = {
      ExtractCommand.Servers.class,
      ExtractCommand.Logs.class,
      ExtractCommand.Locations.class
    })
public class ExtractCommand implements Callable<Integer> {

  enum Format {
    TABLE,
    JSON,
    YAML
  }

  @CommandLine.ParentCommand private Main main;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @Override
  public Integer call() {
    main.out().error(spec.commandLine().getUsageMessage());
    return 2;
  }

  /** Output options shared by the extract subcommands. */
  static class OutputOptions {
    @CommandLine.Option(
        names = {"-f", "--format"},
        defaultValue = "table",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    Format format;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write to this file instead of stdout")
    Path output;
  }

  @CommandLine.Command(
      name = "servers",
      description = "List server blocks",
      mixinStandardHelpOptions = true)
  static class Servers implements Callable<Integer> {
    @CommandLine.ParentCommand private ExtractCommand parent;

    @CommandLine.Mixin private OutputOptions options;

    @CommandLine.Option(names = "--ssl-only", description = "Only servers with an ssl listener")
    private boolean sslOnly;

    @CommandLine.Option(names = "--port", description = "Only servers listening on this port")
    private Integer port;

    @CommandLine.Option(
        names = "--name",
        description = "Only servers with a matching server_name (* wildcard)")
    private String name;

    @Override
    public Integer call() {
      List<Filter> filters = new ArrayList<>();
      if (sslOnly) {
        filters.add(new Filter(FilterType.SSL_ONLY, null));
      }
      if (port != null) {
        filters.add(new Filter(FilterType.PORT, port.toString()));
      }
      if (name != null) {
        filters.add(new Filter(FilterType.SERVER_NAME, name));
      }
      List<Server> servers =
          parent.main.load().servers().stream()
              .filter(s -> filters.stream().allMatch(f -> f.matches(s)))
              .collect(Collectors.toList());

      List<Map<String, Object>> rows = new ArrayList<>();
      for (Server s : servers) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("server_name", s.serverNames().isEmpty() ? "_" : s.serverNames());
        row.put(
            "listen",
            s.listen().stream().map(ListenDirective::endpoint).collect(Collectors.toList()));
        row.put("ssl", s.hasSsl());
        row.put("default", s.isDefaultServer());
        row.put("locations", s.locations().size());
        row.put("root", s.root());
        rows.add(row);
      }
      parent.emit(options, JsonViews.servers(servers), rows);
      return 0;
    }
  }

  @CommandLine.Command(
      name = "logs",
      description = "List access logs",
      mixinStandardHelpOptions = true)
  static class Logs implements Callable<Integer> {
    @CommandLine.ParentCommand private ExtractCommand parent;

    @CommandLine.Mixin private OutputOptions options;

    @CommandLine.Option(names = "--with-formats", description = "Include the log_format definitions")
    private boolean withFormats;

    @CommandLine.Option(
        names = "--context",
        description = "Only logs whose context (main, server or location) contains this text")
    private String context;

    @Override
    public Integer call() {
      NginxDiscovery discovery = parent.main.load();
      List<AccessLog> logs = discovery.accessLogs();
      if (context != null) {
        String needle = context.toLowerCase(Locale.ROOT);
        logs =
            logs.stream()
                .filter(l -> l.context().label().toLowerCase(Locale.ROOT).contains(needle))
                .collect(Collectors.toList());
      }
      List<LogFormat> formats = withFormats ? discovery.logFormats() : List.of();

      ObjectNode tree = JsonNodeFactory.instance.objectNode();
      tree.set("logs", JsonViews.accessLogs(logs));
      if (withFormats) {
        tree.set("formats", JsonViews.logFormats(formats));
      }

      List<Map<String, Object>> rows = new ArrayList<>();
      for (AccessLog l : logs) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("path", l.path());
        row.put("format", l.format().orElse("-"));
        row.put("context", l.context().label());
        row.put(
            "options",
            l.options().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.toList()));
        rows.add(row);
      }
      List<Map<String, Object>> formatRows = new ArrayList<>();
      for (LogFormat f : formats) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", f.name());
        row.put("variables", f.variables().size());
        row.put("pattern", f.pattern());
        formatRows.add(row);
      }
      parent.emit(options, tree, rows, formatRows);
      return 0;
    }
  }

  @CommandLine.Command(
      name = "locations",
      description = "List location blocks of each server",
      mixinStandardHelpOptions = true)
  static class Locations implements Callable<Integer> {
    @CommandLine.ParentCommand private ExtractCommand parent;

    @CommandLine.Mixin private OutputOptions options;

    @CommandLine.Option(names = "--proxy-only", description = "Only locations with proxy_pass")
    private boolean proxyOnly;

    @CommandLine.Option(names = "--static-only", description = "Only locations serving files")
    private boolean staticOnly;

    @CommandLine.Option(
        names = "--server",
        description = "Only locations of servers with a matching server_name (* wildcard)")
    private String server;

    @Override
    public Integer call() {
      Filter serverFilter = server == null ? null : new Filter(FilterType.SERVER_NAME, server);
      ArrayNode tree = JsonNodeFactory.instance.arrayNode();
      List<Map<String, Object>> rows = new ArrayList<>();
      for (Server s : parent.main.load().servers()) {
        if (serverFilter != null && !serverFilter.matches(s)) {
          continue;
        }
        String serverName = s.primaryName().orElse("_");
        for (Location l : s.locations()) {
          if ((proxyOnly && !l.isProxy()) || (staticOnly && !l.isStatic())) {
            continue;
          }
          ObjectNode node = tree.addObject();
          node.put("server", serverName);
          node.setAll((ObjectNode) JsonViews.locations(List.of(l)).get(0));

          Map<String, Object> row = new LinkedHashMap<>();
          row.put("server", serverName);
          row.put("location", l.display());
          row.put("type", l.isProxy() ? "proxy" : l.isStatic() ? "static" : "-");
          row.put("target", l.isProxy() ? l.proxyPass() : l.root());
          rows.add(row);
        }
      }
      parent.emit(options, tree, rows);
      return 0;
    }
  }

  /**
   * Writes the result in the selected format. Table output prints each row set as its own table,
   * separated by a blank line; empty trailing row sets are skipped.
   */
  @SafeVarargs
  final void emit(OutputOptions options, JsonNode tree, List<Map<String, Object>>... tables) {
    String text;
    switch (options.format) {
      case JSON:
        text = Exporters.write(tree, ExportFormat.JSON, true);
        break;
      case YAML:
        text = Exporters.write(tree, ExportFormat.YAML, true);
        break;
      default:
        text = renderTables(tables);
        break;
    }
    if (options.output == null) {
      main.out().printf("%s", text);
      return;
    }
    try {
      Files.writeString(options.output, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigIoException(options.output, e);
    }
    if (!main.quiet()) {
      main.out().error("Output written to: " + options.output);
    }
  }

  @SafeVarargs
  private static String renderTables(List<Map<String, Object>>... tables) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream stream = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    OutputWriter out = OutputWriter.forPrintStream(stream);
    for (int i = 0; i < tables.length; i++) {
      if (i > 0) {
        if (tables[i].isEmpty()) {
          continue;
        }
        out.println("");
      }
      TableRenderer.render(tables[i], out);
    }
    stream.flush();
    return buffer.toString(StandardCharsets.UTF_8);
  }
}
