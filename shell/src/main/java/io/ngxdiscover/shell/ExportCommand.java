package io.ngxdiscover.shell;

import io.ngxdiscover.NginxDiscovery;
import io.ngxdiscover.export.ExportFormat;
import io.ngxdiscover.export.ExportOptions;
import io.ngxdiscover.export.Exporters;
import io.ngxdiscover.export.Filter;
import io.ngxdiscover.parser.error.ConfigIoException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "export",
    description = "Export the configuration as JSON, YAML or a Markdown report",
    mixinStandardHelpOptions = true)
public class ExportCommand implements Callable<Integer> {

  @CommandLine.ParentCommand private Main main;

  @CommandLine.Parameters(index = "0", description = "json, yaml or markdown")
  private String format;

  @CommandLine.Option(
      names = {"-o", "--output"},
      description = "Write to this file instead of stdout")
  private Path output;

  @CommandLine.Option(
      names = "--filter",
      description = "type=pattern, with type one of server_name, port, location, upstream, ssl_only, directive")
  private String filter;

  @CommandLine.Option(names = "--compact", description = "Compact JSON instead of pretty printed")
  private boolean compact;

  @CommandLine.Option(names = "--no-metadata", description = "Leave out the metadata section")
  private boolean noMetadata;

  @Override
  public Integer call() {
    ExportOptions.Builder builder =
        ExportOptions.builder()
            .format(ExportFormat.parse(format))
            .pretty(!compact)
            .includeMetadata(!noMetadata);
    if (filter != null) {
      builder.filter(Filter.parse(filter));
    }
    ExportOptions options = builder.build();
    NginxDiscovery discovery = main.load();

    if (output == null) {
      main.out().printf("%s", discovery.export(options));
      return 0;
    }
    try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      Exporters.export(discovery.config(), writer, options);
    } catch (IOException e) {
      throw new ConfigIoException(output, e);
    }
    if (!main.quiet()) {
      main.out().error("Configuration exported to: " + output);
    }
    return 0;
  }
}
