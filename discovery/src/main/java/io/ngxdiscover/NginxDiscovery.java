package io.ngxdiscover;

import io.ngxdiscover.export.ExportFormat;
import io.ngxdiscover.export.ExportOptions;
import io.ngxdiscover.export.Exporters;
import io.ngxdiscover.extract.LogExtractor;
import io.ngxdiscover.extract.ServerExtractor;
import io.ngxdiscover.parser.NginxParser;
import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.error.NginxException;
import io.ngxdiscover.types.AccessLog;
import io.ngxdiscover.types.ErrorLog;
import io.ngxdiscover.types.ListenDirective;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.LogFormat;
import io.ngxdiscover.types.Server;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High level view of one NGINX configuration.
 *
 * <pre>
 * NginxDiscovery discovery = NginxDiscovery.fromConfigFile(Path.of("/etc/nginx/nginx.conf"));
 * for (Server server : discovery.sslServers()) {
 *   System.out.println(server.primaryName().orElse("_") + " " + server.ports());
 * }
 * </pre>
 *
 * <p>The configuration is parsed once; every query runs over the same immutable tree.
 */
public final class NginxDiscovery {
  private static final Logger log = LoggerFactory.getLogger(NginxDiscovery.class);

  private final Config config;
  private final Path source;

  private NginxDiscovery(Config config, Path source) {
    this.config = config;
    this.source = source;
  }

  /**
   * Parses configuration text.
   *
   * @throws NginxException if the text is malformed
   */
  public static NginxDiscovery fromConfigText(String text) {
    Objects.requireNonNull(text, "text");
    return new NginxDiscovery(NginxParser.parse(text), null);
  }

  /**
   * Reads and parses a configuration file.
   *
   * @throws io.ngxdiscover.parser.error.ConfigIoException if the file cannot be read
   * @throws NginxException if the content is malformed; the error carries the offending line
   */
  public static NginxDiscovery fromConfigFile(Path path) {
    Config config = NginxParser.parseFile(path);
    log.info("Loaded {} directives from {}", config.countDirectives(), path);
    return new NginxDiscovery(config, path);
  }

  /** Wraps an already parsed configuration. */
  public static NginxDiscovery fromConfig(Config config) {
    return new NginxDiscovery(Objects.requireNonNull(config, "config"), null);
  }

  public Config config() {
    return config;
  }

  /** Returns the file the configuration was read from, if any. */
  public Optional<Path> source() {
    return Optional.ofNullable(source);
  }

  public List<Server> servers() {
    return ServerExtractor.servers(config);
  }

  public List<Server> sslServers() {
    return servers().stream().filter(Server::hasSsl).collect(Collectors.toList());
  }

  /** Returns every port any server listens on, sorted and without duplicates. */
  public List<Integer> listeningPorts() {
    return servers().stream()
        .flatMap(s -> s.listen().stream())
        .map(ListenDirective::port)
        .distinct()
        .sorted()
        .collect(Collectors.toList());
  }

  public List<AccessLog> accessLogs() {
    return LogExtractor.accessLogs(config);
  }

  public List<ErrorLog> errorLogs() {
    return LogExtractor.errorLogs(config);
  }

  public List<LogFormat> logFormats() {
    return LogExtractor.logFormats(config);
  }

  /** Returns the locations of all servers, nested ones included. */
  public List<Location> locations() {
    return ServerExtractor.locations(config);
  }

  public int locationCount() {
    return locations().size();
  }

  public List<Location> proxyLocations() {
    return locations().stream().filter(Location::isProxy).collect(Collectors.toList());
  }

  /** Exports the whole configuration as pretty printed JSON. */
  public String toJson() {
    return Exporters.exportToString(config, ExportOptions.defaults());
  }

  public String toYaml() {
    return Exporters.exportToString(
        config, ExportOptions.builder().format(ExportFormat.YAML).build());
  }

  public String export(ExportOptions options) {
    return Exporters.exportToString(config, options);
  }

  @Override
  public String toString() {
    return "NginxDiscovery{source=" + source + ", " + config + "}";
  }
}
