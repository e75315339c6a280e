package io.ngxdiscover.shell;

import io.ngxdiscover.NginxDiscovery;
import io.ngxdiscover.parser.error.InvalidInputException;
import io.ngxdiscover.parser.error.NginxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "nginx-discover",
    description = "Parse and inspect NGINX configurations",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {ParseCommand.class, ExtractCommand.class, ExportCommand.class})
public class Main implements Callable<Integer> {
  static final List<Path> DEFAULT_CONFIGS =
      List.of(
          Path.of("/etc/nginx/nginx.conf"),
          Path.of("/usr/local/nginx/conf/nginx.conf"),
          Path.of("/usr/local/etc/nginx/nginx.conf"),
          Path.of("nginx.conf"));

  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.io.ngxdiscover";

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "NGINX configuration file (default: first existing of the standard locations)")
  private Path config;

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Report the configuration used and enable debug logging")
  private boolean verbose;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress status messages")
  private boolean quiet;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  private final OutputWriter out;
  private final List<Path> searchPath;

  public Main() {
    this(OutputWriter.system(), DEFAULT_CONFIGS);
  }

  Main(OutputWriter out, List<Path> searchPath) {
    this.out = out;
    this.searchPath = searchPath;
  }

  public static void main(String[] args) {
    int exitCode = commandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  /**
   * Wires a command line around the given root command. Configuration errors are reported with
   * their detailed description and exit code 1.
   */
  static CommandLine commandLine(Main main) {
    CommandLine cmd = new CommandLine(main);
    cmd.setCaseInsensitiveEnumValuesAllowed(true);
    cmd.setExecutionExceptionHandler(
        (ex, commandLine, parseResult) -> {
          if (ex instanceof NginxException) {
            main.out.error(((NginxException) ex).detailed());
            return 1;
          }
          throw ex;
        });
    return cmd;
  }

  @Override
  public Integer call() {
    out.error(spec.commandLine().getUsageMessage());
    return 2;
  }

  OutputWriter out() {
    return out;
  }

  boolean quiet() {
    return quiet;
  }

  /** Loads the configuration selected by {@code --config} or found on the search path. */
  NginxDiscovery load() {
    if (verbose) {
      System.setProperty(LOG_LEVEL_PROPERTY, "debug");
    }
    Path path = resolveConfig();
    if (verbose) {
      out.error("Reading config: " + path);
    }
    return NginxDiscovery.fromConfigFile(path);
  }

  Path resolveConfig() {
    if (config != null) {
      return config;
    }
    for (Path candidate : searchPath) {
      if (Files.isRegularFile(candidate)) {
        return candidate;
      }
    }
    throw new InvalidInputException(
        "Could not find NGINX configuration file. Please specify with --config");
  }
}
