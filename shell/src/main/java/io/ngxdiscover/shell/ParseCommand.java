package io.ngxdiscover.shell;

import io.ngxdiscover.NginxDiscovery;
import io.ngxdiscover.shell.render.TreePrinter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "parse",
    description = "Parse the configuration and show its tree and a summary",
    mixinStandardHelpOptions = true)
public class ParseCommand implements Callable<Integer> {

  @CommandLine.ParentCommand private Main main;

  @CommandLine.Option(names = "--tree", description = "Show the directive tree only")
  private boolean tree;

  @CommandLine.Option(names = "--summary", description = "Show the summary only")
  private boolean summary;

  @CommandLine.Option(names = "--json", description = "Print the configuration as JSON")
  private boolean json;

  @Override
  public Integer call() {
    NginxDiscovery discovery = main.load();
    OutputWriter out = main.out();
    if (json) {
      out.printf("%s", discovery.toJson());
    } else if (tree) {
      TreePrinter.print(discovery.config(), out);
    } else if (summary) {
      printSummary(discovery, out);
    } else {
      TreePrinter.print(discovery.config(), out);
      out.println("");
      printSummary(discovery, out);
    }
    if (!main.quiet() && !json) {
      out.println("");
      out.println("Configuration parsed successfully");
    }
    return 0;
  }

  static void printSummary(NginxDiscovery discovery, OutputWriter out) {
    out.println("=== Configuration Summary ===");
    out.println("");
    out.println("  Total directives: " + discovery.config().countDirectives());
    int servers = discovery.servers().size();
    out.println("  Server blocks: " + servers);
    if (servers > 0) {
      int ssl = discovery.sslServers().size();
      out.println("    - SSL enabled: " + ssl);
      out.println("    - HTTP only: " + (servers - ssl));
    }
    List<Integer> ports = discovery.listeningPorts();
    if (!ports.isEmpty()) {
      out.println("  Listening ports: " + ports);
    }
    out.println("  Access logs: " + discovery.accessLogs().size());
    out.println("  Log formats: " + discovery.logFormats().size());
    int locations = discovery.locationCount();
    if (locations > 0) {
      out.println("  Location blocks: " + locations);
      int proxies = discovery.proxyLocations().size();
      if (proxies > 0) {
        out.println("    - Proxy locations: " + proxies);
      }
    }
  }
}
