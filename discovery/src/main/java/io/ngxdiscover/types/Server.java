package io.ngxdiscover.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@code server} block.
 *
 * @param serverNames names from every {@code server_name} directive, in order
 * @param listen parsed {@code listen} directives
 * @param root document root, or {@code null}
 * @param locations direct {@code location} children
 * @param accessLogs access logs declared directly in the block
 * @param errorLogs error logs declared directly in the block
 * @param index index file names
 */
public record Server(
    List<String> serverNames,
    List<ListenDirective> listen,
    String root,
    List<Location> locations,
    List<AccessLog> accessLogs,
    List<ErrorLog> errorLogs,
    List<String> index) {

  public Server {
    serverNames = copy(serverNames);
    listen = copy(listen);
    locations = copy(locations);
    accessLogs = copy(accessLogs);
    errorLogs = copy(errorLogs);
    index = copy(index);
  }

  public boolean hasSsl() {
    return listen.stream().anyMatch(ListenDirective::ssl);
  }

  public boolean isDefaultServer() {
    return listen.stream().anyMatch(ListenDirective::defaultServer);
  }

  public Optional<String> primaryName() {
    return serverNames.isEmpty() ? Optional.empty() : Optional.of(serverNames.get(0));
  }

  /** Returns the listen ports in declaration order, without duplicates. */
  public List<Integer> ports() {
    List<Integer> ports = new ArrayList<>();
    for (ListenDirective l : listen) {
      if (!ports.contains(l.port())) {
        ports.add(l.port());
      }
    }
    return ports;
  }

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  /** Accumulates the parts of a server block while its children are read. */
  public static final class Builder {
    private final List<String> serverNames = new ArrayList<>();
    private final List<ListenDirective> listen = new ArrayList<>();
    private String root;
    private final List<Location> locations = new ArrayList<>();
    private final List<AccessLog> accessLogs = new ArrayList<>();
    private final List<ErrorLog> errorLogs = new ArrayList<>();
    private final List<String> index = new ArrayList<>();

    public Builder serverName(String name) {
      serverNames.add(name);
      return this;
    }

    public Builder listen(ListenDirective directive) {
      listen.add(directive);
      return this;
    }

    public Builder root(String path) {
      this.root = path;
      return this;
    }

    public Builder location(Location location) {
      locations.add(location);
      return this;
    }

    public Builder accessLog(AccessLog log) {
      accessLogs.add(log);
      return this;
    }

    public Builder errorLog(ErrorLog log) {
      errorLogs.add(log);
      return this;
    }

    public Builder index(String file) {
      index.add(file);
      return this;
    }

    public Server build() {
      return new Server(serverNames, listen, root, locations, accessLogs, errorLogs, index);
    }
  }

  public static Builder builder() {
    return new Builder();
  }
}
