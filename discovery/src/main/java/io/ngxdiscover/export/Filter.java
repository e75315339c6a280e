package io.ngxdiscover.export;

import io.ngxdiscover.extract.ServerExtractor;
import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.parser.ast.DirectiveItem;
import io.ngxdiscover.parser.error.InvalidInputException;
import io.ngxdiscover.types.ListenDirective;
import io.ngxdiscover.types.Location;
import io.ngxdiscover.types.Server;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Narrows a configuration before export.
 *
 * <p>{@link FilterType#DIRECTIVE} keeps the top-level directives with the given name. Every other
 * type prunes the blocks it applies to ({@code server}, {@code location} or {@code upstream}) at
 * any depth when they do not match, and leaves all other directives in place. Name and path
 * patterns are globs where {@code *} matches any run of characters; server names compare
 * case-insensitively.
 *
 * @param type what the filter selects on
 * @param pattern the value or glob to match
 */
public record Filter(FilterType type, String pattern) {

  public Filter {
    Objects.requireNonNull(type, "type");
    pattern = pattern == null ? "" : pattern;
    if (type == FilterType.PORT && ListenDirective.parsePort(pattern) == null) {
      throw new InvalidInputException("Invalid port number: " + pattern);
    }
  }

  /**
   * Parses a {@code type=pattern} filter expression such as {@code server_name=*.example.com} or
   * {@code port=443}. {@code server} is accepted for {@code server_name}; {@code ssl} and {@code
   * ssl_only} need no pattern.
   *
   * @throws InvalidInputException for a malformed expression, an unknown type or a bad port
   */
  public static Filter parse(String spec) {
    if (spec == null || spec.isBlank()) {
      throw new InvalidInputException("Invalid filter format. Expected: type=pattern, got: " + spec);
    }
    int eq = spec.indexOf('=');
    String typeName = (eq < 0 ? spec : spec.substring(0, eq)).trim().toLowerCase(Locale.ROOT);
    String pattern = eq < 0 ? null : spec.substring(eq + 1);
    FilterType type;
    switch (typeName) {
      case "server_name":
      case "server":
        type = FilterType.SERVER_NAME;
        break;
      case "port":
        type = FilterType.PORT;
        break;
      case "upstream":
        type = FilterType.UPSTREAM;
        break;
      case "location":
        type = FilterType.LOCATION;
        break;
      case "ssl":
      case "ssl_only":
        return new Filter(FilterType.SSL_ONLY, pattern);
      case "directive":
        type = FilterType.DIRECTIVE;
        break;
      default:
        if (eq < 0) {
          throw new InvalidInputException(
              "Invalid filter format. Expected: type=pattern, got: " + spec);
        }
        throw new InvalidInputException("Unknown filter type: " + typeName);
    }
    if (pattern == null) {
      throw new InvalidInputException("Invalid filter format. Expected: type=pattern, got: " + spec);
    }
    return new Filter(type, pattern);
  }

  /** Returns a filtered copy of the configuration; the input is left unchanged. */
  public Config apply(Config config) {
    if (type == FilterType.DIRECTIVE) {
      Config filtered = new Config(config.directives());
      filtered.retain(d -> d.name().equals(pattern));
      return filtered;
    }
    return new Config(prune(config.directives()));
  }

  private List<Directive> prune(List<Directive> directives) {
    List<Directive> out = new ArrayList<>(directives.size());
    for (Directive d : directives) {
      if (!keep(d)) {
        continue;
      }
      if (d.isBlock()) {
        DirectiveItem.Block block = (DirectiveItem.Block) d.item();
        out.add(
            new Directive(
                new DirectiveItem.Block(block.name(), block.args(), prune(block.children())),
                d.span()));
      } else {
        out.add(d);
      }
    }
    return out;
  }

  private boolean keep(Directive d) {
    if (!d.isBlock()) {
      return true;
    }
    switch (type) {
      case SERVER_NAME:
      case PORT:
      case SSL_ONLY:
        return !d.name().equals("server") || matches(ServerExtractor.server(d));
      case LOCATION:
        return !d.name().equals("location")
            || glob(pattern, false).matcher(Location.fromArgs(d.argsAsStrings()).path()).matches();
      case UPSTREAM:
        return !d.name().equals("upstream")
            || glob(pattern, false).matcher(d.firstArg().orElse("")).matches();
      default:
        return true;
    }
  }

  /** Whether a server block passes a server-level filter. */
  public boolean matches(Server server) {
    switch (type) {
      case SERVER_NAME:
        Pattern names = glob(pattern, true);
        return server.serverNames().stream().anyMatch(n -> names.matcher(n).matches());
      case PORT:
        int port = ListenDirective.parsePort(pattern);
        return server.listen().stream().anyMatch(l -> l.port() == port);
      case SSL_ONLY:
        return server.hasSsl();
      default:
        return true;
    }
  }

  static Pattern glob(String glob, boolean ignoreCase) {
    StringBuilder regex = new StringBuilder();
    int start = 0;
    int star;
    while ((star = glob.indexOf('*', start)) >= 0) {
      regex.append(Pattern.quote(glob.substring(start, star))).append(".*");
      start = star + 1;
    }
    regex.append(Pattern.quote(glob.substring(start)));
    return Pattern.compile(regex.toString(), ignoreCase ? Pattern.CASE_INSENSITIVE : 0);
  }

  @Override
  public String toString() {
    return type.name().toLowerCase(Locale.ROOT) + "=" + pattern;
  }
}
