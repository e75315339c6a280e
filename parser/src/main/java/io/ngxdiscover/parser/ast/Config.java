package io.ngxdiscover.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Root of a parsed configuration: the top-level directives in source order.
 *
 * <p>The parser never modifies a config after returning it. {@link #addDirective} and {@link
 * #retain} are for callers that build or filter trees.
 */
public final class Config {

  private final List<Directive> directives;

  public Config() {
    this.directives = new ArrayList<>();
  }

  public Config(List<Directive> directives) {
    this.directives = new ArrayList<>(directives);
  }

  /** Returns an unmodifiable view of the top-level directives. */
  public List<Directive> directives() {
    return Collections.unmodifiableList(directives);
  }

  public void addDirective(Directive directive) {
    directives.add(directive);
  }

  /** Removes every top-level directive that does not match the predicate. */
  public void retain(Predicate<Directive> keep) {
    directives.removeIf(keep.negate());
  }

  /** Returns the top-level directives with the given name. */
  public List<Directive> findDirectives(String name) {
    List<Directive> out = new ArrayList<>();
    for (Directive d : directives) {
      if (d.name().equals(name)) {
        out.add(d);
      }
    }
    return out;
  }

  /** Returns every directive with the given name at any depth, depth first in source order. */
  public List<Directive> findDirectivesRecursive(String name) {
    List<Directive> out = new ArrayList<>();
    for (Directive d : directives) {
      Directive.collect(d, name, out);
    }
    return out;
  }

  /** Counts every directive in the tree, top-level and nested. */
  public int countDirectives() {
    return count(directives);
  }

  private static int count(List<Directive> list) {
    int n = list.size();
    for (Directive d : list) {
      n += count(d.children());
    }
    return n;
  }

  public boolean isEmpty() {
    return directives.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Config other && directives.equals(other.directives);
  }

  @Override
  public int hashCode() {
    return directives.hashCode();
  }

  @Override
  public String toString() {
    return "Config{directives=" + directives.size() + ", total=" + countDirectives() + "}";
  }
}
