package io.ngxdiscover.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single configuration statement together with its source location.
 *
 * <p>Equality compares the directive content only; the span is location metadata and two
 * directives parsed from different offsets are equal when their names, arguments and children are.
 *
 * @param item the directive content
 * @param span where the directive was written, from its name to its terminator
 */
public record Directive(DirectiveItem item, Span span) {

  public Directive {
    Objects.requireNonNull(item, "item");
    span = span == null ? Span.DEFAULT : span;
  }

  public static Directive simple(String name, List<String> args) {
    return simple(name, args, Span.DEFAULT);
  }

  public static Directive simple(String name, List<String> args, Span span) {
    return new Directive(new DirectiveItem.Simple(name, literals(args)), span);
  }

  public static Directive simpleWithValues(String name, List<Value> args) {
    return new Directive(new DirectiveItem.Simple(name, args), Span.DEFAULT);
  }

  public static Directive block(String name, List<String> args, List<Directive> children) {
    return block(name, args, children, Span.DEFAULT);
  }

  public static Directive block(
      String name, List<String> args, List<Directive> children, Span span) {
    return new Directive(new DirectiveItem.Block(name, literals(args), children), span);
  }

  public static Directive blockWithValues(
      String name, List<Value> args, List<Directive> children) {
    return new Directive(new DirectiveItem.Block(name, args, children), Span.DEFAULT);
  }

  public String name() {
    return item.name();
  }

  public List<Value> args() {
    return item.args();
  }

  /** Returns the children of a block directive, or an empty list for a simple one. */
  public List<Directive> children() {
    if (item instanceof DirectiveItem.Block block) {
      return block.children();
    }
    return List.of();
  }

  public boolean isBlock() {
    return item instanceof DirectiveItem.Block;
  }

  public boolean isSimple() {
    return item instanceof DirectiveItem.Simple;
  }

  public Optional<String> firstArg() {
    List<Value> args = args();
    return args.isEmpty() ? Optional.empty() : Optional.of(args.get(0).text());
  }

  public List<String> argsAsStrings() {
    List<String> out = new ArrayList<>(args().size());
    for (Value v : args()) {
      out.add(v.text());
    }
    return out;
  }

  /** Returns the direct children with the given name, in source order. */
  public List<Directive> findChildren(String name) {
    List<Directive> out = new ArrayList<>();
    for (Directive child : children()) {
      if (child.name().equals(name)) {
        out.add(child);
      }
    }
    return out;
  }

  /**
   * Collects this directive and all of its descendants with the given name, depth first in
   * source order.
   */
  public List<Directive> findRecursive(String name) {
    List<Directive> out = new ArrayList<>();
    collect(this, name, out);
    return out;
  }

  static void collect(Directive directive, String name, List<Directive> out) {
    if (directive.name().equals(name)) {
      out.add(directive);
    }
    for (Directive child : directive.children()) {
      collect(child, name, out);
    }
  }

  private static List<Value> literals(List<String> args) {
    if (args == null) {
      return List.of();
    }
    List<Value> values = new ArrayList<>(args.size());
    for (String a : args) {
      values.add(Value.literal(a));
    }
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Directive other && item.equals(other.item);
  }

  @Override
  public int hashCode() {
    return item.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name());
    for (Value v : args()) {
      sb.append(' ').append(v.toConfigString());
    }
    if (isBlock()) {
      sb.append(" { ").append(children().size()).append(" children }");
    } else {
      sb.append(';');
    }
    return sb.toString();
  }
}
