package io.ngxdiscover.parser.ast;

import java.util.Objects;

/**
 * One argument of a directive.
 *
 * <p>{@link #text()} is the payload regardless of the variant; {@link #toConfigString()} renders
 * the value the way it is written in a configuration file.
 */
public sealed interface Value
    permits Value.Literal, Value.SingleQuoted, Value.DoubleQuoted, Value.Variable {

  /** Returns the raw payload (without quotes or the leading {@code $}). */
  String text();

  /** Returns the value as it would appear in a configuration file. */
  String toConfigString();

  default boolean isVariable() {
    return this instanceof Variable;
  }

  default boolean isQuoted() {
    return this instanceof SingleQuoted || this instanceof DoubleQuoted;
  }

  static Value literal(String text) {
    return new Literal(text);
  }

  static Value singleQuoted(String text) {
    return new SingleQuoted(text);
  }

  static Value doubleQuoted(String text) {
    return new DoubleQuoted(text);
  }

  static Value variable(String name) {
    return new Variable(name);
  }

  /** Plain unquoted text: {@code nginx}, {@code 80}, {@code buffer=32k}. */
  record Literal(String text) implements Value {
    public Literal {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toConfigString() {
      return text;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Text between single quotes, kept verbatim (escapes are not interpreted). */
  record SingleQuoted(String text) implements Value {
    public SingleQuoted {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toConfigString() {
      return "'" + text + "'";
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Text between double quotes, kept verbatim (escapes are not interpreted). */
  record DoubleQuoted(String text) implements Value {
    public DoubleQuoted {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toConfigString() {
      return "\"" + text + "\"";
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Variable reference; {@code text} is the name without {@code $} or braces. */
  record Variable(String text) implements Value {
    public Variable {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toConfigString() {
      return "$" + text;
    }

    @Override
    public String toString() {
      return text;
    }
  }
}
