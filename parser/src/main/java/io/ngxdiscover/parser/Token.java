package io.ngxdiscover.parser;

import io.ngxdiscover.parser.ast.Span;
import java.util.Objects;

/**
 * A single lexical unit of configuration text.
 *
 * @param kind the token kind
 * @param value the payload for words, strings, numbers, variables and comments; empty otherwise
 * @param span where the token was read
 * @param quote the delimiter of a {@link TokenKind#STRING} token, {@code 0} for other kinds
 */
public record Token(TokenKind kind, String value, Span span, char quote) {

  public Token {
    Objects.requireNonNull(kind, "kind");
    value = value == null ? "" : value;
  }

  public Token(TokenKind kind, String value, Span span) {
    this(kind, value, span, '\0');
  }

  public static Token quoted(String value, char quote, Span span) {
    return new Token(TokenKind.STRING, value, span, quote);
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  /** Describes the token with its payload, as used in "found" diagnostics. */
  public String describe() {
    return switch (kind) {
      case WORD -> "word '" + value + "'";
      case STRING -> "string \"" + value + "\"";
      case NUMBER -> "number '" + value + "'";
      case VARIABLE -> "variable '$" + value + "'";
      case COMMENT -> "comment '# " + value + "'";
      default -> kind.describe();
    };
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%d-%d", kind, value, span.start(), span.end());
  }
}
