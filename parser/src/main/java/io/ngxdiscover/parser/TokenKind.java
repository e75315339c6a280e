package io.ngxdiscover.parser;

/**
 * Token kinds produced by the {@link Lexer}.
 *
 * <p>Kinds with a payload carry it in {@link Token#value()}; the structural kinds have an empty
 * value.
 */
public enum TokenKind {
  /** Identifier, path, regex or {@code key=value} option: {@code server}, {@code /var/www} */
  WORD,

  /** Quoted string: {@code "value"} or {@code 'value'}; the value excludes the quotes */
  STRING,

  /** Digits and dots: {@code 80}, {@code 1.5} */
  NUMBER,

  /** Variable reference: {@code $host}, {@code ${host}}; the value is the name */
  VARIABLE,

  /** Opening brace: { */
  LEFT_BRACE,

  /** Closing brace: } */
  RIGHT_BRACE,

  /** Statement terminator: ; */
  SEMICOLON,

  /** Line comment: {@code # text}; the value is the trimmed text after {@code #} */
  COMMENT,

  /** End of input */
  EOF;

  /** Describes the kind without a payload, as used in "expected" diagnostics. */
  public String describe() {
    return switch (this) {
      case WORD -> "word";
      case STRING -> "string";
      case NUMBER -> "number";
      case VARIABLE -> "variable";
      case LEFT_BRACE -> "'{'";
      case RIGHT_BRACE -> "'}'";
      case SEMICOLON -> "';'";
      case COMMENT -> "comment";
      case EOF -> "end of file";
    };
  }
}
