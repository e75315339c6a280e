package io.ngxdiscover.parser.error;

/**
 * Fluent construction of {@link ConfigParseException}s.
 *
 * <pre>
 * throw new ErrorBuilder()
 *     .message("missing semicolon")
 *     .location(3, 20)
 *     .snippet(Snippets.extract(source, 3, 0))
 *     .help("Add a semicolon after '80'")
 *     .build();
 * </pre>
 */
public final class ErrorBuilder {

  private String message = "";
  private int line;
  private int col;
  private String snippet;
  private String help;

  public ErrorBuilder message(String message) {
    this.message = message;
    return this;
  }

  public ErrorBuilder location(int line, int col) {
    this.line = line;
    this.col = col;
    return this;
  }

  public ErrorBuilder snippet(String snippet) {
    this.snippet = snippet;
    return this;
  }

  public ErrorBuilder help(String help) {
    this.help = help;
    return this;
  }

  public ConfigParseException build() {
    return new ConfigParseException(message, line, col, snippet, help);
  }
}
