package io.ngxdiscover.parser.error;

/**
 * Base type of every error raised while reading, parsing or processing an NGINX configuration.
 *
 * <p>Each subclass is one diagnostic kind. Positions are 1-indexed; {@link #line()} and {@link
 * #col()} return 0 when the kind carries no position. Any error may carry a source snippet, either
 * supplied at construction ({@link ConfigParseException}) or attached afterwards with {@link
 * #withSourceContext(String)}; {@link #detailed()} renders it under the headline with a {@code ^}
 * pointer at the column.
 */
public abstract sealed class NginxException extends RuntimeException
    permits ConfigParseException,
        UnexpectedEofException,
        ConfigSyntaxException,
        InvalidDirectiveException,
        InvalidArgumentException,
        ConfigIoException,
        SerializationException,
        InvalidInputException {

  private final int line;
  private final int col;
  private String snippet;

  protected NginxException(String message, int line, int col, String snippet, Throwable cause) {
    super(message, cause);
    this.line = line;
    this.col = col;
    this.snippet = snippet;
  }

  public int line() {
    return line;
  }

  public int col() {
    return col;
  }

  /** Returns the attached source snippet, or {@code null}. */
  public String snippet() {
    return snippet;
  }

  /** Returns the bare message, without the position prefix. */
  public String message() {
    return getMessage();
  }

  /** Returns a one-line description, {@code line L:C: message} for positioned errors. */
  public String shortMessage() {
    return getMessage();
  }

  /**
   * Returns a multi-line, human readable description: the headline, the kind specific details and,
   * when available, the source snippet with a pointer to the column.
   */
  public String detailed() {
    StringBuilder out = new StringBuilder(describe());
    appendSnippet(out);
    return out.toString();
  }

  /** Headline and kind specific detail lines. */
  protected abstract String describe();

  /**
   * Attaches the offending source line to this error, taken from the text it was raised for. Errors
   * without a line number, or that already carry a snippet, are left unchanged.
   *
   * @param source the full configuration text
   * @return this error
   */
  public NginxException withSourceContext(String source) {
    if (snippet == null && line > 0 && source != null) {
      Snippets.line(source, line).ifPresent(s -> this.snippet = s);
    }
    return this;
  }

  void appendSnippet(StringBuilder out) {
    if (snippet == null) {
      return;
    }
    out.append("\n\n").append(snippet).append('\n');
    out.append(" ".repeat(Math.max(0, col - 1))).append("^\n");
  }
}
