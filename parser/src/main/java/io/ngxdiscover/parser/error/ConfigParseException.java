package io.ngxdiscover.parser.error;

/** Parse error with an optional source snippet and an optional suggestion for fixing it. */
public final class ConfigParseException extends NginxException {

  private final String rawMessage;
  private final String help;

  public ConfigParseException(String message, int line, int col) {
    this(message, line, col, null, null);
  }

  public ConfigParseException(String message, int line, int col, String snippet, String help) {
    super(
        "Parse error at line " + line + ", column " + col + ": " + message, line, col, snippet, null);
    this.rawMessage = message;
    this.help = help;
  }

  /** Returns the suggested fix, or {@code null}. */
  public String help() {
    return help;
  }

  @Override
  public String message() {
    return rawMessage;
  }

  @Override
  public String shortMessage() {
    return "line " + line() + ":" + col() + ": " + rawMessage;
  }

  @Override
  protected String describe() {
    return getMessage();
  }

  @Override
  public String detailed() {
    StringBuilder out = new StringBuilder(describe());
    appendSnippet(out);
    if (help != null) {
      out.append("\nHelp: ").append(help).append('\n');
    }
    return out.toString();
  }
}
