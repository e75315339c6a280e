package io.ngxdiscover.parser.error;

/** Malformed input, reported with what the lexer or parser expected and what it found instead. */
public final class ConfigSyntaxException extends NginxException {

  private final String rawMessage;
  private final String expected;
  private final String found;

  public ConfigSyntaxException(String message, int line, int col, String expected, String found) {
    super("Syntax error: " + message, line, col, null, null);
    this.rawMessage = message;
    this.expected = expected;
    this.found = found;
  }

  /** Returns what was expected, or {@code null}. */
  public String expected() {
    return expected;
  }

  /** Returns what was found instead, or {@code null}. */
  public String found() {
    return found;
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
    StringBuilder out = new StringBuilder();
    out.append("Syntax error at line ")
        .append(line())
        .append(", column ")
        .append(col())
        .append(": ")
        .append(rawMessage);
    if (expected != null) {
      out.append("\nExpected: ").append(expected);
    }
    if (found != null) {
      out.append("\nFound: ").append(found);
    }
    return out.toString();
  }
}
