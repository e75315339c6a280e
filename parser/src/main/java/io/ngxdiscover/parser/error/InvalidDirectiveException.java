package io.ngxdiscover.parser.error;

/** A directive name or usage that a consumer of the tree rejects. */
public final class InvalidDirectiveException extends NginxException {

  private final String name;
  private final String reason;
  private final String suggestion;

  public InvalidDirectiveException(String name, String reason, String suggestion) {
    super("Invalid directive: " + name, 0, 0, null, null);
    this.name = name;
    this.reason = reason;
    this.suggestion = suggestion;
  }

  public String name() {
    return name;
  }

  public String reason() {
    return reason;
  }

  public String suggestion() {
    return suggestion;
  }

  @Override
  public String message() {
    return name;
  }

  @Override
  protected String describe() {
    StringBuilder out = new StringBuilder("Invalid directive: ").append(name);
    if (reason != null) {
      out.append("\nReason: ").append(reason);
    }
    if (suggestion != null) {
      out.append("\nSuggestion: Try using '").append(suggestion).append("' instead");
    }
    return out.toString();
  }
}
