package io.ngxdiscover.parser.error;

/** A caller supplied option or expression is malformed. */
public final class InvalidInputException extends NginxException {

  private final String rawMessage;

  public InvalidInputException(String message) {
    super("Invalid input: " + message, 0, 0, null, null);
    this.rawMessage = message;
  }

  @Override
  public String message() {
    return rawMessage;
  }

  @Override
  protected String describe() {
    return getMessage();
  }
}
