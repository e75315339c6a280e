package io.ngxdiscover.parser.error;

/** An argument a consumer of the tree cannot interpret for the given directive. */
public final class InvalidArgumentException extends NginxException {

  private final String directive;
  private final String rawMessage;
  private final String expected;

  public InvalidArgumentException(String directive, String message, String expected) {
    super("Invalid argument for directive '" + directive + "': " + message, 0, 0, null, null);
    this.directive = directive;
    this.rawMessage = message;
    this.expected = expected;
  }

  public String directive() {
    return directive;
  }

  public String expected() {
    return expected;
  }

  @Override
  public String message() {
    return rawMessage;
  }

  @Override
  protected String describe() {
    if (expected == null) {
      return getMessage();
    }
    return getMessage() + "\nExpected: " + expected;
  }
}
