package io.ngxdiscover.parser.error;

/** The input ended while a closing delimiter was still expected. */
public final class UnexpectedEofException extends NginxException {

  private final String expected;

  public UnexpectedEofException(String expected, int line) {
    super("Unexpected end of input", line, 0, null, null);
    this.expected = expected;
  }

  public String expected() {
    return expected;
  }

  @Override
  public String shortMessage() {
    return "line " + line() + ": unexpected end of input, expected " + expected;
  }

  @Override
  protected String describe() {
    return "Unexpected end of file at line " + line() + "\nExpected: " + expected;
  }
}
