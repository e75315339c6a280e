package io.ngxdiscover.parser.error;

/** A parsed configuration could not be written in the requested format. */
public final class SerializationException extends NginxException {

  public SerializationException(String message, Throwable cause) {
    super("Serialization error: " + message, 0, 0, null, cause);
  }

  @Override
  protected String describe() {
    return getMessage();
  }
}
