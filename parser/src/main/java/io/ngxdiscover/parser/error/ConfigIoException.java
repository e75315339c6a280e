package io.ngxdiscover.parser.error;

import java.io.IOException;
import java.nio.file.Path;

/** A configuration file could not be read. */
public final class ConfigIoException extends NginxException {

  private final Path path;

  public ConfigIoException(Path path, IOException cause) {
    super("IO error: " + path + ": " + cause.getMessage(), 0, 0, null, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }

  @Override
  public synchronized IOException getCause() {
    return (IOException) super.getCause();
  }

  @Override
  protected String describe() {
    return getMessage();
  }
}
