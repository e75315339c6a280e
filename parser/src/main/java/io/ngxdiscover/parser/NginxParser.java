package io.ngxdiscover.parser;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.error.ConfigIoException;
import io.ngxdiscover.parser.error.NginxException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry points for parsing NGINX configuration text and files. */
public final class NginxParser {
  private static final Logger log = LoggerFactory.getLogger(NginxParser.class);

  private NginxParser() {}

  /**
   * Parses configuration text.
   *
   * @param input the configuration source
   * @return the parsed configuration
   * @throws NginxException if the input is malformed
   */
  public static Config parse(String input) {
    Objects.requireNonNull(input, "input");
    return new Parser(input).parse();
  }

  /**
   * Reads and parses a UTF-8 configuration file. Parse failures carry the offending source line as
   * their snippet.
   *
   * @param path the file to read
   * @return the parsed configuration
   * @throws ConfigIoException if the file cannot be read
   * @throws NginxException if the content is malformed
   */
  public static Config parseFile(Path path) {
    String source = readSource(path);
    try {
      return parse(source);
    } catch (NginxException e) {
      log.debug("Failed to parse {}: {}", path, e.getMessage());
      throw e.withSourceContext(source);
    }
  }

  /**
   * Reads a configuration file as UTF-8 text.
   *
   * @throws ConfigIoException if the file cannot be read
   */
  public static String readSource(Path path) {
    Objects.requireNonNull(path, "path");
    try {
      String source = Files.readString(path, StandardCharsets.UTF_8);
      log.debug("Read {} chars from {}", source.length(), path);
      return source;
    } catch (IOException e) {
      throw new ConfigIoException(path, e);
    }
  }
}
