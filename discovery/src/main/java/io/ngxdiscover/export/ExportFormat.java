package io.ngxdiscover.export;

import io.ngxdiscover.parser.error.InvalidInputException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Output formats of {@link Exporters}. */
public enum ExportFormat {
  JSON("json", "json", "application/json", true),
  YAML("yaml", "yaml", "application/x-yaml", false),
  MARKDOWN("markdown", "md", "text/markdown", false);

  private final String displayName;
  private final String extension;
  private final String mimeType;
  private final boolean supportsPretty;

  ExportFormat(String displayName, String extension, String mimeType, boolean supportsPretty) {
    this.displayName = displayName;
    this.extension = extension;
    this.mimeType = mimeType;
    this.supportsPretty = supportsPretty;
  }

  public String extension() {
    return extension;
  }

  public String mimeType() {
    return mimeType;
  }

  /** Whether the format has a compact and a pretty rendering; YAML and Markdown are always laid out. */
  public boolean supportsPretty() {
    return supportsPretty;
  }

  /**
   * Looks up a format by name, case-insensitively. Accepts {@code yml} and {@code md} as aliases.
   *
   * @throws InvalidInputException for an unknown name
   */
  public static ExportFormat parse(String name) {
    String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    switch (key) {
      case "json":
        return JSON;
      case "yaml":
      case "yml":
        return YAML;
      case "markdown":
      case "md":
        return MARKDOWN;
      default:
        throw new InvalidInputException(
            "Unknown format: "
                + name
                + ". Available: "
                + Arrays.stream(values()).map(ExportFormat::toString).collect(Collectors.joining(", ")));
    }
  }

  @Override
  public String toString() {
    return displayName;
  }
}
