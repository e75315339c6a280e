package io.ngxdiscover.parser.error;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Helpers for cutting source lines out of configuration text for diagnostics. */
public final class Snippets {

  private Snippets() {}

  /**
   * Returns the given line with up to {@code contextLines} lines before and after it, joined with
   * newlines. The range is clamped to the lines of the source.
   *
   * @param source the full text
   * @param line 1-indexed line number
   * @param contextLines number of surrounding lines on each side
   * @return the selected lines, or an empty string if the line is past the end
   */
  public static String extract(String source, int line, int contextLines) {
    List<String> lines = source.lines().collect(Collectors.toList());
    int idx = Math.max(0, line - 1);
    int start = Math.max(0, idx - contextLines);
    int end = Math.min(lines.size(), idx + contextLines + 1);
    if (start >= end) {
      return "";
    }
    return String.join("\n", lines.subList(start, end));
  }

  /** Returns the 1-indexed line of the source, if it exists. */
  public static Optional<String> line(String source, int line) {
    return source.lines().skip(Math.max(0, line - 1)).findFirst();
  }
}
