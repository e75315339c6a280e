package io.ngxdiscover.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named {@code log_format} with the variables its pattern references.
 *
 * @param name format name, referenced by {@code access_log}
 * @param pattern the format pattern, with multi-part patterns joined by single spaces
 * @param variables variable names in order of appearance, without {@code $} or braces
 */
public record LogFormat(String name, String pattern, List<String> variables) {

  public LogFormat {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(pattern, "pattern");
    variables = variables == null ? List.of() : List.copyOf(variables);
  }

  /** Creates a format, collecting the {@code $name} and {@code ${name}} references in the pattern. */
  public static LogFormat of(String name, String pattern) {
    return new LogFormat(name, pattern, extractVariables(pattern));
  }

  static List<String> extractVariables(String pattern) {
    List<String> variables = new ArrayList<>();
    int i = 0;
    int n = pattern.length();
    while (i < n) {
      if (pattern.charAt(i) != '$') {
        i++;
        continue;
      }
      i++;
      int start;
      int end;
      if (i < n && pattern.charAt(i) == '{') {
        start = ++i;
        while (i < n && pattern.charAt(i) != '}') {
          i++;
        }
        end = i;
        if (i < n) {
          i++; // }
        }
      } else {
        start = i;
        while (i < n && (Character.isLetterOrDigit(pattern.charAt(i)) || pattern.charAt(i) == '_')) {
          i++;
        }
        end = i;
      }
      if (end > start) {
        variables.add(pattern.substring(start, end));
      }
    }
    return variables;
  }
}
