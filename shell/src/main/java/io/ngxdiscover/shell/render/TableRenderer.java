package io.ngxdiscover.shell.render;

import io.ngxdiscover.shell.OutputWriter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Renders rows of {@code column -> value} maps as a boxed text table. */
public final class TableRenderer {
  static final int MAX_WIDTH = 60;

  private TableRenderer() {}

  /**
   * Renders the rows. Columns are the union of the row keys in first-seen order; cells wider than
   * {@value #MAX_WIDTH} characters are truncated with an ellipsis.
   */
  public static void render(List<Map<String, Object>> rows, OutputWriter out) {
    if (rows == null || rows.isEmpty()) {
      out.println("(no rows)");
      return;
    }
    Set<String> cols = new LinkedHashSet<>();
    for (Map<String, Object> row : rows) cols.addAll(row.keySet());
    List<String> headers = new ArrayList<>(cols);

    int[] widths = new int[headers.size()];
    for (int c = 0; c < headers.size(); c++) widths[c] = headers.get(c).length();
    List<List<String>> cells = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      List<String> line = new ArrayList<>(headers.size());
      for (int c = 0; c < headers.size(); c++) {
        String cell = toCell(row.get(headers.get(c)));
        line.add(cell);
        widths[c] = Math.max(widths[c], Math.min(MAX_WIDTH, cell.length()));
      }
      cells.add(line);
    }

    printLine(headers, widths, out);
    StringBuilder sep = new StringBuilder();
    for (int w : widths) {
      sep.append("+").append("-".repeat(w + 2));
    }
    sep.append("+");
    out.println(sep.toString());
    for (List<String> line : cells) {
      printLine(line, widths, out);
    }
  }

  private static void printLine(List<String> values, int[] widths, OutputWriter out) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      sb.append("| ").append(pad(truncate(values.get(i), widths[i]), widths[i])).append(" ");
    }
    sb.append("|");
    out.println(sb.toString());
  }

  static String toCell(Object v) {
    if (v == null) return "";
    if (v instanceof List<?> list) {
      List<String> parts = new ArrayList<>(list.size());
      for (Object o : list) parts.add(String.valueOf(o));
      return String.join(", ", parts);
    }
    if (v instanceof Boolean b) return b ? "yes" : "no";
    return String.valueOf(v);
  }

  private static String pad(String s, int w) {
    if (s.length() >= w) return s;
    return s + " ".repeat(w - s.length());
  }

  private static String truncate(String s, int w) {
    if (s.length() <= w) return s;
    if (w <= 1) return s.substring(0, w);
    return s.substring(0, w - 1) + "…"; // ellipsis character
  }
}
