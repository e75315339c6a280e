package io.ngxdiscover.parser.ast;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * A location in configuration source text.
 *
 * <p>Offsets are byte positions in the UTF-8 encoding of the source; line and column are 1-indexed
 * and point at the first character covered by the span.
 *
 * @param start byte offset where the span starts (inclusive)
 * @param end byte offset where the span ends (exclusive)
 * @param line line number of the first character
 * @param col column number of the first character
 */
public record Span(int start, int end, int line, int col) {

  /** Zero-length span at the beginning of the input. */
  public static final Span DEFAULT = new Span(0, 0, 1, 1);

  public Span {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span offsets: " + start + ".." + end);
    }
  }

  /** Creates a zero-length span at the given position. */
  public static Span at(int pos, int line, int col) {
    return new Span(pos, pos, line, col);
  }

  /**
   * Combines two spans into one that covers both.
   *
   * @param other the span to merge with
   * @return the enclosing span
   */
  public Span merge(Span other) {
    return new Span(
        Math.min(start, other.start),
        Math.max(end, other.end),
        Math.min(line, other.line),
        Math.min(col, other.col));
  }

  /** Returns the length of this span in bytes. */
  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start >= end;
  }

  /**
   * Returns the part of the source covered by this span.
   *
   * @param source the text this span was produced from
   * @return the covered text, or empty if the span lies outside the source
   */
  public Optional<String> slice(String source) {
    byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
    if (end > bytes.length) {
      return Optional.empty();
    }
    return Optional.of(new String(bytes, start, end - start, StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "line " + line + ", column " + col;
  }
}
