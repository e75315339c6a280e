package io.ngxdiscover.parser.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class SpanTest {

  @Test
  void defaultSpanStartsAtLineOne() {
    assertEquals(new Span(0, 0, 1, 1), Span.DEFAULT);
    assertTrue(Span.DEFAULT.isEmpty());
  }

  @Test
  void mergeCoversBothSpans() {
    Span a = new Span(10, 14, 2, 5);
    Span b = new Span(3, 8, 1, 4);

    assertEquals(new Span(3, 14, 1, 4), a.merge(b));
    assertEquals(a.merge(b), b.merge(a));
  }

  @Test
  void lengthInBytes() {
    assertEquals(4, new Span(6, 10, 1, 7).length());
    assertEquals(0, Span.at(3, 1, 4).length());
  }

  @Test
  void sliceUsesUtf8Offsets() {
    String source = "name 'ü' x";

    assertEquals(Optional.of("'ü'"), new Span(5, 9, 1, 6).slice(source));
    assertEquals(Optional.of("name"), new Span(0, 4, 1, 1).slice(source));
    assertEquals(Optional.empty(), new Span(0, 100, 1, 1).slice(source));
  }

  @Test
  void rejectsInvertedOffsets() {
    assertThrows(IllegalArgumentException.class, () -> new Span(5, 2, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2, 1, 1));
  }

  @Test
  void displaysLineAndColumn() {
    assertEquals("line 3, column 7", new Span(20, 25, 3, 7).toString());
  }
}
