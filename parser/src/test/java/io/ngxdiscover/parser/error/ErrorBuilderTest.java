package io.ngxdiscover.parser.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ErrorBuilderTest {

  @Test
  void buildsParseErrorWithAllParts() {
    String source = "server {\n    listen 80\n}";

    ConfigParseException e =
        new ErrorBuilder()
            .message("missing semicolon")
            .location(2, 14)
            .snippet(Snippets.extract(source, 2, 0))
            .help("Add a semicolon after '80'")
            .build();

    assertEquals(2, e.line());
    assertEquals(14, e.col());
    assertEquals("missing semicolon", e.message());
    assertEquals("    listen 80", e.snippet());
    assertEquals("Add a semicolon after '80'", e.help());
    assertTrue(e.detailed().contains("\n    listen 80\n             ^\n"));
  }

  @Test
  void helpWithoutSnippet() {
    ConfigParseException e =
        new ErrorBuilder().message("bad").location(1, 1).help("try again").build();

    assertNull(e.snippet());
    assertEquals("Parse error at line 1, column 1: bad\nHelp: try again\n", e.detailed());
  }

  @Test
  void snippetWithoutHelp() {
    ConfigParseException e =
        new ErrorBuilder().message("bad").location(1, 3).snippet("abc").build();

    assertEquals("Parse error at line 1, column 3: bad\n\nabc\n  ^\n", e.detailed());
  }
}
