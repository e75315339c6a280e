package io.ngxdiscover.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class LocationTest {

  @Test
  void plainPrefix() {
    Location l = Location.fromArgs(List.of("/path"));

    assertEquals("/path", l.path());
    assertEquals(LocationModifier.NONE, l.modifier());
    assertEquals("/path", l.display());
  }

  @Test
  void modifiers() {
    assertEquals(LocationModifier.EXACT, Location.fromArgs(List.of("=", "/exact")).modifier());
    assertEquals(
        LocationModifier.PREFIX_PRIORITY, Location.fromArgs(List.of("^~", "/static/")).modifier());
    assertEquals(LocationModifier.REGEX, Location.fromArgs(List.of("~", "\\.php$")).modifier());
    Location ci = Location.fromArgs(List.of("~*", "\\.(jpg|png)$"));
    assertEquals(LocationModifier.REGEX_CASE_INSENSITIVE, ci.modifier());
    assertEquals("\\.(jpg|png)$", ci.path());
    assertEquals("~* \\.(jpg|png)$", ci.display());
  }

  @Test
  void missingPathDefaults() {
    assertEquals("/", Location.fromArgs(List.of()).path());
    assertEquals("/", Location.fromArgs(List.of("=")).path());
    assertEquals("", Location.fromArgs(List.of("~")).path());
  }

  @Test
  void proxyAndStatic() {
    Location base = Location.fromArgs(List.of("/api"));

    assertFalse(base.isProxy());
    assertFalse(base.isStatic());
    assertTrue(base.withProxyPass("http://backend").isProxy());
    assertTrue(base.withRoot("/var/www").isStatic());
    assertFalse(base.withRoot("/var/www").withProxyPass("http://backend").isStatic());
  }

  @Test
  void modifierSymbols() {
    assertEquals(LocationModifier.NONE, LocationModifier.fromSymbol("/"));
    assertEquals(LocationModifier.NONE, LocationModifier.fromSymbol(""));
    assertTrue(LocationModifier.REGEX.isRegex());
    assertFalse(LocationModifier.EXACT.isRegex());
    assertEquals("^~", LocationModifier.PREFIX_PRIORITY.symbol());
  }
}
