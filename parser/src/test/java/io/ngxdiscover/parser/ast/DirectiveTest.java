package io.ngxdiscover.parser.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DirectiveTest {

  private static Directive tree() {
    return Directive.block(
        "http",
        List.of(),
        List.of(
            Directive.simple("access_log", List.of("/var/log/nginx/access.log")),
            Directive.block(
                "server",
                List.of(),
                List.of(
                    Directive.simple("listen", List.of("80")),
                    Directive.block(
                        "location",
                        List.of("/"),
                        List.of(Directive.simple("access_log", List.of("off")))))),
            Directive.block("server", List.of(), List.of(Directive.simple("listen", List.of("443"))))));
  }

  @Test
  void simpleDirectiveAccessors() {
    Directive d = Directive.simple("listen", List.of("80", "default_server"));

    assertTrue(d.isSimple());
    assertFalse(d.isBlock());
    assertEquals("listen", d.name());
    assertEquals(List.of(Value.literal("80"), Value.literal("default_server")), d.args());
    assertEquals(List.of("80", "default_server"), d.argsAsStrings());
    assertEquals(Optional.of("80"), d.firstArg());
    assertEquals(List.of(), d.children());
    assertEquals(Span.DEFAULT, d.span());
  }

  @Test
  void firstArgOfBareDirective() {
    assertEquals(Optional.empty(), Directive.simple("ip_hash", List.of()).firstArg());
  }

  @Test
  void argsAsStringsDropsQuotes() {
    Directive d =
        Directive.simpleWithValues(
            "log_format", List.of(Value.literal("main"), Value.singleQuoted("$status")));

    assertEquals(List.of("main", "$status"), d.argsAsStrings());
  }

  @Test
  void findChildrenIsDirectOnly() {
    List<Directive> servers = tree().findChildren("server");

    assertEquals(2, servers.size());
    assertTrue(tree().findChildren("listen").isEmpty());
  }

  @Test
  void findRecursiveIsPreOrderAndIncludesSelf() {
    Directive http = tree();

    List<String> logs =
        http.findRecursive("access_log").stream()
            .map(d -> d.firstArg().orElse(""))
            .collect(Collectors.toList());
    assertEquals(List.of("/var/log/nginx/access.log", "off"), logs);
    assertEquals(List.of(http), http.findRecursive("http"));
    assertEquals(
        List.of("80", "443"),
        http.findRecursive("listen").stream()
            .map(d -> d.firstArg().orElse(""))
            .collect(Collectors.toList()));
  }

  @Test
  void equalityIgnoresSpan() {
    Directive a = Directive.simple("user", List.of("nginx"), new Span(0, 11, 1, 1));
    Directive b = Directive.simple("user", List.of("nginx"), new Span(40, 51, 3, 1));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, Directive.simple("user", List.of("www")));
  }

  @Test
  void childrenAreImmutable() {
    Directive d = tree();

    assertThrows(UnsupportedOperationException.class, () -> d.children().clear());
    assertThrows(UnsupportedOperationException.class, () -> d.args().add(Value.literal("x")));
  }

  @Test
  void readableToString() {
    assertEquals("listen 80 ssl;", Directive.simple("listen", List.of("80", "ssl")).toString());
    assertEquals(
        "location / { 1 children }",
        Directive.block("location", List.of("/"), List.of(Directive.simple("root", List.of("/srv"))))
            .toString());
  }
}
