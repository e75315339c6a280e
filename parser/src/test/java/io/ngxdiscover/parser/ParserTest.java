package io.ngxdiscover.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.parser.ast.Span;
import io.ngxdiscover.parser.ast.Value;
import io.ngxdiscover.parser.error.ConfigSyntaxException;
import io.ngxdiscover.parser.error.NginxException;
import io.ngxdiscover.parser.error.UnexpectedEofException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParserTest {

  private static Config parse(String input) {
    return new Parser(input).parse();
  }

  @Test
  void simpleDirective() {
    Config config = parse("user nginx;");

    assertEquals(new Config(List.of(Directive.simple("user", List.of("nginx")))), config);
    Directive user = config.directives().get(0);
    assertTrue(user.isSimple());
    assertEquals(List.of(Value.literal("nginx")), user.args());
  }

  @Test
  void blockDirective() {
    Config config = parse("server { listen 80; }");

    Directive server = config.directives().get(0);
    assertTrue(server.isBlock());
    assertEquals("server", server.name());
    assertTrue(server.args().isEmpty());
    assertEquals(List.of(Directive.simple("listen", List.of("80"))), server.children());
  }

  @Test
  void emptyInputAndCommentsOnly() {
    assertTrue(parse("").isEmpty());
    assertTrue(parse("# nothing here\n   # still nothing\n").isEmpty());
  }

  @Test
  void emptyBlockHasNoChildren() {
    Directive events = parse("events { }").directives().get(0);

    assertTrue(events.isBlock());
    assertEquals(List.of(), events.children());
  }

  @Test
  void directiveWithoutArguments() {
    Directive d = parse("ip_hash;").directives().get(0);

    assertEquals("ip_hash", d.name());
    assertTrue(d.args().isEmpty());
  }

  @Test
  void variablesAndLiterals() {
    Directive set = parse("set $host localhost;").directives().get(0);

    assertEquals(List.of(Value.variable("host"), Value.literal("localhost")), set.args());
  }

  @Test
  void quotedContentIsOpaque() {
    Directive format = parse("log_format main '$remote_addr';").directives().get(0);

    assertEquals(List.of(Value.literal("main"), Value.singleQuoted("$remote_addr")), format.args());
    assertFalse(format.args().get(1).isVariable());
  }

  @Test
  void quoteStyleIsPreserved() {
    Directive d = parse("add_header X-Frame \"DENY\" 'always';").directives().get(0);

    assertEquals(Value.doubleQuoted("DENY"), d.args().get(1));
    assertEquals(Value.singleQuoted("always"), d.args().get(2));
    assertEquals("\"DENY\"", d.args().get(1).toConfigString());
  }

  @Test
  void nestedBlocks() {
    Config config = parse("http { server { listen 80; location / { root /var/www; } } }");

    assertEquals(5, config.countDirectives());
    Directive http = config.directives().get(0);
    Directive server = http.children().get(0);
    Directive location = server.findChildren("location").get(0);
    assertEquals(List.of(Value.literal("/")), location.args());
    assertEquals("/var/www", location.children().get(0).firstArg().orElseThrow());
  }

  @Test
  void commentsAreDroppedEverywhere() {
    Config config =
        parse(
            "# head\n"
                + "http { # open\n"
                + "  gzip # before arg\n"
                + "  on; # after\n"
                + "  # inside\n"
                + "}\n"
                + "# tail");

    assertEquals(parse("http { gzip on; }"), config);
  }

  @Test
  void locationWithModifier() {
    Directive location = parse("location ~* \\.php$ { fastcgi_pass php; }").directives().get(0);

    assertEquals("~*", location.args().get(0).text());
    assertEquals("\\.php$", location.args().get(1).text());
    assertEquals(1, location.children().size());
  }

  @Test
  void directiveSpanCoversNameToTerminator() {
    Config config = parse("events {}\nuser  nginx ;");

    assertEquals(new Span(0, 9, 1, 1), config.directives().get(0).span());
    assertEquals(new Span(10, 23, 2, 1), config.directives().get(1).span());
  }

  // Errors

  @Test
  void missingSemicolonAtEof() {
    ConfigSyntaxException e =
        assertThrows(ConfigSyntaxException.class, () -> parse("root \"/var/www\""));

    assertEquals("';'", e.expected());
    assertEquals("end of file", e.found());
  }

  @Test
  void missingClosingBrace() {
    ConfigSyntaxException e =
        assertThrows(ConfigSyntaxException.class, () -> parse("http { server { listen 80; }"));

    assertEquals("'}'", e.expected());
    assertEquals("end of file", e.found());
  }

  @Test
  void strayClosingBraceIsNotADirectiveName() {
    ConfigSyntaxException e = assertThrows(ConfigSyntaxException.class, () -> parse("}"));

    assertEquals("expected directive name", e.message());
    assertEquals("word", e.expected());
    assertEquals("'}'", e.found());
  }

  @Test
  void closingBraceInArgumentPosition() {
    ConfigSyntaxException e =
        assertThrows(ConfigSyntaxException.class, () -> parse("server { listen 80 }"));

    assertEquals("expected value", e.message());
    assertEquals("'}'", e.found());
    assertEquals(1, e.line());
    assertEquals(20, e.col());
  }

  @Test
  void directiveNameMustBeWord() {
    ConfigSyntaxException e = assertThrows(ConfigSyntaxException.class, () -> parse("80;"));

    assertEquals("number '80'", e.found());
  }

  @Test
  void lexerErrorsSurfaceFromConstructor() {
    assertThrows(UnexpectedEofException.class, () -> new Parser("root '/var"));
    assertThrows(NginxException.class, () -> new Parser("user @;"));
  }

  @Test
  void errorPositionOnLaterLine() {
    ConfigSyntaxException e =
        assertThrows(ConfigSyntaxException.class, () -> parse("user nginx;\nworker_processes 4\n}"));

    assertEquals(3, e.line());
    assertEquals(1, e.col());
  }
}
