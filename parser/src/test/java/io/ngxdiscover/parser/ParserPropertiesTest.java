package io.ngxdiscover.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.parser.ast.Value;
import io.ngxdiscover.parser.error.NginxException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import net.jqwik.api.*;

/**
 * Property tests for the parser over generated configuration text.
 *
 * <p>Generated directives are rendered back to text with {@link Value#toConfigString()} so that the
 * expected tree is known up front.
 */
@PropertyDefaults(tries = 300)
class ParserPropertiesTest {

  private static final String COMMENT = " # generated comment\n";

  @Property
  void simpleDirectiveKeepsArgumentOrder(
      @ForAll("names") String name, @ForAll("argLists") List<Value> args) {
    Config config = NginxParser.parse(render(name, args) + ";");

    assertEquals(1, config.directives().size());
    Directive d = config.directives().get(0);
    assertTrue(d.isSimple());
    assertEquals(name, d.name());
    assertEquals(args, d.args());
  }

  @Property
  void blockChildrenEqualIndependentParse(
      @ForAll("names") String name, @ForAll("bodies") String body) {
    Config config = NginxParser.parse(name + " {\n" + body + "\n}");

    assertEquals(1, config.directives().size());
    Directive block = config.directives().get(0);
    assertTrue(block.isBlock());
    assertEquals(NginxParser.parse(body).directives(), block.children());
  }

  @Property
  void commentsNeverReachTheTree(@ForAll("directiveLists") List<List<String>> directives) {
    String plain =
        directives.stream().map(tokens -> String.join(" ", tokens)).collect(Collectors.joining("\n"));
    String commented =
        COMMENT
            + directives.stream()
                .map(tokens -> String.join(COMMENT, tokens))
                .collect(Collectors.joining(COMMENT))
            + COMMENT;

    assertEquals(NginxParser.parse(plain), NginxParser.parse(commented));
  }

  @Property
  void parsingIsDeterministic(@ForAll("configTexts") String text) {
    Config first;
    try {
      first = NginxParser.parse(text);
    } catch (NginxException e) {
      NginxException again = assertThrows(NginxException.class, () -> NginxParser.parse(text));
      assertEquals(e.getClass(), again.getClass());
      assertEquals(e.detailed(), again.detailed());
      return;
    }
    assertEquals(first, NginxParser.parse(text));
  }

  @Property
  void malformedInputOnlyRaisesNginxException(@ForAll("noise") String text) {
    try {
      Config config = NginxParser.parse(text);
      assertNotNull(config);
    } catch (NginxException e) {
      assertNotNull(e.detailed());
      assertTrue(e.line() >= 0);
    }
  }

  @Property
  void missingSemicolonIsAlwaysAnError(
      @ForAll("names") String name, @ForAll("argLists") List<Value> args) {
    assertThrows(NginxException.class, () -> NginxParser.parse(render(name, args)));
  }

  // ==================== Generators ====================

  @Provide
  Arbitrary<String> names() {
    return Combinators.combine(
            Arbitraries.strings().withCharRange('a', 'z').ofLength(1),
            Arbitraries.strings().withCharRange('a', 'z').withChars('_').ofMaxLength(15))
        .as((head, tail) -> head + tail);
  }

  @Provide
  Arbitrary<List<Value>> argLists() {
    return values().list().ofMaxSize(6);
  }

  @Provide
  Arbitrary<String> bodies() {
    return Combinators.combine(names(), argLists())
        .as((name, args) -> render(name, args) + ";")
        .list()
        .ofMaxSize(5)
        .map(lines -> String.join("\n", lines));
  }

  @Provide
  Arbitrary<List<List<String>>> directiveLists() {
    return Combinators.combine(names(), argLists())
        .as(
            (name, args) -> {
              List<String> tokens = new ArrayList<>();
              tokens.add(name);
              for (Value v : args) {
                tokens.add(v.toConfigString());
              }
              tokens.add(";");
              return tokens;
            })
        .list()
        .ofMinSize(1)
        .ofMaxSize(5);
  }

  @Provide
  Arbitrary<String> configTexts() {
    return Arbitraries.oneOf(bodies(), noise());
  }

  @Provide
  Arbitrary<String> noise() {
    return Arbitraries.strings()
        .withChars("abcxyz019_./:=$'\"{};#\\~*^ \n\t@(")
        .ofMaxLength(40);
  }

  private Arbitrary<Value> values() {
    Arbitrary<String> word =
        Combinators.combine(
                Arbitraries.strings().withCharRange('a', 'z').withChars("/_.").ofLength(1),
                Arbitraries.strings()
                    .withCharRange('a', 'z')
                    .numeric()
                    .withChars("/_.-:=")
                    .ofMaxLength(12))
            .as((head, tail) -> head + tail);
    Arbitrary<String> number = Arbitraries.integers().between(0, 65535).map(String::valueOf);
    Arbitrary<String> quotedText =
        Arbitraries.strings().withCharRange('a', 'z').withChars(" $/[]-").ofMaxLength(20);
    return Arbitraries.oneOf(
        word.map(Value::literal),
        number.map(Value::literal),
        names().map(Value::variable),
        quotedText.map(Value::singleQuoted),
        quotedText.map(Value::doubleQuoted));
  }

  private static String render(String name, List<Value> args) {
    StringBuilder out = new StringBuilder(name);
    for (Value v : args) {
      out.append(' ').append(v.toConfigString());
    }
    return out.toString();
  }
}
