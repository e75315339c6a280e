package io.ngxdiscover.parser;

import io.ngxdiscover.parser.ast.Config;
import io.ngxdiscover.parser.ast.Directive;
import io.ngxdiscover.parser.ast.DirectiveItem;
import io.ngxdiscover.parser.ast.Span;
import io.ngxdiscover.parser.ast.Value;
import io.ngxdiscover.parser.error.ConfigSyntaxException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for NGINX configuration files.
 *
 * <p>Grammar:
 *
 * <pre>
 * config     := directive*
 * directive  := WORD value* ( ';' | '{' directive* '}' )
 * value      := WORD | NUMBER | STRING | VARIABLE
 * </pre>
 *
 * <p>Comments may appear between any two tokens and are dropped. The input is tokenized completely
 * when the parser is created; the first error aborts the parse.
 */
public final class Parser {
  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  private final List<Token> tokens;
  private int pos;

  /**
   * Tokenizes the input.
   *
   * @throws io.ngxdiscover.parser.error.NginxException if the input cannot be tokenized
   */
  public Parser(String input) {
    this.tokens = new Lexer(input).tokenize();
    this.pos = 0;
  }

  /**
   * Parses all tokens into a configuration tree.
   *
   * @return the parsed configuration
   * @throws ConfigSyntaxException if the token stream does not follow the grammar
   */
  public Config parse() {
    Config config = new Config();
    while (!isAtEnd()) {
      if (skipComment()) {
        continue;
      }
      config.addDirective(parseDirective());
    }
    log.debug(
        "Parsed {} top-level directives ({} total) from {} tokens",
        config.directives().size(),
        config.countDirectives(),
        tokens.size());
    return config;
  }

  private Directive parseDirective() {
    Token nameToken = expectWord();
    String name = nameToken.value();

    List<Value> args = new ArrayList<>();
    while (!check(TokenKind.SEMICOLON) && !check(TokenKind.LEFT_BRACE) && !isAtEnd()) {
      if (skipComment()) {
        continue;
      }
      args.add(parseValue());
    }

    if (check(TokenKind.LEFT_BRACE)) {
      advance();
      List<Directive> children = parseBlockContents();
      Token close = expect(TokenKind.RIGHT_BRACE);
      return new Directive(
          new DirectiveItem.Block(name, args, children), spanOf(nameToken, close));
    }

    Token semicolon = expect(TokenKind.SEMICOLON);
    return new Directive(new DirectiveItem.Simple(name, args), spanOf(nameToken, semicolon));
  }

  private List<Directive> parseBlockContents() {
    List<Directive> children = new ArrayList<>();
    while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
      if (skipComment()) {
        continue;
      }
      children.add(parseDirective());
    }
    return children;
  }

  private Value parseValue() {
    Token token = current();
    Value value;
    switch (token.kind()) {
      case STRING:
        value =
            token.quote() == '"'
                ? Value.doubleQuoted(token.value())
                : Value.singleQuoted(token.value());
        break;
      case WORD:
      case NUMBER:
        value = Value.literal(token.value());
        break;
      case VARIABLE:
        value = Value.variable(token.value());
        break;
      default:
        throw new ConfigSyntaxException(
            "expected value",
            token.span().line(),
            token.span().col(),
            "word, string, number, or variable",
            token.describe());
    }
    advance();
    return value;
  }

  private Token expectWord() {
    Token token = current();
    if (token.is(TokenKind.WORD)) {
      advance();
      return token;
    }
    throw new ConfigSyntaxException(
        "expected directive name",
        token.span().line(),
        token.span().col(),
        TokenKind.WORD.describe(),
        token.describe());
  }

  private Token expect(TokenKind kind) {
    if (check(kind)) {
      Token token = current();
      advance();
      return token;
    }
    Token found = current();
    throw new ConfigSyntaxException(
        "unexpected token",
        found.span().line(),
        found.span().col(),
        kind.describe(),
        found.describe());
  }

  private boolean skipComment() {
    if (check(TokenKind.COMMENT)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean check(TokenKind kind) {
    return !isAtEnd() && current().is(kind);
  }

  private boolean isAtEnd() {
    return current().is(TokenKind.EOF);
  }

  // the token list always ends with EOF, which also stands in for any position past the end
  private Token current() {
    return pos < tokens.size() ? tokens.get(pos) : tokens.get(tokens.size() - 1);
  }

  private void advance() {
    if (!isAtEnd()) {
      pos++;
    }
  }

  private static Span spanOf(Token first, Token last) {
    Span start = first.span();
    return new Span(start.start(), last.span().end(), start.line(), start.col());
  }
}
