package io.ngxdiscover.parser;

import io.ngxdiscover.parser.ast.Span;
import io.ngxdiscover.parser.error.ConfigSyntaxException;
import io.ngxdiscover.parser.error.UnexpectedEofException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer for NGINX configuration text.
 *
 * <p>Performs a single pass over the input, dispatching on the current character:
 *
 * <ul>
 *   <li>{@code #} starts a comment running to the end of the line
 *   <li>{@code { } ;} are structural tokens; a lone {@code =} is a word
 *   <li>{@code "} and {@code '} start a quoted string; a backslash escapes the next character, and
 *       the text between the quotes is kept verbatim
 *   <li>{@code $name} and {@code ${name}} are variable references
 *   <li>a digit starts a number (digits and dots)
 *   <li>letters and {@code _ / . * ^ ~ \} start a word, which may also contain {@code - : = $}
 * </ul>
 *
 * <p>Spans carry UTF-8 byte offsets and the 1-indexed line and column (in characters) where each
 * token starts. The first malformed token aborts lexing.
 */
public final class Lexer {
  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  private final String input;
  // char index into input
  private int index;
  // UTF-8 byte offset of index
  private int pos;
  private int line = 1;
  private int col = 1;

  private int tokenIndex;
  private int tokenPos;
  private int tokenLine;
  private int tokenCol;

  public Lexer(String input) {
    this.input = Objects.requireNonNull(input, "input");
  }

  /**
   * Reads the next token, skipping any whitespace before it.
   *
   * @return the next token; {@link TokenKind#EOF} once the input is exhausted
   * @throws ConfigSyntaxException on an unexpected character, a newline inside a quoted string or
   *     an empty variable name
   * @throws UnexpectedEofException when the input ends inside a quoted string or {@code ${...}}
   */
  public Token nextToken() {
    skipWhitespace();
    markTokenStart();

    if (isEof()) {
      return new Token(TokenKind.EOF, "", Span.at(pos, line, col));
    }

    int ch = current();
    switch (ch) {
      case '#':
        return lexComment();
      case '{':
        advance();
        return token(TokenKind.LEFT_BRACE, "");
      case '}':
        advance();
        return token(TokenKind.RIGHT_BRACE, "");
      case ';':
        advance();
        return token(TokenKind.SEMICOLON, "");
      case '=':
        // option syntax like buffer=32k is lexed as one word; a lone '=' is a word of its own
        advance();
        return token(TokenKind.WORD, "=");
      case '"':
      case '\'':
        return lexString((char) ch);
      case '$':
        return lexVariable();
      default:
        break;
    }
    if (isAsciiDigit(ch)) {
      return lexNumber();
    }
    if (isWordStart(ch)) {
      return lexWord();
    }
    String c = new String(Character.toChars(ch));
    throw new ConfigSyntaxException(
        "unexpected character '" + c + "'", line, col, "valid token", "'" + c + "'");
  }

  /**
   * Tokenizes the whole input.
   *
   * @return all tokens, ending with a single {@link TokenKind#EOF} token
   */
  public List<Token> tokenize() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      Token token = nextToken();
      tokens.add(token);
      if (token.is(TokenKind.EOF)) {
        break;
      }
    }
    log.trace("Tokenized {} chars into {} tokens", input.length(), tokens.size());
    return tokens;
  }

  private void skipWhitespace() {
    while (!isEof() && Character.isWhitespace(current())) {
      advance();
    }
  }

  private Token lexComment() {
    advance(); // #
    int start = index;
    while (!isEof() && current() != '\n') {
      advance();
    }
    return token(TokenKind.COMMENT, input.substring(start, index).strip());
  }

  private Token lexString(char quote) {
    advance(); // opening quote
    int start = index;
    boolean escaped = false;
    while (!isEof()) {
      int ch = current();
      if (escaped) {
        escaped = false;
        advance();
        continue;
      }
      if (ch == '\\') {
        escaped = true;
        advance();
        continue;
      }
      if (ch == quote) {
        String value = input.substring(start, index);
        advance(); // closing quote
        return Token.quoted(value, quote, span());
      }
      if (ch == '\n') {
        throw new ConfigSyntaxException(
            "unterminated string literal", line, col, "closing quote", "newline");
      }
      advance();
    }
    throw new UnexpectedEofException("closing quote", line);
  }

  private Token lexVariable() {
    advance(); // $
    if (!isEof() && current() == '{') {
      advance(); // {
      int start = index;
      while (!isEof() && current() != '}') {
        advance();
      }
      if (isEof()) {
        throw new UnexpectedEofException("'}'", line);
      }
      String name = input.substring(start, index);
      if (name.isEmpty()) {
        throw new ConfigSyntaxException(
            "expected variable name after '${'", line, col, "variable name", "'}'");
      }
      advance(); // }
      return token(TokenKind.VARIABLE, name);
    }

    int start = index;
    while (!isEof() && isWordChar(current())) {
      advance();
    }
    if (index == start) {
      throw new ConfigSyntaxException(
          "expected variable name after '$'", line, col, "variable name", null);
    }
    return token(TokenKind.VARIABLE, input.substring(start, index));
  }

  private Token lexNumber() {
    while (!isEof() && (isAsciiDigit(current()) || current() == '.')) {
      advance();
    }
    return token(TokenKind.NUMBER, input.substring(tokenIndex, index));
  }

  private Token lexWord() {
    while (!isEof() && isWordChar(current())) {
      advance();
    }
    return token(TokenKind.WORD, input.substring(tokenIndex, index));
  }

  private void markTokenStart() {
    tokenIndex = index;
    tokenPos = pos;
    tokenLine = line;
    tokenCol = col;
  }

  private Span span() {
    return new Span(tokenPos, pos, tokenLine, tokenCol);
  }

  private Token token(TokenKind kind, String value) {
    return new Token(kind, value, span());
  }

  private int current() {
    return isEof() ? 0 : input.codePointAt(index);
  }

  private boolean isEof() {
    return index >= input.length();
  }

  private void advance() {
    if (isEof()) {
      return;
    }
    int ch = input.codePointAt(index);
    index += Character.charCount(ch);
    pos += utf8Length(ch);
    if (ch == '\n') {
      line++;
      col = 1;
    } else {
      col++;
    }
  }

  private static int utf8Length(int codePoint) {
    if (codePoint < 0x80) return 1;
    if (codePoint < 0x800) return 2;
    if (codePoint < 0x10000) return 3;
    return 4;
  }

  private static boolean isAsciiDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isAsciiLetter(int ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
  }

  static boolean isWordStart(int ch) {
    return isAsciiLetter(ch)
        || ch == '_'
        || ch == '/'
        || ch == '.'
        || ch == '*'
        || ch == '^'
        || ch == '~'
        || ch == '\\';
  }

  static boolean isWordChar(int ch) {
    return isAsciiLetter(ch)
        || isAsciiDigit(ch)
        || ch == '_'
        || ch == '-'
        || ch == '/'
        || ch == '.'
        || ch == ':'
        || ch == '='
        || ch == '*'
        || ch == '^'
        || ch == '~'
        || ch == '\\'
        // trailing anchors in regex locations, e.g. \.php$
        || ch == '$';
  }
}
