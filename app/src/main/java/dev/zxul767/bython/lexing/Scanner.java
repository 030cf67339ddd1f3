package dev.zxul767.bython.lexing;

import static dev.zxul767.bython.lexing.TokenType.*;

import dev.zxul767.bython.ErrorReporter;
import dev.zxul767.bython.Errors;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Scanner implements RawTokenSource {
  public static final Map<String, TokenType> keywords;
  static {
    keywords = new HashMap<>();
    keywords.put("and", AND);
    keywords.put("as", AS);
    keywords.put("assert", ASSERT);
    keywords.put("break", BREAK);
    keywords.put("class", CLASS);
    keywords.put("continue", CONTINUE);
    keywords.put("def", DEF);
    keywords.put("del", DEL);
    keywords.put("elif", ELIF);
    keywords.put("else", ELSE);
    keywords.put("except", EXCEPT);
    keywords.put("False", FALSE);
    keywords.put("finally", FINALLY);
    keywords.put("for", FOR);
    keywords.put("from", FROM);
    keywords.put("global", GLOBAL);
    keywords.put("if", IF);
    keywords.put("import", IMPORT);
    keywords.put("in", IN);
    keywords.put("is", IS);
    keywords.put("lambda", LAMBDA);
    keywords.put("None", NONE);
    keywords.put("nonlocal", NONLOCAL);
    keywords.put("not", NOT);
    keywords.put("or", OR);
    keywords.put("pass", PASS);
    keywords.put("raise", RAISE);
    keywords.put("return", RETURN);
    keywords.put("True", TRUE);
    keywords.put("try", TRY);
    keywords.put("while", WHILE);
    keywords.put("with", WITH);
    keywords.put("yield", YIELD);
  }

  public static final String EOF_LEXEME = "<EOF>";

  private final ErrorReporter errors;
  private String sourceCode;
  // `start` & `current` are meant to index `sourceCode` and they
  // represent the bounds of the token currently under examination.
  private int start = 0;
  private int current = 0;
  // `line` starts at 1 (and not 0) to be user friendly
  private int line = 1;

  public Scanner(String sourceCode) { this(sourceCode, new Errors()); }

  public Scanner(String sourceCode, ErrorReporter errors) {
    if (sourceCode == null)
      throw new NullPointerException("sourceCode");
    this.sourceCode = sourceCode;
    this.errors = errors;
  }

  // returns every raw token in the source, including newline runs and the
  // trailing end-of-input token
  public List<Token> scanTokens() {
    List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = nextToken();
      tokens.add(token);
    } while (token.type != EOF);
    return tokens;
  }

  @Override
  public Token nextToken() {
    while (!isAtEnd()) {
      start = current;
      Token token = scanToken();
      if (token != null)
        return token;
    }
    start = current;
    return new Token(EOF, EOF_LEXEME, /* value: */ null, line, current, current);
  }

  @Override
  public int lookahead(int i) {
    if (i < 1)
      throw new IllegalArgumentException("lookahead starts at 1, got " + i);
    int index = current + i - 1;
    if (index >= sourceCode.length())
      return RawTokenSource.END_OF_INPUT;
    return sourceCode.charAt(index);
  }

  @Override
  public int charIndex() {
    return current;
  }

  @Override
  public int line() {
    return line;
  }

  @Override
  public void reset() {
    start = 0;
    current = 0;
    line = 1;
  }

  @Override
  public void reset(String sourceCode) {
    if (sourceCode == null)
      throw new NullPointerException("sourceCode");
    this.sourceCode = sourceCode;
    reset();
  }

  // scans a single lexeme; returns null for those that produce no token
  // (whitespace, comments and erroneous input)
  private Token scanToken() {
    char c = advance();
    switch (c) {
    case '(':
      return token(LEFT_PAREN);
    case ')':
      return token(RIGHT_PAREN);
    case '[':
      return token(LEFT_BRACKET);
    case ']':
      return token(RIGHT_BRACKET);
    case '{':
      return token(LEFT_BRACE);
    case '}':
      return token(RIGHT_BRACE);
    case ',':
      return token(COMMA);
    case '.':
      if (isDigit(peek()))
        return number();
      return token(DOT);
    case ':':
      return token(COLON);
    case ';':
      return token(SEMICOLON);
    case '@':
      return token(AT);
    case '~':
      return token(TILDE);
    case '+':
      return token(PLUS);
    case '%':
      return token(PERCENT);
    case '&':
      return token(AMPERSAND);
    case '|':
      return token(PIPE);
    case '^':
      return token(CARET);

    case '-':
      return token(match('>') ? ARROW : MINUS);
    case '*':
      return token(match('*') ? STAR_STAR : STAR);
    case '!':
      return token(match('=') ? BANG_EQUAL : BANG);
    case '=':
      return token(match('=') ? EQUAL_EQUAL : EQUAL);
    case '<':
      return token(match('=') ? LESS_EQUAL : LESS);
    case '>':
      return token(match('=') ? GREATER_EQUAL : GREATER);
    case '/':
      if (match('/')) {
        singleLineComment();
      } else if (match('*')) {
        multiLineComment();
      } else {
        return token(SLASH);
      }
      return null;
    case '#':
      singleLineComment();
      return null;

    case ' ':
    case '\t':
      // ignore whitespace;
      return null;

    case '\\':
      // explicit line joining: the terminator after a backslash is not a
      // newline token
      if (isLineTerminator(peek())) {
        if (advance() == '\r')
          match('\n');
        line++;
      } else {
        errors.error(line, "Unexpected character: <\\>.");
      }
      return null;

    case '\r':
      match('\n');
      return newline();
    case '\n':
    case '\f':
      return newline();

    case '"':
    case '\'':
      return string(c);

    default:
      if (isDigit(c)) {
        return number();
      } else if (isAlpha(c)) {
        return identifier();
      }
      errors.error(line, String.format("Unexpected character: <%c>.", c));
      return null;
    }
  }

  // Scan a line terminator together with the indentation of the next line.
  //
  // pre-condition: the terminator (\n, \r\n, \r or \f) has just been consumed
  // post-condition: the spaces and tabs following it have been consumed
  private Token newline() {
    int terminatedLine = line;
    char terminator = sourceCode.charAt(start);
    // a form feed is a page break, not a line break
    if (terminator != '\f')
      line++;

    while (peek() == ' ' || peek() == '\t')
      advance();

    return new Token(
        NEWLINE, sourceCode.substring(start, current), /* value: */ null,
        terminatedLine, start, current
    );
  }

  // Scan (and ignore the contents of) a single-line comment.
  //
  // pre-condition: the opening delimiter (# or //) has just been consumed
  // post-condition: all characters up to a line terminator (or EOF) have
  //     been consumed.
  private void singleLineComment() {
    while (!isLineTerminator(peek()) && !isAtEnd())
      advance();
  }

  // Scan (and ignore the contents of) a multi-line comment.
  //
  // pre-condition: the /* opening chars have just been consumed.
  // post-condition: all characters up to and including the last */ delimiter
  //    have been consumed (i.e., nested multiline comments are properly
  //    handled)
  private void multiLineComment() {
    int openComments = 1; // we've just consumed the opening delimiter

    while (!isAtEnd()) {
      if (peek() == '/' && peekAhead(1) == '*') {
        openComments++;
        advance(2);
      } else if (peek() == '*' && peekAhead(1) == '/') {
        openComments--;
        advance(2);
      } else {
        countLine(advance());
      }
      if (openComments == 0)
        break;
    }

    // `openComments` should be zero if the first opening delimiter was closed
    if (isAtEnd() && openComments != 0) {
      errors.error(line, "Unterminated multi-line comment.");
    }
  }

  private Token identifier() {
    while (isAlphaNumeric(peek()))
      advance();

    String text = sourceCode.substring(start, current);
    TokenType type = keywords.get(text);
    if (type == null)
      type = IDENTIFIER;

    return token(type);
  }

  // pre-condition: the opening `quote` has just been consumed
  private Token string(char quote) {
    if (peek() == quote && peekAhead(1) == quote) {
      advance(2);
      return longString(quote);
    }

    int startLine = line;
    while (peek() != quote && !isAtEnd()) {
      // short strings cannot span lines
      if (isLineTerminator(peek())) {
        errors.error(startLine, "Unterminated string.");
        return null;
      }
      // escapes are kept verbatim; we only make sure an escaped quote
      // doesn't end the string
      if (peek() == '\\' && peekAhead(1) != '\0' &&
          !isLineTerminator(peekAhead(1)))
        advance();
      advance();
    }
    if (isAtEnd()) {
      errors.error(startLine, "Unterminated string.");
      return null;
    }
    // the closing quote
    advance();

    // trim the surrounding quotes
    String value = sourceCode.substring(start + 1, current - 1);
    return token(STRING, value, startLine);
  }

  // pre-condition: the three opening quotes have just been consumed
  private Token longString(char quote) {
    int startLine = line;
    while (!isAtEnd()) {
      if (peek() == quote && peekAhead(1) == quote && peekAhead(2) == quote) {
        advance(3);
        String value = sourceCode.substring(start + 3, current - 3);
        return token(STRING, value, startLine);
      }
      char c = advance();
      if (c == '\\' && !isAtEnd())
        c = advance();
      countLine(c);
    }
    errors.error(startLine, "Unterminated string.");
    return null;
  }

  private Token number() {
    // both integers and decimals start with digits (or a leading dot)...
    while (isDigit(peek()))
      advance();

    // we're looking at a decimal number...
    if (peek() == '.' && isDigit(peekAhead(1))) {
      // consume the "."
      advance();
      while (isDigit(peek()))
        advance();
    }
    // integers and decimals share a single representation
    return token(
        NUMBER, Double.parseDouble(sourceCode.substring(start, current)), line
    );
  }

  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (sourceCode.charAt(current) != expected)
      return false;
    current++;
    return true;
  }

  // returns the next character to be consumed
  private char peek() { return peekAhead(0); }

  // returns the character to be consumed `distance` chars ahead
  private char peekAhead(int distance) {
    if (current + distance >= sourceCode.length())
      return '\0';
    return sourceCode.charAt(current + distance);
  }

  // advances `line` past `c` if it ends one: `\n`, or a `\r` that isn't the
  // first half of `\r\n`
  private void countLine(char c) {
    if (c == '\n' || (c == '\r' && peek() != '\n'))
      line++;
  }

  static boolean isLineTerminator(int c) {
    return c == '\n' || c == '\r' || c == '\f';
  }

  private boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

  private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // returns the previously current character and advances one char forward
  private char advance() { return sourceCode.charAt(current++); }

  // returns the previously current character and advances `count` chars forward
  // pre-condition: current + count <= sourceCode.length()
  private char advance(int count) {
    char currentChar = sourceCode.charAt(current);
    current += count;
    return currentChar;
  }

  private Token token(TokenType type) {
    return token(type, /* value: */ null, line);
  }

  private Token token(TokenType type, Object value, int tokenLine) {
    String text = sourceCode.substring(start, current);
    return new Token(type, text, value, tokenLine, start, current);
  }
}
