package dev.zxul767.bython.lexing;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The token kinds {@link NewlineLexer} needs to know about: the statement
 * terminator, the end-of-input marker and the tokens that open and close a
 * bracketed region. Everything else passes through the lexer untouched.
 */
public final class TokenKinds {
  public final TokenType newline;
  public final TokenType eof;
  private final Set<TokenType> openers;
  private final Set<TokenType> closers;

  public TokenKinds(
      TokenType newline, TokenType eof, Set<TokenType> openers,
      Set<TokenType> closers
  ) {
    this.newline = Objects.requireNonNull(newline, "newline");
    this.eof = Objects.requireNonNull(eof, "eof");
    if (newline == eof)
      throw new IllegalArgumentException(
          "newline and end-of-input kinds must differ"
      );

    this.openers = copyOf(openers, "openers");
    this.closers = copyOf(closers, "closers");

    for (TokenType type : this.openers) {
      if (this.closers.contains(type))
        throw new IllegalArgumentException(
            String.format("%s cannot both open and close a bracket", type)
        );
    }
  }

  // `(`, `[` and `{` open a region in which newlines are not significant
  public static TokenKinds bython() {
    return new TokenKinds(
        TokenType.NEWLINE, TokenType.EOF,
        EnumSet.of(
            TokenType.LEFT_PAREN, TokenType.LEFT_BRACKET, TokenType.LEFT_BRACE
        ),
        EnumSet.of(
            TokenType.RIGHT_PAREN, TokenType.RIGHT_BRACKET,
            TokenType.RIGHT_BRACE
        )
    );
  }

  public boolean isOpener(TokenType type) { return openers.contains(type); }

  public boolean isCloser(TokenType type) { return closers.contains(type); }

  public Set<TokenType> openers() { return openers; }

  public Set<TokenType> closers() { return closers; }

  private Set<TokenType> copyOf(Set<TokenType> types, String what) {
    Objects.requireNonNull(types, what);
    Set<TokenType> copy = types.isEmpty() ? EnumSet.noneOf(TokenType.class)
                                          : EnumSet.copyOf(types);
    if (copy.contains(newline) || copy.contains(eof))
      throw new IllegalArgumentException(String.format(
          "%s cannot include the newline or end-of-input kinds", what
      ));
    return Collections.unmodifiableSet(copy);
  }
}
