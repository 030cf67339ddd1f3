package dev.zxul767.bython;

import dev.zxul767.bython.lexing.Token;

/**
 * Sink for problems found while lexing. The scanner reports lexical errors
 * (unexpected characters, unterminated literals) and the newline lexer
 * reports unbalanced brackets; neither stops scanning.
 */
public interface ErrorReporter {
  void error(int line, String message);

  void error(Token token, String message);
}
