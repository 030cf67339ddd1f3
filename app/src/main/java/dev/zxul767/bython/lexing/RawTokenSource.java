package dev.zxul767.bython.lexing;

/**
 * A scanner that turns source characters into raw tokens one at a time.
 *
 * <p>Line terminators are reported as tokens of the newline kind whose
 * lexeme is the whole terminator run (the terminator plus any indentation
 * captured after it). Deciding whether such a run ends a statement is left
 * to {@link NewlineLexer}.
 */
public interface RawTokenSource {
  // value returned by `lookahead` past the end of the input
  int END_OF_INPUT = -1;

  // scans and returns the next raw token; once the input is exhausted,
  // every call returns a token of the end-of-input kind
  Token nextToken();

  // returns the `i`-th unconsumed character (1-based), or `END_OF_INPUT` if the
  // input ends before it
  int lookahead(int i);

  // index of the next unconsumed character
  int charIndex();

  // line of the next unconsumed character (1-based)
  int line();

  // rewinds to the beginning of the current input
  void reset();

  // replaces the input and rewinds to its beginning
  void reset(String sourceCode);
}
