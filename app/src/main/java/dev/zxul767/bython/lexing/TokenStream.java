package dev.zxul767.bython.lexing;

/** Pull interface offered to parsers. */
public interface TokenStream {
  Token nextToken();

  // the token most recently returned by `nextToken`, or null before the first
  // call
  Token lastToken();
}
