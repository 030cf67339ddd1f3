package dev.zxul767.bython.lexing;

public enum TokenType {
  // brackets
  LEFT_PAREN,
  RIGHT_PAREN,
  LEFT_BRACKET,
  RIGHT_BRACKET,
  LEFT_BRACE,
  RIGHT_BRACE,

  // single-character punctuation
  COMMA,
  DOT,
  COLON,
  SEMICOLON,
  AT,
  TILDE,

  // one or two character operators
  PLUS,
  MINUS,
  ARROW,
  STAR,
  STAR_STAR,
  SLASH,
  PERCENT,
  AMPERSAND,
  PIPE,
  CARET,
  BANG,
  BANG_EQUAL,
  EQUAL,
  EQUAL_EQUAL,
  GREATER,
  GREATER_EQUAL,
  LESS,
  LESS_EQUAL,

  // literals
  IDENTIFIER,
  STRING,
  NUMBER,

  // keywords
  AND,
  AS,
  ASSERT,
  BREAK,
  CLASS,
  CONTINUE,
  DEF,
  DEL,
  ELIF,
  ELSE,
  EXCEPT,
  FALSE,
  FINALLY,
  FOR,
  FROM,
  GLOBAL,
  IF,
  IMPORT,
  IN,
  IS,
  LAMBDA,
  NONE,
  NONLOCAL,
  NOT,
  OR,
  PASS,
  RAISE,
  RETURN,
  TRUE,
  TRY,
  WHILE,
  WITH,
  YIELD,

  // statement terminator and end of input
  NEWLINE,
  EOF
}
