package dev.zxul767.bython.lexing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  public final Object value;
  public final int line;
  // character offsets into the source code: `start` is inclusive and `end`
  // is exclusive
  public final int start;
  public final int end;

  public Token(
      TokenType type, String lexeme, Object value, int line, int start, int end
  ) {
    this.type = type;
    this.lexeme = lexeme;
    this.value = value;
    this.line = line;
    this.start = start;
    this.end = end;
  }

  public String toString() {
    return type + " " + lexeme + " " + value + " [" + start + "," + end + ")";
  }
}
