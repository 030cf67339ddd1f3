package dev.zxul767.bython;

import dev.zxul767.bython.lexing.Token;
import dev.zxul767.bython.lexing.TokenType;
import java.io.PrintStream;

public class Errors implements ErrorReporter {
  private final PrintStream out;
  private boolean hadError = false;

  public Errors() { this(System.err); }

  public Errors(PrintStream out) { this.out = out; }

  @Override
  public void error(int line, String message) {
    report(line, /* where: */ "", message);
  }

  @Override
  public void error(Token token, String message) {
    if (token.type == TokenType.EOF) {
      report(token.line, " at end", message);
    } else {
      report(token.line, String.format(" at '%s'", token.lexeme), message);
    }
  }

  public boolean hadError() { return hadError; }

  public void reset() { hadError = false; }

  private void report(int line, String where, String message) {
    out.println(
        "Lexing Error: [line " + line + "] Error" + where + ": " + message
    );
    out.flush();
    hadError = true;
  }
}
