package dev.zxul767.bython.lexing;

// Counts the brackets (parens, square brackets and braces) that are currently
// open. Newlines are not significant while any of them is.
public class BracketDepth {
  private int depth = 0;

  public void open() { depth++; }

  // returns false (and leaves the depth at zero) when there is nothing to
  // close
  public boolean close() {
    if (depth == 0)
      return false;
    depth--;
    return true;
  }

  public boolean isOpen() { return depth > 0; }

  public int depth() { return depth; }

  public void reset() { depth = 0; }
}
