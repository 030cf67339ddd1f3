package dev.zxul767.bython.lexing;

import java.util.List;
import java.util.stream.Collectors;

// Renders tokens one per line, e.g. `IDENTIFIER 'x' [0,1)`.
public class TokenPrinter {
  public String print(Token token) {
    return String.format(
        "%s '%s' [%d,%d)", token.type, escape(token.lexeme), token.start,
        token.end
    );
  }

  public String print(List<Token> tokens) {
    return tokens.stream().map(this::print).collect(Collectors.joining("\n"));
  }

  static String escape(String text) {
    StringBuilder builder = new StringBuilder();
    for (char c : text.toCharArray()) {
      switch (c) {
      case '\n':
        builder.append("\\n");
        break;
      case '\r':
        builder.append("\\r");
        break;
      case '\t':
        builder.append("\\t");
        break;
      case '\f':
        builder.append("\\f");
        break;
      case '\'':
        builder.append("\\'");
        break;
      case '\\':
        builder.append("\\\\");
        break;
      default:
        builder.append(c);
      }
    }
    return builder.toString();
  }
}
