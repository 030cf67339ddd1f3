package dev.zxul767.bython.lexing;

import java.util.regex.Pattern;

/**
 * Decides whether a raw newline run ends a logical statement.
 *
 * <p>A run is insignificant when it occurs inside an open bracket, or when
 * the line that follows it is blank or starts with a comment (as long as
 * there is still input after the first character of that line). Only the
 * last newline before a line with actual content is kept.
 */
public class NewlineClassifier {
  public enum Significance { SIGNIFICANT, INSIGNIFICANT }

  private static final Pattern NEWLINE_CHARS = Pattern.compile("[\r\n\f]+");

  // `lookahead1` and `lookahead2` are the two characters following the
  // newline run, `RawTokenSource.END_OF_INPUT` if the input ends before them
  public Significance classify(
      int lookahead1, int lookahead2, boolean bracketOpen
  ) {
    if (bracketOpen)
      return Significance.INSIGNIFICANT;

    if (lookahead2 != RawTokenSource.END_OF_INPUT &&
        (Scanner.isLineTerminator(lookahead1) ||
         isCommentStart(lookahead1, lookahead2)))
      return Significance.INSIGNIFICANT;

    return Significance.SIGNIFICANT;
  }

  // everything in `run` except its line terminators (i.e., the indentation
  // captured after them)
  public static String leadingContent(String run) {
    return NEWLINE_CHARS.matcher(run).replaceAll("");
  }

  // only comments that run to the end of the line: a block comment may be
  // followed by code on the same line
  static boolean isCommentStart(int first, int second) {
    return first == '#' || (first == '/' && second == '/');
  }
}
