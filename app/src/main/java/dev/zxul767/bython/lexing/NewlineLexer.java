package dev.zxul767.bython.lexing;

import dev.zxul767.bython.ErrorReporter;
import dev.zxul767.bython.Errors;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sits between a {@link RawTokenSource} and the parser and rewrites the raw
 * token stream so that {@code NEWLINE} tokens mark exactly the ends of
 * logical statements.
 *
 * <ul>
 *   <li>newlines inside open brackets, newlines followed by blank or
 *       comment-only lines, and newlines that would repeat a statement
 *       boundary are dropped;
 *   <li>the stream always ends with a single {@code NEWLINE} followed by
 *       {@code EOF}, whether or not the source ends with a line terminator;
 *   <li>once {@code EOF} has been returned, every further call returns that
 *       same token.
 * </ul>
 *
 * <p>A lexer serves a single consumer and is not thread-safe.
 */
public class NewlineLexer implements TokenStream {
  private static final Logger logger =
      LoggerFactory.getLogger(NewlineLexer.class);

  public enum State {
    // nothing buffered: the next pull has to advance the raw scanner
    SCANNING,
    // serving tokens buffered by an earlier scanner step
    DRAINING
  }

  private final RawTokenSource source;
  private final TokenKinds kinds;
  private final ErrorReporter errors;
  private final NewlineClassifier classifier = new NewlineClassifier();
  private final BracketDepth depth = new BracketDepth();
  private final Deque<Token> pending = new ArrayDeque<>();
  // the token most recently handed out to the consumer
  private Token lastToken = null;
  // set once the end-of-input token has been handed out
  private Token endOfInput = null;

  public NewlineLexer(String sourceCode) { this(sourceCode, new Errors()); }

  public NewlineLexer(String sourceCode, ErrorReporter errors) {
    this(new Scanner(sourceCode, errors), TokenKinds.bython(), errors);
  }

  public NewlineLexer(
      RawTokenSource source, TokenKinds kinds, ErrorReporter errors
  ) {
    this.source = Objects.requireNonNull(source, "source");
    this.kinds = Objects.requireNonNull(kinds, "kinds");
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  // pulls tokens up to and including the end-of-input token
  public List<Token> scanTokens() {
    List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = nextToken();
      tokens.add(token);
    } while (token.type != kinds.eof);
    return tokens;
  }

  @Override
  public Token nextToken() {
    if (endOfInput != null)
      return endOfInput;

    while (pending.isEmpty()) {
      advance();
    }

    Token token = pending.removeFirst();
    lastToken = token;
    if (token.type == kinds.eof)
      endOfInput = token;
    return token;
  }

  @Override
  public Token lastToken() {
    return lastToken;
  }

  public State state() {
    return pending.isEmpty() ? State.SCANNING : State.DRAINING;
  }

  public int bracketDepth() { return depth.depth(); }

  // lexes the current input again from its beginning
  public void reset() {
    source.reset();
    clear();
  }

  // starts lexing `sourceCode`; nothing from the previous input carries over
  public void reset(String sourceCode) {
    source.reset(sourceCode);
    clear();
  }

  private void clear() {
    depth.reset();
    pending.clear();
    lastToken = null;
    endOfInput = null;
  }

  // performs one step of the raw scanner, queueing whatever it produces
  // (possibly nothing)
  private void advance() {
    if (source.lookahead(1) == RawTokenSource.END_OF_INPUT) {
      synthesizeEnd();
      return;
    }

    Token token = source.nextToken();
    if (token.type == kinds.eof) {
      // the input ended with whitespace or comments
      synthesizeEnd();
    } else if (token.type == kinds.newline) {
      onNewline(token);
    } else {
      if (kinds.isOpener(token.type)) {
        depth.open();
      } else if (kinds.isCloser(token.type) && !depth.close()) {
        errors.error(token, "Unmatched closing bracket.");
      }
      pending.addLast(token);
    }
  }

  private void onNewline(Token run) {
    int next = source.lookahead(1);
    int nextNext = source.lookahead(2);

    NewlineClassifier.Significance significance =
        classifier.classify(next, nextNext, depth.isOpen());

    if (significance == NewlineClassifier.Significance.INSIGNIFICANT) {
      logger.trace(
          "line {}: skipping newline (bracket depth {})", run.line,
          depth.depth()
      );
      return;
    }

    // leading blank lines and repeated boundaries carry no meaning
    Token previous = previousToken();
    if (previous == null || previous.type == kinds.newline) {
      logger.trace("line {}: collapsing repeated newline", run.line);
      return;
    }

    String text = NewlineClassifier.leadingContent(run.lexeme);
    pending.addLast(
        new Token(
            kinds.newline, text, /* value: */ null, run.line,
            run.end - text.length(), run.end
        )
    );
  }

  // the raw end-of-input token is never queued: both tokens are built here so
  // that they sit at the same offset
  private void synthesizeEnd() {
    int offset = source.charIndex();
    Token previous = previousToken();
    if (previous == null || previous.type != kinds.newline) {
      logger.debug(
          "line {}: input does not end with a newline, adding one",
          source.line()
      );
      pending.addLast(syntheticToken(kinds.newline, "", offset));
    }
    pending.addLast(syntheticToken(kinds.eof, Scanner.EOF_LEXEME, offset));
  }

  // synthetic tokens take no room in the source: they sit right after the
  // last character consumed
  private Token syntheticToken(TokenType type, String text, int offset) {
    return new Token(type, text, /* value: */ null, source.line(), offset, offset);
  }

  // the most recent token either handed out or waiting to be
  private Token previousToken() {
    return pending.isEmpty() ? lastToken : pending.peekLast();
  }
}
