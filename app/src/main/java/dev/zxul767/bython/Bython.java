package dev.zxul767.bython;

import dev.zxul767.bython.lexing.NewlineLexer;
import dev.zxul767.bython.lexing.Scanner;
import dev.zxul767.bython.lexing.Token;
import dev.zxul767.bython.lexing.TokenPrinter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Bython {
  private static final Logger logger = LoggerFactory.getLogger(Bython.class);

  private static final TokenPrinter printer = new TokenPrinter();

  public static void main(String[] args) throws IOException {
    if (args.length > 1) {
      System.out.println("Usage: bython [script.by]");
      System.exit(64);
    } else if (args.length == 1) {
      runFile(args[0]);
    } else {
      runPrompt();
    }
  }

  private static void runFile(String path) throws IOException {
    logger.debug("lexing {}", path);
    byte[] bytes = Files.readAllBytes(Paths.get(path));
    Errors errors = new Errors();
    PrintWriter out = new PrintWriter(System.out, /* autoFlush: */ true);
    run(new String(bytes, StandardCharsets.UTF_8), errors, out);
    if (errors.hadError())
      System.exit(65);
  }

  private static void runPrompt() throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    showBanner(terminal);

    // errors and tokens go through the same channel so that they show up
    // in the order they were produced
    Errors errors = new Errors(System.out);
    PrintWriter out = terminal.writer();

    LineReader reader = createReplReader(terminal);
    // reused for every chunk: `reset` makes sure no bracket depth leaks from
    // one chunk into the next
    NewlineLexer lexer = new NewlineLexer("", errors);
    // lexes incomplete input to find out whether more lines are needed; its
    // diagnostics would only repeat those of the final pass
    NewlineLexer bracketCheck = new NewlineLexer("", new SilentErrors());
    while (true) {
      try {
        String chunk = readChunk(reader, bracketCheck);
        if (chunk == null)
          break;
        if (chunk.trim().isEmpty())
          continue;

        lexer.reset(chunk);
        out.println(printer.print(lexer.scanTokens()));
        out.flush();

        // if the user makes a mistake, we don't kill the session
        errors.reset();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  // Reads lines until they form a complete chunk: the last line doesn't end
  // in a line-joining backslash and every bracket opened has been closed.
  //
  // returns null when the user asks to quit
  private static String
  readChunk(LineReader reader, NewlineLexer bracketCheck) {
    StringBuilder chunk = new StringBuilder();
    String prompt = ">>> ";
    while (true) {
      String line = reader.readLine(prompt);
      if (chunk.length() == 0 && line.trim().equals("quit"))
        return null;

      chunk.append(line).append('\n');
      if (line.endsWith("\\") ||
          hasOpenBrackets(bracketCheck, chunk.toString())) {
        prompt = "... ";
        continue;
      }
      return chunk.toString();
    }
  }

  private static boolean
  hasOpenBrackets(NewlineLexer bracketCheck, String source) {
    bracketCheck.reset(source);
    bracketCheck.scanTokens();
    return bracketCheck.bracketDepth() > 0;
  }

  static void run(String source, ErrorReporter errors, PrintWriter out) {
    NewlineLexer lexer = new NewlineLexer(source, errors);
    List<Token> tokens = lexer.scanTokens();
    out.println(printer.print(tokens));
    out.flush();
  }

  private static void showBanner(Terminal terminal) {
    String banner =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("Bython token inspector")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(banner);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println(
        "- Open brackets or a trailing \\ continue the input on the next line"
    );
    terminal.writer().println("- Use «tab» for keyword completion");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    DefaultParser parser = new DefaultParser();
    // backslashes are part of the input, not jline escapes
    parser.setEscapeChars(new char[0]);

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(parser)
        .completer(completer)
        .build();
  }

  private static class SilentErrors implements ErrorReporter {
    @Override
    public void error(int line, String message) {}

    @Override
    public void error(Token token, String message) {}
  }
}
