package dev.zxul767.bython.lexing;

import static dev.zxul767.bython.lexing.TokenType.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class TokenKindsTest {
  @Test
  void bythonKindsTreatAllBracketsAlike() {
    TokenKinds kinds = TokenKinds.bython();

    assertThat(kinds.openers(), containsInAnyOrder(LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE));
    assertThat(kinds.closers(), containsInAnyOrder(RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE));
    assertTrue(kinds.isOpener(LEFT_BRACE));
    assertFalse(kinds.isCloser(LEFT_BRACE));
    assertFalse(kinds.isOpener(IDENTIFIER));
  }

  @Test
  void kindsCannotBeModifiedAfterConstruction() {
    EnumSet<TokenType> openers = EnumSet.of(LEFT_PAREN);
    TokenKinds kinds =
        new TokenKinds(NEWLINE, EOF, openers, EnumSet.of(RIGHT_PAREN));

    openers.add(LEFT_BRACE);
    assertFalse(kinds.isOpener(LEFT_BRACE));
    assertThrows(
        UnsupportedOperationException.class,
        () -> kinds.openers().add(LEFT_BRACKET)
    );
  }

  @Test
  void rejectsInconsistentKinds() {
    assertThrows(
        IllegalArgumentException.class,
        ()
            -> new TokenKinds(
                NEWLINE, NEWLINE, EnumSet.noneOf(TokenType.class),
                EnumSet.noneOf(TokenType.class)
            )
    );
    assertThrows(
        IllegalArgumentException.class,
        ()
            -> new TokenKinds(
                NEWLINE, EOF, EnumSet.of(LEFT_PAREN), EnumSet.of(LEFT_PAREN)
            )
    );
    assertThrows(
        IllegalArgumentException.class,
        ()
            -> new TokenKinds(
                NEWLINE, EOF, EnumSet.of(NEWLINE), EnumSet.of(RIGHT_PAREN)
            )
    );
    assertThrows(
        NullPointerException.class,
        () -> new TokenKinds(null, EOF, EnumSet.of(LEFT_PAREN), EnumSet.of(RIGHT_PAREN))
    );
  }

  @Test
  void allowsConfigurationsWithoutBrackets() {
    TokenKinds kinds = new TokenKinds(
        NEWLINE, EOF, EnumSet.noneOf(TokenType.class),
        EnumSet.noneOf(TokenType.class)
    );
    assertThat(kinds.openers(), is(empty()));
  }
}
