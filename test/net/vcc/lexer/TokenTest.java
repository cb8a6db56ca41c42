package net.vcc.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.vcc.util.LocationTracker;
import org.junit.jupiter.api.Test;

public class TokenTest {

    private static Token token(TokenType type, String content, long line,
                               long column) {
        return new Token(type, new LocationTracker.FixedLocation(line,
            column, 0), content);
    }

    @Test
    public void rendersKindLexemeAndPosition() {
        assertEquals("identifier \"abc\" 3 7",
                     token(TokenType.IDENTIFIER, "abc", 3, 7).toString());
        assertEquals("end \"\" 1 1",
                     token(TokenType.END, "", 1, 1).toString());
        assertEquals("func_keyword \"func\" 1 1",
                     token(TokenType.FUNC_KEYWORD, "func", 1, 1).toString());
    }

    @Test
    public void sameAsIgnoresPosition() {
        Token a = token(TokenType.PLUS, "+", 1, 2);
        Token b = token(TokenType.PLUS, "+", 5, 9);
        assertTrue(a.sameAs(b));
        assertNotEquals(a, b);
        assertEquals(a, token(TokenType.PLUS, "+", 1, 2));
        assertEquals(a.hashCode(), token(TokenType.PLUS, "+", 1, 2)
                     .hashCode());
        assertFalse(a.sameAs(token(TokenType.MINUS, "-", 1, 2)));
    }

    @Test
    public void rejectsMissingParts() {
        assertThrows(NullPointerException.class,
                     () -> token(null, "x", 1, 1));
        assertThrows(NullPointerException.class,
                     () -> token(TokenType.IDENTIFIER, null, 1, 1));
        assertThrows(NullPointerException.class,
                     () -> new Token(TokenType.END, null, ""));
    }

    @Test
    public void keywordsAreClassified() {
        assertEquals(TokenType.FUNC_KEYWORD, TokenType.forKeyword("func"));
        assertEquals(TokenType.RETURN_KEYWORD,
                     TokenType.forKeyword("return"));
        assertEquals(TokenType.IDENTIFIER, TokenType.forKeyword("int"));
        assertTrue(TokenType.RETURN_KEYWORD.isKeyword());
        assertFalse(TokenType.IDENTIFIER.isKeyword());
        assertEquals(2, TokenType.getKeywords().size());
    }

}
