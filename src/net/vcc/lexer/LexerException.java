package net.vcc.lexer;

import net.vcc.api.parser.LocatedParserException;
import net.vcc.api.parser.TextLocation;
import net.vcc.util.Formats;

/**
 * Raised when the source text cannot be split into tokens.
 */
public class LexerException extends LocatedParserException {

    public LexerException(TextLocation pos, String message) {
        super(pos, message);
    }

    public static LexerException unexpectedCharacter(TextLocation pos,
                                                     int ch) {
        return new LexerException(pos, "unexpected character " +
            Formats.formatCharacter(ch) + " " + formatLocation(pos));
    }

    public static LexerException unterminatedComment(TextLocation pos) {
        return new LexerException(pos, "unterminated comment " +
            formatLocation(pos));
    }

}
