package net.vcc.parser;

import net.vcc.api.parser.LocatedParserException;
import net.vcc.lexer.Token;

/**
 * Raised when the parser meets a token its current state does not accept.
 * The message always reads "unexpected token &lt;token&gt;"; subclasses
 * explain themselves further through {@link #getDetail()}.
 */
public class UnexpectedTokenException extends LocatedParserException {

    private final Token token;
    private final String detail;

    public UnexpectedTokenException(Token token) {
        this(token, null);
    }
    protected UnexpectedTokenException(Token token, String detail) {
        super(token.getPosition(), "unexpected token " + token);
        this.token = token;
        this.detail = detail;
    }

    public Token getToken() {
        return token;
    }

    public String getDetail() {
        return detail;
    }

}
