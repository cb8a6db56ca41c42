package net.vcc.parser;

import net.vcc.lexer.Token;

/**
 * Raised when an identifier does not name a visible entity.
 * Only entities declared before the point of use are visible.
 */
public class UnresolvedNameException extends UnexpectedTokenException {

    private final String entityKind;

    public UnresolvedNameException(Token token, String entityKind) {
        super(token, "no " + entityKind + " named " + token.getContent());
        this.entityKind = entityKind;
    }

    /**
     * What the name should have referred to, e.g. "class" or "object".
     */
    public String getEntityKind() {
        return entityKind;
    }

    public String getName() {
        return getToken().getContent();
    }

}
