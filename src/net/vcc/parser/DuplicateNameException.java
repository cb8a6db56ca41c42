package net.vcc.parser;

import net.vcc.lexer.Token;

/**
 * Raised when a declaration reuses a name already taken in its scope.
 */
public class DuplicateNameException extends UnexpectedTokenException {

    private final String entityKind;

    public DuplicateNameException(Token token, String entityKind) {
        super(token, entityKind + " " + token.getContent() +
              " already defined");
        this.entityKind = entityKind;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public String getName() {
        return getToken().getContent();
    }

}
