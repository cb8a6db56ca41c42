package net.vcc.lexer;

import net.vcc.api.parser.TextLocation;

public class Token {

    private final TokenType type;
    private final TextLocation position;
    private final String content;

    public Token(TokenType type, TextLocation position, String content) {
        if (type == null)
            throw new NullPointerException("Token type may not be null");
        if (position == null)
            throw new NullPointerException(
                "Token coordinates may not be null");
        if (content == null)
            throw new NullPointerException(
                "Token content may not be null");
        this.type = type;
        this.position = position;
        this.content = content;
    }

    /**
     * Renders as &lt;kind&gt; "&lt;lexeme&gt;" &lt;line&gt; &lt;column&gt;.
     * The lexeme is reproduced verbatim (identifiers and punctuation never
     * need escaping).
     */
    public String toString() {
        return String.format("%s \"%s\" %d %d", getType(), getContent(),
                             getLine(), getColumn());
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token to = (Token) other;
        return (getType() == to.getType() &&
                getPosition().getLine() == to.getPosition().getLine() &&
                getPosition().getColumn() == to.getPosition().getColumn() &&
                getPosition().getCharacterIndex() ==
                    to.getPosition().getCharacterIndex() &&
                getContent().equals(to.getContent()));
    }

    public int hashCode() {
        return getType().hashCode() ^ (int) getLine() * 31 ^
            (int) getColumn() ^ getContent().hashCode();
    }

    public TokenType getType() {
        return type;
    }

    public TextLocation getPosition() {
        return position;
    }

    public long getLine() {
        return position.getLine();
    }

    public long getColumn() {
        return position.getColumn();
    }

    public String getContent() {
        return content;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    /**
     * Whether this token has the same kind and lexeme as other,
     * regardless of where either was found.
     */
    public boolean sameAs(Token other) {
        return (getType() == other.getType() &&
                getContent().equals(other.getContent()));
    }

}
