package net.vcc.api.parser;

/**
 * A ParserException that is tied to a particular place in the source text.
 * Diagnostics render the place as "&lt;line&gt; &lt;column&gt;"; see
 * {@link #formatLocation(TextLocation)}.
 */
public class LocatedParserException extends ParserException {

    private final TextLocation location;

    public LocatedParserException(TextLocation pos, String message) {
        super(message);
        if (pos == null)
            throw new NullPointerException(
                "Exception location may not be null");
        location = pos;
    }
    public LocatedParserException(TextLocation pos, String message,
                                  Throwable cause) {
        super(message, cause);
        if (pos == null)
            throw new NullPointerException(
                "Exception location may not be null");
        location = pos;
    }

    public TextLocation getLocation() {
        return location;
    }

    public long getLine() {
        return location.getLine();
    }

    public long getColumn() {
        return location.getColumn();
    }

    public static String formatLocation(TextLocation pos) {
        return pos.getLine() + " " + pos.getColumn();
    }

}
