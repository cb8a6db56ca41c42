package net.vcc.api.parser;

/**
 * Generic superclass for checked compiler front end exceptions.
 * Both lexical and syntactic failures are reported as subclasses of this.
 */
public class ParserException extends Exception {

    public ParserException() {
        super();
    }
    public ParserException(String message) {
        super(message);
    }
    public ParserException(Throwable cause) {
        super(cause);
    }
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

}
