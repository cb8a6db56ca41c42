package net.vcc.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import net.vcc.api.parser.TextLocation;
import net.vcc.util.LocationTracker;

/**
 * Converts source text into a list of tokens.
 *
 * The lexer is a state machine with the following properties:
 * <ul>
 * <li>An index into the source string designates the current character.
 *     It is only ever incremented, and never beyond the terminating
 *     {@link #SENTINEL}.</li>
 * <li>Whenever the START state is entered, the current index, line and
 *     column are saved as the start of a new lexeme; tokens carry that
 *     saved position.</li>
 * <li>Generated tokens are appended to the result list, which is only
 *     ever appended to. The last token is always of type END.</li>
 * </ul>
 */
public class Lexer {

    public enum State {
        // Either CR or CRLF, both of which indicate a single newline
        CR_OR_CRLF,
        // Either / (division), // (line comment), or /* (block comment)
        DIVIDE_OR_COMMENT,
        // [A-Za-z_][A-Za-z0-9_]*; either an identifier or a keyword
        IDENTIFIER_OR_KEYWORD,
        // Either - (minus) or -> (arrow)
        MINUS_OR_ARROW,
        // Inside a block comment
        MULTI_LINE_COMMENT,
        // Either CR or CRLF inside a block comment
        MULTI_LINE_COMMENT_CR_OR_CRLF,
        // Seen * inside a block comment; a following / ends it
        MULTI_LINE_COMMENT_MAYBE_END,
        // Inside a line comment, terminated by a newline
        SINGLE_LINE_COMMENT,
        // Start of a new lexeme
        START
    }

    public static final char SENTINEL = '\0';

    public static final int DEFAULT_TAB_SIZE =
        LocationTracker.DEFAULT_TAB_SIZE;

    private static final Logger LOGGER = Logger.getLogger("Lexer");

    private final String source;
    private final LocationTracker position;
    private final List<Token> tokens;
    private State state;
    private int index;
    private int startIndex;
    private TextLocation startPosition;
    private TextLocation commentStart;
    private boolean done;

    public Lexer(String source) {
        if (source == null)
            throw new NullPointerException("Source may not be null");
        if (source.isEmpty() ||
                source.charAt(source.length() - 1) != SENTINEL)
            source += SENTINEL;
        this.source = source;
        this.position = new LocationTracker(DEFAULT_TAB_SIZE);
        this.tokens = new ArrayList<Token>();
        this.state = State.START;
        this.index = 0;
        this.startIndex = 0;
        this.startPosition = position.snapshot();
        this.commentStart = null;
        this.done = false;
    }

    public String getSource() {
        return source;
    }

    public int getTabSize() {
        return position.getTabSize();
    }
    /**
     * Set the amount of columns per tab stop.
     * This only affects the column numbers attached to tokens.
     */
    public void setTabSize(int ts) {
        position.setTabSize(ts);
    }

    public State getState() {
        return state;
    }

    public TextLocation getPosition() {
        return position.snapshot();
    }

    public boolean isDone() {
        return done;
    }

    /**
     * The tokens produced so far.
     */
    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Run the lexer to completion and return the token list.
     */
    public List<Token> run() throws LexerException {
        if (done)
            throw new IllegalStateException("Lexer has already run");
        while (! done) {
            step();
        }
        LOGGER.fine("Produced " + tokens.size() + " tokens");
        return getTokens();
    }

    /**
     * Perform a single state transition.
     * Consumes at most one character.
     */
    public void step() throws LexerException {
        if (done)
            throw new IllegalStateException("Lexer has finished");
        char ch = currentChar();
        switch (state) {
            case CR_OR_CRLF:
                if (ch == '\n') advanceChar();
                position.advanceLine();
                state = State.START;
                break;
            case DIVIDE_OR_COMMENT:
                switch (ch) {
                    case '/':
                        advanceChar();
                        state = State.SINGLE_LINE_COMMENT;
                        break;
                    case '*':
                        advanceChar();
                        commentStart = startPosition;
                        state = State.MULTI_LINE_COMMENT;
                        break;
                    default:
                        addToken(TokenType.DIVIDE);
                        state = State.START;
                        break;
                }
                break;
            case IDENTIFIER_OR_KEYWORD:
                if (isIdentifierChar(ch)) {
                    advanceChar();
                } else {
                    addToken(TokenType.forKeyword(getLexeme()));
                    state = State.START;
                }
                break;
            case MINUS_OR_ARROW:
                if (ch == '>') {
                    advanceChar();
                    addToken(TokenType.ARROW);
                } else {
                    addToken(TokenType.MINUS);
                }
                state = State.START;
                break;
            case MULTI_LINE_COMMENT:
                switch (ch) {
                    case '\n':
                        advanceChar();
                        position.advanceLine();
                        break;
                    case '\r':
                        advanceChar();
                        state = State.MULTI_LINE_COMMENT_CR_OR_CRLF;
                        break;
                    case '*':
                        advanceChar();
                        state = State.MULTI_LINE_COMMENT_MAYBE_END;
                        break;
                    case '\t':
                        advanceTab();
                        break;
                    default:
                        if (atSentinel())
                            throw LexerException.unterminatedComment(
                                commentStart);
                        advanceChar();
                        break;
                }
                break;
            case MULTI_LINE_COMMENT_CR_OR_CRLF:
                if (ch == '\n') advanceChar();
                position.advanceLine();
                state = State.MULTI_LINE_COMMENT;
                break;
            case MULTI_LINE_COMMENT_MAYBE_END:
                if (ch == '/') {
                    advanceChar();
                    commentStart = null;
                    state = State.START;
                } else {
                    state = State.MULTI_LINE_COMMENT;
                }
                break;
            case SINGLE_LINE_COMMENT:
                switch (ch) {
                    case '\n':
                        advanceChar();
                        position.advanceLine();
                        state = State.START;
                        break;
                    case '\r':
                        advanceChar();
                        state = State.CR_OR_CRLF;
                        break;
                    case '\t':
                        advanceTab();
                        break;
                    default:
                        if (atSentinel()) {
                            state = State.START;
                        } else {
                            advanceChar();
                        }
                        break;
                }
                break;
            case START:
                startLexeme();
                if (isIdentifierStart(ch)) {
                    advanceChar();
                    state = State.IDENTIFIER_OR_KEYWORD;
                    break;
                }
                switch (ch) {
                    case '+':
                        emitSingle(TokenType.PLUS);
                        break;
                    case '*':
                        emitSingle(TokenType.MULTIPLY);
                        break;
                    case '%':
                        emitSingle(TokenType.MODULO);
                        break;
                    case ',':
                        emitSingle(TokenType.COMMA);
                        break;
                    case ';':
                        emitSingle(TokenType.SEMICOLON);
                        break;
                    case '{':
                        emitSingle(TokenType.LEFT_CURLY);
                        break;
                    case '}':
                        emitSingle(TokenType.RIGHT_CURLY);
                        break;
                    case '(':
                        emitSingle(TokenType.LEFT_PAREN);
                        break;
                    case ')':
                        emitSingle(TokenType.RIGHT_PAREN);
                        break;
                    case '\n':
                        advanceChar();
                        position.advanceLine();
                        break;
                    case '\r':
                        advanceChar();
                        state = State.CR_OR_CRLF;
                        break;
                    case '\t':
                        advanceTab();
                        break;
                    case ' ':
                        advanceChar();
                        break;
                    case '/':
                        advanceChar();
                        state = State.DIVIDE_OR_COMMENT;
                        break;
                    case '-':
                        advanceChar();
                        state = State.MINUS_OR_ARROW;
                        break;
                    case SENTINEL:
                        addToken(TokenType.END);
                        done = true;
                        break;
                    default:
                        throw LexerException.unexpectedCharacter(
                            position.snapshot(),
                            source.codePointAt(index));
                }
                break;
        }
    }

    protected char currentChar() {
        return source.charAt(index);
    }

    protected boolean atSentinel() {
        return index == source.length() - 1;
    }

    private void startLexeme() {
        startIndex = index;
        startPosition = position.snapshot();
    }

    private void advanceChar() {
        if (atSentinel()) return;
        index++;
        position.advanceChar();
    }

    private void advanceTab() {
        if (atSentinel()) return;
        index++;
        position.advanceTab();
    }

    private String getLexeme() {
        return source.substring(startIndex, index);
    }

    private void emitSingle(TokenType type) {
        advanceChar();
        addToken(type);
    }

    private Token addToken(TokenType type) {
        Token ret = new Token(type, startPosition, getLexeme());
        tokens.add(ret);
        return ret;
    }

    private static boolean isIdentifierStart(char ch) {
        return ((ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') ||
                ch == '_');
    }

    private static boolean isIdentifierChar(char ch) {
        return isIdentifierStart(ch) || (ch >= '0' && ch <= '9');
    }

}
