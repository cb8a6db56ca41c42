package net.vcc.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of token kinds.
 * Each kind has a display name used in diagnostics and token dumps.
 */
public enum TokenType {
    ARROW("arrow"),
    COMMA("comma"),
    DIVIDE("divide"),
    END("end"),
    FUNC_KEYWORD("func_keyword"),
    IDENTIFIER("identifier"),
    LEFT_CURLY("left_curly"),
    LEFT_PAREN("left_paren"),
    MINUS("minus"),
    MODULO("modulo"),
    MULTIPLY("multiply"),
    PLUS("plus"),
    RETURN_KEYWORD("return_keyword"),
    RIGHT_CURLY("right_curly"),
    RIGHT_PAREN("right_paren"),
    SEMICOLON("semicolon");

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> kw = new HashMap<String, TokenType>();
        kw.put("func", FUNC_KEYWORD);
        kw.put("return", RETURN_KEYWORD);
        KEYWORDS = Collections.unmodifiableMap(kw);
    }

    private final String displayName;

    private TokenType(String displayName) {
        this.displayName = displayName;
    }

    public String toString() {
        return displayName;
    }

    public boolean isKeyword() {
        return KEYWORDS.containsValue(this);
    }

    public static Map<String, TokenType> getKeywords() {
        return KEYWORDS;
    }

    /**
     * Classify a captured identifier-shaped lexeme.
     * Returns the keyword kind if lexeme is reserved, IDENTIFIER otherwise.
     */
    public static TokenType forKeyword(String lexeme) {
        TokenType ret = KEYWORDS.get(lexeme);
        return (ret == null) ? IDENTIFIER : ret;
    }

}
