package net.vcc.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Formats {

    private static final Pattern ESCAPE = Pattern.compile(
        "[\0-\037\"\\\\\177]");

    // Prevent construction.
    private Formats() {}

    public static String escapeCharacter(int ch) {
        switch (ch) {
            case '\t': return "\\t";
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\0': return "\\0";
            case '"': return "\\\"";
            case '\'': return "\\'";
            case '\\': return "\\\\";
        }
        if (ch < 040 || ch == 0177)
            return String.format("\\x%02X", ch);
        return new String(Character.toChars(ch));
    }

    /**
     * Render a single code point as a single-quoted literal.
     */
    public static String formatCharacter(int ch) {
        return "'" + escapeCharacter(ch) + "'";
    }

    /**
     * Render a string as a double-quoted literal, escaping control
     * characters, quotes and backslashes.
     */
    public static String formatString(String s) {
        Matcher m = ESCAPE.matcher(s);
        StringBuffer sb = new StringBuffer("\"");
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(
                escapeCharacter(m.group().charAt(0))));
        }
        m.appendTail(sb);
        return sb.append('"').toString();
    }

}
