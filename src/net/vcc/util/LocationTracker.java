package net.vcc.util;

import net.vcc.api.parser.TextLocation;

/**
 * Mutable line/column/index cursor over a source text.
 * Unlike a reader, this does not interpret characters on its own; the
 * caller decides whether a character starts a new line or a tab stop.
 */
public class LocationTracker implements TextLocation {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("line %d column %d (char %d)", getLine(),
                                 getColumn(), getCharacterIndex());
        }

        public boolean equals(Object other) {
            if (! (other instanceof FixedLocation)) return false;
            FixedLocation co = (FixedLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    public static final int DEFAULT_TAB_SIZE = 2;

    private long line;
    private long column;
    private long characterIndex;
    private int tabSize;

    public LocationTracker(long line, long column, long characterIndex,
                           int tabSize) {
        this.line = line;
        this.column = column;
        this.characterIndex = characterIndex;
        setTabSize(tabSize);
    }
    public LocationTracker(int tabSize) {
        this(1, 1, 0, tabSize);
    }
    public LocationTracker() {
        this(DEFAULT_TAB_SIZE);
    }

    public String toString() {
        return String.format("%s@%h[line=%s,column=%s,char=%s,tabSize=%s]",
            getClass().getName(), this, getLine(), getColumn(),
            getCharacterIndex(), getTabSize());
    }

    public long getLine() {
        return line;
    }

    public long getColumn() {
        return column;
    }

    public long getCharacterIndex() {
        return characterIndex;
    }

    public int getTabSize() {
        return tabSize;
    }
    public void setTabSize(int ts) {
        if (ts <= 0)
            throw new IllegalArgumentException("Invalid tab size " + ts);
        tabSize = ts;
    }

    /**
     * Step over one ordinary character.
     */
    public void advanceChar() {
        characterIndex++;
        column++;
    }

    /**
     * Step over a tab character, moving to the next tab stop.
     * Tab stops are the multiples of the tab size; a tab at column c
     * lands on the smallest one strictly greater than c.
     */
    public void advanceTab() {
        characterIndex++;
        column = (column + tabSize) / tabSize * tabSize;
    }

    /**
     * Start a new line. The line break characters themselves are stepped
     * over with advanceChar(); this only moves the line and column, as a
     * CRLF pair must not count as two lines.
     */
    public void advanceLine() {
        line++;
        column = 1;
    }

    public TextLocation snapshot() {
        return new FixedLocation(this);
    }

}
