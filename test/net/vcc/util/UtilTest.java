package net.vcc.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.logging.Level;
import net.vcc.api.NamedValue;
import net.vcc.api.parser.TextLocation;
import org.junit.jupiter.api.Test;

public class UtilTest {

    private static class Named implements NamedValue {

        private final String name;

        public Named(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

    }

    @Test
    public void formatsCharactersAndStrings() {
        assertEquals("'a'", Formats.formatCharacter('a'));
        assertEquals("'\\n'", Formats.formatCharacter('\n'));
        assertEquals("'\\x01'", Formats.formatCharacter(1));
        assertEquals("'\\''", Formats.formatCharacter('\''));
        assertEquals("\"a\\\"b\\n\"", Formats.formatString("a\"b\n"));
        assertEquals("\"x\\\\y\"", Formats.formatString("x\\y"));
    }

    @Test
    public void trackerCountsColumnsAndLines() {
        LocationTracker t = new LocationTracker();
        assertEquals(1, t.getLine());
        assertEquals(1, t.getColumn());
        t.advanceChar();
        t.advanceChar();
        assertEquals(3, t.getColumn());
        TextLocation snap = t.snapshot();
        t.advanceLine();
        assertEquals(2, t.getLine());
        assertEquals(1, t.getColumn());
        assertEquals(2, t.getCharacterIndex());
        assertEquals(1, snap.getLine());
        assertEquals(3, snap.getColumn());
        assertEquals(new LocationTracker.FixedLocation(1, 3, 2), snap);
    }

    @Test
    public void snapshotsEqualOnlyOtherSnapshots() {
        LocationTracker t = new LocationTracker();
        TextLocation snap = t.snapshot();
        assertEquals(new LocationTracker.FixedLocation(1, 1, 0), snap);
        assertEquals(new LocationTracker.FixedLocation(1, 1, 0).hashCode(),
                     snap.hashCode());
        assertNotEquals(snap, t);
        assertNotEquals(t, snap);
    }

    @Test
    public void trackerSnapsTabsToStops() {
        LocationTracker t = new LocationTracker(4);
        t.advanceTab();
        assertEquals(4, t.getColumn());
        t.advanceTab();
        assertEquals(8, t.getColumn());
        t.advanceChar();
        t.advanceTab();
        assertEquals(12, t.getColumn());
        assertThrows(IllegalArgumentException.class, () -> t.setTabSize(0));
        assertThrows(IllegalArgumentException.class,
                     () -> new LocationTracker(-1));
    }

    @Test
    public void namedMapKeysValuesByName() {
        NamedMap<Named> map = new NamedMap<Named>();
        Named a = new Named("a");
        assertTrue(map.add(a));
        assertFalse(map.add(new Named("a")));
        assertSame(a, map.get("a"));
        assertTrue(map.containsValue(a));
        assertThrows(IllegalArgumentException.class,
                     () -> map.put("b", new Named("c")));
        assertFalse(map.removeValue(new Named("a")));
        assertTrue(map.removeValue(a));
        assertTrue(map.isEmpty());
    }

    @Test
    public void parsesLogLevels() {
        assertEquals(Level.FINE, Logging.parseLevel("fine"));
        assertEquals(Level.WARNING, Logging.parseLevel("WARNING"));
        IllegalArgumentException exc = assertThrows(
            IllegalArgumentException.class,
            () -> Logging.parseLevel("loud"));
        assertEquals("Invalid logging level \"loud\"", exc.getMessage());
    }

}
