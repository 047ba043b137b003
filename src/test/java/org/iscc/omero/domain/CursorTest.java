package org.iscc.omero.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CursorTest {

    private static final Instant T1 = Instant.parse("2024-04-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-04-01T10:00:01Z");

    private static AssetReference asset(String id, Instant imported) {
        return new AssetReference(id, id, imported, List.of());
    }

    @Test
    void shouldStartBeforeEverything() {
        Cursor initial = Cursor.initial();

        assertEquals(Instant.EPOCH, initial.lastSeenTimestamp());
        assertEquals("", initial.lastSeenId());
        assertTrue(initial.precedes(asset("a", T1)));
    }

    @Test
    void shouldOrderByTimestampThenId() {
        Cursor atB = Cursor.at(asset("b", T1));

        assertTrue(atB.precedes(asset("c", T1)), "Same timestamp, larger id");
        assertFalse(atB.precedes(asset("a", T1)), "Same timestamp, smaller id");
        assertFalse(atB.precedes(asset("b", T1)), "Same position");
        assertTrue(atB.precedes(asset("a", T2)), "Later timestamp wins over id");
    }

    @Test
    void shouldNeverMoveBackward() {
        Cursor cursor = Cursor.initial();
        cursor = cursor.advance(asset("b", T2));
        Cursor before = cursor;

        cursor = cursor.advance(asset("a", T1));

        assertSame(before, cursor);
        assertEquals(T2, cursor.lastSeenTimestamp());
        assertEquals("b", cursor.lastSeenId());
    }

    @Test
    void shouldRejectMissingTimestamp() {
        assertThrows(IllegalArgumentException.class, () -> new Cursor(null, "x"));
        assertEquals("", new Cursor(T1, null).lastSeenId());
    }
}
