package eu.virtualparadox.incidentkb.ingest.chunker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSpanTest {

    @Test
    void sliceIsHalfOpen() {
        TextSpan span = new TextSpan(4, 9);
        assertEquals(5, span.length());
        assertEquals("quick", span.slice("the quick fox"));
    }

    @Test
    void emptySpanSlicesToEmptyText() {
        TextSpan span = new TextSpan(3, 3);
        assertEquals(0, span.length());
        assertEquals("", span.slice("abcdef"));
    }

    @Test
    void invalidBoundsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TextSpan(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new TextSpan(5, 4));
    }

    @Test
    void spansCompareByValue() {
        assertEquals(new TextSpan(1, 7), new TextSpan(1, 7));
        assertNotEquals(new TextSpan(1, 7), new TextSpan(1, 8));
    }
}
