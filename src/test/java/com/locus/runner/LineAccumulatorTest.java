package com.locus.runner;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineAccumulatorTest {

    @Test
    void holdsBackPartialLineUntilCompleted() {
        var acc = new LineAccumulator();

        assertEquals(List.of(), acc.feed("{\"type\":\"res"));
        assertTrue(acc.hasPending());
        assertEquals(List.of("{\"type\":\"result\"}"), acc.feed("ult\"}\n"));
        assertFalse(acc.hasPending());
    }

    @Test
    void splitsSeveralLinesInOneChunk() {
        var acc = new LineAccumulator();

        assertEquals(List.of("a", "", "b"), acc.feed("a\n\nb\nc"));
        assertEquals("c", acc.flush());
        assertEquals("", acc.flush());
    }

    @Test
    void stripsCarriageReturns() {
        assertEquals(List.of("one", "two"), new LineAccumulator().feed("one\r\ntwo\r\n"));
    }
}
