package org.Aayush.arbor.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LayoutException Tests")
class LayoutExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessageFormat() {
        IllegalStateException cause = new IllegalStateException("cause");
        LayoutException ex = new LayoutException("ARBOR_TEST", "something broke", cause);

        assertEquals("ARBOR_TEST", ex.getReasonCode());
        assertEquals("[ARBOR_TEST] something broke", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertFalse(ex.hasElementIndex());
        assertEquals(LayoutException.NO_ELEMENT, ex.getElementIndex());
    }

    @Test
    @DisplayName("Element failures keep the offending list position")
    void testElementIndex() {
        LayoutException ex = new LayoutException("ARBOR_TEST", 4, "nodes[4] must be non-null");

        assertTrue(ex.hasElementIndex());
        assertEquals(4, ex.getElementIndex());
        assertEquals("[ARBOR_TEST] nodes[4] must be non-null", ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Reason code must be present")
    void testReasonCodeRequired() {
        assertThrows(NullPointerException.class, () -> new LayoutException(null, "msg"));
        assertThrows(IllegalArgumentException.class, () -> new LayoutException(" ", "msg"));
        assertThrows(NullPointerException.class, () -> new LayoutException("ARBOR_TEST", null));
    }
}
