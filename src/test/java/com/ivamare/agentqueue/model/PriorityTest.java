package com.ivamare.agentqueue.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Priority")
class PriorityTest {

    @Nested
    @DisplayName("demote")
    class DemoteTests {

        @Test
        @DisplayName("should move one level toward lower urgency")
        void shouldMoveOneLevelDown() {
            assertEquals(Priority.P1, Priority.P0.demote());
            assertEquals(Priority.P2, Priority.P1.demote());
            assertEquals(Priority.P3, Priority.P2.demote());
        }

        @Test
        @DisplayName("should saturate at P3")
        void shouldSaturateAtLowest() {
            assertEquals(Priority.P3, Priority.P3.demote());
        }
    }

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("should accept P-prefixed values in either case")
        void shouldAcceptPrefixedValues() {
            assertEquals(Priority.P1, Priority.parse("P1"));
            assertEquals(Priority.P3, Priority.parse("p3"));
        }

        @Test
        @DisplayName("should accept bare digits with whitespace")
        void shouldAcceptBareDigits() {
            assertEquals(Priority.P0, Priority.parse("0"));
            assertEquals(Priority.P2, Priority.parse(" 2 "));
        }

        @Test
        @DisplayName("should clamp out-of-range numbers")
        void shouldClampOutOfRange() {
            assertEquals(Priority.P3, Priority.parse(7));
            assertEquals(Priority.P0, Priority.parse(-1));
            assertEquals(Priority.P0, Priority.parse("-5"));
            assertEquals(Priority.P3, Priority.parse("P9"));
        }

        @Test
        @DisplayName("should fall back to P2 for garbage and null")
        void shouldFallBackToP2() {
            assertEquals(Priority.P2, Priority.parse("urgent"));
            assertEquals(Priority.P2, Priority.parse("P"));
            assertEquals(Priority.P2, Priority.parse(null));
        }

        @Test
        @DisplayName("should pass through an existing priority")
        void shouldPassThroughPriority() {
            assertEquals(Priority.P0, Priority.parse(Priority.P0));
        }
    }

    @Test
    @DisplayName("should map more urgent tiers to higher transport priorities")
    void shouldOrderTransportPriorities() {
        assertTrue(Priority.P0.transportPriority() > Priority.P1.transportPriority());
        assertTrue(Priority.P1.transportPriority() > Priority.P2.transportPriority());
        assertTrue(Priority.P2.transportPriority() > Priority.P3.transportPriority());
        assertTrue(Priority.P0.transportPriority() <= Priority.MAX_TRANSPORT_PRIORITY);
    }

    @Test
    @DisplayName("should reject levels outside 0..3")
    void shouldRejectInvalidLevel() {
        assertThrows(IllegalArgumentException.class, () -> Priority.of(4));
        assertTrue(Priority.P0.isMoreUrgentThan(Priority.P1));
        assertFalse(Priority.P3.isMoreUrgentThan(Priority.P3));
    }
}
