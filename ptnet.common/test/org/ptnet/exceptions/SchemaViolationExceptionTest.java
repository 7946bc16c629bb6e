package org.ptnet.exceptions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class SchemaViolationExceptionTest {

    @Test
    public void testMissingFieldMessage() {
        SchemaViolationException e = new SchemaViolationException("net1", "transition", "t1", "name/graphics/offset");

        assertEquals("net 'net1': transition 't1' is missing required name/graphics/offset", e.getMessage());
        assertEquals("net1", e.getNetId());
        assertEquals("transition", e.getElementKind());
        assertEquals("t1", e.getElementId());
        assertNull(e.getOffendingText());
        assertEquals(SchemaViolationException.ERROR_CODE, e.getErrorCode());
    }

    @Test
    public void testOffendingTextMessage() {
        SchemaViolationException e = new SchemaViolationException("net1", "place", "p1", "graphics/position@x", "abc");

        assertEquals("net 'net1': place 'p1' has invalid graphics/position@x: 'abc'", e.getMessage());
        assertTrue(e.toString().startsWith("SchemaViolationException [net1 - SCHEMA_VIOLATION]"));
    }

    @Test
    public void testDanglingReferenceNamesArcAndId() {
        DanglingReferenceException e = new DanglingReferenceException("net1", "a1", "ghost");

        assertEquals("a1", e.getArcId());
        assertEquals("ghost", e.getUnresolvedId());
        assertTrue(e.getMessage().contains("'a1'"));
        assertTrue(e.getMessage().contains("'ghost'"));
    }
}
