package com.vireo.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParameterPatterns Tests")
public class ParameterPatternsTest {

    @Test
    @DisplayName("Built-in types are registered")
    void testDefaults() {
        ParameterPatterns patterns = new ParameterPatterns();

        assertEquals(14, patterns.all().size());
        assertEquals("[A-Z0-9]{8}", patterns.get("id"));
        assertEquals("[0-9]{4}", patterns.get("year"));
        assertEquals(".*", patterns.get("any"));
        assertNull(patterns.get("missing"));
    }

    @Test
    @DisplayName("Types can be added and overridden")
    void testAddAndOverride() {
        // Given: the default table
        ParameterPatterns patterns = new ParameterPatterns();

        // When: a type is added and another replaced
        patterns.add("hex", "[0-9a-f]+").add("id", "[0-9]+");

        // Then: both are visible
        assertTrue(patterns.has("hex"));
        assertEquals("[0-9]+", patterns.get("id"));
    }

    @Test
    @DisplayName("Invalid names and regexes are rejected")
    void testInvalidInput() {
        ParameterPatterns patterns = new ParameterPatterns();

        assertThrows(IllegalArgumentException.class, () -> patterns.add("bad-name", "[a-z]+"));
        assertThrows(IllegalArgumentException.class, () -> patterns.add("broken", "[a-z"));
        assertThrows(UnsupportedOperationException.class, () -> patterns.all().put("x", "y"));
    }
}
