package com.entity.network.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CypherLiterals")
class CypherLiteralsTest {

    @Test
    @DisplayName("Should quote strings and leave numbers and booleans bare")
    void testLiterals() {
        assertEquals("'acme'", CypherLiterals.literal("acme"));
        assertEquals("0.75", CypherLiterals.literal(0.75));
        assertEquals("3", CypherLiterals.literal(3L));
        assertEquals("true", CypherLiterals.literal(true));
        assertEquals("null", CypherLiterals.literal(null));
    }

    @Test
    @DisplayName("Should escape quotes and backslashes")
    void testEscaping() {
        assertEquals("'O\\'Brien'", CypherLiterals.literal("O'Brien"));
        assertEquals("'C:\\\\tmp'", CypherLiterals.literal("C:\\tmp"));
        assertEquals("'{\"country\":\"FR\"}'", CypherLiterals.literal("{\"country\":\"FR\"}"));
    }

    @Test
    @DisplayName("Longer parameter names are bound before their prefixes")
    void testPrefixNames() {
        Map<String, Object> params = new HashMap<>();
        params.put("id", "a");
        params.put("idList", "b");
        assertEquals("MATCH (e {id: 'a', list: 'b'})",
                CypherLiterals.inline("MATCH (e {id: $id, list: $idList})", params));
    }

    @Test
    @DisplayName("Queries without parameters are returned unchanged")
    void testNoParams() {
        assertEquals("RETURN 1", CypherLiterals.inline("RETURN 1", Map.of()));
        assertEquals("RETURN 1", CypherLiterals.inline("RETURN 1", null));
    }
}
