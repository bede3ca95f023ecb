package com.cmflineage.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class NodeIdTest {

    @Test
    void shouldParseWhatItPrints() {
        NodeId id = NodeId.of("site-a", 42);

        assertEquals("site-a:42", id.toString());
        assertEquals(id, NodeId.parse("site-a:42"));
    }

    @Test
    void shouldSerializeAsPlainString() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        NodeId id = NodeId.of("central", 7);

        String json = mapper.writeValueAsString(id);

        assertEquals("\"central:7\"", json);
        assertEquals(id, mapper.readValue(json, NodeId.class));
    }

    @Test
    void shouldRejectMalformedIds() {
        assertThrows(IllegalArgumentException.class, () -> NodeId.parse("no-separator"));
        assertThrows(IllegalArgumentException.class, () -> NodeId.parse("site:abc"));
        assertThrows(IllegalArgumentException.class, () -> NodeId.of("bad:store", 1));
        assertThrows(IllegalArgumentException.class, () -> NodeId.of("site", -1));
    }

    @Test
    void shouldOrderByStoreThenSequence() {
        assertTrue(NodeId.of("a", 10).compareTo(NodeId.of("b", 1)) < 0);
        assertTrue(NodeId.of("a", 2).compareTo(NodeId.of("a", 10)) < 0);
    }
}
