package me.golemcore.relay.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeTest {

    @Test
    void shouldDistinguishKindsWithSameId() {
        assertNotEquals(Scope.privateChat("100"), Scope.group("100"));
        assertEquals("private:100", Scope.privateChat("100").key());
        assertEquals("group:100", Scope.group("100").toString());
    }

    @Test
    void shouldParseKeysLeniently() {
        assertEquals(Scope.group("777"), Scope.parse("GROUP: 777"));
        assertTrue(Scope.parse("private:1").isPrivate());
    }

    @Test
    void shouldRejectMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("777"));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("group:"));
        assertThrows(IllegalArgumentException.class, () -> Scope.parse("channel:1"));
        assertThrows(IllegalArgumentException.class, () -> Scope.group(" "));
    }

    @Test
    void shouldSerializeAsKey() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(Map.of("scope", Scope.group("5")));

        assertEquals("{\"scope\":\"group:5\"}", json);
        assertEquals(Scope.group("5"), mapper.readValue("\"group:5\"", Scope.class));
    }
}
