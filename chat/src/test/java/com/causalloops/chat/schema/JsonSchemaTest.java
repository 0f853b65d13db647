package com.causalloops.chat.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonSchemaTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static JsonNode json(JsonSchema s) throws Exception {
        return mapper.readTree(mapper.writeValueAsString(s));
    }

    @Test
    void string_omitsEmptyMembers() throws Exception {
        JsonNode n = json(JsonSchema.string("a name"));
        assertEquals("string", n.get("type").asText());
        assertEquals("a name", n.get("description").asText());
        assertEquals(2, n.size());
    }

    @Test
    void stringEnum_writesEnumKeyword() throws Exception {
        JsonNode n = json(JsonSchema.stringEnum("sign", "+", "-"));
        assertEquals("+", n.get("enum").get(0).asText());
        assertEquals("-", n.get("enum").get(1).asText());
    }

    @Test
    void closedObject_requiresAllProperties_inDeclarationOrder_andForbidsOthers() throws Exception {
        Map<String, JsonSchema> props = new LinkedHashMap<>();
        props.put("b", JsonSchema.string("b"));
        props.put("a", JsonSchema.string("a"));
        JsonSchema s = JsonSchema.closedObject("thing", props).withDraft07();

        JsonNode n = json(s);
        assertEquals("object", n.get("type").asText());
        assertEquals(List.of("b", "a"), mapper.convertValue(n.get("required"), List.class));
        assertFalse(n.get("additionalProperties").asBoolean(true));
        assertEquals(JsonSchema.DRAFT_07, n.get("$schema").asText());

        var names = n.get("properties").fieldNames();
        assertEquals("b", names.next());
        assertEquals("a", names.next());
    }

    @Test
    void array_nestsItems() throws Exception {
        JsonNode n = json(JsonSchema.array("list", JsonSchema.string("item")));
        assertEquals("array", n.get("type").asText());
        assertEquals("string", n.get("items").get("type").asText());
    }

    @Test
    void propertiesAreImmutable() {
        Map<String, JsonSchema> props = new LinkedHashMap<>();
        props.put("a", JsonSchema.string("a"));
        JsonSchema s = JsonSchema.closedObject("thing", props);
        props.put("b", JsonSchema.string("b"));
        assertEquals(1, s.properties().size());
        assertThrows(UnsupportedOperationException.class, () -> s.properties().clear());
    }
}
