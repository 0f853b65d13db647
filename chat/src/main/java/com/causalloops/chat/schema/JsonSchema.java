package com.causalloops.chat.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The subset of JSON Schema used to constrain model output. Empty members are not serialized.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"$schema", "type", "description", "properties", "items", "enum", "required", "additionalProperties"})
public record JsonSchema(
        SchemaType type,
        String description,
        Map<String, JsonSchema> properties,
        JsonSchema items,
        @JsonProperty("enum") List<String> enumValues,
        List<String> required,
        Boolean additionalProperties,
        @JsonProperty("$schema") String schema) {

    public static final String DRAFT_07 = "http://json-schema.org/draft-07/schema#";

    public JsonSchema {
        properties = properties == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
        required = required == null ? null : List.copyOf(required);
    }

    public static JsonSchema string(String description) {
        return new JsonSchema(SchemaType.STRING, description, null, null, null, null, null, null);
    }

    public static JsonSchema stringEnum(String description, String... values) {
        return new JsonSchema(SchemaType.STRING, description, null, null, List.of(values), null, null, null);
    }

    public static JsonSchema array(String description, JsonSchema items) {
        return new JsonSchema(SchemaType.ARRAY, description, null, items, null, null, null, null);
    }

    /** A closed object: every listed property is required and no others are allowed. */
    public static JsonSchema closedObject(String description, Map<String, JsonSchema> properties) {
        return new JsonSchema(SchemaType.OBJECT, description, properties, null, null,
                List.copyOf(properties.keySet()), false, null);
    }

    public JsonSchema withDraft07() {
        return new JsonSchema(type, description, properties, items, enumValues, required, additionalProperties, DRAFT_07);
    }
}
