package com.causalloops.chat.schema;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SchemaType {
    STRING("string"),
    ARRAY("array"),
    OBJECT("object");

    private final String wire;

    SchemaType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
