package com.causalloops.chat;

import com.causalloops.chat.schema.JsonSchema;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/** Named JSON schema the model's answer must conform to. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseFormat(
        String name,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean strict,
        JsonSchema schema) {
    public ResponseFormat {
        Objects.requireNonNull(name, "name");
    }
}
