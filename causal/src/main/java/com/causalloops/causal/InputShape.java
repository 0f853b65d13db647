package com.causalloops.causal;

import com.causalloops.chat.schema.JsonSchema;

/** Which wire shape the model is asked to answer in. */
public enum InputShape {
    RELATIONSHIPS(ResponseSchemas.RELATIONSHIPS),
    CAUSAL_CHAINS(ResponseSchemas.CAUSAL_CHAINS);

    private final JsonSchema schema;

    InputShape(JsonSchema schema) {
        this.schema = schema;
    }

    public JsonSchema schema() {
        return schema;
    }
}
