package com.causalloops.chat.openai;

import com.causalloops.chat.Message;
import com.causalloops.chat.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChatCompletionRequest(
        List<Message> messages,
        String model,
        @JsonProperty("response_format") JsonSchemaResponseFormat responseFormat,
        Double temperature,
        @JsonProperty("reasoning_effort") String reasoningEffort,
        @JsonProperty("max_tokens") Integer maxTokens) {

    /** OpenAI's wrapper around a response format: {@code {"type": "json_schema", "json_schema": {...}}}. */
    public record JsonSchemaResponseFormat(String type, @JsonProperty("json_schema") ResponseFormat jsonSchema) {
        public static JsonSchemaResponseFormat of(ResponseFormat format) {
            return new JsonSchemaResponseFormat("json_schema", format);
        }
    }
}
