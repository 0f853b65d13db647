package com.causalloops.chat;

import com.causalloops.chat.schema.JsonSchema;

/**
 * Settings for one chat request. Unset values are {@code null} (or 0 for max tokens) and are left
 * out of the request.
 */
public record ChatOptions(
        Double temperature,
        String reasoningEffort,
        ResponseFormat responseFormat,
        int maxTokens,
        String systemPrompt) {

    public static ChatOptions apply(ChatOption... options) {
        Builder b = new Builder();
        if (options != null) {
            for (ChatOption o : options) o.applyTo(b);
        }
        return b.build();
    }

    public static ChatOption withTemperature(double t) {
        return b -> b.temperature = t;
    }

    /** {@code low}, {@code medium} or {@code high}; passed through as given. */
    public static ChatOption withReasoningEffort(String lowMedHigh) {
        return b -> b.reasoningEffort = lowMedHigh;
    }

    public static ChatOption withMaxTokens(int tokens) {
        return b -> b.maxTokens = tokens;
    }

    public static ChatOption withResponseFormat(String name, boolean strict, JsonSchema schema) {
        return b -> b.responseFormat = new ResponseFormat(name, strict, schema);
    }

    public static ChatOption withSystemPrompt(String prompt) {
        return b -> b.systemPrompt = prompt;
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isEmpty();
    }

    public static final class Builder {
        private Double temperature;
        private String reasoningEffort;
        private ResponseFormat responseFormat;
        private int maxTokens;
        private String systemPrompt;

        private Builder() {}

        private ChatOptions build() {
            return new ChatOptions(temperature, reasoningEffort, responseFormat, maxTokens, systemPrompt);
        }
    }
}
