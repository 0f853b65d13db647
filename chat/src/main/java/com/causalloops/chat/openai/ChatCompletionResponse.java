package com.causalloops.chat.openai;

import java.util.List;
import java.util.Optional;

public record ChatCompletionResponse(String id, String object, long created, String model, List<Choice> choices) {

    public record Choice(int index, ChoiceMessage message) {}

    public record ChoiceMessage(String role, String content) {}

    /** Content of the first choice, if there is one with a message. */
    public Optional<String> firstContent() {
        if (choices == null || choices.isEmpty()) return Optional.empty();
        Choice first = choices.get(0);
        if (first == null || first.message() == null) return Optional.empty();
        return Optional.ofNullable(first.message().content());
    }
}
