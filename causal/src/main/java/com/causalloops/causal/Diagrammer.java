package com.causalloops.causal;

import com.causalloops.chat.ChatClient;

/** Asks a chat model for a causal loop diagram. */
public interface Diagrammer {

    /**
     * @param prompt              what to diagram
     * @param backgroundKnowledge extra context sent before the prompt; ignored if null or empty
     * @throws CausalMapDecodeException            if the answer is not a causal map
     * @throws com.causalloops.chat.ChatClientException if the call itself fails
     */
    CausalMap generate(String prompt, String backgroundKnowledge);

    static Diagrammer of(ChatClient client) {
        return new ChatDiagrammer(client, InputShape.RELATIONSHIPS, PromptTemplates.load());
    }

    static Diagrammer of(ChatClient client, InputShape shape) {
        return new ChatDiagrammer(client, shape, PromptTemplates.load());
    }
}
