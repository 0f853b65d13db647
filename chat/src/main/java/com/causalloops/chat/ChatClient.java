package com.causalloops.chat;

import java.util.List;

/** A chat-completion round trip. Implementations return the raw response body. */
public interface ChatClient {
    /**
     * @throws ChatClientException if the call fails or the server answers with a non-2xx status
     */
    String chatCompletion(List<Message> messages, ChatOption... options);
}
