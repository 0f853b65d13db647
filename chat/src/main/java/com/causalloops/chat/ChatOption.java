package com.causalloops.chat;

/** One setting applied to a chat request; see the factories on {@link ChatOptions}. */
@FunctionalInterface
public interface ChatOption {
    void applyTo(ChatOptions.Builder builder);
}
