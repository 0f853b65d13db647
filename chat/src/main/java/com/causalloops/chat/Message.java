package com.causalloops.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Message(String role, String content) {
    public static final String USER_ROLE = "user";
    public static final String SYSTEM_ROLE = "system";

    public static Message user(String content) {
        return new Message(USER_ROLE, content);
    }

    public static Message system(String content) {
        return new Message(SYSTEM_ROLE, content);
    }
}
