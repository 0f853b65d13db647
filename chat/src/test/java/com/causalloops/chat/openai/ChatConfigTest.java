package com.causalloops.chat.openai;

import com.causalloops.common.IEnvGetter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChatConfigTest {

    @Test
    void fromEnv_usesDefaults_whenOnlyModelIsSet() {
        ChatConfig c = ChatConfig.fromEnv(IEnvGetter.fromMap(Map.of(ChatConfig.ENV_MODEL, "gpt-4o")));

        assertEquals(ChatConfig.OPENAI_URL, c.apiBase());
        assertEquals("gpt-4o", c.modelName());
        assertNull(c.apiKey());
        assertEquals(Duration.ofMillis(ChatConfig.DEFAULT_CONNECT_TIMEOUT_MS), c.connectTimeout());
        assertEquals(Duration.ofMillis(ChatConfig.DEFAULT_READ_TIMEOUT_MS), c.readTimeout());
        assertTrue(c.debugDirectory().isEmpty());
    }

    @Test
    void fromEnv_readsEverything() {
        ChatConfig c = ChatConfig.fromEnv(IEnvGetter.fromMap(Map.of(
                ChatConfig.ENV_API_BASE, ChatConfig.OLLAMA_URL + "/",
                ChatConfig.ENV_MODEL, "llama3",
                ChatConfig.ENV_API_KEY, "secret",
                ChatConfig.ENV_CONNECT_TIMEOUT_MS, "250",
                ChatConfig.ENV_READ_TIMEOUT_MS, "1000",
                ChatConfig.ENV_DEBUG_DIR, "/tmp/cld")));

        assertEquals(ChatConfig.OLLAMA_URL, c.apiBase(), "trailing slash is dropped");
        assertEquals("http://localhost:11434/v1/chat/completions", c.completionsUrl());
        assertEquals("secret", c.apiKey());
        assertEquals(Duration.ofMillis(250), c.connectTimeout());
        assertEquals(Duration.ofSeconds(1), c.readTimeout());
        assertEquals(Path.of("/tmp/cld"), c.debugDirectory().orElseThrow());
    }

    @Test
    void fromEnv_withoutModel_fails() {
        var ex = assertThrows(IllegalStateException.class, () -> ChatConfig.fromEnv(IEnvGetter.fromMap(Map.of())));
        assertTrue(ex.getMessage().contains(ChatConfig.ENV_MODEL));
    }

    @Test
    void toString_hidesTheKey() {
        ChatConfig c = ChatConfig.fromEnv(IEnvGetter.fromMap(Map.of(
                ChatConfig.ENV_MODEL, "m", ChatConfig.ENV_API_KEY, "sk-very-secret")));
        assertFalse(c.toString().contains("sk-very-secret"));
    }
}
