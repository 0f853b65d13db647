package com.causalloops.chat.openai;

import com.causalloops.common.IEnvGetter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Where and how to reach an OpenAI-compatible chat-completions endpoint.
 *
 * @param apiBase  base URL without the trailing {@code /chat/completions}
 * @param apiKey   bearer token, {@code null} for servers that need none (e.g. a local Ollama)
 * @param debugDir if set, request and response bodies are written there
 */
public record ChatConfig(
        String apiBase,
        String modelName,
        String apiKey,
        Duration connectTimeout,
        Duration readTimeout,
        Path debugDir) {

    public static final String OPENAI_URL = "https://api.openai.com/v1";
    public static final String OLLAMA_URL = "http://localhost:11434/v1";

    public static final String ENV_API_BASE = "CAUSAL_LLM_API_BASE";
    public static final String ENV_MODEL = "CAUSAL_LLM_MODEL";
    public static final String ENV_API_KEY = "CAUSAL_LLM_API_KEY";
    public static final String ENV_CONNECT_TIMEOUT_MS = "CAUSAL_LLM_CONNECT_TIMEOUT_MS";
    public static final String ENV_READ_TIMEOUT_MS = "CAUSAL_LLM_READ_TIMEOUT_MS";
    public static final String ENV_DEBUG_DIR = "CAUSAL_LLM_DEBUG_DIR";

    static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    // structured answers for large diagrams take minutes on local models
    static final long DEFAULT_READ_TIMEOUT_MS = 600_000;

    public ChatConfig {
        Objects.requireNonNull(apiBase, "apiBase");
        Objects.requireNonNull(modelName, "modelName");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        if (apiBase.endsWith("/")) apiBase = apiBase.substring(0, apiBase.length() - 1);
    }

    public static ChatConfig of(String apiBase, String modelName) {
        return new ChatConfig(apiBase, modelName, null,
                Duration.ofMillis(DEFAULT_CONNECT_TIMEOUT_MS), Duration.ofMillis(DEFAULT_READ_TIMEOUT_MS), null);
    }

    public static ChatConfig fromEnv(IEnvGetter env) {
        String debugDir = IEnvGetter.getStringOr(env, ENV_DEBUG_DIR, null);
        return new ChatConfig(
                IEnvGetter.getStringOr(env, ENV_API_BASE, OPENAI_URL),
                IEnvGetter.getString(env, ENV_MODEL),
                IEnvGetter.getStringOr(env, ENV_API_KEY, null),
                Duration.ofMillis(IEnvGetter.getLongOr(env, ENV_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS)),
                Duration.ofMillis(IEnvGetter.getLongOr(env, ENV_READ_TIMEOUT_MS, DEFAULT_READ_TIMEOUT_MS)),
                debugDir == null ? null : Path.of(debugDir));
    }

    public String completionsUrl() {
        return apiBase + "/chat/completions";
    }

    public Optional<Path> debugDirectory() {
        return Optional.ofNullable(debugDir);
    }

    public ChatConfig withDebugDir(Path dir) {
        return new ChatConfig(apiBase, modelName, apiKey, connectTimeout, readTimeout, dir);
    }

    @Override
    public String toString() {
        return "ChatConfig[apiBase=" + apiBase + ", modelName=" + modelName
                + ", apiKey=" + (apiKey == null ? "none" : "***")
                + ", connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout
                + ", debugDir=" + debugDir + "]";
    }
}
