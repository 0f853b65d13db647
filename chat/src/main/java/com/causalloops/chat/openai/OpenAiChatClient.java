package com.causalloops.chat.openai;

import com.causalloops.chat.ChatClient;
import com.causalloops.chat.ChatClientException;
import com.causalloops.chat.ChatOption;
import com.causalloops.chat.ChatOptions;
import com.causalloops.chat.Message;
import com.causalloops.common.apiclient.ApiClient;
import com.causalloops.common.apiclient.BlockingHttp2ApiClient;
import com.causalloops.common.apiclient.HttpClientConfig;
import com.causalloops.common.apiclient.HttpStatusException;
import com.causalloops.common.apiclient.JsonPostCodec;
import com.causalloops.common.codec.Codec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Chat client for OpenAI-compatible {@code /chat/completions} endpoints (OpenAI, Ollama, ...).
 * The system prompt travels as the first message.
 */
public final class OpenAiChatClient implements ChatClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final ChatConfig config;
    private final Codec<ChatCompletionRequest, String> requestCodec;
    private final ApiClient<ChatCompletionRequest, String> api;

    public OpenAiChatClient(ChatConfig config) {
        this(config, c -> HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(c.connectTimeout())
                .build());
    }

    public OpenAiChatClient(ChatConfig config,
                            Function<HttpClientConfig<ChatCompletionRequest, String>, HttpClient> httpFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.requestCodec = Codec.clazzCodec(ChatCompletionRequest.class);
        var codec = new JsonPostCodec<ChatCompletionRequest, String>(requestCodec, body -> body);
        var httpConfig = new HttpClientConfig<>(
                config.connectTimeout(),
                config.readTimeout(),
                codec,
                config.apiKey() == null
                        ? HttpClientConfig.<ChatCompletionRequest>defaultHeadersFn()
                        : HttpClientConfig.<ChatCompletionRequest>bearerHeadersFn(config.apiKey()));
        this.api = new BlockingHttp2ApiClient<>(httpConfig, httpFactory);
    }

    @Override
    public String chatCompletion(List<Message> messages, ChatOption... options) {
        Objects.requireNonNull(messages, "messages");
        ChatCompletionRequest request = toRequest(messages, ChatOptions.apply(options));

        config.debugDirectory().ifPresent(dir -> writeDebug(dir, "request.json",
                requestCodec.encode(request).valueOrDefault("")));

        String corrId = UUID.randomUUID().toString();
        log.info("Chat completion: model={} messages={} corrId={}", config.modelName(), request.messages().size(), corrId);
        String body;
        try {
            body = api.post(config.completionsUrl(), corrId, request);
        } catch (HttpStatusException e) {
            throw new ChatClientException("http status code: " + e.statusCode() + " (" + e.body() + ")", e.statusCode(), e);
        } catch (RuntimeException e) {
            throw new ChatClientException("chat completion failed: " + e.getMessage(), e);
        }

        config.debugDirectory().ifPresent(dir -> writeDebug(dir, "response.json", body));
        return body;
    }

    ChatCompletionRequest toRequest(List<Message> messages, ChatOptions opts) {
        List<Message> all = new ArrayList<>(messages.size() + 1);
        if (opts.hasSystemPrompt()) {
            all.add(Message.system(opts.systemPrompt()));
        }
        all.addAll(messages);

        return new ChatCompletionRequest(
                List.copyOf(all),
                config.modelName(),
                opts.responseFormat() == null ? null : ChatCompletionRequest.JsonSchemaResponseFormat.of(opts.responseFormat()),
                opts.temperature(),
                opts.reasoningEffort(),
                opts.maxTokens() > 0 ? opts.maxTokens() : null);
    }

    private static void writeDebug(Path dir, String fileName, String content) {
        Path out = dir.resolve(fileName);
        try {
            Files.createDirectories(dir);
            Files.writeString(out, content == null ? "" : content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ChatClientException("Cannot write debug file " + out, e);
        }
    }
}
