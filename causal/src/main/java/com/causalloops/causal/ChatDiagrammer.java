package com.causalloops.causal;

import com.causalloops.causal.json.CausalMapCodec;
import com.causalloops.chat.ChatClient;
import com.causalloops.chat.ChatOptions;
import com.causalloops.chat.Message;
import com.causalloops.chat.openai.ChatCompletionResponse;
import com.causalloops.common.codec.Codec;
import com.causalloops.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@link Diagrammer} that makes one constrained chat completion and decodes the first choice. */
public final class ChatDiagrammer implements Diagrammer {
    private static final Logger log = LoggerFactory.getLogger(ChatDiagrammer.class);

    static final String RESPONSE_FORMAT_NAME = "relationships_response";
    static final int MAX_TOKENS = 64 * 1024;

    private final ChatClient client;
    private final InputShape shape;
    private final PromptTemplates templates;
    private final String systemPrompt;
    private final Codec<ChatCompletionResponse, String> envelopeCodec = Codec.clazzCodec(ChatCompletionResponse.class);
    private final CausalMapCodec mapCodec = new CausalMapCodec();

    public ChatDiagrammer(ChatClient client, InputShape shape, PromptTemplates templates) {
        this.client = Objects.requireNonNull(client, "client");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.systemPrompt = templates.system(prettySchema(shape));
    }

    @Override
    public CausalMap generate(String prompt, String backgroundKnowledge) {
        Objects.requireNonNull(prompt, "prompt");
        List<Message> messages = new ArrayList<>(2);
        if (backgroundKnowledge != null && !backgroundKnowledge.isEmpty()) {
            messages.add(Message.user(templates.background(backgroundKnowledge)));
        }
        messages.add(Message.user(prompt));

        String body = client.chatCompletion(messages,
                ChatOptions.withResponseFormat(RESPONSE_FORMAT_NAME, true, shape.schema()),
                ChatOptions.withMaxTokens(MAX_TOKENS),
                ChatOptions.withSystemPrompt(systemPrompt));

        ErrorsOr<CausalMap> map = envelopeCodec.decode(body)
                .addPrefixIfError("Cannot read chat completion: ")
                .flatMap(response -> response.firstContent()
                        .<ErrorsOr<String>>map(ErrorsOr::lift)
                        .orElseGet(() -> ErrorsOr.error("Chat completion has no choices")))
                .flatMap(mapCodec::decode);

        if (map.isError()) {
            log.warn("Model answer is not a causal map: {}", map.getErrors());
            throw new CausalMapDecodeException(map.getErrors());
        }
        CausalMap result = map.valueOrThrow();
        log.info("Diagram '{}' has {} chains", result.title(), result.chains().size());
        return result;
    }

    private static String prettySchema(InputShape shape) {
        try {
            return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(shape.schema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize response schema " + shape, e);
        }
    }
}
