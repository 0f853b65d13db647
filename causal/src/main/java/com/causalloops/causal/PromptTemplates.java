package com.causalloops.causal;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** The system and background prompt templates. Placeholders are {@code {schema}} and {@code {backgroundKnowledge}}. */
public record PromptTemplates(String system, String background) {
    static final String SYSTEM_RESOURCE = "system_prompt.txt";
    static final String BACKGROUND_RESOURCE = "background_prompt.txt";

    public PromptTemplates {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(background, "background");
    }

    /** Loads both templates from the classpath, next to this class. */
    public static PromptTemplates load() {
        return new PromptTemplates(resource(SYSTEM_RESOURCE), resource(BACKGROUND_RESOURCE));
    }

    public String system(String schemaJson) {
        return system.replace("{schema}", schemaJson);
    }

    public String background(String backgroundKnowledge) {
        return background.replace("{backgroundKnowledge}", backgroundKnowledge);
    }

    private static String resource(String name) {
        try (InputStream in = PromptTemplates.class.getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classpath resource " + name, e);
        }
    }
}
