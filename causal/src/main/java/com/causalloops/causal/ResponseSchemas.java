package com.causalloops.causal;

import com.causalloops.chat.schema.JsonSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/** JSON Schema (draft-07) documents that constrain a model's answer to one of the two wire shapes. */
public final class ResponseSchemas {

    private ResponseSchemas() {}

    static final String EXPLANATION = "Concisely explain your reasoning for each change you made to the old CLD to create "
            + "the new CLD. Speak in plain English, don't reference json specifically. Don't reiterate the request or any "
            + "of these instructions.";
    static final String TITLE = "A highly descriptive 7 word max title describing your explanation.";
    static final String FROM = "This is a variable which causes the to variable in this relationship that is between two "
            + "variables, from and to.  The from variable is the equivalent of a cause.  The to variable is the "
            + "equivalent of an effect";
    static final String TO = "This is a variable which is impacted by the from variable in this relationship that is "
            + "between two variables, from and to.  The from variable is the equivalent of a cause.  The to variable is "
            + "the equivalent of an effect";
    static final String POLARITY = "There are two possible kinds of relationships.  The first are relationships with "
            + "positive polarity that are represented with a + symbol.  In relationships with positive polarity (+) a "
            + "change in the from variable causes a change in the same direction in the to variable.  For example, in a "
            + "relationship with positive polarity (+), a decrease in the from variable, would lead to a decrease in the "
            + "to variable.  The second kind of relationship are those with negative polarity that are represented with "
            + "a - symbol.  In relationships with negative polarity (-) a change in the from variable causes a change in "
            + "the opposite direction in the to variable.  For example, in a relationship with negative polarity (-) an "
            + "increase in the from variable, would lead to a decrease in the to variable.";
    static final String REASONING = "This is an explanation for why this relationship exists";
    static final String POLARITY_REASONING = "This is the reason for why the polarity for this relationship was chosen";

    public static final JsonSchema RELATIONSHIPS = relationships();
    public static final JsonSchema CAUSAL_CHAINS = causalChains();

    private static JsonSchema polarity() {
        return JsonSchema.stringEnum(POLARITY, Polarity.POSITIVE.symbol(), Polarity.NEGATIVE.symbol());
    }

    private static JsonSchema relationships() {
        Map<String, JsonSchema> relationship = new LinkedHashMap<>();
        relationship.put("from", JsonSchema.string(FROM));
        relationship.put("to", JsonSchema.string(TO));
        relationship.put("polarity", polarity());
        relationship.put("reasoning", JsonSchema.string(REASONING));
        relationship.put("polarityReasoning", JsonSchema.string(POLARITY_REASONING));

        Map<String, JsonSchema> root = new LinkedHashMap<>();
        root.put("explanation", JsonSchema.string(EXPLANATION));
        root.put("title", JsonSchema.string(TITLE));
        root.put("relationships", JsonSchema.array(
                "The list of relationships you think are appropriate to satisfy my request based on all of the "
                        + "information I have given you",
                JsonSchema.closedObject("This is a relationship between two variables, from and to (from is the cause, "
                        + "to is the effect).  The relationship also contains a polarity which describes how a change in "
                        + "the from variable impacts the to variable", relationship)));
        return JsonSchema.closedObject(null, root).withDraft07();
    }

    private static JsonSchema causalChains() {
        Map<String, JsonSchema> entry = new LinkedHashMap<>();
        entry.put("variable", JsonSchema.string("The variable affected by the previous variable in the chain"));
        entry.put("polarity", polarity());
        entry.put("polarity_reasoning", JsonSchema.string(POLARITY_REASONING));

        Map<String, JsonSchema> chain = new LinkedHashMap<>();
        chain.put("initial_variable", JsonSchema.string("The variable that starts this chain of causes and effects"));
        chain.put("relationships", JsonSchema.array(
                "Each step of the chain, in order; every variable is caused by the one before it",
                JsonSchema.closedObject("One step of a causal chain", entry)));
        chain.put("reasoning", JsonSchema.string("This is an explanation for why this chain of relationships exists"));

        Map<String, JsonSchema> root = new LinkedHashMap<>();
        root.put("explanation", JsonSchema.string(EXPLANATION));
        root.put("title", JsonSchema.string(TITLE));
        root.put("causal_chains", JsonSchema.array(
                "The causal chains you think are appropriate to satisfy my request based on all of the information "
                        + "I have given you",
                JsonSchema.closedObject("A path of causal influences starting at initial_variable", chain)));
        return JsonSchema.closedObject(null, root).withDraft07();
    }
}
