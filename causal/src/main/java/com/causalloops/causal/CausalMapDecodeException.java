package com.causalloops.causal;

import java.util.List;

/** The model answered, but its answer could not be read as a causal map. */
public class CausalMapDecodeException extends RuntimeException {
    private final List<String> errors;

    public CausalMapDecodeException(List<String> errors) {
        super("Cannot decode causal map: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
