package com.causalloops.causal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of a causal influence: with ({@code +}) or against ({@code -}) its cause. */
public enum Polarity {
    POSITIVE("+"),
    NEGATIVE("-");

    private final String symbol;

    Polarity(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static Polarity fromSymbol(String symbol) {
        if (symbol == null) return null;
        for (Polarity p : values()) {
            if (p.symbol.equals(symbol.trim())) return p;
        }
        throw new IllegalArgumentException("Unknown polarity '" + symbol + "', expected '+' or '-'");
    }
}
