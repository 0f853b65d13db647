package com.causalloops.graph;

import java.util.Locale;

/** Canonical form of a variable name: node identity everywhere in the graph. */
public final class VariableNames {
    private VariableNames() {}

    /** Trims and case-folds. {@code null} becomes the empty string. */
    public static String normalize(String name) {
        if (name == null) return "";
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
