package com.causalloops.graph;

import java.util.Objects;

/** A directed edge between two variable names, as written (not yet normalized). */
public record Edge(String from, String to) {
    public Edge {
        from = Objects.requireNonNullElse(from, "");
        to = Objects.requireNonNullElse(to, "");
    }
}
