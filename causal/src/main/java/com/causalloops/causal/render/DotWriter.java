package com.causalloops.causal.render;

import com.causalloops.causal.CausalMap;
import com.causalloops.causal.Relationship;

/** Graphviz DOT text for a map's relationships. Variable names are written as given. */
public final class DotWriter {

    private DotWriter() {}

    public static String write(CausalMap map) {
        StringBuilder sb = new StringBuilder("digraph {\n\toverlap=false\n\tmode=KK\n");
        for (Relationship r : map.relationships()) {
            sb.append('\t').append(quote(r.from())).append(" -> ").append(quote(r.to())).append('\n');
        }
        return sb.append("}\n").toString();
    }

    static String quote(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 2).append('"');
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
