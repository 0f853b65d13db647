package com.causalloops.causal.json;

import com.causalloops.causal.Relationship;

import java.util.List;

/** The flat wire shape: {@code {title, explanation, relationships: [{from, to, ...}]}}. */
public record RelationshipsDocument(String title, String explanation, List<Relationship> relationships) {
    public RelationshipsDocument {
        relationships = relationships == null ? List.of() : relationships;
    }
}
