package com.aml.network.core.model;

import java.util.List;

/**
 * A connected group of entities joined by high-confidence relationships.
 *
 * @param id                identifier unique within one detection run
 * @param memberIds         member entity ids in discovery order
 * @param internalEdgeCount qualifying edges between members
 * @param density           internalEdgeCount / (n(n-1)/2)
 * @param averageConfidence mean confidence of the internal edges
 */
public record Community(
        String id,
        List<String> memberIds,
        int internalEdgeCount,
        double density,
        double averageConfidence
) {
    public Community {
        memberIds = memberIds != null ? List.copyOf(memberIds) : List.of();
    }

    public int size() {
        return memberIds.size();
    }

    public boolean contains(String entityId) {
        return memberIds.contains(entityId);
    }
}
