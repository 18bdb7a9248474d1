package com.aml.network.core.model;

import java.util.List;

/**
 * A closed chain of relationships. {@code entityIds} lists each member once, in walk
 * order, starting from the lexicographically smallest id.
 */
public record CircularRelationship(List<String> entityIds) {

    public CircularRelationship {
        entityIds = entityIds != null ? List.copyOf(entityIds) : List.of();
    }

    public int length() {
        return entityIds.size();
    }
}
