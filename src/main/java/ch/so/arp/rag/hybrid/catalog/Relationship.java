package ch.so.arp.rag.hybrid.catalog;

import java.util.Objects;

/**
 * Typed, directed edge from the owning {@link GraphNode} to {@code targetId}.
 */
public record Relationship(String relationType, String targetId) {

    public Relationship {
        Objects.requireNonNull(relationType, "relationType");
        Objects.requireNonNull(targetId, "targetId");
    }
}
