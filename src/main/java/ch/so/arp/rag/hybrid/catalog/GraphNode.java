package ch.so.arp.rag.hybrid.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Node of the knowledge graph with its outgoing relationships.
 */
public record GraphNode(String id, String type, List<Relationship> relationships) {

    public GraphNode {
        Objects.requireNonNull(id, "id");
        type = type == null ? "" : type;
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }
}
