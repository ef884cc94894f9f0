package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;

/**
 * Best path found from an anchor to a node.
 *
 * @param score product of the traversal weights divided by {@code 1 + hops}
 * @param steps edges in traversal order, empty at hop 0
 */
public record GraphPath(String nodeId, String anchorId, int hops, double score, List<Step> steps) {

    public GraphPath {
        steps = List.copyOf(steps);
    }

    public record Step(String fromNodeId, String relationType, String toNodeId, double weight) {
    }
}
