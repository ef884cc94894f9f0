package ch.so.arp.rag.hybrid.retrieval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import ch.so.arp.rag.hybrid.catalog.ContentCatalog;
import ch.so.arp.rag.hybrid.catalog.GraphNode;
import ch.so.arp.rag.hybrid.catalog.Relationship;
import ch.so.arp.rag.hybrid.parameter.ParameterSnapshot;
import ch.so.arp.rag.hybrid.parameter.Strategy;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;

/**
 * Scores graph nodes by their best weighted path from the query anchors.
 *
 * <p>For every hop count {@code h} up to the limit the scorer keeps, per node,
 * the highest weight product reachable in exactly {@code h} hops. A node's score
 * is the maximum of {@code product / (1 + h)}. Equal scores prefer fewer hops,
 * then the lexicographically smaller anchor.
 */
public class GraphTraversalScorer {

    private final ContentCatalog catalog;
    private final WeightSchema schema;
    private final int hopLimit;
    private final boolean bidirectional;

    public GraphTraversalScorer(ContentCatalog catalog, WeightSchema schema, int hopLimit, boolean bidirectional) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.schema = Objects.requireNonNull(schema, "schema");
        if (hopLimit < 0) {
            throw new IllegalArgumentException("hopLimit must not be negative");
        }
        this.hopLimit = hopLimit;
        this.bidirectional = bidirectional;
    }

    /**
     * @return best path per reachable node; unreachable nodes are absent and
     *         score 0
     */
    public Map<String, GraphPath> score(Collection<String> anchorIds, Strategy strategy, ParameterSnapshot snapshot) {
        if (anchorIds == null || anchorIds.isEmpty()) {
            return Map.of();
        }
        Map<String, Frontier> layer = new HashMap<>();
        for (String anchor : new TreeSet<>(anchorIds)) {
            layer.putIfAbsent(anchor, new Frontier(anchor, anchor, 1.0d, null, null, 0.0d));
        }
        Map<String, GraphPath> best = new HashMap<>();
        for (int hops = 0; hops <= hopLimit && !layer.isEmpty(); hops++) {
            for (Frontier entry : layer.values()) {
                double score = entry.product / (1 + hops);
                GraphPath current = best.get(entry.nodeId);
                if (current == null || score > current.score()) {
                    best.put(entry.nodeId, new GraphPath(entry.nodeId, entry.anchorId, hops, score, entry.steps()));
                }
            }
            if (hops == hopLimit) {
                break;
            }
            // cancelled by the retrieval deadline, the caller discards the result
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            layer = expand(layer, strategy, snapshot);
        }
        return best;
    }

    private Map<String, Frontier> expand(Map<String, Frontier> layer, Strategy strategy, ParameterSnapshot snapshot) {
        Map<String, Frontier> next = new HashMap<>();
        for (Frontier entry : layer.values()) {
            for (Relationship edge : edges(entry.nodeId)) {
                if (!strategy.allows(edge.relationType())) {
                    continue;
                }
                double weight = schema.traversalWeight(snapshot, strategy, edge.relationType());
                double product = entry.product * weight;
                if (product <= 0.0d) {
                    continue;
                }
                Frontier candidate = new Frontier(edge.targetId(), entry.anchorId, product, entry,
                        edge.relationType(), weight);
                next.merge(edge.targetId(), candidate, Frontier::better);
            }
        }
        return next;
    }

    private List<Relationship> edges(String nodeId) {
        List<Relationship> edges = new ArrayList<>();
        GraphNode node = catalog.findNode(nodeId).orElse(null);
        if (node != null) {
            edges.addAll(node.relationships());
        }
        if (bidirectional) {
            edges.addAll(catalog.inboundRelationships(nodeId));
        }
        return edges;
    }

    private record Frontier(String nodeId, String anchorId, double product, Frontier previous, String relationType,
            double weight) {

        static Frontier better(Frontier left, Frontier right) {
            if (left.product != right.product) {
                return left.product > right.product ? left : right;
            }
            return left.anchorId.compareTo(right.anchorId) <= 0 ? left : right;
        }

        List<GraphPath.Step> steps() {
            List<GraphPath.Step> steps = new ArrayList<>();
            for (Frontier cursor = this; cursor.previous != null; cursor = cursor.previous) {
                steps.add(new GraphPath.Step(cursor.previous.nodeId, cursor.relationType, cursor.nodeId,
                        cursor.weight));
            }
            Collections.reverse(steps);
            return steps;
        }
    }
}
