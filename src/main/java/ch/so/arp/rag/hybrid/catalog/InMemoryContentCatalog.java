package ch.so.arp.rag.hybrid.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.InputValidationException;

/**
 * Catalog keeping chunks and graph nodes in memory. Node replacement rebuilds the
 * inbound edge index for the affected node only.
 */
public class InMemoryContentCatalog implements ContentCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryContentCatalog.class);

    private final int dimensions;
    private final Map<String, Chunk> chunks = new ConcurrentHashMap<>();
    private final Map<String, GraphNode> nodes = new ConcurrentHashMap<>();
    private final Map<String, List<Relationship>> inbound = new ConcurrentHashMap<>();

    public InMemoryContentCatalog(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public void putChunk(Chunk chunk) {
        if (chunk.embedding().length != dimensions) {
            throw new InputValidationException("Chunk '" + chunk.id() + "' has " + chunk.embedding().length
                    + " dimensions, expected " + dimensions);
        }
        chunks.put(chunk.id(), chunk);
        LOGGER.debug("Stored chunk {} ({})", chunk.id(), chunk.contentType());
    }

    @Override
    public synchronized void putNode(GraphNode node) {
        GraphNode previous = nodes.put(node.id(), node);
        if (previous != null) {
            for (Relationship edge : previous.relationships()) {
                inbound.computeIfPresent(edge.targetId(), (target, edges) -> {
                    List<Relationship> remaining = new ArrayList<>(edges);
                    remaining.remove(new Relationship(edge.relationType(), previous.id()));
                    return remaining.isEmpty() ? null : List.copyOf(remaining);
                });
            }
        }
        for (Relationship edge : node.relationships()) {
            inbound.merge(edge.targetId(), List.of(new Relationship(edge.relationType(), node.id())),
                    (left, right) -> {
                        List<Relationship> merged = new ArrayList<>(left);
                        merged.addAll(right);
                        return List.copyOf(merged);
                    });
        }
    }

    @Override
    public Optional<Chunk> findChunk(String chunkId) {
        return Optional.ofNullable(chunks.get(chunkId));
    }

    @Override
    public Optional<GraphNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public Collection<Chunk> chunks() {
        return List.copyOf(chunks.values());
    }

    @Override
    public List<Relationship> inboundRelationships(String nodeId) {
        return inbound.getOrDefault(nodeId, List.of());
    }

    @Override
    public int embeddingDimensions() {
        return dimensions;
    }
}
