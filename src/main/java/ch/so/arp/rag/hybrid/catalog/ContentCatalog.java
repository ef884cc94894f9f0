package ch.so.arp.rag.hybrid.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the externally produced chunks and graph structure, plus the
 * write operations used by the ingestion endpoint.
 */
public interface ContentCatalog {

    void putChunk(Chunk chunk);

    void putNode(GraphNode node);

    Optional<Chunk> findChunk(String chunkId);

    Optional<GraphNode> findNode(String nodeId);

    Collection<Chunk> chunks();

    /**
     * Edges pointing at the given node, used for inbound traversal.
     *
     * @param nodeId the target node
     * @return the inbound edges, expressed as relationships whose target is the
     *         source node
     */
    List<Relationship> inboundRelationships(String nodeId);

    int embeddingDimensions();
}
