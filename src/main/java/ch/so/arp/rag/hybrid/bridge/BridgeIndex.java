package ch.so.arp.rag.hybrid.bridge;

import java.util.List;

/**
 * Many-to-many mapping between chunks and graph nodes.
 *
 * <p>All operations fail with a {@link ch.so.arp.rag.hybrid.DanglingReferenceException}
 * when the chunk or node is unknown to the catalog. Weight updates are atomic per
 * (chunk, node, relation) key and clamp the result to [0,1].
 */
public interface BridgeIndex {

    List<BridgeMapping> getNodesForChunk(String chunkId);

    /**
     * @param relationType optional relation filter, {@code null} returns every relation
     */
    List<BridgeMapping> getChunksForNode(String nodeId, String relationType);

    /**
     * Create the mapping or refresh its confidence. Re-upserting an existing key
     * keeps the learned weight.
     */
    BridgeMapping upsertMapping(String chunkId, String nodeId, String relationType, double initialWeight,
            double confidence);

    /**
     * Add {@code delta} to the weight of a single mapping.
     *
     * @throws ch.so.arp.rag.hybrid.NotFoundException if the mapping does not exist
     */
    BridgeMapping updateWeight(String chunkId, String nodeId, String relationType, double delta);

    /**
     * Add {@code delta} to every mapping between the chunk and the node.
     *
     * @throws ch.so.arp.rag.hybrid.NotFoundException if no mapping links the pair
     */
    List<BridgeMapping> updateWeight(String chunkId, String nodeId, double delta);
}
