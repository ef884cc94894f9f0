package ch.so.arp.rag.hybrid.bridge;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ch.so.arp.rag.hybrid.DanglingReferenceException;
import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.catalog.ContentCatalog;

/**
 * Shared reference checks and weight arithmetic for bridge index implementations.
 */
abstract class AbstractBridgeIndex implements BridgeIndex {

    protected final ContentCatalog catalog;
    protected final Clock clock;

    protected AbstractBridgeIndex(ContentCatalog catalog, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<BridgeMapping> getNodesForChunk(String chunkId) {
        requireChunk(chunkId);
        return findByChunk(chunkId);
    }

    @Override
    public List<BridgeMapping> getChunksForNode(String nodeId, String relationType) {
        requireNode(nodeId);
        List<BridgeMapping> mappings = findByNode(nodeId);
        if (relationType == null) {
            return mappings;
        }
        return mappings.stream().filter(mapping -> mapping.relationType().equals(relationType)).toList();
    }

    @Override
    public BridgeMapping upsertMapping(String chunkId, String nodeId, String relationType, double initialWeight,
            double confidence) {
        requireChunk(chunkId);
        requireNode(nodeId);
        if (relationType == null || relationType.isBlank()) {
            throw new InputValidationException("relationType must not be blank");
        }
        requireUnitInterval("initialWeight", initialWeight);
        requireUnitInterval("confidence", confidence);
        return doUpsert(new BridgeMapping.Key(chunkId, nodeId, relationType), initialWeight, confidence);
    }

    @Override
    public BridgeMapping updateWeight(String chunkId, String nodeId, String relationType, double delta) {
        requireChunk(chunkId);
        requireNode(nodeId);
        if (!Double.isFinite(delta)) {
            throw new InputValidationException("delta must be finite");
        }
        BridgeMapping.Key key = new BridgeMapping.Key(chunkId, nodeId, relationType);
        BridgeMapping updated = doAddToWeight(key, delta);
        if (updated == null) {
            throw new NotFoundException("No bridge mapping " + key);
        }
        return updated;
    }

    @Override
    public List<BridgeMapping> updateWeight(String chunkId, String nodeId, double delta) {
        List<BridgeMapping> links = getNodesForChunk(chunkId).stream()
                .filter(mapping -> mapping.nodeId().equals(nodeId))
                .toList();
        if (links.isEmpty()) {
            requireNode(nodeId);
            throw new NotFoundException("No bridge mapping between chunk '" + chunkId + "' and node '" + nodeId + "'");
        }
        List<BridgeMapping> updated = new ArrayList<>();
        for (BridgeMapping link : links) {
            updated.add(updateWeight(chunkId, nodeId, link.relationType(), delta));
        }
        return updated;
    }

    protected abstract List<BridgeMapping> findByChunk(String chunkId);

    protected abstract List<BridgeMapping> findByNode(String nodeId);

    protected abstract BridgeMapping doUpsert(BridgeMapping.Key key, double initialWeight, double confidence);

    /**
     * Atomically add {@code delta} to the mapping weight.
     *
     * @return the updated mapping or {@code null} when the key does not exist
     */
    protected abstract BridgeMapping doAddToWeight(BridgeMapping.Key key, double delta);

    static double clamp(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }

    private void requireChunk(String chunkId) {
        if (chunkId == null || catalog.findChunk(chunkId).isEmpty()) {
            throw new DanglingReferenceException("Unknown chunk '" + chunkId + "'");
        }
    }

    private void requireNode(String nodeId) {
        if (nodeId == null || catalog.findNode(nodeId).isEmpty()) {
            throw new DanglingReferenceException("Unknown graph node '" + nodeId + "'");
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value >= 0.0d && value <= 1.0d)) {
            throw new InputValidationException(name + " must be within [0,1] but was " + value);
        }
    }
}
