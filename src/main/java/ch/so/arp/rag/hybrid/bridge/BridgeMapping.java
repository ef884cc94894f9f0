package ch.so.arp.rag.hybrid.bridge;

import java.time.Instant;
import java.util.Objects;

/**
 * Weighted link between a content chunk and a graph node. The structure comes
 * from ingestion; {@link #weight()} is the learned part owned by this service.
 */
public record BridgeMapping(
        String chunkId,
        String nodeId,
        String relationType,
        double weight,
        double confidence,
        Instant createdAt,
        Instant updatedAt,
        long version) {

    public BridgeMapping {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(relationType, "relationType");
        if (weight < 0.0d || weight > 1.0d || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be within [0,1] but was " + weight);
        }
        if (confidence < 0.0d || confidence > 1.0d || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1] but was " + confidence);
        }
    }

    public Key key() {
        return new Key(chunkId, nodeId, relationType);
    }

    BridgeMapping withWeight(double newWeight, Instant now) {
        return new BridgeMapping(chunkId, nodeId, relationType, newWeight, confidence, createdAt, now, version + 1);
    }

    BridgeMapping withConfidence(double newConfidence, Instant now) {
        return new BridgeMapping(chunkId, nodeId, relationType, weight, newConfidence, createdAt, now, version + 1);
    }

    /**
     * Identity of a mapping: one weight per (chunk, node, relation).
     */
    public record Key(String chunkId, String nodeId, String relationType) {

        @Override
        public String toString() {
            return chunkId + "->" + nodeId + " [" + relationType + "]";
        }
    }
}
