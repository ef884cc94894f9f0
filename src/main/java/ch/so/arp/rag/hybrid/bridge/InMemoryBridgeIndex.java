package ch.so.arp.rag.hybrid.bridge;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import ch.so.arp.rag.hybrid.catalog.ContentCatalog;

/**
 * Bridge index backed by a {@link ConcurrentHashMap}; {@code compute} gives the
 * single-writer guarantee per mapping key. Mapping keys are also indexed by
 * chunk and by node. Mappings are never removed, so the indexes only grow.
 */
public class InMemoryBridgeIndex extends AbstractBridgeIndex {

    private static final Comparator<BridgeMapping> ORDER = Comparator.comparing(BridgeMapping::chunkId)
            .thenComparing(BridgeMapping::nodeId)
            .thenComparing(BridgeMapping::relationType);

    private final Map<BridgeMapping.Key, BridgeMapping> mappings = new ConcurrentHashMap<>();
    private final Map<String, Set<BridgeMapping.Key>> byChunk = new ConcurrentHashMap<>();
    private final Map<String, Set<BridgeMapping.Key>> byNode = new ConcurrentHashMap<>();

    public InMemoryBridgeIndex(ContentCatalog catalog, Clock clock) {
        super(catalog, clock);
    }

    @Override
    protected List<BridgeMapping> findByChunk(String chunkId) {
        return resolve(byChunk.get(chunkId));
    }

    @Override
    protected List<BridgeMapping> findByNode(String nodeId) {
        return resolve(byNode.get(nodeId));
    }

    private List<BridgeMapping> resolve(Set<BridgeMapping.Key> keys) {
        if (keys == null) {
            return List.of();
        }
        return keys.stream().map(mappings::get).filter(Objects::nonNull).sorted(ORDER).toList();
    }

    @Override
    protected BridgeMapping doUpsert(BridgeMapping.Key key, double initialWeight, double confidence) {
        BridgeMapping stored = mappings.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing == null) {
                return new BridgeMapping(k.chunkId(), k.nodeId(), k.relationType(), initialWeight, confidence, now, now,
                        0L);
            }
            return existing.confidence() == confidence ? existing : existing.withConfidence(confidence, now);
        });
        byChunk.computeIfAbsent(key.chunkId(), chunkId -> ConcurrentHashMap.newKeySet()).add(key);
        byNode.computeIfAbsent(key.nodeId(), nodeId -> ConcurrentHashMap.newKeySet()).add(key);
        return stored;
    }

    @Override
    protected BridgeMapping doAddToWeight(BridgeMapping.Key key, double delta) {
        return mappings.computeIfPresent(key, (k, existing) -> {
            if (delta == 0.0d) {
                return existing;
            }
            double next = clamp(existing.weight() + delta);
            return next == existing.weight() ? existing : existing.withWeight(next, clock.instant());
        });
    }
}
