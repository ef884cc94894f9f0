package ch.so.arp.rag.hybrid.bridge;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.ConflictRetrier;
import ch.so.arp.rag.hybrid.catalog.ContentCatalog;

/**
 * {@link BridgeIndex} persisted in a relational table. Weight updates use an
 * optimistic version column and are retried on conflict.
 */
public class JdbcBridgeIndex extends AbstractBridgeIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcBridgeIndex.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS hybrid_bridge_mapping (
              chunk_id      VARCHAR(255)     NOT NULL,
              node_id       VARCHAR(500)     NOT NULL,
              relation_type VARCHAR(100)     NOT NULL,
              weight        DOUBLE PRECISION NOT NULL CHECK (weight >= 0 AND weight <= 1),
              confidence    DOUBLE PRECISION NOT NULL CHECK (confidence >= 0 AND confidence <= 1),
              created_at    BIGINT           NOT NULL,
              updated_at    BIGINT           NOT NULL,
              version       BIGINT           NOT NULL,
              PRIMARY KEY (chunk_id, node_id, relation_type)
            )
            """;

    private static final String SELECT_COLUMNS = """
            SELECT chunk_id, node_id, relation_type, weight, confidence, created_at, updated_at, version
            FROM hybrid_bridge_mapping
            """;

    private final JdbcClient jdbcClient;
    private final ConflictRetrier retrier;

    public JdbcBridgeIndex(JdbcClient jdbcClient, ContentCatalog catalog, Clock clock, ConflictRetrier retrier) {
        super(catalog, clock);
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
    }

    public void ensureSchema() {
        jdbcClient.sql(CREATE_TABLE_SQL).update();
        LOGGER.info("Bridge mapping table is ready");
    }

    @Override
    protected List<BridgeMapping> findByChunk(String chunkId) {
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE chunk_id = :chunkId ORDER BY node_id, relation_type")
                .param("chunkId", chunkId)
                .query(MappingRowMapper.INSTANCE)
                .list();
    }

    @Override
    protected List<BridgeMapping> findByNode(String nodeId) {
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE node_id = :nodeId ORDER BY chunk_id, relation_type")
                .param("nodeId", nodeId)
                .query(MappingRowMapper.INSTANCE)
                .list();
    }

    @Override
    protected BridgeMapping doUpsert(BridgeMapping.Key key, double initialWeight, double confidence) {
        return retrier.execute(() -> {
            Optional<BridgeMapping> existing = find(key);
            Instant now = clock.instant();
            if (existing.isEmpty()) {
                BridgeMapping created = new BridgeMapping(key.chunkId(), key.nodeId(), key.relationType(),
                        initialWeight, confidence, now, now, 0L);
                try {
                    jdbcClient.sql("""
                            INSERT INTO hybrid_bridge_mapping
                              (chunk_id, node_id, relation_type, weight, confidence, created_at, updated_at, version)
                            VALUES (:chunkId, :nodeId, :relationType, :weight, :confidence, :createdAt, :updatedAt, 0)
                            """)
                            .param("chunkId", key.chunkId())
                            .param("nodeId", key.nodeId())
                            .param("relationType", key.relationType())
                            .param("weight", initialWeight)
                            .param("confidence", confidence)
                            .param("createdAt", now.toEpochMilli())
                            .param("updatedAt", now.toEpochMilli())
                            .update();
                } catch (DuplicateKeyException ex) {
                    throw new ConcurrencyConflictException(key.toString(), -1L, 0L);
                }
                return created;
            }
            BridgeMapping current = existing.get();
            if (current.confidence() == confidence) {
                return current;
            }
            BridgeMapping next = current.withConfidence(confidence, now);
            compareAndSet(current, next);
            return next;
        });
    }

    @Override
    protected BridgeMapping doAddToWeight(BridgeMapping.Key key, double delta) {
        return retrier.execute(() -> {
            Optional<BridgeMapping> existing = find(key);
            if (existing.isEmpty()) {
                return null;
            }
            BridgeMapping current = existing.get();
            double next = clamp(current.weight() + delta);
            if (delta == 0.0d || next == current.weight()) {
                return current;
            }
            BridgeMapping updated = current.withWeight(next, clock.instant());
            compareAndSet(current, updated);
            return updated;
        });
    }

    private Optional<BridgeMapping> find(BridgeMapping.Key key) {
        return jdbcClient.sql(SELECT_COLUMNS
                + " WHERE chunk_id = :chunkId AND node_id = :nodeId AND relation_type = :relationType")
                .param("chunkId", key.chunkId())
                .param("nodeId", key.nodeId())
                .param("relationType", key.relationType())
                .query(MappingRowMapper.INSTANCE)
                .optional();
    }

    private void compareAndSet(BridgeMapping current, BridgeMapping next) {
        int updated = jdbcClient.sql("""
                UPDATE hybrid_bridge_mapping
                SET weight = :weight, confidence = :confidence, updated_at = :updatedAt, version = :nextVersion
                WHERE chunk_id = :chunkId AND node_id = :nodeId AND relation_type = :relationType
                  AND version = :expectedVersion
                """)
                .param("weight", next.weight())
                .param("confidence", next.confidence())
                .param("updatedAt", next.updatedAt().toEpochMilli())
                .param("nextVersion", next.version())
                .param("chunkId", current.chunkId())
                .param("nodeId", current.nodeId())
                .param("relationType", current.relationType())
                .param("expectedVersion", current.version())
                .update();
        if (updated == 0) {
            throw new ConcurrencyConflictException(current.key().toString(), current.version(), -1L);
        }
    }

    private enum MappingRowMapper implements RowMapper<BridgeMapping> {
        INSTANCE;

        @Override
        public BridgeMapping mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new BridgeMapping(
                    rs.getString("chunk_id"),
                    rs.getString("node_id"),
                    rs.getString("relation_type"),
                    rs.getDouble("weight"),
                    rs.getDouble("confidence"),
                    Instant.ofEpochMilli(rs.getLong("created_at")),
                    Instant.ofEpochMilli(rs.getLong("updated_at")),
                    rs.getLong("version"));
        }
    }
}
