package ch.so.arp.rag.hybrid.parameter;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.NotFoundException;

/**
 * Relational {@link ParameterStore}. Current values live in
 * {@code hybrid_parameter}; every committed version is appended to
 * {@code hybrid_parameter_change} within the same transaction.
 */
public class JdbcParameterStore implements ParameterStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcParameterStore.class);

    private static final String CREATE_PARAMETER_SQL = """
            CREATE TABLE IF NOT EXISTS hybrid_parameter (
              param_key          VARCHAR(300)     PRIMARY KEY,
              param_values       TEXT             NOT NULL,
              param_priors       TEXT             NOT NULL,
              lower_bound        DOUBLE PRECISION NOT NULL,
              upper_bound        DOUBLE PRECISION NOT NULL,
              version            BIGINT           NOT NULL,
              updated_at         BIGINT           NOT NULL,
              last_reinforced_at BIGINT           NOT NULL
            )
            """;

    private static final String CREATE_CHANGE_SQL = """
            CREATE TABLE IF NOT EXISTS hybrid_parameter_change (
              id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
              param_key    VARCHAR(300) NOT NULL,
              version      BIGINT       NOT NULL,
              param_values TEXT         NOT NULL,
              changed_at   BIGINT       NOT NULL,
              feedback_id  VARCHAR(255),
              reason       VARCHAR(20)  NOT NULL
            )
            """;

    private static final String SELECT_PARAMETER_SQL = """
            SELECT param_key, param_values, param_priors, lower_bound, upper_bound, version, updated_at,
                   last_reinforced_at
            FROM hybrid_parameter
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactions;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<VersionedParameter> parameterMapper = this::mapParameter;

    public JdbcParameterStore(JdbcClient jdbcClient, TransactionTemplate transactions, ObjectMapper objectMapper,
            Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void ensureSchema() {
        jdbcClient.sql(CREATE_PARAMETER_SQL).update();
        jdbcClient.sql(CREATE_CHANGE_SQL).update();
        LOGGER.info("Parameter tables are ready");
    }

    @Override
    public boolean initializeIfAbsent(VersionedParameter initial) {
        if (find(initial.key()).isPresent()) {
            return false;
        }
        try {
            transactions.executeWithoutResult(status -> {
                jdbcClient.sql("""
                        INSERT INTO hybrid_parameter (param_key, param_values, param_priors, lower_bound,
                          upper_bound, version, updated_at, last_reinforced_at)
                        VALUES (:key, :values, :priors, :lower, :upper, :version, :updatedAt, :reinforcedAt)
                        """)
                        .param("key", initial.key())
                        .param("values", toJson(initial.values()))
                        .param("priors", toJson(initial.priors()))
                        .param("lower", initial.lowerBound())
                        .param("upper", initial.upperBound())
                        .param("version", initial.version())
                        .param("updatedAt", initial.updatedAt().toEpochMilli())
                        .param("reinforcedAt", initial.lastReinforcedAt().toEpochMilli())
                        .update();
                appendChange(new ParameterChange(initial.key(), initial.version(), initial.values(), clock.instant(),
                        null, ParameterChange.Reason.BOOTSTRAP));
            });
            return true;
        } catch (DuplicateKeyException ex) {
            LOGGER.debug("Parameter {} was initialized concurrently", initial.key());
            return false;
        }
    }

    @Override
    public Optional<VersionedParameter> find(String key) {
        return jdbcClient.sql(SELECT_PARAMETER_SQL + " WHERE param_key = :key")
                .param("key", key)
                .query(parameterMapper)
                .optional();
    }

    @Override
    public VersionedParameter compareAndSet(long expectedVersion, VersionedParameter next,
            ParameterChange.Reason reason, String feedbackId) {
        return transactions.execute(status -> {
            int updated = jdbcClient.sql("""
                    UPDATE hybrid_parameter
                    SET param_values = :values, version = :nextVersion, updated_at = :updatedAt,
                        last_reinforced_at = :reinforcedAt
                    WHERE param_key = :key AND version = :expectedVersion
                    """)
                    .param("values", toJson(next.values()))
                    .param("nextVersion", next.version())
                    .param("updatedAt", next.updatedAt().toEpochMilli())
                    .param("reinforcedAt", next.lastReinforcedAt().toEpochMilli())
                    .param("key", next.key())
                    .param("expectedVersion", expectedVersion)
                    .update();
            if (updated == 0) {
                VersionedParameter stored = find(next.key())
                        .orElseThrow(() -> new NotFoundException("Unknown parameter '" + next.key() + "'"));
                throw new ConcurrencyConflictException(next.key(), expectedVersion, stored.version());
            }
            appendChange(new ParameterChange(next.key(), next.version(), next.values(), next.updatedAt(), feedbackId,
                    reason));
            return next;
        });
    }

    @Override
    public ParameterSnapshot snapshot() {
        Map<String, VersionedParameter> parameters = new LinkedHashMap<>();
        jdbcClient.sql(SELECT_PARAMETER_SQL).query(parameterMapper).list()
                .forEach(parameter -> parameters.put(parameter.key(), parameter));
        return new ParameterSnapshot(parameters, clock.instant());
    }

    @Override
    public List<ParameterChange> history(String key) {
        return jdbcClient.sql("""
                SELECT param_key, version, param_values, changed_at, feedback_id, reason
                FROM hybrid_parameter_change
                WHERE param_key = :key
                ORDER BY id
                """)
                .param("key", key)
                .query((rs, rowNum) -> new ParameterChange(
                        rs.getString("param_key"),
                        rs.getLong("version"),
                        fromJson(rs.getString("param_values")),
                        Instant.ofEpochMilli(rs.getLong("changed_at")),
                        rs.getString("feedback_id"),
                        ParameterChange.Reason.valueOf(rs.getString("reason"))))
                .list();
    }

    private void appendChange(ParameterChange change) {
        jdbcClient.sql("""
                INSERT INTO hybrid_parameter_change (param_key, version, param_values, changed_at, feedback_id, reason)
                VALUES (:key, :version, :values, :changedAt, :feedbackId, :reason)
                """)
                .param("key", change.key())
                .param("version", change.version())
                .param("values", toJson(change.values()))
                .param("changedAt", change.changedAt().toEpochMilli())
                .param("feedbackId", change.feedbackId())
                .param("reason", change.reason().name())
                .update();
    }

    private VersionedParameter mapParameter(ResultSet rs, int rowNum) throws SQLException {
        return new VersionedParameter(
                rs.getString("param_key"),
                fromJson(rs.getString("param_values")),
                fromJson(rs.getString("param_priors")),
                rs.getDouble("lower_bound"),
                rs.getDouble("upper_bound"),
                rs.getLong("version"),
                Instant.ofEpochMilli(rs.getLong("updated_at")),
                Instant.ofEpochMilli(rs.getLong("last_reinforced_at")));
    }

    private String toJson(double[] values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize parameter values", ex);
        }
    }

    private double[] fromJson(String json) {
        try {
            return objectMapper.readValue(json, double[].class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored parameter values are not valid JSON", ex);
        }
    }
}
