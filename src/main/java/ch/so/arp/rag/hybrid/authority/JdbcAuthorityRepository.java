package ch.so.arp.rag.hybrid.authority;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.ConflictRetrier;

/**
 * Authority records in {@code hybrid_user_authority}: one row per user, the
 * per-level and per-domain histories as a JSON document, guarded by a version
 * column.
 */
public class JdbcAuthorityRepository implements AuthorityRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcAuthorityRepository.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS hybrid_user_authority (
              user_id             VARCHAR(255)     PRIMARY KEY,
              baseline_credential DOUBLE PRECISION NOT NULL,
              history             TEXT             NOT NULL,
              version             BIGINT           NOT NULL,
              created_at          BIGINT           NOT NULL,
              updated_at          BIGINT           NOT NULL
            )
            """;

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;
    private final ConflictRetrier retrier;

    public JdbcAuthorityRepository(JdbcClient jdbcClient, ObjectMapper objectMapper, ConflictRetrier retrier) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
    }

    public void ensureSchema() {
        jdbcClient.sql(CREATE_TABLE_SQL).update();
        LOGGER.info("User authority table is ready");
    }

    @Override
    public Optional<UserAuthority> find(String userId) {
        return load(userId).map(Row::authority);
    }

    @Override
    public UserAuthority update(String userId, Supplier<UserAuthority> initial, UnaryOperator<UserAuthority> change) {
        return retrier.execute(() -> {
            Optional<Row> stored = load(userId);
            if (stored.isEmpty()) {
                UserAuthority created = change.apply(initial.get());
                try {
                    jdbcClient.sql("""
                            INSERT INTO hybrid_user_authority (user_id, baseline_credential, history, version,
                              created_at, updated_at)
                            VALUES (:userId, :baseline, :history, 0, :createdAt, :updatedAt)
                            """)
                            .param("userId", userId)
                            .param("baseline", created.baselineCredential())
                            .param("history", toJson(created))
                            .param("createdAt", created.createdAt().toEpochMilli())
                            .param("updatedAt", created.updatedAt().toEpochMilli())
                            .update();
                } catch (DuplicateKeyException ex) {
                    throw new ConcurrencyConflictException("authority/" + userId, -1L, 0L);
                }
                return created;
            }
            Row row = stored.get();
            UserAuthority updated = change.apply(row.authority());
            int count = jdbcClient.sql("""
                    UPDATE hybrid_user_authority
                    SET baseline_credential = :baseline, history = :history, version = version + 1,
                        updated_at = :updatedAt
                    WHERE user_id = :userId AND version = :version
                    """)
                    .param("baseline", updated.baselineCredential())
                    .param("history", toJson(updated))
                    .param("updatedAt", updated.updatedAt().toEpochMilli())
                    .param("userId", userId)
                    .param("version", row.version())
                    .update();
            if (count == 0) {
                throw new ConcurrencyConflictException("authority/" + userId, row.version(), row.version() + 1);
            }
            return updated;
        });
    }

    private Optional<Row> load(String userId) {
        return jdbcClient.sql("""
                SELECT user_id, baseline_credential, history, version, created_at, updated_at
                FROM hybrid_user_authority
                WHERE user_id = :userId
                """)
                .param("userId", userId)
                .query((rs, rowNum) -> {
                    History history = fromJson(rs.getString("history"));
                    UserAuthority authority = new UserAuthority(rs.getString("user_id"),
                            rs.getDouble("baseline_credential"), history.levels(), history.domains(),
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            Instant.ofEpochMilli(rs.getLong("updated_at")));
                    return new Row(authority, rs.getLong("version"));
                })
                .optional();
    }

    private String toJson(UserAuthority authority) {
        try {
            return objectMapper.writeValueAsString(new History(authority.levels(), authority.domains()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize authority history", ex);
        }
    }

    private History fromJson(String json) {
        try {
            return objectMapper.readValue(json, History.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored authority history is not valid JSON", ex);
        }
    }

    private record Row(UserAuthority authority, long version) {
    }

    record History(Map<FeedbackLevel, AuthorityRecord> levels,
            Map<FeedbackLevel, Map<String, AuthorityRecord>> domains) {
    }
}
