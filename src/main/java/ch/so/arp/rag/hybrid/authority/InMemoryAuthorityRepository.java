package ch.so.arp.rag.hybrid.authority;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Authority records held in memory; one {@code compute} per user serializes
 * concurrent updates.
 */
public class InMemoryAuthorityRepository implements AuthorityRepository {

    private final Map<String, UserAuthority> users = new ConcurrentHashMap<>();

    @Override
    public Optional<UserAuthority> find(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public UserAuthority update(String userId, Supplier<UserAuthority> initial, UnaryOperator<UserAuthority> change) {
        return users.compute(userId, (id, existing) -> change.apply(existing == null ? initial.get() : existing));
    }
}
