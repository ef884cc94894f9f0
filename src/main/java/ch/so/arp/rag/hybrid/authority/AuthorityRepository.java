package ch.so.arp.rag.hybrid.authority;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Storage of {@link UserAuthority} records. {@link #update} is atomic per user.
 */
public interface AuthorityRepository {

    Optional<UserAuthority> find(String userId);

    /**
     * @param initial creates the record for a user seen for the first time
     */
    UserAuthority update(String userId, Supplier<UserAuthority> initial, UnaryOperator<UserAuthority> change);
}
