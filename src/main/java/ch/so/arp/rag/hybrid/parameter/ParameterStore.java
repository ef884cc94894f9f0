package ch.so.arp.rag.hybrid.parameter;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of learnable parameters with optimistic versioning and an
 * append-only change log. Versions are never deleted.
 */
public interface ParameterStore {

    /**
     * Store the initial version unless the key already exists.
     *
     * @return {@code true} if the parameter was created
     */
    boolean initializeIfAbsent(VersionedParameter initial);

    Optional<VersionedParameter> find(String key);

    /**
     * Commit {@code next} if the stored version still equals
     * {@code expectedVersion}.
     *
     * @throws ch.so.arp.rag.hybrid.ConcurrencyConflictException if another writer
     *                                                            committed first
     * @throws ch.so.arp.rag.hybrid.NotFoundException            if the key is unknown
     */
    VersionedParameter compareAndSet(long expectedVersion, VersionedParameter next, ParameterChange.Reason reason,
            String feedbackId);

    ParameterSnapshot snapshot();

    List<ParameterChange> history(String key);
}
