package ch.so.arp.rag.hybrid.parameter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.NotFoundException;

/**
 * Parameter store for local development and tests. The change log lives next to
 * the current value and is appended inside the same atomic {@code compute}.
 */
public class InMemoryParameterStore implements ParameterStore {

    private final Map<String, VersionedParameter> current = new ConcurrentHashMap<>();
    private final Map<String, List<ParameterChange>> changes = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryParameterStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean initializeIfAbsent(VersionedParameter initial) {
        boolean[] created = new boolean[1];
        current.computeIfAbsent(initial.key(), key -> {
            created[0] = true;
            append(new ParameterChange(key, initial.version(), initial.values(), clock.instant(), null,
                    ParameterChange.Reason.BOOTSTRAP));
            return initial;
        });
        return created[0];
    }

    @Override
    public Optional<VersionedParameter> find(String key) {
        return Optional.ofNullable(current.get(key));
    }

    @Override
    public VersionedParameter compareAndSet(long expectedVersion, VersionedParameter next,
            ParameterChange.Reason reason, String feedbackId) {
        String key = next.key();
        VersionedParameter committed = current.compute(key, (k, stored) -> {
            if (stored == null) {
                throw new NotFoundException("Unknown parameter '" + k + "'");
            }
            if (stored.version() != expectedVersion) {
                throw new ConcurrencyConflictException(k, expectedVersion, stored.version());
            }
            append(new ParameterChange(k, next.version(), next.values(), next.updatedAt(), feedbackId, reason));
            return next;
        });
        return committed;
    }

    @Override
    public ParameterSnapshot snapshot() {
        return new ParameterSnapshot(current, clock.instant());
    }

    @Override
    public List<ParameterChange> history(String key) {
        List<ParameterChange> log = changes.get(key);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    private void append(ParameterChange change) {
        List<ParameterChange> log = changes.computeIfAbsent(change.key(), key -> new ArrayList<>());
        synchronized (log) {
            log.add(change);
        }
    }
}
