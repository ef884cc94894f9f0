package ch.so.arp.rag.hybrid.parameter;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.ConflictRetrier;
import ch.so.arp.rag.hybrid.NotFoundException;

/**
 * Single write path for learnable parameters. Each call re-reads the current
 * version, derives the new values and commits them with compare-and-swap,
 * retrying when a concurrent writer got there first.
 */
public class ParameterWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParameterWriter.class);

    private final ParameterStore store;
    private final ConflictRetrier retrier;
    private final Clock clock;

    public ParameterWriter(ParameterStore store, ConflictRetrier retrier, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Apply an update to one key.
     *
     * @param update derives the new values from the current version; returning
     *               {@code null} skips the write
     * @param reinforced whether the write counts as reinforcement for decay
     * @return the committed version, or the current one when nothing changed
     */
    public VersionedParameter apply(String key, Function<VersionedParameter, double[]> update,
            ParameterChange.Reason reason, String feedbackId, boolean reinforced) {
        return apply(key, update, reason, feedbackId, reinforced, null);
    }

    /**
     * Same as {@link #apply(String, Function, ParameterChange.Reason, String, boolean)}
     * with the new version stamped at {@code at}, or at the clock's instant when
     * {@code at} is {@code null}.
     */
    public VersionedParameter apply(String key, Function<VersionedParameter, double[]> update,
            ParameterChange.Reason reason, String feedbackId, boolean reinforced, Instant at) {
        return retrier.execute(() -> {
            VersionedParameter current = store.find(key)
                    .orElseThrow(() -> new NotFoundException("Unknown parameter '" + key + "'"));
            double[] values = update.apply(current);
            if (values == null) {
                return current;
            }
            VersionedParameter next = current.next(values, at != null ? at : clock.instant(), reinforced);
            if (Arrays.equals(next.values(), current.values())) {
                return current;
            }
            return store.compareAndSet(current.version(), next, reason, feedbackId);
        });
    }

    /**
     * Add {@code delta} element-wise to the current values.
     */
    public VersionedParameter add(String key, double[] delta, String feedbackId) {
        return apply(key, current -> {
            double[] values = current.values();
            if (values.length != delta.length) {
                throw new IllegalArgumentException("'" + key + "' expects " + values.length + " deltas");
            }
            boolean changed = false;
            for (int i = 0; i < values.length; i++) {
                if (delta[i] != 0.0d) {
                    values[i] += delta[i];
                    changed = true;
                }
            }
            return changed ? values : null;
        }, ParameterChange.Reason.FEEDBACK, feedbackId, true);
    }

    /**
     * Append a new version restoring the values of an older one. History is
     * never rewritten.
     */
    public VersionedParameter rollback(String key, long version) {
        ParameterChange target = store.history(key).stream()
                .filter(change -> change.version() == version)
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Parameter '" + key + "' has no version " + version));
        VersionedParameter restored = apply(key, current -> target.values(), ParameterChange.Reason.ROLLBACK, null,
                false);
        LOGGER.info("Rolled back {} to the values of version {} (now version {})", key, version, restored.version());
        return restored;
    }
}
