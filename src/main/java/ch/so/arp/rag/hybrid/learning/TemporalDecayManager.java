package ch.so.arp.rag.hybrid.learning;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.parameter.ParameterChange;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.ParameterStore;
import ch.so.arp.rag.hybrid.parameter.ParameterWriter;
import ch.so.arp.rag.hybrid.parameter.VersionedParameter;

/**
 * Pulls traversal weights that have not been reinforced back towards their
 * priors: {@code θ ← d^days · θ + (1 - d^days) · prior}, with {@code days}
 * counted from the last write to the key. Keys reinforced within the grace
 * period are skipped. Alpha, gating and rerank parameters do not decay.
 */
public class TemporalDecayManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemporalDecayManager.class);

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ParameterStore parameterStore;
    private final ParameterWriter parameterWriter;
    private final double decayRate;
    private final Duration reinforcementGrace;

    public TemporalDecayManager(ParameterStore parameterStore, ParameterWriter parameterWriter, double decayRate,
            Duration reinforcementGrace) {
        this.parameterStore = Objects.requireNonNull(parameterStore, "parameterStore");
        this.parameterWriter = Objects.requireNonNull(parameterWriter, "parameterWriter");
        if (!(decayRate > 0.0d && decayRate <= 1.0d)) {
            throw new IllegalArgumentException("decayRate must be within (0,1]");
        }
        this.decayRate = decayRate;
        this.reinforcementGrace = Objects.requireNonNull(reinforcementGrace, "reinforcementGrace");
    }

    public DecayReport sweep(Instant now) {
        int examined = 0;
        int decayed = 0;
        for (VersionedParameter parameter : parameterStore.snapshot().parameters().values()) {
            if (!ParameterKeys.isTraverse(parameter.key())) {
                continue;
            }
            examined++;
            try {
                VersionedParameter result = parameterWriter.apply(parameter.key(), current -> decayed(current, now),
                        ParameterChange.Reason.DECAY, null, false, now);
                if (result.version() != parameter.version()) {
                    decayed++;
                }
            } catch (NotFoundException ex) {
                LOGGER.warn("Parameter {} disappeared during the decay sweep", parameter.key());
            }
        }
        LOGGER.info("Decay sweep at {} moved {} of {} traversal weights towards their priors", now, decayed,
                examined);
        return new DecayReport(now, examined, decayed);
    }

    /**
     * Decay covers the days since the last write to the key, so consecutive
     * sweeps add up to {@code rate^days} whatever the sweep interval is.
     *
     * @return the decayed values, or {@code null} while the key is within the
     *         reinforcement grace period or already at its prior
     */
    private double[] decayed(VersionedParameter current, Instant now) {
        if (Duration.between(current.lastReinforcedAt(), now).compareTo(reinforcementGrace) < 0) {
            return null;
        }
        Duration sinceUpdate = Duration.between(current.updatedAt(), now);
        if (sinceUpdate.isNegative() || sinceUpdate.isZero()) {
            return null;
        }
        double days = sinceUpdate.toMillis() / MILLIS_PER_DAY;
        double factor = Math.pow(decayRate, days);
        double[] values = current.values();
        double[] priors = current.priors();
        if (Arrays.equals(values, priors)) {
            return null;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] = factor * values[i] + (1.0d - factor) * priors[i];
        }
        return values;
    }
}
