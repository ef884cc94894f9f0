package ch.so.arp.rag.hybrid.learning;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleSupplier;

import ch.so.arp.rag.hybrid.authority.FeedbackLevel;
import ch.so.arp.rag.hybrid.bridge.BridgeMapping;

/**
 * What an update of one feedback event has committed so far. An attempt that
 * fails half way keeps its progress, and resuming it skips the parameter keys,
 * bridge links and baseline samples that are already in.
 */
public final class UpdateProgress {

    private final Map<FeedbackLevel, Double> advantages = new EnumMap<>(FeedbackLevel.class);
    private final Set<String> parameterKeys = ConcurrentHashMap.newKeySet();
    private final Set<BridgeMapping.Key> bridgeLinks = ConcurrentHashMap.newKeySet();

    /**
     * The advantage of a level, sampled from the baseline on first use only.
     */
    synchronized double advantage(FeedbackLevel level, DoubleSupplier sample) {
        Double known = advantages.get(level);
        if (known == null) {
            known = sample.getAsDouble();
            advantages.put(level, known);
        }
        return known;
    }

    boolean isCommitted(String parameterKey) {
        return parameterKeys.contains(parameterKey);
    }

    void committed(String parameterKey) {
        parameterKeys.add(parameterKey);
    }

    boolean isCommitted(BridgeMapping.Key link) {
        return bridgeLinks.contains(link);
    }

    void committed(BridgeMapping.Key link) {
        bridgeLinks.add(link);
    }

    public Set<String> committedParameters() {
        return Set.copyOf(parameterKeys);
    }
}
