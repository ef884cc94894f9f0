package ch.so.arp.rag.hybrid.retrieval;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Everything one retrieval pass used, kept for credit assignment once feedback
 * arrives.
 *
 * @param gate              gating distribution in strategy order
 * @param strategies        outcome per strategy id, in strategy order
 * @param combined          the top-k combined ranking as presented
 * @param parameterVersions version of every parameter in the snapshot used
 */
public record TraceIteration(
        int iteration,
        Instant executedAt,
        float[] embedding,
        List<String> anchorNodes,
        int topK,
        Set<String> contentTypes,
        double[] gate,
        Map<String, StrategyOutcome> strategies,
        List<RankedCandidate> combined,
        Map<String, Long> parameterVersions) {

    public TraceIteration {
        embedding = embedding.clone();
        anchorNodes = List.copyOf(anchorNodes);
        contentTypes = contentTypes == null ? Set.of() : Set.copyOf(contentTypes);
        gate = gate.clone();
        strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        parameterVersions = Collections.unmodifiableMap(new TreeMap<>(parameterVersions));
        combined = List.copyOf(combined);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    @Override
    public double[] gate() {
        return gate.clone();
    }

    public boolean presented(String chunkId) {
        return combined.stream().anyMatch(candidate -> candidate.chunkId().equals(chunkId));
    }
}
