package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Response of {@link HybridRetrievalService#retrieve(RetrievalQuery)}.
 *
 * @param perStrategy top-k ranking of every strategy that completed in time
 */
public record RetrievalResult(
        String traceId,
        int iteration,
        Map<String, List<ScoredCandidate>> perStrategy,
        List<RankedCandidate> combined,
        TraceIteration trace) {
}
