package ch.so.arp.rag.hybrid.retrieval;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import ch.so.arp.rag.hybrid.NotFoundException;

/**
 * Bounded, expiring store of retrieval traces. Feedback for an evicted trace is
 * rejected like feedback for an unknown one.
 */
public class TraceRepository {

    private final Cache<String, RetrievalTrace> traces;

    public TraceRepository(Duration retention, long maximumSize) {
        this.traces = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maximumSize)
                .build();
    }

    public void save(RetrievalTrace trace) {
        traces.put(trace.traceId(), trace);
    }

    public Optional<RetrievalTrace> find(String traceId) {
        return Optional.ofNullable(traceId == null ? null : traces.getIfPresent(traceId));
    }

    /**
     * Atomically append the iteration built from the current trace state.
     *
     * @throws NotFoundException if the trace is unknown or expired
     */
    public RetrievalTrace append(String traceId, Function<RetrievalTrace, TraceIteration> iteration) {
        RetrievalTrace updated = traces.asMap().computeIfPresent(traceId,
                (id, trace) -> trace.append(iteration.apply(trace)));
        if (updated == null) {
            throw new NotFoundException("Unknown retrieval trace '" + traceId + "'");
        }
        return updated;
    }
}
