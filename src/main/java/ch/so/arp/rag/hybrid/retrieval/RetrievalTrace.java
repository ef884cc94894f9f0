package ch.so.arp.rag.hybrid.retrieval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A retrieval session: the first query plus any follow-up iterations that
 * continued it before feedback was given.
 */
public record RetrievalTrace(String traceId, String domain, Instant createdAt, List<TraceIteration> iterations) {

    public RetrievalTrace {
        iterations = List.copyOf(iterations);
    }

    public TraceIteration latest() {
        return iterations.get(iterations.size() - 1);
    }

    RetrievalTrace append(TraceIteration iteration) {
        List<TraceIteration> extended = new ArrayList<>(iterations);
        extended.add(iteration);
        return new RetrievalTrace(traceId, domain, createdAt, extended);
    }
}
