package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;

/**
 * Result of one strategy task within a retrieval iteration.
 *
 * @param candidates every scored vector candidate, best first; the response
 *                   only shows the top-k
 * @param error      failure description for {@link Status#FAILED} and
 *                   {@link Status#TIMED_OUT}, otherwise {@code null}
 */
public record StrategyOutcome(String strategyId, Status status, double gate, double alpha,
        List<ScoredCandidate> candidates, String error) {

    public StrategyOutcome {
        candidates = List.copyOf(candidates);
    }

    public boolean succeeded() {
        return status == Status.OK;
    }

    public enum Status {
        OK, TIMED_OUT, FAILED
    }
}
