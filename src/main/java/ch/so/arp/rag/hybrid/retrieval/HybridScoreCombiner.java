package ch.so.arp.rag.hybrid.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.bridge.BridgeIndex;
import ch.so.arp.rag.hybrid.bridge.BridgeMapping;

/**
 * Blends vector and graph evidence for one strategy:
 * {@code final = alpha · vector + (1 - alpha) · graph}.
 */
public class HybridScoreCombiner {

    private static final Logger LOGGER = LoggerFactory.getLogger(HybridScoreCombiner.class);

    static final Comparator<ScoredCandidate> RANKING = Comparator.comparingDouble(ScoredCandidate::finalScore)
            .reversed()
            .thenComparing(ScoredCandidate::chunkId);

    private final BridgeIndex bridgeIndex;
    private final double neutralGraphScore;

    public HybridScoreCombiner(BridgeIndex bridgeIndex, double neutralGraphScore) {
        this.bridgeIndex = Objects.requireNonNull(bridgeIndex, "bridgeIndex");
        if (!(neutralGraphScore >= 0.0d && neutralGraphScore <= 1.0d)) {
            throw new IllegalArgumentException("neutralGraphScore must be within [0,1]");
        }
        this.neutralGraphScore = neutralGraphScore;
    }

    /**
     * @param nodeScores best path per node for this strategy; empty when the query
     *                   has no anchors
     * @param anchored   whether the query named any anchor nodes
     */
    public List<ScoredCandidate> combine(List<VectorMatch> matches, Map<String, GraphPath> nodeScores, boolean anchored,
            double alpha) {
        List<ScoredCandidate> candidates = new ArrayList<>(matches.size());
        for (VectorMatch match : matches) {
            List<BridgeMapping> links = bridgeIndex.getNodesForChunk(match.chunkId());
            if (links.isEmpty() || !anchored) {
                candidates.add(candidate(match, neutralGraphScore, alpha, false, null, null));
                continue;
            }
            BridgeMapping bestLink = null;
            GraphPath bestPath = null;
            double graphScore = 0.0d;
            for (BridgeMapping link : links) {
                GraphPath path = nodeScores.get(link.nodeId());
                if (path == null) {
                    continue;
                }
                double score = link.weight() * path.score();
                if (bestLink == null || score > graphScore) {
                    graphScore = score;
                    bestLink = link;
                    bestPath = path;
                }
            }
            candidates.add(candidate(match, graphScore, alpha, true, bestLink, bestPath));
        }
        candidates.sort(RANKING);
        LOGGER.debug("Combined {} candidates with alpha {}", candidates.size(), alpha);
        return candidates;
    }

    private static ScoredCandidate candidate(VectorMatch match, double graphScore, double alpha, boolean linked,
            BridgeMapping link, GraphPath path) {
        double combined = alpha * match.score() + (1.0d - alpha) * graphScore;
        return new ScoredCandidate(match.chunkId(), match.score(), graphScore, alpha, combined, linked, link, path);
    }
}
