package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;
import java.util.Set;

/**
 * Nearest neighbour search over chunk embeddings. Results must be deterministic
 * for a fixed index state.
 */
public interface VectorSimilaritySearcher {

    /**
     * @param contentTypes allowed content types, {@code null} or empty for all
     * @return at most {@code topN} matches, best first, ties ordered by chunk id
     */
    List<VectorMatch> search(float[] embedding, int topN, Set<String> contentTypes);
}
