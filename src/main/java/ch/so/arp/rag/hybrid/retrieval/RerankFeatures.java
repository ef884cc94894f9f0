package ch.so.arp.rag.hybrid.retrieval;

/**
 * Inputs of the rerank model for one chunk.
 *
 * @param gatedScore  gate-weighted mean of the per-strategy final scores
 * @param agreement   fraction of successful strategies ranking the chunk within
 *                    their top-k
 */
public record RerankFeatures(double gatedScore, double vectorScore, double graphScore, double agreement) {

    public static final int SIZE = 4;

    public double[] toArray() {
        return new double[] { gatedScore, vectorScore, graphScore, agreement };
    }
}
