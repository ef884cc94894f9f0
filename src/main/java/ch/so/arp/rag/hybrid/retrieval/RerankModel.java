package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;

/**
 * Orders the fused candidates and exposes the policy used to learn from
 * synthesis feedback.
 */
public interface RerankModel {

    double score(double[] weights, RerankFeatures features);

    /**
     * Probability of presenting each candidate first.
     */
    double[] policy(double[] weights, List<RerankFeatures> presented);

    /**
     * Gradient of {@code log π(action)} with respect to the weights.
     */
    double[] logProbabilityGradient(double[] weights, List<RerankFeatures> presented, int action);
}
