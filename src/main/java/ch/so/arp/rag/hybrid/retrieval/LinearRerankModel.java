package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;

/**
 * Linear scoring {@code w · f} with a softmax policy over the presented
 * candidates at the given temperature.
 */
public class LinearRerankModel implements RerankModel {

    private final double temperature;

    public LinearRerankModel(double temperature) {
        if (!(temperature > 0.0d)) {
            throw new IllegalArgumentException("temperature must be positive");
        }
        this.temperature = temperature;
    }

    @Override
    public double score(double[] weights, RerankFeatures features) {
        double[] values = features.toArray();
        if (weights.length != values.length) {
            throw new IllegalArgumentException("expected " + values.length + " rerank weights");
        }
        double score = 0.0d;
        for (int i = 0; i < values.length; i++) {
            score += weights[i] * values[i];
        }
        return score;
    }

    @Override
    public double[] policy(double[] weights, List<RerankFeatures> presented) {
        double[] probabilities = new double[presented.size()];
        if (presented.isEmpty()) {
            return probabilities;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < presented.size(); i++) {
            probabilities[i] = score(weights, presented.get(i)) / temperature;
            max = Math.max(max, probabilities[i]);
        }
        double sum = 0.0d;
        for (int i = 0; i < probabilities.length; i++) {
            probabilities[i] = Math.exp(probabilities[i] - max);
            sum += probabilities[i];
        }
        for (int i = 0; i < probabilities.length; i++) {
            probabilities[i] /= sum;
        }
        return probabilities;
    }

    @Override
    public double[] logProbabilityGradient(double[] weights, List<RerankFeatures> presented, int action) {
        double[] gradient = new double[RerankFeatures.SIZE];
        if (action < 0 || action >= presented.size()) {
            return gradient;
        }
        double[] probabilities = policy(weights, presented);
        double[] expected = new double[RerankFeatures.SIZE];
        for (int i = 0; i < presented.size(); i++) {
            double[] features = presented.get(i).toArray();
            for (int j = 0; j < features.length; j++) {
                expected[j] += probabilities[i] * features[j];
            }
        }
        double[] chosen = presented.get(action).toArray();
        for (int j = 0; j < gradient.length; j++) {
            gradient[j] = (chosen[j] - expected[j]) / temperature;
        }
        return gradient;
    }
}
