package ch.so.arp.rag.hybrid.learning;

/**
 * Step size and stabilisers of the policy gradient.
 *
 * @param gradientClip        gradients are clipped to {@code ±gradientClip}
 *                            per parameter entry
 * @param iterationCreditDecay credit of iteration {@code i} of {@code n} is
 *                            proportional to {@code decay^(n-1-i)}; 1 gives
 *                            every iteration the same share
 */
public record LearningSettings(double learningRate, double gradientClip, double iterationCreditDecay) {

    public LearningSettings {
        if (!(learningRate > 0.0d)) {
            throw new IllegalArgumentException("learningRate must be positive");
        }
        if (!(gradientClip > 0.0d)) {
            throw new IllegalArgumentException("gradientClip must be positive");
        }
        if (!(iterationCreditDecay > 0.0d && iterationCreditDecay <= 1.0d)) {
            throw new IllegalArgumentException("iterationCreditDecay must be within (0,1]");
        }
    }

    /**
     * Normalized credit per iteration, summing to 1.
     */
    public double[] iterationCredits(int iterations) {
        double[] credits = new double[iterations];
        double sum = 0.0d;
        for (int i = 0; i < iterations; i++) {
            credits[i] = Math.pow(iterationCreditDecay, iterations - 1 - i);
            sum += credits[i];
        }
        for (int i = 0; i < iterations; i++) {
            credits[i] /= sum;
        }
        return credits;
    }
}
