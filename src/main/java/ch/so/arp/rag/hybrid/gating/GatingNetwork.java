package ch.so.arp.rag.hybrid.gating;

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.ParameterSnapshot;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;

/**
 * Maps a query embedding to a probability distribution over strategies:
 * {@code softmax((W·x + b) / temperature)} with {@code x} the L2-normalized
 * embedding. {@code W} and {@code b} are stored row-major under
 * {@link ParameterKeys#GATING}, one row of {@code D + 1} values per strategy.
 */
public class GatingNetwork {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatingNetwork.class);

    private final WeightSchema schema;
    private final double temperature;

    public GatingNetwork(WeightSchema schema, double temperature) {
        this.schema = Objects.requireNonNull(schema, "schema");
        if (!(temperature > 0.0d)) {
            throw new IllegalArgumentException("temperature must be positive");
        }
        this.temperature = temperature;
    }

    public double temperature() {
        return temperature;
    }

    /**
     * @return one probability per strategy in schema order, summing to 1
     */
    public double[] forward(ParameterSnapshot snapshot, float[] embedding) {
        double[] normalized = normalize(embedding);
        int strategies = schema.size();
        if (normalized == null) {
            return uniform(strategies);
        }
        double[] matrix = snapshot.values(ParameterKeys.GATING);
        int columns = normalized.length + 1;
        if (matrix.length != strategies * columns) {
            LOGGER.warn("Gating parameters have {} values, expected {}; falling back to uniform gate", matrix.length,
                    strategies * columns);
            return uniform(strategies);
        }
        double[] logits = new double[strategies];
        for (int row = 0; row < strategies; row++) {
            double sum = matrix[row * columns + normalized.length];
            for (int column = 0; column < normalized.length; column++) {
                sum += matrix[row * columns + column] * normalized[column];
            }
            logits[row] = sum / temperature;
        }
        return softmax(logits);
    }

    /**
     * Gradient of {@code log p(action)} with respect to the gating matrix,
     * {@code (onehot(action) - p) · [x, 1] / temperature}, laid out like the
     * stored parameter. Degenerate embeddings only move the bias column.
     */
    public double[] logProbabilityGradient(float[] embedding, double[] probabilities, int action) {
        double[] normalized = normalize(embedding);
        int dimensions = schema.embeddingDimensions();
        int columns = dimensions + 1;
        double[] gradient = new double[schema.size() * columns];
        for (int row = 0; row < schema.size(); row++) {
            double advantage = ((row == action) ? 1.0d : 0.0d) - probabilities[row];
            if (normalized != null) {
                for (int column = 0; column < dimensions; column++) {
                    gradient[row * columns + column] = advantage * normalized[column] / temperature;
                }
            }
            gradient[row * columns + dimensions] = advantage / temperature;
        }
        return gradient;
    }

    /**
     * @return the unit vector, or {@code null} for all-zero or non-finite input
     * @throws InputValidationException if the dimension does not match
     */
    double[] normalize(float[] embedding) {
        if (embedding == null || embedding.length != schema.embeddingDimensions()) {
            throw new InputValidationException("Query embedding must have " + schema.embeddingDimensions()
                    + " dimensions");
        }
        double norm = 0.0d;
        for (float value : embedding) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0d || !Double.isFinite(norm)) {
            return null;
        }
        double[] normalized = new double[embedding.length];
        for (int i = 0; i < embedding.length; i++) {
            normalized[i] = embedding[i] / norm;
        }
        return normalized;
    }

    static double[] softmax(double[] logits) {
        double max = Arrays.stream(logits).max().orElse(0.0d);
        if (!Double.isFinite(max)) {
            return uniform(logits.length);
        }
        double[] exponentials = new double[logits.length];
        double sum = 0.0d;
        for (int i = 0; i < logits.length; i++) {
            if (!Double.isFinite(logits[i])) {
                return uniform(logits.length);
            }
            exponentials[i] = Math.exp(logits[i] - max);
            sum += exponentials[i];
        }
        for (int i = 0; i < exponentials.length; i++) {
            exponentials[i] /= sum;
        }
        return exponentials;
    }

    private static double[] uniform(int size) {
        double[] uniform = new double[size];
        Arrays.fill(uniform, 1.0d / size);
        return uniform;
    }
}
