package ch.so.arp.rag.hybrid.learning;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

import ch.so.arp.rag.hybrid.authority.FeedbackLevel;

/**
 * Moving average of the most recent rewards per level, used as the variance
 * reducing baseline of the policy gradient.
 */
public class RewardBaseline {

    private static final double EMPTY_BASELINE = 0.5d;

    private final int window;
    private final Map<FeedbackLevel, Deque<Double>> rewards = new EnumMap<>(FeedbackLevel.class);

    public RewardBaseline(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1");
        }
        this.window = window;
        for (FeedbackLevel level : FeedbackLevel.values()) {
            rewards.put(level, new ArrayDeque<>());
        }
    }

    /**
     * @return {@code reward - baseline}, with the baseline taken before the
     *         reward joins the window
     */
    public double advantage(FeedbackLevel level, double reward) {
        Deque<Double> history = rewards.get(level);
        synchronized (history) {
            double baseline = history.isEmpty() ? EMPTY_BASELINE
                    : history.stream().mapToDouble(Double::doubleValue).average().orElse(EMPTY_BASELINE);
            history.addLast(reward);
            while (history.size() > window) {
                history.removeFirst();
            }
            return reward - baseline;
        }
    }

    public double current(FeedbackLevel level) {
        Deque<Double> history = rewards.get(level);
        synchronized (history) {
            return history.stream().mapToDouble(Double::doubleValue).average().orElse(EMPTY_BASELINE);
        }
    }
}
