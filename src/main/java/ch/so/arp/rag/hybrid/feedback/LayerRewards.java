package ch.so.arp.rag.hybrid.feedback;

import ch.so.arp.rag.hybrid.authority.FeedbackLevel;

/**
 * Scalar reward per feedback level, each within [0,1].
 */
public record LayerRewards(double retrieval, double reasoning, double synthesis) {

    public double get(FeedbackLevel level) {
        return switch (level) {
            case RETRIEVAL -> retrieval;
            case REASONING -> reasoning;
            case SYNTHESIS -> synthesis;
        };
    }
}
