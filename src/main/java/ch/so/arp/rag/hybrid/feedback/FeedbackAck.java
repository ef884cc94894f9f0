package ch.so.arp.rag.hybrid.feedback;

import java.util.Set;

import ch.so.arp.rag.hybrid.authority.FeedbackLevel;

/**
 * Acknowledgement of an ingested feedback event.
 *
 * @param rewards      decomposed rewards, {@code null} for duplicates
 * @param judgedLevels levels that carried a judgment and drive parameter updates
 */
public record FeedbackAck(String feedbackId, Status status, LayerRewards rewards, Set<FeedbackLevel> judgedLevels) {

    public FeedbackAck {
        judgedLevels = Set.copyOf(judgedLevels);
    }

    static FeedbackAck accepted(String feedbackId, LayerRewards rewards, Set<FeedbackLevel> judgedLevels) {
        return new FeedbackAck(feedbackId, Status.ACCEPTED, rewards, judgedLevels);
    }

    static FeedbackAck resumed(String feedbackId, LayerRewards rewards, Set<FeedbackLevel> judgedLevels) {
        return new FeedbackAck(feedbackId, Status.RESUMED, rewards, judgedLevels);
    }

    static FeedbackAck duplicate(String feedbackId) {
        return new FeedbackAck(feedbackId, Status.DUPLICATE, null, Set.of());
    }

    public enum Status {
        ACCEPTED,
        /** A re-sent event whose earlier update failed; the update was resumed. */
        RESUMED,
        DUPLICATE
    }
}
