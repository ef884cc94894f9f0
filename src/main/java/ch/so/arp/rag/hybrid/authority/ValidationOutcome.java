package ch.so.arp.rag.hybrid.authority;

import java.util.Map;

/**
 * Consensus verdict on a feedback event, per level it judged.
 *
 * @param confirmed whether the consensus agreed with the user's judgment
 */
public record ValidationOutcome(String feedbackId, String userId, String domain,
        Map<FeedbackLevel, Boolean> confirmed) {

    public ValidationOutcome {
        confirmed = Map.copyOf(confirmed);
    }
}
