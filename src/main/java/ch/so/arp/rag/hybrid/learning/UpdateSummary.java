package ch.so.arp.rag.hybrid.learning;

import java.util.List;

/**
 * Parameters and bridge links changed by one feedback event.
 */
public record UpdateSummary(String feedbackId, List<String> parameterKeys, int bridgeLinks) {

    public UpdateSummary {
        parameterKeys = List.copyOf(parameterKeys);
    }

    public static UpdateSummary none(String feedbackId) {
        return new UpdateSummary(feedbackId, List.of(), 0);
    }
}
