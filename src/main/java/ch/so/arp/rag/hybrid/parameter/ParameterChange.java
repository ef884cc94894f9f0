package ch.so.arp.rag.hybrid.parameter;

import java.time.Instant;

/**
 * Append-only audit entry written for every committed parameter version.
 *
 * @param feedbackId the feedback event that triggered the change, {@code null}
 *                   for bootstrap, decay and rollback entries
 */
public record ParameterChange(String key, long version, double[] values, Instant changedAt, String feedbackId,
        Reason reason) {

    public ParameterChange {
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public enum Reason {
        BOOTSTRAP, FEEDBACK, DECAY, ROLLBACK
    }
}
