package ch.so.arp.rag.hybrid.authority;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation history of a user at one level, optionally within one domain.
 *
 * @param validated feedback events whose consensus outcome is known
 * @param confirmed validated events the consensus agreed with
 * @param recent    outcomes of the most recent validated events, oldest first
 */
public record AuthorityRecord(long validated, long confirmed, List<Boolean> recent) {

    public static final AuthorityRecord EMPTY = new AuthorityRecord(0L, 0L, List.of());

    public AuthorityRecord {
        if (validated < 0 || confirmed < 0 || confirmed > validated) {
            throw new IllegalArgumentException("confirmed must be within [0, validated]");
        }
        recent = List.copyOf(recent);
    }

    public boolean hasHistory() {
        return validated > 0;
    }

    public double trackRecord(double neutral) {
        return validated == 0 ? neutral : (double) confirmed / validated;
    }

    public double recentPerformance(double neutral) {
        if (recent.isEmpty()) {
            return neutral;
        }
        long correct = recent.stream().filter(Boolean::booleanValue).count();
        return (double) correct / recent.size();
    }

    AuthorityRecord record(boolean correct, int window) {
        List<Boolean> outcomes = new ArrayList<>(recent);
        outcomes.add(correct);
        while (outcomes.size() > window) {
            outcomes.remove(0);
        }
        return new AuthorityRecord(validated + 1, confirmed + (correct ? 1 : 0), outcomes);
    }
}
