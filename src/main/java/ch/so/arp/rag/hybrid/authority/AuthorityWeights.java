package ch.so.arp.rag.hybrid.authority;

/**
 * Mixing weights of the authority formula. They must sum to 1.
 */
public record AuthorityWeights(double baseline, double trackRecord, double recentPerformance) {

    private static final double TOLERANCE = 1.0e-6d;

    public AuthorityWeights {
        if (baseline < 0.0d || trackRecord < 0.0d || recentPerformance < 0.0d) {
            throw new IllegalArgumentException("authority weights must not be negative");
        }
        double sum = baseline + trackRecord + recentPerformance;
        if (Math.abs(sum - 1.0d) > TOLERANCE) {
            throw new IllegalArgumentException("authority weights must sum to 1 but sum to " + sum);
        }
    }

    public static AuthorityWeights defaults() {
        return new AuthorityWeights(0.3d, 0.5d, 0.2d);
    }
}
