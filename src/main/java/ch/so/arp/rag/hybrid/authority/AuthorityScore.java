package ch.so.arp.rag.hybrid.authority;

/**
 * Authority of a user for one level and domain, with the terms it is made of.
 *
 * @param source {@code DOMAIN}, {@code LEVEL} or {@code PRIOR} depending on which
 *               history was used
 */
public record AuthorityScore(String userId, FeedbackLevel level, String domain, double authority,
        double baselineCredential, double trackRecord, double recentPerformance, long validated, String source) {
}
