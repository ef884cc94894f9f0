package ch.so.arp.rag.hybrid.authority;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything known about the trustworthiness of one user. Created on the first
 * feedback event and never deleted.
 *
 * @param baselineCredential credential score registered for the user
 * @param levels             history per level across all domains
 * @param domains            history per level and domain
 */
public record UserAuthority(
        String userId,
        double baselineCredential,
        Map<FeedbackLevel, AuthorityRecord> levels,
        Map<FeedbackLevel, Map<String, AuthorityRecord>> domains,
        Instant createdAt,
        Instant updatedAt) {

    public UserAuthority {
        Objects.requireNonNull(userId, "userId");
        if (!(baselineCredential >= 0.0d && baselineCredential <= 1.0d)) {
            throw new IllegalArgumentException("baselineCredential must be within [0,1]");
        }
        EnumMap<FeedbackLevel, AuthorityRecord> levelCopy = new EnumMap<>(FeedbackLevel.class);
        levelCopy.putAll(levels);
        levels = Collections.unmodifiableMap(levelCopy);
        EnumMap<FeedbackLevel, Map<String, AuthorityRecord>> domainCopy = new EnumMap<>(FeedbackLevel.class);
        domains.forEach((level, perDomain) -> domainCopy.put(level, Collections.unmodifiableMap(new TreeMap<>(perDomain))));
        domains = Collections.unmodifiableMap(domainCopy);
    }

    public static UserAuthority create(String userId, double baselineCredential, Instant now) {
        return new UserAuthority(userId, baselineCredential, Map.of(), Map.of(), now, now);
    }

    public AuthorityRecord level(FeedbackLevel level) {
        return levels.getOrDefault(level, AuthorityRecord.EMPTY);
    }

    public AuthorityRecord domain(FeedbackLevel level, String domain) {
        if (domain == null) {
            return AuthorityRecord.EMPTY;
        }
        return domains.getOrDefault(level, Map.of()).getOrDefault(domain, AuthorityRecord.EMPTY);
    }

    UserAuthority withBaseline(double baseline, Instant now) {
        return new UserAuthority(userId, baseline, levels, domains, createdAt, now);
    }

    UserAuthority withOutcome(FeedbackLevel level, String domain, boolean correct, int window, Instant now) {
        Map<FeedbackLevel, AuthorityRecord> nextLevels = new EnumMap<>(FeedbackLevel.class);
        nextLevels.putAll(levels);
        nextLevels.put(level, level(level).record(correct, window));
        Map<FeedbackLevel, Map<String, AuthorityRecord>> nextDomains = new EnumMap<>(FeedbackLevel.class);
        nextDomains.putAll(domains);
        if (domain != null && !domain.isBlank()) {
            Map<String, AuthorityRecord> perDomain = new TreeMap<>(domains.getOrDefault(level, Map.of()));
            perDomain.put(domain, domain(level, domain).record(correct, window));
            nextDomains.put(level, perDomain);
        }
        return new UserAuthority(userId, baselineCredential, nextLevels, nextDomains, createdAt, now);
    }
}
