package ch.so.arp.rag.hybrid.authority;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.InputValidationException;

/**
 * Multilevel authority:
 * {@code α · baselineCredential + β · trackRecord + γ · recentPerformance},
 * clamped to [0,1]. The domain history is used once it holds validated events,
 * otherwise the history of the whole level.
 */
public class AuthorityCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthorityCalculator.class);

    private final AuthorityRepository repository;
    private final AuthorityWeights weights;
    private final int recentWindow;
    private final double neutralPrior;
    private final Executor updateExecutor;
    private final Clock clock;

    public AuthorityCalculator(AuthorityRepository repository, AuthorityWeights weights, int recentWindow,
            double neutralPrior, Executor updateExecutor, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.weights = Objects.requireNonNull(weights, "weights");
        if (recentWindow < 1) {
            throw new IllegalArgumentException("recentWindow must be at least 1");
        }
        this.recentWindow = recentWindow;
        this.neutralPrior = neutralPrior;
        this.updateExecutor = Objects.requireNonNull(updateExecutor, "updateExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public double getAuthority(String userId, FeedbackLevel level, String domain) {
        return describe(userId, level, domain).authority();
    }

    public AuthorityScore describe(String userId, FeedbackLevel level, String domain) {
        Objects.requireNonNull(level, "level");
        UserAuthority user = userId == null ? null : repository.find(userId).orElse(null);
        if (user == null) {
            return new AuthorityScore(userId, level, domain, neutralPrior, neutralPrior, neutralPrior, neutralPrior, 0L,
                    "PRIOR");
        }
        AuthorityRecord domainRecord = user.domain(level, domain);
        AuthorityRecord history = domainRecord.hasHistory() ? domainRecord : user.level(level);
        double trackRecord = history.trackRecord(neutralPrior);
        double recent = history.recentPerformance(neutralPrior);
        double authority = weights.baseline() * user.baselineCredential() + weights.trackRecord() * trackRecord
                + weights.recentPerformance() * recent;
        return new AuthorityScore(userId, level, domain, Math.max(0.0d, Math.min(1.0d, authority)),
                user.baselineCredential(), trackRecord, recent, history.validated(),
                domainRecord.hasHistory() ? "DOMAIN" : "LEVEL");
    }

    /**
     * Make sure a record exists for the user. Called when the first feedback
     * event of a user arrives.
     */
    public UserAuthority register(String userId) {
        return repository.find(userId).orElseGet(() -> repository.update(userId,
                () -> UserAuthority.create(userId, neutralPrior, clock.instant()), existing -> existing));
    }

    public UserAuthority registerBaseline(String userId, double baselineCredential) {
        if (userId == null || userId.isBlank()) {
            throw new InputValidationException("userId must not be blank");
        }
        if (!(baselineCredential >= 0.0d && baselineCredential <= 1.0d)) {
            throw new InputValidationException("baselineCredential must be within [0,1]");
        }
        UserAuthority updated = repository.update(userId,
                () -> UserAuthority.create(userId, baselineCredential, clock.instant()),
                existing -> existing.withBaseline(baselineCredential, clock.instant()));
        LOGGER.info("Registered baseline credential {} for user {}", baselineCredential, userId);
        return updated;
    }

    /**
     * Record a consensus outcome. Runs on the update executor so that slow
     * consensus never blocks feedback ingestion.
     */
    public CompletableFuture<UserAuthority> updateFromFeedback(ValidationOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        return CompletableFuture.supplyAsync(() -> apply(outcome), updateExecutor)
                .whenComplete((result, failure) -> {
                    if (failure != null) {
                        LOGGER.error("Authority update for feedback {} failed", outcome.feedbackId(), failure);
                    }
                });
    }

    private UserAuthority apply(ValidationOutcome outcome) {
        UserAuthority updated = repository.update(outcome.userId(),
                () -> UserAuthority.create(outcome.userId(), neutralPrior, clock.instant()),
                existing -> {
                    UserAuthority next = existing;
                    for (Map.Entry<FeedbackLevel, Boolean> entry : outcome.confirmed().entrySet()) {
                        next = next.withOutcome(entry.getKey(), outcome.domain(), entry.getValue(), recentWindow,
                                clock.instant());
                    }
                    return next;
                });
        LOGGER.info("Updated authority of user {} from feedback {} ({} levels)", outcome.userId(),
                outcome.feedbackId(), outcome.confirmed().size());
        return updated;
    }
}
