package ch.so.arp.rag.hybrid.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.authority.AuthorityScore;
import ch.so.arp.rag.hybrid.authority.FeedbackLevel;
import ch.so.arp.rag.hybrid.learning.LearningSettings;
import ch.so.arp.rag.hybrid.learning.PolicyGradientUpdater;
import ch.so.arp.rag.hybrid.learning.RewardBaseline;
import ch.so.arp.rag.hybrid.parameter.ParameterChange;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.ParameterSnapshot;
import ch.so.arp.rag.hybrid.parameter.ParameterStore;
import ch.so.arp.rag.hybrid.parameter.ParameterWriter;
import ch.so.arp.rag.hybrid.parameter.VersionedParameter;
import ch.so.arp.rag.hybrid.retrieval.RetrievalQuery;
import ch.so.arp.rag.hybrid.retrieval.RetrievalResult;

class FeedbackServiceTest {

    private static final String DEFINES = ParameterKeys.traverse("literal", "defines");

    private final HybridFixture fixture = new HybridFixture();
    private final FeedbackService service = fixture.feedbackService();
    private final RetrievalResult result = fixture.retrievalService()
            .retrieve(RetrievalQuery.of(HybridFixture.QUERY, List.of("n1"), "civil", 4));

    @Test
    void acceptedFeedbackUpdatesParameters() {
        FeedbackAck ack = service.ingest(positive("f1"));

        assertThat(ack.status()).isEqualTo(FeedbackAck.Status.ACCEPTED);
        assertThat(ack.rewards().retrieval()).isEqualTo(1.0d);
        assertThat(ack.judgedLevels()).containsExactly(FeedbackLevel.RETRIEVAL);
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().value()).isGreaterThan(0.95d);
        List<ParameterChange> history = fixture.parameterStore.history(DEFINES);
        assertThat(history.get(history.size() - 1).feedbackId()).isEqualTo("f1");
    }

    @Test
    void duplicateFeedbackIsAcknowledgedOnce() {
        service.ingest(positive("f1"));
        int versions = fixture.parameterStore.history(DEFINES).size();
        double weight = fixture.parameterStore.find(DEFINES).orElseThrow().value();

        FeedbackAck again = service.ingest(positive("f1"));

        assertThat(again.status()).isEqualTo(FeedbackAck.Status.DUPLICATE);
        assertThat(again.rewards()).isNull();
        assertThat(fixture.parameterStore.history(DEFINES)).hasSize(versions);
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().value()).isEqualTo(weight);
    }

    @Test
    void rejectsFeedbackThatDoesNotMatchTheTrace() {
        assertThatThrownBy(() -> service.ingest(new FeedbackEvent("f1", "unknown-trace", "u1", null,
                new RetrievalJudgment(1.0d, 1.0d, 1.0d), null, null)))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> service.ingest(new FeedbackEvent("f1", result.traceId(), " ", null,
                new RetrievalJudgment(1.0d, 1.0d, 1.0d), null, null)))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> service.ingest(new FeedbackEvent("f1", result.traceId(), "u1", null,
                new RetrievalJudgment(1.5d, 1.0d, 1.0d), null, null)))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> service.ingest(new FeedbackEvent("f1", result.traceId(), "u1", null, null,
                new ReasoningJudgment(Map.of("teleological", 1.0d), 1.0d, null), null)))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> service.ingest(new FeedbackEvent("f1", result.traceId(), "u1", null, null, null,
                new SynthesisJudgment(1.0d, 1.0d, "c-never-shown"))))
                .isInstanceOf(InputValidationException.class);

        // rejected events are not remembered
        assertThat(service.ingest(positive("f1")).status()).isEqualTo(FeedbackAck.Status.ACCEPTED);
    }

    @Test
    void validationUpdatesAuthorityOnce() {
        service.ingest(positive("f1"));

        service.validate("f1", Map.of(FeedbackLevel.RETRIEVAL, true)).join();

        AuthorityScore score = fixture.authorityCalculator.describe("u1", FeedbackLevel.RETRIEVAL, "civil");
        assertThat(score.source()).isEqualTo("DOMAIN");
        assertThat(score.validated()).isEqualTo(1L);
        assertThat(score.authority()).isGreaterThan(0.5d);
        assertThatThrownBy(() -> service.validate("f1", Map.of(FeedbackLevel.RETRIEVAL, true)))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> service.validate("f-unknown", Map.of(FeedbackLevel.RETRIEVAL, true)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void validationRejectsMissingVerdicts() {
        service.ingest(positive("f1"));
        Map<FeedbackLevel, Boolean> confirmed = new HashMap<>();
        confirmed.put(FeedbackLevel.RETRIEVAL, null);

        assertThatThrownBy(() -> service.validate("f1", confirmed)).isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> service.validate("f1", Map.of())).isInstanceOf(InputValidationException.class);
        assertThat(service.validate("f1", Map.copyOf(Map.of(FeedbackLevel.RETRIEVAL, false))).join().userId())
                .isEqualTo("u1");
    }

    @Test
    void failedUpdateResumesOnResendWithoutCountingTwice() {
        RewardBaseline baseline = new RewardBaseline(100);
        FeedbackService flaky = serviceOver(new ConflictingStore(fixture.parameterStore, ParameterKeys.RERANK, 5),
                baseline, fixture.directExecutor, false);

        assertThatThrownBy(() -> flaky.ingest(everyLevel("f1"))).isInstanceOf(ConcurrencyConflictException.class);
        assertThat(changesFrom("f1", ParameterKeys.GATING)).isEqualTo(1);
        assertThat(changesFrom("f1", ParameterKeys.RERANK)).isZero();
        double linkWeight = fixture.bridgeIndex.getNodesForChunk("c2").get(0).weight();

        FeedbackAck resent = flaky.ingest(everyLevel("f1"));

        assertThat(resent.status()).isEqualTo(FeedbackAck.Status.RESUMED);
        assertThat(changesFrom("f1", ParameterKeys.GATING)).isEqualTo(1);
        assertThat(changesFrom("f1", DEFINES)).isEqualTo(1);
        assertThat(changesFrom("f1", ParameterKeys.RERANK)).isEqualTo(1);
        assertThat(fixture.bridgeIndex.getNodesForChunk("c2").get(0).weight()).isEqualTo(linkWeight);
        assertThat(flaky.ingest(everyLevel("f1")).status()).isEqualTo(FeedbackAck.Status.DUPLICATE);

        // rewards 1.0 (f1) and 0.0 (f2), each sampled once
        flaky.ingest(new FeedbackEvent("f2", result.traceId(), "u1", null, new RetrievalJudgment(0.0d, 0.0d, 0.0d),
                null, null));
        assertThat(baseline.current(FeedbackLevel.RETRIEVAL)).isCloseTo(0.5d, within(1.0e-12d));
    }

    @Test
    void queuedUpdateIsRequeuedAfterConflicts() {
        List<Runnable> queued = new ArrayList<>();
        FeedbackService async = serviceOver(new ConflictingStore(fixture.parameterStore, ParameterKeys.RERANK, 5),
                new RewardBaseline(100), queued::add, true);

        assertThat(async.ingest(everyLevel("f1")).status()).isEqualTo(FeedbackAck.Status.ACCEPTED);

        assertThat(drain(queued)).isEqualTo(2);
        assertThat(changesFrom("f1", ParameterKeys.GATING)).isEqualTo(1);
        assertThat(changesFrom("f1", ParameterKeys.RERANK)).isEqualTo(1);
        assertThat(async.ingest(everyLevel("f1")).status()).isEqualTo(FeedbackAck.Status.DUPLICATE);
    }

    @Test
    void queuedUpdateThatKeepsConflictingResumesOnResend() {
        List<Runnable> queued = new ArrayList<>();
        FeedbackService async = serviceOver(new ConflictingStore(fixture.parameterStore, ParameterKeys.RERANK, 15),
                new RewardBaseline(100), queued::add, true);
        async.ingest(everyLevel("f1"));

        assertThat(drain(queued)).isEqualTo(3);
        assertThat(changesFrom("f1", ParameterKeys.RERANK)).isZero();

        assertThat(async.ingest(everyLevel("f1")).status()).isEqualTo(FeedbackAck.Status.RESUMED);
        assertThat(drain(queued)).isEqualTo(1);
        assertThat(changesFrom("f1", ParameterKeys.GATING)).isEqualTo(1);
        assertThat(changesFrom("f1", ParameterKeys.RERANK)).isEqualTo(1);
    }

    @Test
    void queuedUpdatesRunOnTheUpdateExecutor() {
        List<Runnable> queued = new ArrayList<>();
        FeedbackService async = new FeedbackService(fixture.traceRepository, fixture.schema,
                new RewardDecomposer(fixture.schema), fixture.updater(), fixture.authorityCalculator, queued::add,
                true, Duration.ofDays(1), 100L, fixture.clock);

        FeedbackAck ack = async.ingest(positive("f1"));

        assertThat(ack.status()).isEqualTo(FeedbackAck.Status.ACCEPTED);
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().version()).isZero();
        queued.forEach(Runnable::run);
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().version()).isEqualTo(1L);
    }

    private FeedbackService serviceOver(ParameterStore store, RewardBaseline baseline, Executor executor,
            boolean async) {
        ParameterWriter writer = new ParameterWriter(store, fixture.retrier, fixture.clock);
        PolicyGradientUpdater updater = new PolicyGradientUpdater(fixture.schema, store, writer, fixture.bridgeIndex,
                fixture.gatingNetwork, fixture.rerankModel, fixture.authorityCalculator, baseline,
                new LearningSettings(0.01d, 0.1d, 0.5d));
        return new FeedbackService(fixture.traceRepository, fixture.schema, new RewardDecomposer(fixture.schema),
                updater, fixture.authorityCalculator, executor, async, Duration.ofDays(1), 100L, fixture.clock);
    }

    private long changesFrom(String feedbackId, String key) {
        return fixture.parameterStore.history(key).stream()
                .filter(change -> feedbackId.equals(change.feedbackId()))
                .count();
    }

    private static int drain(List<Runnable> queued) {
        int runs = 0;
        while (!queued.isEmpty()) {
            queued.remove(0).run();
            runs++;
        }
        return runs;
    }

    private FeedbackEvent everyLevel(String id) {
        return new FeedbackEvent(id, result.traceId(), "u1", null, new RetrievalJudgment(1.0d, 1.0d, 1.0d),
                new ReasoningJudgment(Map.of("literal", 0.0d, "systemic", 1.0d), 1.0d, "systemic"),
                new SynthesisJudgment(1.0d, 1.0d, "c2"));
    }

    private FeedbackEvent positive(String id) {
        return new FeedbackEvent(id, result.traceId(), "u1", null, new RetrievalJudgment(1.0d, 1.0d, 1.0d), null,
                null);
    }

    /**
     * Store whose compare-and-set on one key loses a given number of times.
     */
    private static final class ConflictingStore implements ParameterStore {

        private final ParameterStore delegate;
        private final String conflictingKey;
        private final AtomicInteger conflicts;

        ConflictingStore(ParameterStore delegate, String conflictingKey, int conflicts) {
            this.delegate = delegate;
            this.conflictingKey = conflictingKey;
            this.conflicts = new AtomicInteger(conflicts);
        }

        @Override
        public boolean initializeIfAbsent(VersionedParameter initial) {
            return delegate.initializeIfAbsent(initial);
        }

        @Override
        public Optional<VersionedParameter> find(String key) {
            return delegate.find(key);
        }

        @Override
        public VersionedParameter compareAndSet(long expectedVersion, VersionedParameter next,
                ParameterChange.Reason reason, String feedbackId) {
            if (next.key().equals(conflictingKey) && conflicts.getAndDecrement() > 0) {
                throw new ConcurrencyConflictException(conflictingKey, expectedVersion, expectedVersion + 1);
            }
            return delegate.compareAndSet(expectedVersion, next, reason, feedbackId);
        }

        @Override
        public ParameterSnapshot snapshot() {
            return delegate.snapshot();
        }

        @Override
        public List<ParameterChange> history(String key) {
            return delegate.history(key);
        }
    }
}
