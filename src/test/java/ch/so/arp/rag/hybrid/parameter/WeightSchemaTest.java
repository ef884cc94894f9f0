package ch.so.arp.rag.hybrid.parameter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class WeightSchemaTest {

    private static final Instant NOW = Instant.parse("2026-01-05T08:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final WeightSchema schema = new WeightSchema(List.of(
            new Strategy("literal", Map.of("defines", 0.95d), 0.5d, Set.of("defines", "refers_to"), 0.7d, 0.4d),
            new Strategy("temporal", Map.of("amends", 0.9d), 0.5d, Set.of(), 0.6d, 0.1d)),
            0.3d, 0.9d, 3);

    @Test
    void bootstrapCreatesEveryParameterFromItsPrior() {
        InMemoryParameterStore store = new InMemoryParameterStore(clock);

        int created = schema.bootstrap(store, clock);

        ParameterSnapshot snapshot = store.snapshot();
        assertThat(snapshot.parameters()).containsOnlyKeys("traverse/literal/defines", "traverse/literal/refers_to",
                "traverse/temporal/amends", "alpha/literal", "alpha/temporal", ParameterKeys.GATING,
                ParameterKeys.RERANK);
        assertThat(created).isEqualTo(7);
        assertThat(snapshot.scalar("traverse/literal/refers_to", -1.0d)).isEqualTo(0.5d);
        assertThat(snapshot.values(ParameterKeys.GATING))
                .containsExactly(0.5d, 0.5d, 0.5d, 0.4d, 0.5d, 0.5d, 0.5d, 0.1d);
        assertThat(snapshot.values(ParameterKeys.RERANK)).containsExactly(WeightSchema.RERANK_PRIORS);
    }

    @Test
    void bootstrapKeepsLearnedValues() {
        InMemoryParameterStore store = new InMemoryParameterStore(clock);
        schema.bootstrap(store, clock);
        VersionedParameter alpha = store.find("alpha/literal").orElseThrow();
        store.compareAndSet(0L, alpha.next(new double[] { 0.85d }, NOW, true), ParameterChange.Reason.FEEDBACK, "f");

        int created = schema.bootstrap(store, clock);

        assertThat(created).isZero();
        assertThat(store.find("alpha/literal").orElseThrow().value()).isEqualTo(0.85d);
    }

    @Test
    void bootstrapRejectsMismatchingMatrix() {
        InMemoryParameterStore store = new InMemoryParameterStore(clock);
        store.initializeIfAbsent(VersionedParameter.initial(ParameterKeys.GATING, new double[] { 0.5d, 0.5d }, 0.0d,
                1.0d, NOW));

        assertThatThrownBy(() -> schema.bootstrap(store, clock)).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ParameterKeys.GATING);
    }

    @Test
    void rejectsDuplicateStrategies() {
        Strategy literal = new Strategy("literal", Map.of(), 0.5d, Set.of(), 0.7d, 0.25d);

        assertThatThrownBy(() -> new WeightSchema(List.of(literal, literal), 0.3d, 0.9d, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void disallowedRelationsAreNotTraversed() {
        Strategy literal = schema.find("literal").orElseThrow();

        assertThat(literal.allows("defines")).isTrue();
        assertThat(literal.allows("amends")).isFalse();
        assertThat(literal.priorFor("refers_to")).isEqualTo(0.5d);
        assertThat(schema.indexOf("temporal")).isEqualTo(1);
        assertThat(schema.indexOf("missing")).isEqualTo(-1);
    }
}
