package ch.so.arp.rag.hybrid.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.hybrid.NotFoundException;

class TraceRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-05T08:00:00Z");

    private final TraceRepository repository = new TraceRepository(Duration.ofHours(1), 10L);

    @Test
    void appendsIterationsInOrder() {
        repository.save(new RetrievalTrace("t1", "civil", NOW, List.of(iteration(0))));

        RetrievalTrace updated = repository.append("t1", trace -> iteration(trace.iterations().size()));

        assertThat(updated.iterations()).extracting(TraceIteration::iteration).containsExactly(0, 1);
        assertThat(repository.find("t1").orElseThrow().latest().iteration()).isEqualTo(1);
    }

    @Test
    void unknownTraceCannotBeExtended() {
        assertThatThrownBy(() -> repository.append("missing", trace -> iteration(1)))
                .isInstanceOf(NotFoundException.class);
        assertThat(repository.find(null)).isEmpty();
    }

    private static TraceIteration iteration(int index) {
        return new TraceIteration(index, NOW, new float[] { 1f, 0f }, List.of("n1"), 3, Set.of(),
                new double[] { 1.0d }, Map.of(), List.of(), Map.of());
    }
}
