package ch.so.arp.rag.hybrid.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.InputValidationException;

class InMemoryVectorIndexTest {

    private final HybridFixture fixture = new HybridFixture();
    private final InMemoryVectorIndex index = new InMemoryVectorIndex(fixture.catalog);

    @Test
    void ranksByRescaledCosine() {
        List<VectorMatch> matches = index.search(HybridFixture.QUERY, 10, Set.of());

        assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("c1", "c2", "c3", "c4");
        assertThat(matches.get(0).score()).isCloseTo(1.0d, within(1.0e-9d));
        assertThat(matches.get(2).score()).isCloseTo(0.5d, within(1.0e-9d));
    }

    @Test
    void filtersByContentTypeAndLimits() {
        assertThat(index.search(HybridFixture.QUERY, 10, Set.of("commentary"))).extracting(VectorMatch::chunkId)
                .containsExactly("c3");
        assertThat(index.search(HybridFixture.QUERY, 2, null)).hasSize(2);
        assertThat(index.search(HybridFixture.QUERY, 0, null)).isEmpty();
    }

    @Test
    void zeroQueryScoresNeutral() {
        assertThat(index.search(new float[4], 10, null)).allSatisfy(match -> assertThat(match.score()).isEqualTo(0.5d));
    }

    @Test
    void rejectsWrongDimension() {
        assertThatThrownBy(() -> index.search(new float[2], 10, null)).isInstanceOf(InputValidationException.class);
    }
}
