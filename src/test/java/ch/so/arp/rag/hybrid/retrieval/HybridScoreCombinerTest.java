package ch.so.arp.rag.hybrid.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.parameter.Strategy;

class HybridScoreCombinerTest {

    private final HybridFixture fixture = new HybridFixture();
    private final List<VectorMatch> matches = List.of(
            new VectorMatch("c1", "norm", 1.0d),
            new VectorMatch("c3", "commentary", 0.5d),
            new VectorMatch("c4", "norm", 0.5d));

    @Test
    void directlyLinkedAnchorChunkGetsFullGraphScore() {
        Strategy literal = fixture.schema.find("literal").orElseThrow();
        Map<String, GraphPath> nodeScores = fixture.graphScorer.score(List.of("n1"), literal,
                fixture.parameterStore.snapshot());

        List<ScoredCandidate> candidates = fixture.combiner.combine(matches, nodeScores, true, 0.7d);

        ScoredCandidate top = candidates.get(0);
        assertThat(top.chunkId()).isEqualTo("c1");
        assertThat(top.graphScore()).isEqualTo(1.0d);
        assertThat(top.finalScore()).isCloseTo(1.0d, within(1.0e-12d));
        assertThat(top.link().nodeId()).isEqualTo("n1");
        assertThat(top.path().hops()).isZero();
    }

    @Test
    void linkedChunkWithoutPathScoresZeroGraph() {
        Strategy literal = fixture.schema.find("literal").orElseThrow();
        Map<String, GraphPath> nodeScores = fixture.graphScorer.score(List.of("n1"), literal,
                fixture.parameterStore.snapshot());

        List<ScoredCandidate> candidates = fixture.combiner.combine(matches, nodeScores, true, 0.7d);

        ScoredCandidate commentary = candidates.stream().filter(c -> c.chunkId().equals("c3")).findFirst()
                .orElseThrow();
        assertThat(commentary.linked()).isTrue();
        assertThat(commentary.graphScore()).isZero();
        assertThat(commentary.link()).isNull();
        assertThat(commentary.finalScore()).isCloseTo(0.35d, within(1.0e-12d));
    }

    @Test
    void unlinkedOrUnanchoredChunksUseNeutralGraphScore() {
        List<ScoredCandidate> unanchored = fixture.combiner.combine(matches, Map.of(), false, 0.7d);

        assertThat(unanchored).allSatisfy(candidate -> {
            assertThat(candidate.linked()).isFalse();
            assertThat(candidate.graphScore()).isEqualTo(0.5d);
        });
        assertThat(unanchored).extracting(ScoredCandidate::chunkId).containsExactly("c1", "c3", "c4");
        assertThat(unanchored.get(0).finalScore()).isCloseTo(0.85d, within(1.0e-12d));
    }
}
