package ch.so.arp.rag.hybrid.gating;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.parameter.ParameterChange;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.ParameterSnapshot;

class GatingNetworkTest {

    private final HybridFixture fixture = new HybridFixture();

    @Test
    void forwardReturnsProbabilityDistribution() {
        // strategy 0 reacts to the first dimension, strategy 1 to the second
        fixture.parameterWriter.apply(ParameterKeys.GATING,
                current -> new double[] { 1.0d, 0.0d, 0.0d, 0.0d, 0.2d, 0.0d, 1.0d, 0.0d, 0.0d, 0.2d },
                ParameterChange.Reason.FEEDBACK, "f", true);
        ParameterSnapshot snapshot = fixture.parameterStore.snapshot();
        Random random = new Random(7);

        for (int i = 0; i < 50; i++) {
            float[] embedding = new float[HybridFixture.DIMENSIONS];
            for (int d = 0; d < embedding.length; d++) {
                embedding[d] = (float) (random.nextGaussian() * 10);
            }
            double[] gate = fixture.gatingNetwork.forward(snapshot, embedding);

            assertThat(gate).hasSize(2);
            assertThat(Arrays.stream(gate).sum()).isCloseTo(1.0d, within(1.0e-9d));
            assertThat(gate).allSatisfy(p -> assertThat(p).isBetween(0.0d, 1.0d));
        }
        double[] literalQuery = fixture.gatingNetwork.forward(snapshot, new float[] { 1f, 0f, 0f, 0f });
        assertThat(literalQuery[0]).isGreaterThan(literalQuery[1]);
    }

    @Test
    void zeroEmbeddingFallsBackToUniformGate() {
        double[] gate = fixture.gatingNetwork.forward(fixture.parameterStore.snapshot(), new float[4]);

        assertThat(gate).containsExactly(0.5d, 0.5d);
    }

    @Test
    void equalPriorsGiveUniformGate() {
        double[] gate = fixture.gatingNetwork.forward(fixture.parameterStore.snapshot(), HybridFixture.QUERY);

        assertThat(gate[0]).isCloseTo(0.5d, within(1.0e-12d));
        assertThat(gate[1]).isCloseTo(0.5d, within(1.0e-12d));
    }

    @Test
    void rejectsWrongDimension() {
        assertThatThrownBy(() -> fixture.gatingNetwork.forward(fixture.parameterStore.snapshot(), new float[3]))
                .isInstanceOf(InputValidationException.class);
    }

    @Test
    void gradientRaisesTheChosenStrategy() {
        double[] gradient = fixture.gatingNetwork.logProbabilityGradient(HybridFixture.QUERY,
                new double[] { 0.5d, 0.5d }, 1);

        // bias column of each row sits at index D
        assertThat(gradient[HybridFixture.DIMENSIONS]).isCloseTo(-2.0d, within(1.0e-12d));
        assertThat(gradient[2 * HybridFixture.DIMENSIONS + 1]).isCloseTo(2.0d, within(1.0e-12d));
        assertThat(gradient[HybridFixture.DIMENSIONS + 1]).isCloseTo(2.0d, within(1.0e-12d));
    }

    @Test
    void softmaxIsStableForLargeLogits() {
        double[] probabilities = GatingNetwork.softmax(new double[] { 1000.0d, 999.0d });

        assertThat(probabilities[0] + probabilities[1]).isCloseTo(1.0d, within(1.0e-12d));
        assertThat(probabilities[0]).isGreaterThan(probabilities[1]);
        assertThat(GatingNetwork.softmax(new double[] { Double.NaN, 1.0d })).containsExactly(0.5d, 0.5d);
    }
}
