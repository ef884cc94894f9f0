package ch.so.arp.rag.hybrid.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.parameter.ParameterChange;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.VersionedParameter;

class TemporalDecayManagerTest {

    private static final String DEFINES = ParameterKeys.traverse("literal", "defines");
    private static final String ALPHA = ParameterKeys.alpha("literal");

    private final HybridFixture fixture = new HybridFixture();
    private final TemporalDecayManager decayManager = new TemporalDecayManager(fixture.parameterStore,
            fixture.parameterWriter, 0.995d, Duration.ofDays(1));

    @Test
    void unreinforcedWeightsConvergeToTheirPrior() {
        fixture.parameterWriter.add(DEFINES, new double[] { -0.5d }, "f1");
        fixture.parameterWriter.add(ALPHA, new double[] { 0.1d }, "f1");

        for (int day = 1; day <= 200; day++) {
            decayManager.sweep(HybridFixture.NOW.plus(Duration.ofDays(day)));
        }
        // |θ - prior| shrinks by 0.995 per day
        assertThat(value(DEFINES)).isCloseTo(0.95d - 0.5d * Math.pow(0.995d, 200), within(1.0e-9d));

        for (int day = 201; day <= 1000; day++) {
            decayManager.sweep(HybridFixture.NOW.plus(Duration.ofDays(day)));
        }
        VersionedParameter defines = fixture.parameterStore.find(DEFINES).orElseThrow();
        assertThat(Math.abs(defines.value() - 0.95d)).isLessThan(0.01d);
        assertThat(defines.lastReinforcedAt()).isEqualTo(HybridFixture.NOW);
        assertThat(value(ALPHA)).isCloseTo(0.8d, within(1.0e-12d));
        assertThat(fixture.parameterStore.history(DEFINES)).extracting(ParameterChange::reason)
                .contains(ParameterChange.Reason.DECAY);
    }

    @Test
    void decayDoesNotDependOnTheSweepInterval() {
        double expected = 0.95d - 0.5d * Math.pow(0.995d, 10);

        fixture.parameterWriter.add(DEFINES, new double[] { -0.5d }, "f1");
        decayManager.sweep(HybridFixture.NOW.plus(Duration.ofDays(10)));
        double once = value(DEFINES);

        HybridFixture daily = new HybridFixture();
        TemporalDecayManager dailyManager = new TemporalDecayManager(daily.parameterStore, daily.parameterWriter,
                0.995d, Duration.ofDays(1));
        daily.parameterWriter.add(DEFINES, new double[] { -0.5d }, "f1");
        for (int day = 1; day <= 10; day++) {
            dailyManager.sweep(HybridFixture.NOW.plus(Duration.ofDays(day)));
        }

        HybridFixture hourly = new HybridFixture();
        TemporalDecayManager hourlyManager = new TemporalDecayManager(hourly.parameterStore, hourly.parameterWriter,
                0.995d, Duration.ofDays(1));
        hourly.parameterWriter.add(DEFINES, new double[] { -0.5d }, "f1");
        for (int hour = 1; hour <= 240; hour++) {
            hourlyManager.sweep(HybridFixture.NOW.plus(Duration.ofHours(hour)));
        }

        assertThat(once).isCloseTo(expected, within(1.0e-12d));
        assertThat(daily.parameterStore.find(DEFINES).orElseThrow().value()).isCloseTo(expected, within(1.0e-9d));
        assertThat(hourly.parameterStore.find(DEFINES).orElseThrow().value()).isCloseTo(expected, within(1.0e-9d));
    }

    @Test
    void recentlyReinforcedWeightsAreLeftAlone() {
        fixture.parameterWriter.add(DEFINES, new double[] { -0.5d }, "f1");

        DecayReport report = decayManager.sweep(HybridFixture.NOW.plus(Duration.ofHours(12)));

        assertThat(report.decayed()).isZero();
        assertThat(report.examined()).isEqualTo(4);
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().value()).isCloseTo(0.45d, within(1.0e-12d));
    }

    @Test
    void weightsAtTheirPriorProduceNoVersions() {
        DecayReport report = decayManager.sweep(Instant.parse("2026-03-01T00:00:00Z"));

        assertThat(report.decayed()).isZero();
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().version()).isZero();
    }

    @Test
    void singleSweepMovesTowardsPrior() {
        fixture.parameterWriter.add(DEFINES, new double[] { -0.5d }, "f1");

        DecayReport report = decayManager.sweep(HybridFixture.NOW.plus(Duration.ofDays(1)));

        assertThat(report.decayed()).isEqualTo(1);
        double expected = 0.995d * 0.45d + 0.005d * 0.95d;
        assertThat(fixture.parameterStore.find(DEFINES).orElseThrow().value()).isCloseTo(expected, within(1.0e-12d));
    }

    private double value(String key) {
        return fixture.parameterStore.find(key).orElseThrow().value();
    }
}
