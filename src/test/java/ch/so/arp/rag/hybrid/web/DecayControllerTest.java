package ch.so.arp.rag.hybrid.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.learning.TemporalDecayManager;

class DecayControllerTest {

    private final HybridFixture fixture = new HybridFixture();
    private final TemporalDecayManager decayManager = new TemporalDecayManager(fixture.parameterStore,
            fixture.parameterWriter, 0.995d, Duration.ofDays(1));

    @Test
    void sweepWithinGracePeriodLeavesWeightsAlone() throws Exception {
        MockMvc mockMvc = WebTestSupport.mockMvc(new DecayController(decayManager, fixture.clock));

        mockMvc.perform(post("/api/decay/sweep"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.examined").value(4))
                .andExpect(jsonPath("$.decayed").value(0));
    }

    @Test
    void sweepAfterReinforcementLapseDecaysLearnedWeights() throws Exception {
        fixture.parameterWriter.add("traverse/literal/defines", new double[] { -0.2d }, "f1");
        Clock later = Clock.fixed(HybridFixture.NOW.plus(Duration.ofDays(10)), ZoneOffset.UTC);
        MockMvc mockMvc = WebTestSupport.mockMvc(new DecayController(decayManager, later));

        mockMvc.perform(post("/api/decay/sweep"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.examined").value(4))
                .andExpect(jsonPath("$.decayed").value(1));
    }
}
