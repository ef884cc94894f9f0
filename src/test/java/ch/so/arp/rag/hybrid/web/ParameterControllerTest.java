package ch.so.arp.rag.hybrid.web;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.HybridFixture;
import ch.so.arp.rag.hybrid.parameter.ParameterWriter;

class ParameterControllerTest {

    private final HybridFixture fixture = new HybridFixture();
    private final MockMvc mockMvc = WebTestSupport.mockMvc(
            new ParameterController(fixture.parameterStore, fixture.parameterWriter));

    @Test
    void listsCurrentParameters() throws Exception {
        mockMvc.perform(get("/api/parameters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parameters['alpha/literal'].values[0]").value(0.7))
                .andExpect(jsonPath("$.parameters['alpha/literal'].version").value(0))
                .andExpect(jsonPath("$.parameters.rerank.values.length()").value(4));
    }

    @Test
    void showsHistoryAndRollsBack() throws Exception {
        fixture.parameterWriter.add("alpha/literal", new double[] { 0.1d }, "f1");

        mockMvc.perform(get("/api/parameters/history").param("key", "alpha/literal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].reason").value("FEEDBACK"))
                .andExpect(jsonPath("$[1].feedbackId").value("f1"));
        mockMvc.perform(post("/api/parameters/rollback").param("key", "alpha/literal").param("version", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.values[0]").value(0.7));
    }

    @Test
    void unknownKeysAreNotFound() throws Exception {
        mockMvc.perform(get("/api/parameters/history").param("key", "alpha/ghost"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/parameters/rollback").param("key", "alpha/literal").param("version", "9"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/parameters/rollback").param("key", "alpha/literal").param("version", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exhaustedConflictsAreReported() throws Exception {
        ParameterWriter writer = mock(ParameterWriter.class);
        when(writer.rollback(eq("alpha/literal"), anyLong()))
                .thenThrow(new ConcurrencyConflictException("alpha/literal", 3L, 4L));
        MockMvc conflicted = WebTestSupport.mockMvc(new ParameterController(fixture.parameterStore, writer));

        conflicted.perform(post("/api/parameters/rollback").param("key", "alpha/literal").param("version", "0"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"));
    }
}
