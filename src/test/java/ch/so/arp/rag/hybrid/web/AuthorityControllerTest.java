package ch.so.arp.rag.hybrid.web;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import ch.so.arp.rag.hybrid.HybridFixture;

class AuthorityControllerTest {

    private final HybridFixture fixture = new HybridFixture();
    private final MockMvc mockMvc = WebTestSupport.mockMvc(new AuthorityController(fixture.authorityCalculator));

    @Test
    void registersBaselineAndReportsAuthority() throws Exception {
        mockMvc.perform(put("/api/authority/u1/baseline").contentType(MediaType.APPLICATION_JSON).content("""
                {"baselineCredential":1.0}
                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baselineCredential").value(1.0));

        mockMvc.perform(get("/api/authority/u1").param("level", "SYNTHESIS").param("domain", "civil"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authority", closeTo(0.65d, 1e-9)))
                .andExpect(jsonPath("$.source").value("LEVEL"));
        mockMvc.perform(get("/api/authority/stranger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value("RETRIEVAL"))
                .andExpect(jsonPath("$.source").value("PRIOR"));
    }

    @Test
    void rejectsInvalidBaseline() throws Exception {
        mockMvc.perform(put("/api/authority/u1/baseline").contentType(MediaType.APPLICATION_JSON).content("""
                {"baselineCredential":1.5}
                """))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/authority/u1").param("level", "SPELLING"))
                .andExpect(status().isBadRequest());
    }
}
