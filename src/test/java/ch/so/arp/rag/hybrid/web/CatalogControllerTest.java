package ch.so.arp.rag.hybrid.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import ch.so.arp.rag.hybrid.HybridFixture;

class CatalogControllerTest {

    private final HybridFixture fixture = new HybridFixture();
    private final MockMvc mockMvc = WebTestSupport.mockMvc(new CatalogController(fixture.catalog,
            fixture.bridgeIndex));

    @Test
    void ingestsChunksNodesAndMappings() throws Exception {
        mockMvc.perform(post("/api/catalog/chunks").contentType(MediaType.APPLICATION_JSON).content("""
                {"id":"c5","embedding":[0,0,0,1],"contentType":"ruling"}
                """))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/catalog/nodes").contentType(MediaType.APPLICATION_JSON).content("""
                {"id":"n5","type":"ruling","relationships":[{"relationType":"refers_to","targetId":"n1"}]}
                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.relationships[0].targetId").value("n1"));
        mockMvc.perform(post("/api/catalog/mappings").contentType(MediaType.APPLICATION_JSON).content("""
                {"chunkId":"c5","nodeId":"n5","relationType":"mentions"}
                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weight").value(0.5))
                .andExpect(jsonPath("$.confidence").value(1.0));

        assertThat(fixture.catalog.inboundRelationships("n1")).hasSize(1);
        mockMvc.perform(get("/api/catalog/chunks/c5/mappings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].nodeId").value("n5"));
        mockMvc.perform(get("/api/catalog/nodes/n1/mappings").param("relationType", "mentions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].chunkId").value("c1"));
    }

    @Test
    void rejectsInvalidIngestion() throws Exception {
        mockMvc.perform(post("/api/catalog/chunks").contentType(MediaType.APPLICATION_JSON).content("""
                {"id":"c6","embedding":[1,0],"contentType":"norm"}
                """))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/catalog/mappings").contentType(MediaType.APPLICATION_JSON).content("""
                {"chunkId":"c1","nodeId":"n404","relationType":"mentions"}
                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("dangling_reference"));
        mockMvc.perform(post("/api/catalog/mappings").contentType(MediaType.APPLICATION_JSON).content("""
                {"chunkId":"c1","nodeId":"n1","relationType":"mentions","initialWeight":2}
                """))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/catalog/chunks/c404/mappings"))
                .andExpect(status().isUnprocessableEntity());
    }
}
