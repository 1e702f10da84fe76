package com.ecoscore.impact;

import com.ecoscore.impact.engine.FactorTables;
import com.ecoscore.impact.engine.MaterialScorer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EcoScoreApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ApplicationContext context;

    @Test
    void factorTablesAreASingleSharedInstance() {
        assertSame(context.getBean(FactorTables.class), context.getBean(FactorTables.class));
        assertNotNull(context.getBean(MaterialScorer.class));
        assertTrue(context.getBeansOfType(DemoRunner.class).isEmpty());
    }

    @Test
    void assessImpactThroughFullStack() throws Exception {
        mvc.perform(post("/v1/assess-impact")
                        .header("X-API-Key", "second-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"product_name": "Steel Water Bottle",
                                 "material_composition": {"steel": 0.9, "rubber": 0.1},
                                 "weight_kg": 0.4, "origin_country": "Poland", "destination_country": "Germany"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.product_name").value("Steel Water Bottle"))
                .andExpect(jsonPath("$.cbam_relevant").value(true))
                .andExpect(jsonPath("$.breakdown.logistics_score").value(90.0));
    }

    @Test
    void keyIsRequiredOnlyForAssessment() throws Exception {
        mvc.perform(post("/v1/assess-impact")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/v1/methodology")).andExpect(status().isOk());
        mvc.perform(get("/health")).andExpect(status().isOk());
    }
}
