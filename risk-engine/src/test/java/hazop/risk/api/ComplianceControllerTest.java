package hazop.risk.api;

import hazop.risk.access.ProjectAccessPolicy;
import hazop.risk.domain.RiskEntry;
import hazop.risk.error.ForbiddenException;
import hazop.risk.store.AnalysisRecord;
import hazop.risk.store.InMemoryRiskRecordStore;
import hazop.risk.store.ProjectRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ComplianceControllerTest {
    private static final UUID PROJECT = UUID.fromString("6f1c2d3e-4a5b-4c6d-8e7f-001122334455");
    private static final UUID ANALYSIS = UUID.fromString("6f1c2d3e-4a5b-4c6d-8e7f-001122334466");

    @TestConfiguration
    static class DenyingAccessConfig {
        @Bean
        @Primary
        ProjectAccessPolicy denyingAccessPolicy() {
            return (userId, projectId) -> {
                if ("outsider".equals(userId)) {
                    throw new ForbiddenException("You do not have access to this project");
                }
            };
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InMemoryRiskRecordStore store;

    @BeforeEach
    void setUp() {
        store.clear();
        store.putProject(new ProjectRecord(PROJECT, "Hydrocracker"));
        store.putAnalysis(new AnalysisRecord(ANALYSIS, PROJECT, "Reactor loop", "in_review"));
        store.addEntry(ANALYSIS, new RiskEntry("e1", ANALYSIS.toString(), "n1", "more", "temperature",
                "more temperature", List.of("Quench failure"), List.of("Runaway reaction"),
                List.of("TAHH-301"), List.of("Review quench valve testing"), 3, 2, null));
    }

    @Test
    void shouldReturnAnalysisCompliance() throws Exception {
        mockMvc.perform(get("/analyses/{id}/compliance", ANALYSIS).param("standards", "IEC_61511,ISO_31000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.analysisId").value(ANALYSIS.toString()))
                .andExpect(jsonPath("$.data.hasLOPA").value(false))
                .andExpect(jsonPath("$.data.summaries", hasSize(2)))
                .andExpect(jsonPath("$.data.summaries[0].standardId").value("IEC_61511"))
                .andExpect(jsonPath("$.data.summaries[0].gaps").isArray());
    }

    @Test
    void shouldRejectMalformedAnalysisId() throws Exception {
        mockMvc.perform(get("/analyses/not-a-uuid/compliance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Invalid analysis ID format"));
    }

    @Test
    void shouldListInvalidStandards() throws Exception {
        mockMvc.perform(get("/projects/{id}/compliance", PROJECT).param("standards", "IEC_61511,BOGUS"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.errors[0].field").value("standards"))
                .andExpect(jsonPath("$.error.errors[0].message", containsString("BOGUS")));
    }

    @Test
    void shouldReturnNotFoundForUnknownProject() throws Exception {
        mockMvc.perform(get("/projects/{id}/compliance", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.message").value("Project not found"));
    }

    @Test
    void shouldForbidUserWithoutAccess() throws Exception {
        mockMvc.perform(get("/projects/{id}/compliance", PROJECT).header("X-User-Id", "outsider"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.error.message", containsString("do not have access")));
    }

    @Test
    void shouldReturnProjectCompliance() throws Exception {
        mockMvc.perform(get("/projects/{id}/compliance", PROJECT).header("X-User-Id", "engineer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.analysisCount").value(1))
                .andExpect(jsonPath("$.data.summaries", hasSize(8)));
    }

    @Test
    void shouldListStandards() throws Exception {
        mockMvc.perform(get("/standards"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(8)))
                .andExpect(jsonPath("$.data[0].id").value("IEC_61511"))
                .andExpect(jsonPath("$.data[0].clauseCount").value(12));
    }
}
