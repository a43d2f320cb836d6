package com.phillippitts.autorecovery.presentation.controller;

import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStatistics;
import com.phillippitts.autorecovery.domain.RecoveryStep;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.RecoveryManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RecoveryController.class)
class RecoveryControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private RecoveryManager manager;

    @Test
    void listsServices() throws Exception {
        when(manager.getServiceHealth()).thenReturn(Map.of("cache", health("cache", ServiceStatus.DEGRADED)));

        mvc.perform(get("/api/recovery/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cache.status").value("DEGRADED"));
    }

    @Test
    void unknownServiceIs404() throws Exception {
        when(manager.getServiceHealth("ghost")).thenReturn(Optional.empty());

        mvc.perform(get("/api/recovery/services/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details").value("Service not found: ghost"));
    }

    @Test
    void triggerReturnsAcceptedWithExecutionId() throws Exception {
        when(manager.getServiceHealth("cache")).thenReturn(Optional.of(health("cache", ServiceStatus.UNHEALTHY)));
        when(manager.triggerRecovery("cache", "operator", RecoveryStrategy.DEGRADE)).thenReturn(Optional.of("e-1"));

        mvc.perform(post("/api/recovery/services/cache/recover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cause\":\"operator\",\"strategy\":\"DEGRADE\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.executionId").value("e-1"));
    }

    @Test
    void triggerWithoutBodyUsesApiCause() throws Exception {
        when(manager.getServiceHealth("cache")).thenReturn(Optional.of(health("cache", ServiceStatus.FAILED)));
        when(manager.triggerRecovery("cache", "api", null)).thenReturn(Optional.of("e-2"));

        mvc.perform(post("/api/recovery/services/cache/recover"))
                .andExpect(status().isAccepted());

        verify(manager).triggerRecovery("cache", "api", null);
    }

    @Test
    void triggerWithoutPlanIsConflict() throws Exception {
        when(manager.getServiceHealth("cache")).thenReturn(Optional.of(health("cache", ServiceStatus.FAILED)));
        when(manager.triggerRecovery(anyString(), anyString(), any())).thenReturn(Optional.empty());

        mvc.perform(post("/api/recovery/services/cache/recover"))
                .andExpect(status().isConflict());
    }

    @Test
    void forceStatusRequiresStatus() throws Exception {
        mvc.perform(put("/api/recovery/services/cache/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void forceStatusReturnsUpdatedHealth() throws Exception {
        when(manager.forceServiceStatus("cache", ServiceStatus.HEALTHY)).thenReturn(true);
        when(manager.getServiceHealth("cache")).thenReturn(Optional.of(health("cache", ServiceStatus.HEALTHY)));

        mvc.perform(put("/api/recovery/services/cache/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"HEALTHY\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("HEALTHY"));
    }

    @Test
    void cancellingFinishedExecutionIsConflict() throws Exception {
        when(manager.getRecoveryExecution("e-1")).thenReturn(Optional.of(execution("e-1")));
        when(manager.cancelRecovery("e-1")).thenReturn(false);

        mvc.perform(post("/api/recovery/executions/e-1/cancel"))
                .andExpect(status().isConflict());
    }

    @Test
    void activeFlagSelectsActiveExecutions() throws Exception {
        when(manager.getActiveRecoveries()).thenReturn(Map.of("e-1", execution("e-1")));

        mvc.perform(get("/api/recovery/executions").param("active", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['e-1'].serviceName").value("cache"))
                .andExpect(jsonPath("$['e-1'].status").value("PENDING"));
    }

    @Test
    void plansAreListedWithStepNames() throws Exception {
        when(manager.getRecoveryPlans()).thenReturn(Map.of("p1", plan()));

        mvc.perform(get("/api/recovery/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.p1.strategy").value("RESTART"))
                .andExpect(jsonPath("$.p1.steps[0]").value("Stop"))
                .andExpect(jsonPath("$.p1.steps[1]").value("Start"));
    }

    @Test
    void statisticsAreExposed() throws Exception {
        when(manager.getStatistics()).thenReturn(new RecoveryStatistics(2, 1, 1, 0,
                Map.of(ServiceStatus.HEALTHY, 1L, ServiceStatus.FAILED, 1L), 3, 2, 1, 0, 0));

        mvc.perform(get("/api/recovery/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalServices").value(2))
                .andExpect(jsonPath("$.successfulRecoveries").value(2));
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        when(manager.getStatistics()).thenReturn(new RecoveryStatistics(0, 0, 0, 0, Map.of(), 0, 0, 0, 0, 0));

        mvc.perform(get("/api/recovery/statistics").header("X-Request-ID", "req-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-42"));
    }

    private static ServiceHealth health(String name, ServiceStatus status) {
        return new ServiceHealth(name, status, NOW, 0, NOW, 5, 0.0, List.of(), null, 0, Map.of());
    }

    private static RecoveryPlan plan() {
        return RecoveryPlan.builder("p1")
                .serviceName("cache")
                .strategy(RecoveryStrategy.RESTART)
                .step(RecoveryStep.builder("Stop").build())
                .step(RecoveryStep.builder("Start").build())
                .build();
    }

    private static RecoveryExecution execution(String id) {
        return new RecoveryExecution(id, plan(), "cache", "test", NOW);
    }
}
