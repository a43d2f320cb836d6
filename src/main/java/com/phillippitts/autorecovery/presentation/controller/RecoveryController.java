package com.phillippitts.autorecovery.presentation.controller;

import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStatistics;
import com.phillippitts.autorecovery.domain.RecoveryStep;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.RetryPolicy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.domain.UserImpact;
import com.phillippitts.autorecovery.exception.RecoveryManagerException;
import com.phillippitts.autorecovery.exception.ServiceNotFoundException;
import com.phillippitts.autorecovery.service.RecoveryManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator API over the {@link RecoveryManager}: inspect services, executions and plans,
 * trigger, cancel or roll back recoveries, and force a service's status.
 */
@RestController
@RequestMapping("/api/recovery")
class RecoveryController {

    private static final Logger LOG = LogManager.getLogger(RecoveryController.class);

    private final RecoveryManager manager;

    RecoveryController(RecoveryManager manager) {
        this.manager = manager;
    }

    @GetMapping("/services")
    Map<String, ServiceHealth> services() {
        return manager.getServiceHealth();
    }

    @GetMapping("/services/{name}")
    ServiceHealth service(@PathVariable String name) {
        return manager.getServiceHealth(name)
                .orElseThrow(() -> new ServiceNotFoundException("Service", name));
    }

    @PostMapping("/services/{name}/recover")
    ResponseEntity<Map<String, String>> recover(@PathVariable String name,
                                                @RequestBody(required = false) TriggerRequest request) {
        if (manager.getServiceHealth(name).isEmpty()) {
            throw new ServiceNotFoundException("Service", name);
        }
        String cause = request != null && request.cause() != null ? request.cause() : "api";
        RecoveryStrategy strategy = request != null ? request.strategy() : null;
        LOG.info("Recovery requested over API: service={}, strategy={}, cause={}", name, strategy, cause);
        String id = manager.triggerRecovery(name, cause, strategy)
                .orElseThrow(() -> new RecoveryManagerException("No recovery plan available for service " + name));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("executionId", id));
    }

    @PutMapping("/services/{name}/status")
    ServiceHealth forceStatus(@PathVariable String name, @Valid @RequestBody StatusRequest request) {
        if (!manager.forceServiceStatus(name, request.status())) {
            throw new ServiceNotFoundException("Service", name);
        }
        return service(name);
    }

    @GetMapping("/executions")
    Map<String, RecoveryExecution> executions(@RequestParam(defaultValue = "false") boolean active) {
        return active ? manager.getActiveRecoveries() : manager.getRecoveryExecutions();
    }

    @GetMapping("/executions/{id}")
    RecoveryExecution execution(@PathVariable String id) {
        return manager.getRecoveryExecution(id)
                .orElseThrow(() -> new ServiceNotFoundException("Execution", id));
    }

    @PostMapping("/executions/{id}/cancel")
    RecoveryExecution cancel(@PathVariable String id) {
        execution(id);
        if (!manager.cancelRecovery(id)) {
            throw new RecoveryManagerException("Execution " + id + " is not pending or running");
        }
        return execution(id);
    }

    @PostMapping("/executions/{id}/rollback")
    RecoveryExecution rollback(@PathVariable String id) {
        execution(id);
        if (!manager.rollbackRecovery(id)) {
            throw new RecoveryManagerException("Execution " + id + " has not finished with SUCCESS or FAILED");
        }
        return execution(id);
    }

    @GetMapping("/plans")
    Map<String, PlanView> plans() {
        Map<String, PlanView> views = new LinkedHashMap<>();
        manager.getRecoveryPlans().forEach((id, plan) -> views.put(id, PlanView.of(plan)));
        return views;
    }

    @GetMapping("/statistics")
    RecoveryStatistics statistics() {
        return manager.getStatistics();
    }

    record TriggerRequest(String cause, RecoveryStrategy strategy) {
    }

    record StatusRequest(@NotNull ServiceStatus status) {
    }

    /** Plan without its step functions. */
    record PlanView(String id,
                    String serviceName,
                    RecoveryStrategy strategy,
                    int priority,
                    long estimatedDurationMs,
                    UserImpact userImpact,
                    List<String> steps,
                    List<String> rollbackSteps,
                    long timeoutMs,
                    RetryPolicy retryPolicy) {

        static PlanView of(RecoveryPlan plan) {
            return new PlanView(plan.id(), plan.serviceName(), plan.strategy(), plan.priority(),
                    plan.estimatedDuration().toMillis(), plan.userImpact(),
                    plan.steps().stream().map(RecoveryStep::name).toList(),
                    plan.rollbackSteps().stream().map(RecoveryStep::name).toList(),
                    plan.timeout().toMillis(), plan.retryPolicy());
        }
    }
}
