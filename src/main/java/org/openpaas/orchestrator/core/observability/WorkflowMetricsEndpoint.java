/*
 * Copyright 2024-2026 The OpenPaaS Orchestrator Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.openpaas.orchestrator.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot Actuator endpoint exposing deployment workflow metrics.
 *
 * <p>Combines the live contents of the {@link DeploymentWorkflowRegistry} with the counters
 * recorded by {@link WorkflowMetrics}, at {@code /actuator/workflow-metrics}.
 */
@Slf4j
@Endpoint(id = "workflow-metrics")
public class WorkflowMetricsEndpoint {

    private static final String PREFIX = WorkflowMetrics.PREFIX;

    private final MeterRegistry registry;
    private final DeploymentWorkflowRegistry workflows;

    public WorkflowMetricsEndpoint(MeterRegistry registry, DeploymentWorkflowRegistry workflows) {
        this.registry = registry;
        this.workflows = workflows;
    }

    @ReadOperation
    public Map<String, Object> metrics() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("workflows", buildWorkflowMetrics());
        result.put("states", buildStateBreakdown());
        result.put("transitions", buildTransitionMetrics(null));
        result.put("sideEffects", buildSideEffectMetrics(null));
        result.put("dlq", Map.of("entries", sumCounters(PREFIX + ".dlq.entries", null, null)));
        result.put("uptime", formatUptime());
        return result;
    }

    /**
     * Metrics for a single state, addressed by its wire value (e.g. {@code deploying}).
     */
    @ReadOperation
    public Map<String, Object> metrics(@Selector String state) {
        DeploymentState parsed;
        try {
            parsed = DeploymentState.fromValue(state.toLowerCase());
        } catch (IllegalArgumentException e) {
            log.warn("[workflow] Unknown state requested for metrics: {}", state);
            return Map.of("error", "Unknown state: " + state);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("state", parsed.value());
        result.put("current", workflows.findByState(parsed).size());
        result.put("transitions", buildTransitionMetrics(parsed.value()));
        result.put("sideEffects", buildSideEffectMetrics(parsed.value()));
        result.put("uptime", formatUptime());
        return result;
    }

    private Map<String, Object> buildWorkflowMetrics() {
        List<DeploymentWorkflow> all = workflows.findAll();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("created", sumCounters(PREFIX + ".created", null, null));
        result.put("live", all.size());
        result.put("inFlight", all.stream().filter(w -> w.state().isInFlight()).count());
        result.put("failed", all.stream().filter(w -> w.state().isFailed()).count());
        result.put("cleanedUp", sumCounters(PREFIX + ".cleanup.removed", null, null));
        result.put("timedOut", sumCounters(PREFIX + ".timeouts", null, null));
        return result;
    }

    private Map<String, Object> buildStateBreakdown() {
        Map<String, Object> states = new LinkedHashMap<>();
        for (DeploymentState s : DeploymentState.values()) {
            states.put(s.value(), workflows.findByState(s).size());
        }
        return states;
    }

    private Map<String, Object> buildTransitionMetrics(String stateFilter) {
        Map<String, Object> transitions = new LinkedHashMap<>();
        transitions.put("accepted", sumCounters(PREFIX + ".transitions", "to", stateFilter));
        transitions.put("rejected", sumCounters(PREFIX + ".transitions.rejected", "state", stateFilter));
        return transitions;
    }

    private Map<String, Object> buildSideEffectMetrics(String stateFilter) {
        double succeeded = sumCountersWithTag(PREFIX + ".side-effects", "success", "true", "state", stateFilter);
        double failed = sumCountersWithTag(PREFIX + ".side-effects", "success", "false", "state", stateFilter);
        Map<String, Object> sideEffects = new LinkedHashMap<>();
        sideEffects.put("total", succeeded + failed);
        sideEffects.put("failed", failed);
        return sideEffects;
    }

    private double sumCounters(String metricName, String tagKey, String tagValue) {
        Search search = registry.find(metricName);
        if (tagValue != null) {
            search = search.tag(tagKey, tagValue);
        }
        return search.counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private double sumCountersWithTag(String metricName, String tagKey, String tagValue,
                                      String filterTagKey, String filterTagValue) {
        Search search = registry.find(metricName).tag(tagKey, tagValue);
        if (filterTagValue != null) {
            search = search.tag(filterTagKey, filterTagValue);
        }
        return search.counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return String.format("%dh %dm %ds", duration.toHours(), duration.toMinutesPart(), duration.toSecondsPart());
    }
}
