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

package org.openpaas.orchestrator.config;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.adapter.CiAdapter;
import org.openpaas.orchestrator.adapter.InMemoryServiceStatusSink;
import org.openpaas.orchestrator.adapter.ServiceStatusSink;
import org.openpaas.orchestrator.adapter.UnavailableCiAdapter;
import org.openpaas.orchestrator.core.dlq.DeadLetterService;
import org.openpaas.orchestrator.core.dlq.DeadLetterStore;
import org.openpaas.orchestrator.core.dlq.InMemoryDeadLetterStore;
import org.openpaas.orchestrator.core.observability.CompositeWorkflowEvents;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.core.observability.WorkflowLoggerEvents;
import org.openpaas.orchestrator.core.observability.WorkflowMetrics;
import org.openpaas.orchestrator.core.scheduling.OrchestrationScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration for the orchestrator.
 *
 * <p>Wires the shared core beans: observability, dead letters, scheduling, and the default
 * adapters used when the host application does not provide its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowLoggerEvents workflowLoggerEvents() {
        return new WorkflowLoggerEvents();
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "workflowEvents")
    public WorkflowEvents workflowEvents(ObjectProvider<WorkflowLoggerEvents> loggerEvents,
                                         ObjectProvider<WorkflowMetrics> metrics) {
        List<WorkflowEvents> delegates = new ArrayList<>();
        loggerEvents.ifAvailable(delegates::add);
        metrics.ifAvailable(delegates::add);
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeWorkflowEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore() {
        return new InMemoryDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "openpaas.orchestrator.dlq.enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterService deadLetterService(DeadLetterStore store, WorkflowEvents events) {
        log.info("[orchestrator] Dead letter queue service initialized");
        return new DeadLetterService(store, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationScheduler orchestrationScheduler(OrchestratorProperties properties) {
        int poolSize = properties.getScheduling().getThreadPoolSize();
        log.info("[orchestrator] Scheduler initialized with thread pool size: {}", poolSize);
        return new OrchestrationScheduler(poolSize);
    }

    @Bean
    @ConditionalOnMissingBean
    public CiAdapter ciAdapter() {
        log.warn("[orchestrator] No CiAdapter bean found, builds will be rejected");
        return new UnavailableCiAdapter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceStatusSink serviceStatusSink() {
        log.info("[orchestrator] Using in-memory service status sink (default)");
        return new InMemoryServiceStatusSink();
    }
}
