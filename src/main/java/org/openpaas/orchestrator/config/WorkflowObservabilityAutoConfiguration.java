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

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.core.dlq.DeadLetterEndpoint;
import org.openpaas.orchestrator.core.dlq.DeadLetterService;
import org.openpaas.orchestrator.core.health.EventBusHealthIndicator;
import org.openpaas.orchestrator.core.observability.WorkflowMetrics;
import org.openpaas.orchestrator.core.observability.WorkflowMetricsEndpoint;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for Micrometer metrics, the actuator endpoints over metrics and dead letters,
 * and the event bus health indicator. Each part activates only when its library is on the classpath.
 */
@Slf4j
@AutoConfiguration(
        after = {OrchestratorAutoConfiguration.class, DeploymentWorkflowAutoConfiguration.class},
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
        })
public class WorkflowObservabilityAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(name = "openpaas.orchestrator.metrics.enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkflowMetrics workflowMetrics(MeterRegistry registry) {
            log.info("[orchestrator] Workflow metrics initialized");
            return new WorkflowMetrics(registry);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnClass(Endpoint.class)
        public WorkflowMetricsEndpoint workflowMetricsEndpoint(MeterRegistry registry,
                                                               DeploymentWorkflowRegistry workflows) {
            return new WorkflowMetricsEndpoint(registry, workflows);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Endpoint.class)
    @ConditionalOnBean(DeadLetterService.class)
    static class DeadLetterEndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterEndpoint deadLetterEndpoint(DeadLetterService deadLetters) {
            log.info("[orchestrator] Dead letter endpoint initialized");
            return new DeadLetterEndpoint(deadLetters);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    @ConditionalOnProperty(name = "openpaas.orchestrator.health.enabled", havingValue = "true", matchIfMissing = true)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventBusHealthIndicator eventBusHealthIndicator(EventBus eventBus, DeploymentWorkflowRegistry workflows) {
            log.info("[orchestrator] Health indicator initialized");
            return new EventBusHealthIndicator(eventBus, workflows);
        }
    }
}
