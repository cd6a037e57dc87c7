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

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.core.resilience.ResilienceDecorator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for resilience4j circuit breakers around CI and GitOps adapter calls.
 *
 * <p>Activated when resilience4j is on the classpath and a {@code CircuitBreakerRegistry}
 * bean is available.
 */
@Slf4j
@AutoConfiguration(after = OrchestratorAutoConfiguration.class, before = DeploymentWorkflowAutoConfiguration.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
@ConditionalOnBean(CircuitBreakerRegistry.class)
@ConditionalOnProperty(name = "openpaas.orchestrator.resilience.enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResilienceDecorator resilienceDecorator(CircuitBreakerRegistry registry) {
        log.info("[orchestrator] Resilience decorator initialized with circuit breaker support");
        return new ResilienceDecorator(registry);
    }
}
