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
import org.openpaas.orchestrator.adapter.GitOpsAdapter;
import org.openpaas.orchestrator.adapter.ServiceStatusSink;
import org.openpaas.orchestrator.core.dlq.DeadLetterService;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.core.resilience.ResilienceDecorator;
import org.openpaas.orchestrator.core.scheduling.OrchestrationScheduler;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.workflow.effect.SideEffectExecutor;
import org.openpaas.orchestrator.workflow.engine.DeploymentWorkflowEngine;
import org.openpaas.orchestrator.workflow.maintenance.StuckWorkflowWatchdog;
import org.openpaas.orchestrator.workflow.maintenance.WorkflowCleanupService;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Auto-configuration for the deployment workflow engine: registry, side-effect executor,
 * engine, and the periodic cleanup and watchdog tasks.
 */
@Slf4j
@AutoConfiguration(after = {OrchestratorAutoConfiguration.class, EventBusAutoConfiguration.class})
public class DeploymentWorkflowAutoConfiguration {

    static final String EFFECT_SCHEDULER = "workflowEffectScheduler";

    @Bean
    @ConditionalOnMissingBean
    public DeploymentWorkflowRegistry deploymentWorkflowRegistry() {
        return new DeploymentWorkflowRegistry();
    }

    @Bean(name = EFFECT_SCHEDULER, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = EFFECT_SCHEDULER)
    public Scheduler workflowEffectScheduler(OrchestratorProperties properties) {
        int lanes = properties.getSideEffects().getMaxConcurrentLanes();
        return Schedulers.newBoundedElastic(lanes, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "workflow-effects");
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public SideEffectExecutor sideEffectExecutor(ServiceStatusSink statusSink, EventBus eventBus,
                                                 ObjectProvider<DeadLetterService> deadLetters,
                                                 WorkflowEvents events, OrchestratorProperties properties,
                                                 @Qualifier(EFFECT_SCHEDULER) Scheduler scheduler) {
        String source = properties.getWorkflow().getEventSource();
        log.info("[orchestrator] Side-effect executor initialized source={} maxConcurrentLanes={}",
                source, properties.getSideEffects().getMaxConcurrentLanes());
        return new SideEffectExecutor(statusSink, eventBus, deadLetters.getIfAvailable(), events, source, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentWorkflowEngine deploymentWorkflowEngine(DeploymentWorkflowRegistry registry,
                                                             SideEffectExecutor sideEffects,
                                                             CiAdapter ciAdapter,
                                                             ObjectProvider<GitOpsAdapter> gitOpsAdapter,
                                                             ObjectProvider<ResilienceDecorator> resilience,
                                                             WorkflowEvents events) {
        GitOpsAdapter gitOps = gitOpsAdapter.getIfAvailable();
        if (gitOps == null) {
            log.warn("[orchestrator] No GitOpsAdapter bean found, deploy and rollback triggers are unavailable");
        }
        log.info("[orchestrator] Deployment workflow engine initialized");
        return new DeploymentWorkflowEngine(registry, sideEffects, ciAdapter, gitOps,
                resilience.getIfAvailable(), events);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "openpaas.orchestrator.cleanup.enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowCleanupService workflowCleanupService(DeploymentWorkflowEngine engine,
                                                         OrchestrationScheduler scheduler,
                                                         OrchestratorProperties properties) {
        OrchestratorProperties.CleanupProperties cleanup = properties.getCleanup();
        return new WorkflowCleanupService(engine, scheduler, cleanup.getInterval(), cleanup.getRetention());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "openpaas.orchestrator.watchdog.enabled", havingValue = "true")
    public StuckWorkflowWatchdog stuckWorkflowWatchdog(DeploymentWorkflowEngine engine,
                                                       DeploymentWorkflowRegistry registry,
                                                       OrchestrationScheduler scheduler,
                                                       WorkflowEvents events,
                                                       OrchestratorProperties properties) {
        OrchestratorProperties.WatchdogProperties watchdog = properties.getWatchdog();
        log.info("[orchestrator] Stuck workflow watchdog initialized buildTimeout={} deployTimeout={}",
                watchdog.getBuildTimeout(), watchdog.getDeployTimeout());
        return new StuckWorkflowWatchdog(engine, registry, scheduler, events,
                watchdog.getInterval(), watchdog.getBuildTimeout(), watchdog.getDeployTimeout());
    }
}
