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

package org.openpaas.orchestrator.adapter;

import org.openpaas.orchestrator.adapter.model.ApplicationStatus;
import org.openpaas.orchestrator.adapter.model.Deployment;
import org.openpaas.orchestrator.adapter.model.Environment;
import org.openpaas.orchestrator.adapter.model.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Contract for the GitOps controller that reconciles cluster state against declared applications.
 */
public interface GitOpsAdapter {

    /** Registers an application for the service and returns the controller's external id. */
    Mono<String> createApplication(Service service, Environment environment);

    Mono<Void> updateApplication(String externalId, Service service);

    Mono<Void> deleteApplication(String externalId);

    /** Asks the controller to reconcile now. */
    Mono<Void> syncApplication(String externalId);

    Mono<ApplicationStatus> getApplicationStatus(String externalId);

    Flux<Deployment> getApplicationHistory(String externalId);

    Mono<Void> rollbackApplication(String externalId, long revision);
}
