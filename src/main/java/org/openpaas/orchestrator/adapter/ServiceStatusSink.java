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

import org.openpaas.orchestrator.adapter.model.ServiceStatus;
import reactor.core.publisher.Mono;

/**
 * Receives user-visible status changes for a service. Typically backed by the service repository.
 */
public interface ServiceStatusSink {

    Mono<Void> updateStatus(String serviceId, ServiceStatus status);
}
