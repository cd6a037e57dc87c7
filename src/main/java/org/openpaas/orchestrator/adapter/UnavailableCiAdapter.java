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

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.adapter.model.Build;
import org.openpaas.orchestrator.adapter.model.BuildSource;
import org.openpaas.orchestrator.adapter.model.Service;
import org.openpaas.orchestrator.core.exception.AdapterException;
import reactor.core.publisher.Mono;

/**
 * Fallback used when no CI runner is configured. Every build is rejected, which the engine
 * records as {@code build_failed}.
 */
@Slf4j
public class UnavailableCiAdapter implements CiAdapter {

    static final String NAME = "ci";

    @Override
    public Mono<Build> triggerBuild(Service service, BuildSource source) {
        log.warn("[adapter] No CI adapter configured, rejecting build for service={}", service.id());
        return Mono.error(new AdapterException(NAME, "no CI adapter configured"));
    }
}
