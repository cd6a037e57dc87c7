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

import org.openpaas.orchestrator.adapter.model.Build;
import org.openpaas.orchestrator.adapter.model.BuildSource;
import org.openpaas.orchestrator.adapter.model.Service;
import reactor.core.publisher.Mono;

/**
 * Contract for the CI runner that turns a {@link BuildSource} into a container image.
 *
 * <p>Implementations return the accepted build; completion is reported later through the
 * workflow's {@code build_succeeded}/{@code build_failed} callbacks. Errors are signalled as
 * {@code Mono.error} and are folded into a failed build by the engine.
 */
public interface CiAdapter {

    Mono<Build> triggerBuild(Service service, BuildSource source);
}
