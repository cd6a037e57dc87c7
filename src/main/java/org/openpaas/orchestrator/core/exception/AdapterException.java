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

package org.openpaas.orchestrator.core.exception;

/**
 * Failure reported by an external collaborator (CI runner, GitOps controller). The engine folds
 * it into a {@code *_failed} transition and never retries it.
 */
public final class AdapterException extends OrchestratorException {
    private final String adapter;

    public AdapterException(String adapter, String message) {
        super(adapter + ": " + message, "ADAPTER_FAILURE");
        this.adapter = adapter;
    }

    public AdapterException(String adapter, String message, Throwable cause) {
        super(adapter + ": " + message, "ADAPTER_FAILURE", cause);
        this.adapter = adapter;
    }

    public String getAdapter() {
        return adapter;
    }
}
