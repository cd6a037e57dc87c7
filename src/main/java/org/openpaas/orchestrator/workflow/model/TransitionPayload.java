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

package org.openpaas.orchestrator.workflow.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional data carried alongside a transition event. Non-null fields are copied onto the
 * workflow; metadata entries are merged into the workflow's metadata.
 */
public record TransitionPayload(
        String buildId,
        String deploymentId,
        String version,
        String error,
        Map<String, String> metadata
) {
    public static final String BUILD_ID = "build_id";
    public static final String DEPLOYMENT_ID = "deployment_id";
    public static final String VERSION = "version";
    public static final String ERROR = "error";

    private static final TransitionPayload EMPTY = new TransitionPayload(null, null, null, null, Map.of());

    public TransitionPayload {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TransitionPayload empty() {
        return EMPTY;
    }

    public static TransitionPayload ofBuild(String buildId) {
        return new TransitionPayload(buildId, null, null, null, Map.of());
    }

    public static TransitionPayload ofError(String error) {
        return new TransitionPayload(null, null, null, error, Map.of());
    }

    /**
     * Builds a payload from the loose map form used by CI and GitOps callbacks. Well-known keys
     * populate the typed fields; every other non-null entry becomes metadata.
     */
    public static TransitionPayload fromMap(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> extra = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (v != null && !isReserved(k)) {
                extra.put(k, String.valueOf(v));
            }
        });
        return new TransitionPayload(str(raw.get(BUILD_ID)), str(raw.get(DEPLOYMENT_ID)),
                str(raw.get(VERSION)), str(raw.get(ERROR)), extra);
    }

    public TransitionPayload withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new TransitionPayload(buildId, deploymentId, version, error, copy);
    }

    private static boolean isReserved(String key) {
        return BUILD_ID.equals(key) || DEPLOYMENT_ID.equals(key) || VERSION.equals(key) || ERROR.equals(key);
    }

    private static String str(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
