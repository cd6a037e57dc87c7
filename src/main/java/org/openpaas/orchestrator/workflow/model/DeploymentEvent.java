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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Events that drive a deployment workflow through the transition table.
 */
public enum DeploymentEvent {
    TRIGGER_BUILD("trigger_build"),
    BUILD_STARTED("build_started"),
    BUILD_SUCCEEDED("build_succeeded"),
    BUILD_FAILED("build_failed"),
    TRIGGER_DEPLOY("trigger_deploy"),
    DEPLOY_STARTED("deploy_started"),
    DEPLOY_SUCCEEDED("deploy_succeeded"),
    DEPLOY_FAILED("deploy_failed"),
    TRIGGER_ROLLBACK("trigger_rollback"),
    ROLLBACK_COMPLETE("rollback_complete"),
    CANCEL("cancel");

    private static final Map<String, DeploymentEvent> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DeploymentEvent::value, Function.identity()));

    private final String value;

    DeploymentEvent(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DeploymentEvent fromValue(String value) {
        DeploymentEvent event = BY_VALUE.get(value);
        if (event == null) {
            throw new IllegalArgumentException("Unknown deployment event: " + value);
        }
        return event;
    }

    @Override
    public String toString() {
        return value;
    }
}
