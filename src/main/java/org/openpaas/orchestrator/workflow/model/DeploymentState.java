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
 * States of a deployment workflow.
 *
 * <p>There is no single terminal state: {@link #DEPLOY_COMPLETE}, {@link #BUILD_FAILED},
 * {@link #DEPLOY_FAILED} and {@link #ROLLBACK_COMPLETE} are quiescent but can be re-entered
 * by a new trigger event.
 */
public enum DeploymentState {
    IDLE("idle"),
    BUILD_QUEUED("build_queued"),
    BUILDING("building"),
    BUILD_COMPLETE("build_complete"),
    BUILD_FAILED("build_failed"),
    DEPLOY_QUEUED("deploy_queued"),
    DEPLOYING("deploying"),
    DEPLOY_COMPLETE("deploy_complete"),
    DEPLOY_FAILED("deploy_failed"),
    ROLLING_BACK("rolling_back"),
    ROLLBACK_COMPLETE("rollback_complete");

    private static final Map<String, DeploymentState> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DeploymentState::value, Function.identity()));

    private final String value;

    DeploymentState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DeploymentState fromValue(String value) {
        DeploymentState state = BY_VALUE.get(value);
        if (state == null) {
            throw new IllegalArgumentException("Unknown deployment state: " + value);
        }
        return state;
    }

    /**
     * States eligible for garbage collection once the retention window has passed.
     * Failed states are never collected.
     */
    public boolean isCollectable() {
        return this == IDLE || this == DEPLOY_COMPLETE || this == ROLLBACK_COMPLETE;
    }

    /**
     * States that wait on an external system to report back.
     */
    public boolean isInFlight() {
        return this == BUILD_QUEUED || this == BUILDING || this == DEPLOY_QUEUED
                || this == DEPLOYING || this == ROLLING_BACK;
    }

    public boolean isFailed() {
        return this == BUILD_FAILED || this == DEPLOY_FAILED;
    }

    @Override
    public String toString() {
        return value;
    }
}
