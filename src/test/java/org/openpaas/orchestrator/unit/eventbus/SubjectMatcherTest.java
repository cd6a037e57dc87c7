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

package org.openpaas.orchestrator.unit.eventbus;

import org.junit.jupiter.api.Test;
import org.openpaas.orchestrator.eventbus.SubjectMatcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectMatcherTest {

    @Test
    void literalSubjectsMatchExactly() {
        assertThat(SubjectMatcher.matches("deploy.started", "deploy.started")).isTrue();
        assertThat(SubjectMatcher.matches("deploy.started", "deploy.completed")).isFalse();
        assertThat(SubjectMatcher.matches("deploy", "deploy.started")).isFalse();
    }

    @Test
    void starMatchesExactlyOneToken() {
        assertThat(SubjectMatcher.matches("deploy.*", "deploy.failed")).isTrue();
        assertThat(SubjectMatcher.matches("*.failed", "build.failed")).isTrue();
        assertThat(SubjectMatcher.matches("deploy.*", "deploy")).isFalse();
        assertThat(SubjectMatcher.matches("deploy.*", "deploy.failed.retry")).isFalse();
    }

    @Test
    void tailMatchesOneOrMoreTokens() {
        assertThat(SubjectMatcher.matches("build.>", "build.started")).isTrue();
        assertThat(SubjectMatcher.matches("build.>", "build.started.extra")).isTrue();
        assertThat(SubjectMatcher.matches("build.>", "build")).isFalse();
        assertThat(SubjectMatcher.matches(">", "audit.log")).isTrue();
        assertThat(SubjectMatcher.matches(null, "audit.log")).isFalse();
    }

    @Test
    void validatePatternRejectsMalformedPatterns() {
        assertThatCode(() -> SubjectMatcher.validatePattern("service.*.>")).doesNotThrowAnyException();
        assertThatThrownBy(() -> SubjectMatcher.validatePattern("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SubjectMatcher.validatePattern("build..started"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SubjectMatcher.validatePattern("build.>.started"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SubjectMatcher.validatePattern("build.sta*"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
