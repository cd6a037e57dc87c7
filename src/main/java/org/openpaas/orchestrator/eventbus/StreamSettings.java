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

package org.openpaas.orchestrator.eventbus;

import java.time.Duration;

/**
 * Retention limits applied to each category stream. Oldest messages are discarded first when any
 * limit is exceeded. A zero or negative value disables the matching limit, the same way NATS
 * JetStream reads it: {@code maxAge} of zero keeps messages forever, {@code maxBytes} or
 * {@code maxMessages} at or below zero leave the stream unbounded by size or count.
 */
public record StreamSettings(Duration maxAge, long maxBytes, long maxMessages, int replicas, boolean fileStorage) {

    public static final Duration DEFAULT_MAX_AGE = Duration.ofDays(7);
    public static final long DEFAULT_MAX_BYTES = 1024L * 1024 * 1024;

    public static StreamSettings defaults() {
        return new StreamSettings(DEFAULT_MAX_AGE, DEFAULT_MAX_BYTES, -1, 1, true);
    }

    public boolean ageLimited() {
        return maxAge != null && !maxAge.isZero() && !maxAge.isNegative();
    }
}
