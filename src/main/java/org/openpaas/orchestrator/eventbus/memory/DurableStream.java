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

package org.openpaas.orchestrator.eventbus.memory;

import org.openpaas.orchestrator.eventbus.StreamCategory;
import org.openpaas.orchestrator.eventbus.StreamSettings;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only log of serialized events for one {@link StreamCategory}.
 *
 * <p>Limits on age, total bytes and message count are enforced on every append and read by
 * discarding the oldest messages first.
 */
public class DurableStream {

    public record StoredMessage(long sequence, String subject, Instant timestamp, byte[] payload) {}

    private final StreamCategory category;
    private final StreamSettings settings;
    private final Clock clock;
    private final Deque<StoredMessage> messages = new ArrayDeque<>();
    private long nextSequence = 1;
    private long totalBytes;
    private long discarded;

    public DurableStream(StreamCategory category, StreamSettings settings, Clock clock) {
        this.category = category;
        this.settings = settings;
        this.clock = clock;
    }

    public synchronized StoredMessage append(String subject, byte[] payload) {
        StoredMessage message = new StoredMessage(nextSequence++, subject, clock.instant(), payload);
        messages.addLast(message);
        totalBytes += payload.length;
        enforceLimits();
        return message;
    }

    public synchronized List<StoredMessage> since(Instant since) {
        enforceLimits();
        List<StoredMessage> result = new ArrayList<>();
        for (StoredMessage m : messages) {
            if (!m.timestamp().isBefore(since)) {
                result.add(m);
            }
        }
        return result;
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized long bytes() {
        return totalBytes;
    }

    public synchronized long discardedCount() {
        return discarded;
    }

    public StreamCategory category() {
        return category;
    }

    private void enforceLimits() {
        Instant oldestAllowed = settings.ageLimited() ? clock.instant().minus(settings.maxAge()) : null;
        while (!messages.isEmpty()) {
            StoredMessage head = messages.peekFirst();
            boolean tooOld = oldestAllowed != null && head.timestamp().isBefore(oldestAllowed);
            boolean tooMany = settings.maxMessages() > 0 && messages.size() > settings.maxMessages();
            boolean tooBig = settings.maxBytes() > 0 && totalBytes > settings.maxBytes();
            if (!tooOld && !tooMany && !tooBig) {
                return;
            }
            messages.pollFirst();
            totalBytes -= head.payload().length;
            discarded++;
        }
    }
}
