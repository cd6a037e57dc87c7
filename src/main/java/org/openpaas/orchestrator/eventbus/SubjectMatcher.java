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

/**
 * NATS-style subject matching. Tokens are separated by {@code '.'}; {@code '*'} matches exactly one
 * token and {@code '>'} matches one or more trailing tokens.
 */
public final class SubjectMatcher {

    private SubjectMatcher() {}

    public static boolean matches(String pattern, String subject) {
        if (pattern == null || subject == null) {
            return false;
        }
        String[] p = pattern.split("\\.", -1);
        String[] s = subject.split("\\.", -1);
        for (int i = 0; i < p.length; i++) {
            if (">".equals(p[i])) {
                return i == p.length - 1 && s.length > i;
            }
            if (i >= s.length) {
                return false;
            }
            if (!"*".equals(p[i]) && !p[i].equals(s[i])) {
                return false;
            }
        }
        return p.length == s.length;
    }

    /**
     * Rejects empty tokens and a {@code '>'} that is not the last token.
     */
    public static void validatePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Subject pattern must not be blank");
        }
        String[] tokens = pattern.split("\\.", -1);
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty()) {
                throw new IllegalArgumentException("Subject pattern has an empty token: " + pattern);
            }
            if (">".equals(token) && i != tokens.length - 1) {
                throw new IllegalArgumentException("'>' must be the last token: " + pattern);
            }
            if (token.length() > 1 && (token.contains("*") || token.contains(">"))) {
                throw new IllegalArgumentException("Wildcards must occupy a whole token: " + pattern);
            }
        }
    }
}
