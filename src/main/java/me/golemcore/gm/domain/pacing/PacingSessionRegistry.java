package me.golemcore.gm.domain.pacing;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the pacing state of every live session. State is created on first
 * interaction and discarded when the host ends the session.
 */
@Component
@Slf4j
public class PacingSessionRegistry {

    private final Clock clock;
    private final Map<String, PacingSession> sessions = new ConcurrentHashMap<>();

    public PacingSessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public PacingSession session(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return sessions.computeIfAbsent(sessionId, id -> {
            log.debug("[Pacing] Creating pacing state for session {}", id);
            return new PacingSession(id, clock.instant());
        });
    }

    public Optional<PacingSession> find(String sessionId) {
        return sessionId != null ? Optional.ofNullable(sessions.get(sessionId)) : Optional.empty();
    }

    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }
}
