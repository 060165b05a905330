package me.golemcore.gm.domain.service;

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
import me.golemcore.gm.domain.model.GameEvent;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.port.outbound.EventLogPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds game events and forwards them to every registered event log. Event
 * logging is best effort: a failing sink never breaks a decision.
 */
@Service
@Slf4j
public class GameEventRecorder {

    private final Clock clock;
    private final List<EventLogPort> eventLogPorts = new ArrayList<>();

    public GameEventRecorder(Clock clock, List<EventLogPort> eventLogPorts) {
        this.clock = clock;
        if (eventLogPorts != null) {
            for (EventLogPort eventLogPort : eventLogPorts) {
                if (eventLogPort != null) {
                    this.eventLogPorts.add(eventLogPort);
                }
            }
        }
    }

    public GameEvent record(String sessionId, GameEventType type, String actor, Map<String, Object> context) {
        GameEvent event = GameEvent.builder()
                .sessionId(sessionId)
                .eventType(type)
                .actor(actor)
                .context(context)
                .timestamp(Instant.now(clock))
                .build();
        for (EventLogPort eventLogPort : eventLogPorts) {
            try {
                eventLogPort.saveEvent(event);
            } catch (RuntimeException e) {
                log.warn("[EventLog] Failed to save {} for session {}: {}", type, sessionId, e.getMessage());
            }
        }
        return event;
    }
}
