package me.golemcore.gm.adapter.outbound.eventlog;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gm.domain.model.GameEvent;
import me.golemcore.gm.infrastructure.event.SpringEventBus;
import me.golemcore.gm.port.outbound.EventLogPort;
import org.springframework.stereotype.Component;

/**
 * Event log that publishes game events on the Spring event bus and writes
 * them to the application log as JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventLogAdapter implements EventLogPort {

    private final SpringEventBus eventBus;
    private final ObjectMapper objectMapper;

    @Override
    public void saveEvent(GameEvent event) {
        eventBus.publish(event);
        if (log.isDebugEnabled()) {
            log.debug("[EventLog] {}", toJson(event));
        }
    }

    String toJson(GameEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[EventLog] Failed to serialize {}: {}", event.eventType(), e.getMessage());
            return String.valueOf(event);
        }
    }
}
