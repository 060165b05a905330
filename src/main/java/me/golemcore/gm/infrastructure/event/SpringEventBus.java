package me.golemcore.gm.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gm.domain.model.GameEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Carries recorded {@link GameEvent}s to in-process listeners, such as a
 * host's persistence layer or a session transcript.
 *
 * <p>
 * Delivery is synchronous, on the thread that recorded the event:
 *
 * <pre>{@code
 * @EventListener
 * void onGameEvent(GameEvent event) { ... }
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    public void publish(GameEvent event) {
        log.debug("[EventBus] {} by {} in session {}", event.eventType(), event.actor(), event.sessionId());
        eventPublisher.publishEvent(event);
    }
}
