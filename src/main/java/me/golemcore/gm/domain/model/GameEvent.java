package me.golemcore.gm.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A game event as written to the event log and offered to the summarizer.
 *
 * @param sessionId
 *            session the event belongs to
 * @param eventType
 *            the kind of event
 * @param actor
 *            player or NPC that caused the event
 * @param context
 *            event specific attributes (never null)
 * @param timestamp
 *            when the event happened
 */
@Builder
public record GameEvent(
        String sessionId,
        GameEventType eventType,
        String actor,
        Map<String, Object> context,
        Instant timestamp) {

    public GameEvent {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public String attribute(String key, String defaultValue) {
        Object value = context.get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    public boolean flag(String key) {
        Object value = context.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }
}
