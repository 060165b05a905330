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

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What the host knows about an NPC.
 *
 * @param npcId
 *            NPC id
 * @param name
 *            display name, derived from the id when absent
 * @param personality
 *            personality keyword, e.g. "friendly" or "gruff"
 * @param busy
 *            busy NPCs never start a conversation
 * @param initiativeThreshold
 *            idle time after which this NPC speaks up; overrides the
 *            personality based threshold
 */
@Builder
public record NpcProfile(String npcId, String name, String personality, boolean busy, Duration initiativeThreshold) {

    public static NpcProfile of(String npcId) {
        return new NpcProfile(npcId, null, null, false, null);
    }

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return humanize(npcId);
    }

    public String personalityKey() {
        return personality != null ? personality.trim().toLowerCase(Locale.ROOT) : "";
    }

    static String humanize(String id) {
        if (id == null || id.isBlank()) {
            return "Someone";
        }
        return Arrays.stream(id.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
    }
}
