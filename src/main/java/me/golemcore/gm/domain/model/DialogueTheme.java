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

import java.util.List;
import java.util.Locale;

/**
 * Theme of an NPC initiated conversation, with the topics handed to the
 * dialogue generator.
 */
public enum DialogueTheme {

    WORLD_EVENTS_CONCERN(List.of("worry", "information_sharing", "local_news")),
    FRIENDLY_CHECK_IN(List.of("friendliness", "casual_conversation", "helpfulness")),
    LOCAL_KNOWLEDGE(List.of("wisdom", "local_lore", "helpful_advice")),
    PROFESSIONAL_INQUIRY(List.of("business", "services", "transactions")),
    CURIOUS_OBSERVATION(List.of("curiosity", "observation", "questions")),
    CONCERN_FOR_PLAYER(List.of("worry", "care", "friendliness"));

    private final List<String> topics;

    DialogueTheme(List<String> topics) {
        this.topics = topics;
    }

    public List<String> topics() {
        return topics;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
