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

import me.golemcore.gm.domain.model.AmbientTrigger;
import me.golemcore.gm.domain.model.EconomicStatus;
import me.golemcore.gm.domain.model.PoliticalStability;
import me.golemcore.gm.domain.model.WorldState;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Template families per ambient trigger and the phrase pools used to fill
 * their decorative slots.
 */
final class AmbientTemplates {

    static final Map<AmbientTrigger, List<String>> FAMILIES = new EnumMap<>(AmbientTrigger.class);

    static final Map<String, List<String>> PHRASES = new LinkedHashMap<>();

    private static final Map<String, String> AURA_SOUNDS = Map.of(
            "ominous", "An unsettling silence presses in",
            "friendly", "Warm chatter drifts on the air",
            "mystical", "A faint hum resonates through the stones",
            "sacred", "A quiet reverence fills the space");

    private static final String DEFAULT_AURA_SOUND = "Something about the air here feels different";

    private static final Map<String, String> SEASONAL_PHRASES = Map.of(
            "autumn", "Fallen leaves skitter across the ground",
            "winter", "Frost clings to every surface",
            "spring", "New growth stirs all around",
            "summer", "The heat hangs heavy");

    static {
        PHRASES.put("ambient_detail", List.of(
                "Light filters through in a mesmerizing pattern",
                "The ambient sounds form a calming backdrop",
                "Everything feels momentarily still"));
        PHRASES.put("atmospheric_verb", List.of("envelops you", "settles in", "changes subtly", "intensifies"));
        PHRASES.put("location_mood_verb", List.of("breathes", "shifts", "pulses", "comes alive"));
        PHRASES.put("presence_verb", List.of("permeates the air", "makes itself known", "lingers"));
        PHRASES.put("seasonal_verb", List.of("has a distinctive feeling", "carries unique scents",
                "settles on your skin"));
        PHRASES.put("npc_action", List.of("works quietly", "moves about", "attends to their tasks",
                "goes about their business"));

        FAMILIES.put(AmbientTrigger.TIME_BASED, List.of(
                "Time passes quietly in {{location}}. {{ambient_detail}}.",
                "The {{time_of_day}} continues its steady rhythm. {{ambient_detail}}.",
                "Moments drift by peacefully. {{ambient_detail}}."));
        FAMILIES.put(AmbientTrigger.LOCATION_BASED, List.of(
                "The {{aura}} atmosphere of {{location}} {{atmospheric_verb}}. {{aura_sound}}.",
                "{{location}} {{location_mood_verb}} around you. {{aura_sound}}.",
                "The essence of {{location}} {{presence_verb}}. {{aura_sound}}."));
        FAMILIES.put(AmbientTrigger.WORLD_STATE_BASED, List.of(
                "Distant rumors of {{world_situation}} remind you of the broader world's concerns.",
                "The ongoing {{world_situation}} weighs even on this moment in {{location}}.",
                "Echoes of {{world_situation}} reach even here."));
        FAMILIES.put(AmbientTrigger.SEASONAL, List.of(
                "The {{season}} air {{seasonal_verb}}. {{seasonal_phrase}}.",
                "The {{season}} weather settles over {{location}}. {{seasonal_phrase}}.",
                "Nature's {{season}} rhythm carries on. {{seasonal_phrase}}."));
        FAMILIES.put(AmbientTrigger.NPC_BASED, List.of(
                "{{npc_name}} {{npc_action}} nearby.",
                "Over by the wall, {{npc_name}} {{npc_action}}.",
                "In the background, {{npc_name}} {{npc_action}}."));
    }

    private AmbientTemplates() {
    }

    static String auraSound(String aura) {
        return AURA_SOUNDS.getOrDefault(aura.toLowerCase(Locale.ROOT), DEFAULT_AURA_SOUND);
    }

    static String seasonalPhrase(String season) {
        return SEASONAL_PHRASES.get(season.toLowerCase(Locale.ROOT));
    }

    /**
     * Describes what makes the world unstable, or null for a stable world.
     */
    static String worldSituation(WorldState worldState) {
        PoliticalStability stability = worldState.politicalStability();
        if (stability == PoliticalStability.UNREST) {
            return "political unrest";
        }
        if (stability == PoliticalStability.REBELLION) {
            return "open rebellion";
        }
        if (stability == PoliticalStability.WAR) {
            return "war";
        }
        EconomicStatus economy = worldState.economicStatus();
        if (economy == EconomicStatus.BOOMING) {
            return "the trade boom";
        }
        if (economy == EconomicStatus.DECLINING) {
            return "economic decline";
        }
        if (economy == EconomicStatus.RECESSION) {
            return "the recession";
        }
        return null;
    }
}
