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

import java.util.List;
import java.util.Map;

/**
 * The host's view of the scene, used by pacing checks between inputs.
 *
 * @param sessionId
 *            session id
 * @param playerId
 *            player id
 * @param currentLocation
 *            location id, e.g. "market_square"
 * @param timeOfDay
 *            e.g. "evening"
 * @param season
 *            e.g. "autumn"
 * @param locationAura
 *            dominant aura of the location, e.g. "ominous"
 * @param presentNpcs
 *            NPC ids present at the location, in the host's order
 * @param npcs
 *            known NPC profiles by id
 * @param worldState
 *            current world state
 * @param playerReputationSummary
 *            free text such as "respected by the guards"
 */
@Builder
public record GameContext(
        String sessionId,
        String playerId,
        String currentLocation,
        String timeOfDay,
        String season,
        String locationAura,
        List<String> presentNpcs,
        Map<String, NpcProfile> npcs,
        WorldState worldState,
        String playerReputationSummary) {

    private static final String NEUTRAL_AURA = "neutral";

    public GameContext {
        presentNpcs = presentNpcs != null ? List.copyOf(presentNpcs) : List.of();
        npcs = npcs != null ? Map.copyOf(npcs) : Map.of();
        worldState = worldState != null ? worldState : WorldState.stable();
    }

    public boolean isPresent(String npcId) {
        return npcId != null && presentNpcs.contains(npcId);
    }

    public NpcProfile npc(String npcId) {
        NpcProfile profile = npcs.get(npcId);
        return profile != null ? profile : NpcProfile.of(npcId);
    }

    public boolean hasDistinctiveAura() {
        return locationAura != null && !locationAura.isBlank() && !NEUTRAL_AURA.equalsIgnoreCase(locationAura);
    }

    public String locationName() {
        if (currentLocation == null || currentLocation.isBlank()) {
            return "this place";
        }
        return NpcProfile.humanize(currentLocation);
    }
}
