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

/**
 * Slice of world state that influences decisions and pacing.
 */
public record WorldState(PoliticalStability politicalStability, EconomicStatus economicStatus) {

    public WorldState {
        politicalStability = politicalStability != null ? politicalStability : PoliticalStability.STABLE;
        economicStatus = economicStatus != null ? economicStatus : EconomicStatus.STABLE;
    }

    public static WorldState stable() {
        return new WorldState(PoliticalStability.STABLE, EconomicStatus.STABLE);
    }

    public static WorldState of(PoliticalStability politicalStability) {
        return new WorldState(politicalStability, EconomicStatus.STABLE);
    }

    public boolean isUnstable() {
        return politicalStability != PoliticalStability.STABLE || economicStatus != EconomicStatus.STABLE;
    }
}
