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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of the skill check performed for a legal branch action.
 *
 * @param success
 *            whether the check passed
 * @param roll
 *            d20 roll, 1..20
 * @param difficulty
 *            target difficulty of the check
 * @param successChance
 *            chance of success after world-state modifiers
 */
public record SkillCheckResult(boolean success, int roll, int difficulty, double successChance) {

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("success", success);
        details.put("roll", roll);
        details.put("difficulty", difficulty);
        details.put("successChance", successChance);
        return details;
    }
}
