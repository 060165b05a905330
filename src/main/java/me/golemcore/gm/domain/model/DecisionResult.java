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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal result of one decision. Exactly one is produced per call to the
 * decision engine.
 */
@Builder
public record DecisionResult(
        DecisionPriority priorityUsed,
        ActionResult actionResult,
        String gmResponseBase,
        List<String> narrativeEnhancements,
        boolean requiresFollowup,
        Map<String, Object> metadata) {

    public DecisionResult {
        narrativeEnhancements = narrativeEnhancements != null ? List.copyOf(narrativeEnhancements) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public ActionOutcome outcome() {
        return actionResult != null ? actionResult.outcome() : ActionOutcome.INVALID;
    }

    public boolean hasActionResult() {
        return actionResult != null;
    }
}
