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
import java.util.Map;

/**
 * Snapshot of pacing statistics for one session.
 */
@Builder
public record PacingStats(
        PacingState currentState,
        Duration sinceSignificantEvent,
        Duration sinceBranchProgression,
        Duration inCurrentLocation,
        long totalInjections,
        Map<AmbientTrigger, Long> triggerUsage,
        Map<PacingState, Long> stateChanges,
        long templatingFailures) {

    public PacingStats {
        triggerUsage = triggerUsage != null ? Map.copyOf(triggerUsage) : Map.of();
        stateChanges = stateChanges != null ? Map.copyOf(stateChanges) : Map.of();
    }
}
