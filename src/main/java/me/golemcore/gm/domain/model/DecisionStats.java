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

import java.util.Map;

/**
 * Immutable snapshot of decision counters.
 */
public record DecisionStats(
        long totalDecisions,
        Map<DecisionPriority, Long> priorityUsage,
        Map<ActionOutcome, Long> actionOutcomes,
        long collaboratorFailures) {

    public DecisionStats {
        priorityUsage = Map.copyOf(priorityUsage);
        actionOutcomes = Map.copyOf(actionOutcomes);
    }

    public long priorityCount(DecisionPriority priority) {
        return priorityUsage.getOrDefault(priority, 0L);
    }

    public long outcomeCount(ActionOutcome outcome) {
        return actionOutcomes.getOrDefault(outcome, 0L);
    }

    public double successRate() {
        return (double) outcomeCount(ActionOutcome.SUCCESS) / Math.max(1, totalDecisions);
    }
}
