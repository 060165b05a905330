package me.golemcore.gm.domain.decision;

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

import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.DecisionPriority;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.DecisionStats;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decision counters. Every recorded decision increments the total, exactly
 * one priority counter and exactly one outcome counter.
 */
public class DecisionMetrics {

    private final AtomicLong totalDecisions = new AtomicLong();
    private final AtomicLong collaboratorFailures = new AtomicLong();
    private final Map<DecisionPriority, AtomicLong> priorityUsage = new EnumMap<>(DecisionPriority.class);
    private final Map<ActionOutcome, AtomicLong> actionOutcomes = new EnumMap<>(ActionOutcome.class);

    public DecisionMetrics() {
        for (DecisionPriority priority : DecisionPriority.values()) {
            priorityUsage.put(priority, new AtomicLong());
        }
        for (ActionOutcome outcome : ActionOutcome.values()) {
            actionOutcomes.put(outcome, new AtomicLong());
        }
    }

    public void record(DecisionResult result) {
        totalDecisions.incrementAndGet();
        priorityUsage.get(result.priorityUsed()).incrementAndGet();
        actionOutcomes.get(result.outcome()).incrementAndGet();
    }

    public void recordCollaboratorFailure() {
        collaboratorFailures.incrementAndGet();
    }

    public DecisionStats snapshot() {
        Map<DecisionPriority, Long> priorities = new EnumMap<>(DecisionPriority.class);
        priorityUsage.forEach((priority, counter) -> priorities.put(priority, counter.get()));
        Map<ActionOutcome, Long> outcomes = new EnumMap<>(ActionOutcome.class);
        actionOutcomes.forEach((outcome, counter) -> outcomes.put(outcome, counter.get()));
        return new DecisionStats(totalDecisions.get(), priorities, outcomes, collaboratorFailures.get());
    }
}
