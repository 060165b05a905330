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
 * The fixed five-tier priority ladder. Lower level wins; there is no scoring
 * and no re-ordering.
 */
public enum DecisionPriority {

    OPPORTUNITY_ALIGNMENT(1),
    BRANCH_ACTION_ALIGNMENT(2),
    PARSED_COMMAND(3),
    GENERAL_INTERPRETATION(4),
    FALLBACK(5);

    private final int level;

    DecisionPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Opportunity and branch-action alignments are narratively significant on
     * their own, regardless of outcome.
     */
    public boolean isNarrativeAlignment() {
        return this == OPPORTUNITY_ALIGNMENT || this == BRANCH_ACTION_ALIGNMENT;
    }
}
