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
 * Types of game events recorded by the core. Only events with a positive
 * significance are kept in the summarization ledger.
 */
public enum GameEventType {

    NARRATIVE_BRANCH_INITIATED(5),
    BRANCH_ACTION_EXECUTED(4),
    WORLD_REACTION_ASSESSED(3),
    COMMAND_EXECUTED(2),
    NPC_INITIATED_DIALOGUE(2),
    DECISION_MADE(0),
    AMBIENT_CONTENT_INJECTED(0),
    EVENT_SUMMARY_CREATED(0);

    private final int significance;

    GameEventType(int significance) {
        this.significance = significance;
    }

    /**
     * Significance 1..5 used to rank ledger entries; 0 for events never
     * summarized.
     */
    public int significance() {
        return significance;
    }

    public boolean isSummarizable() {
        return significance > 0;
    }
}
