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

import java.util.Locale;

/**
 * Machine-readable reasons for refusing to start a narrative branch.
 */
public enum BranchRejectionReason {

    CONDITIONS_NOT_MET("conditions_not_met",
            "but the circumstances don't seem quite right for that course of action"),
    ALREADY_ACTIVE("already_active",
            "but you're already committed to another endeavor"),
    WORLD_STATE_BLOCKING("world_state_blocking",
            "but current events make that path unavailable"),
    PLAYER_STATE_BLOCKING("player_state_blocking",
            "but you're not in the right condition for such an undertaking");

    private final String value;
    private final String narrativePhrase;

    BranchRejectionReason(String value, String narrativePhrase) {
        this.value = value;
        this.narrativePhrase = narrativePhrase;
    }

    public String value() {
        return value;
    }

    /**
     * Clause appended to the acknowledgement when explaining the refusal.
     */
    public String narrativePhrase() {
        return narrativePhrase;
    }

    /**
     * Maps a reason reported by the branch handler. Unknown or missing reasons
     * become {@link #CONDITIONS_NOT_MET}.
     */
    public static BranchRejectionReason fromValue(String value) {
        if (value == null) {
            return CONDITIONS_NOT_MET;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BranchRejectionReason reason : values()) {
            if (reason.value.equals(normalized)) {
                return reason;
            }
        }
        return CONDITIONS_NOT_MET;
    }
}
