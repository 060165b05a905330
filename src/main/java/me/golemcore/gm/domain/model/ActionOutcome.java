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
 * Outcome of an executed action. Every decision reports exactly one outcome.
 */
public enum ActionOutcome {

    SUCCESS("success"),

    FAILURE("failure"),

    PARTIAL_SUCCESS("partial_success"),

    /**
     * The input was not actionable; the host should ask the player to clarify.
     */
    REQUIRES_FOLLOWUP("requires_followup"),

    BLOCKED("blocked"),

    /**
     * Internal failure while deciding or executing.
     */
    INVALID("invalid");

    private final String value;

    ActionOutcome(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
