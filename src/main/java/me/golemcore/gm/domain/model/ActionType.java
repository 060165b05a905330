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
 * Closed set of action kinds the decision engine can dispatch. Each value is
 * served by exactly one {@code ActionExecutor}.
 */
public enum ActionType {

    OPPORTUNITY_INITIATION("opportunity_initiation"),
    BRANCH_ACTION("branch_action"),
    PARSED_COMMAND("parsed_command"),
    GENERAL_INTERPRETATION("general_interpretation"),
    FALLBACK_RESPONSE("fallback_response"),
    ERROR("error");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    /**
     * Machine-readable name used in logs and event records.
     */
    public String value() {
        return value;
    }

    /**
     * Whether a successful action of this type moves a narrative branch forward.
     */
    public boolean progressesBranch() {
        return this == OPPORTUNITY_INITIATION || this == BRANCH_ACTION;
    }
}
