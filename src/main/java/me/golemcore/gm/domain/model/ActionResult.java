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
import java.util.Map;

/**
 * Result of a single executed action. Owned by the {@link DecisionResult} that
 * produced it.
 *
 * @param outcome
 *            the outcome of the action
 * @param actionType
 *            which executor produced the result
 * @param details
 *            executor specific details (never null)
 * @param mechanicsTriggered
 *            whether game mechanics (skill checks, branch state) were touched
 * @param branchId
 *            branch affected by the action, if any
 * @param errorMessage
 *            machine-readable failure reason, if any
 * @param narrativeContext
 *            hints for the prose renderer (never null)
 */
@Builder
public record ActionResult(
        ActionOutcome outcome,
        ActionType actionType,
        Map<String, Object> details,
        boolean mechanicsTriggered,
        String branchId,
        String errorMessage,
        Map<String, Object> narrativeContext) {

    public ActionResult {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        narrativeContext = narrativeContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(narrativeContext))
                : Map.of();
    }

    public boolean isSuccess() {
        return outcome == ActionOutcome.SUCCESS;
    }
}
