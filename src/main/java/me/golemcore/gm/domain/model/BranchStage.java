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

import java.util.Set;

/**
 * The currently active step of a narrative branch and the actions that are
 * legal in it.
 */
public record BranchStage(String stageId, Set<String> availableActions) {

    public BranchStage {
        availableActions = availableActions != null ? Set.copyOf(availableActions) : Set.of();
    }

    public boolean allows(String action) {
        return action != null && availableActions.contains(action);
    }
}
