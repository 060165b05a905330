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

import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionContext;

/**
 * Executes the action chosen by one rung of the decision ladder. Each
 * {@link ActionType} is served by exactly one executor.
 */
public interface ActionExecutor {

    ActionType type();

    /**
     * Executes the action.
     *
     * @param context
     *            the decision context
     * @param argument
     *            rule specific argument (opportunity id, branch action), may be
     *            null
     * @return the action result, never null
     * @throws CollaboratorException
     *             when an external collaborator failed
     */
    ActionResult execute(DecisionContext context, String argument);
}
