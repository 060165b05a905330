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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.SkillCheckResult;
import me.golemcore.gm.domain.service.GameEventRecorder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves a branch action that is legal in the current stage with a skill
 * check. The stage legality itself is checked by the decision engine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BranchActionExecutor implements ActionExecutor {

    static final String FAILURE_REASON = "the attempt was not quite successful";

    private final SkillCheckEvaluator skillCheckEvaluator;
    private final GameEventRecorder eventRecorder;

    @Override
    public ActionType type() {
        return ActionType.BRANCH_ACTION;
    }

    @Override
    public ActionResult execute(DecisionContext context, String action) {
        SkillCheckResult skillCheck = skillCheckEvaluator.evaluate(context.worldState());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", action);
        details.put("skillCheck", skillCheck.toDetails());

        if (skillCheck.success()) {
            Map<String, Object> eventContext = new LinkedHashMap<>();
            eventContext.put("branchId", context.currentBranchId());
            eventContext.put("action", action);
            eventContext.put("success", true);
            eventContext.put("skillCheck", skillCheck.toDetails());
            eventRecorder.record(context.sessionId(), GameEventType.BRANCH_ACTION_EXECUTED, context.playerId(),
                    eventContext);
            log.debug("[Decision] Branch {} advanced by {} (roll {})", context.currentBranchId(), action,
                    skillCheck.roll());

            details.put("branchProgress", "advanced");
            return ActionResult.builder()
                    .outcome(ActionOutcome.SUCCESS)
                    .actionType(ActionType.BRANCH_ACTION)
                    .details(details)
                    .mechanicsTriggered(true)
                    .branchId(context.currentBranchId())
                    .narrativeContext(Map.of("actionSuccessful", true, "skillCheckPassed", true, "progressMade",
                            true))
                    .build();
        }

        details.put("failureReason", FAILURE_REASON);
        return ActionResult.builder()
                .outcome(ActionOutcome.FAILURE)
                .actionType(ActionType.BRANCH_ACTION)
                .details(details)
                .mechanicsTriggered(true)
                .branchId(context.currentBranchId())
                .narrativeContext(Map.of("actionAttempted", true, "skillCheckFailed", true, "setbackOccurred", true))
                .build();
    }
}
