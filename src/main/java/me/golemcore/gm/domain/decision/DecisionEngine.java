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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.DecisionPriority;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.DecisionStats;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.InterpreterOutput;
import me.golemcore.gm.domain.model.ParsedCommand;
import me.golemcore.gm.domain.service.GameEventRecorder;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arbitrates every player input through a fixed five-rung priority ladder and
 * executes exactly one action.
 *
 * <ol>
 * <li>Opportunity alignment: the interpreter tied the input to a pending
 * opportunity; the branch handler is asked to start it.</li>
 * <li>Branch action alignment: the interpreter suggested an action of the
 * active branch. The action is re-validated against the current stage; a stale
 * suggestion is rejected explicitly and resolved at rung 4. Without an active
 * branch the ladder continues at rung 3.</li>
 * <li>Unambiguous parsed command, dispatched through {@link CommandVerb}.</li>
 * <li>General interpreter acknowledgement, no mechanics.</li>
 * <li>Fallback asking the player to clarify.</li>
 * </ol>
 *
 * <p>
 * The first rung that applies wins; there is no scoring. {@link #decide}
 * never throws: an internal failure yields an {@code INVALID} result at rung
 * 5. A failing collaborator at rung 1 degrades the decision to the next rung.
 */
@Service
@Slf4j
public class DecisionEngine {

    public static final String BRANCH_ACTION_REJECTION = "branchActionRejection";
    public static final String NO_ACTIVE_BRANCH = "no_active_branch";
    public static final String ACTION_NOT_AVAILABLE_IN_STAGE = "action_not_available_in_stage";
    public static final String DEGRADED_FROM = "degradedFrom";

    private final Map<ActionType, ActionExecutor> executors = new EnumMap<>(ActionType.class);
    private final NarrativeResponseComposer responses;
    private final GameEventRecorder eventRecorder;
    private final DecisionMetrics metrics = new DecisionMetrics();

    public DecisionEngine(List<ActionExecutor> actionExecutors, NarrativeResponseComposer responses,
            GameEventRecorder eventRecorder) {
        this.responses = responses;
        this.eventRecorder = eventRecorder;
        for (ActionExecutor executor : actionExecutors) {
            ActionExecutor previous = executors.put(executor.type(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate executor for action type " + executor.type());
            }
        }
        for (ActionType type : ActionType.values()) {
            if (type != ActionType.ERROR && !executors.containsKey(type)) {
                throw new IllegalStateException("No executor registered for action type " + type);
            }
        }
    }

    /**
     * Decides and executes the action for one player input.
     *
     * @param context
     *            the decision context; null yields an {@code INVALID} result
     * @return exactly one decision result, never null
     */
    public DecisionResult decide(DecisionContext context) {
        DecisionResult result;
        if (context == null) {
            result = errorDecision("decision context is required");
        } else {
            try {
                result = runLadder(context);
            } catch (RuntimeException e) {
                log.error("[Decision] Failed to decide for session {}: {}", context.sessionId(), e.getMessage(), e);
                result = errorDecision(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        metrics.record(result);
        if (context != null) {
            recordDecision(context, result);
        }
        return result;
    }

    public DecisionStats statistics() {
        return metrics.snapshot();
    }

    private DecisionResult runLadder(DecisionContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        InterpreterOutput interpretation = context.interpreterOutput();

        if (interpretation != null && interpretation.hasAlignedOpportunity()) {
            String opportunityId = interpretation.alignedOpportunityId().trim();
            try {
                ActionResult result = executor(ActionType.OPPORTUNITY_INITIATION).execute(context, opportunityId);
                metadata.put("opportunityId", opportunityId);
                return decision(DecisionPriority.OPPORTUNITY_ALIGNMENT, result,
                        result.isSuccess()
                                ? responses.opportunityStarted(interpretation, result)
                                : responses.opportunityRejected(interpretation, result),
                        responses.opportunityEnhancements(result), false, metadata);
            } catch (CollaboratorException e) {
                metrics.recordCollaboratorFailure();
                log.warn("[Decision] {}; degrading from priority {}", e.getMessage(),
                        DecisionPriority.OPPORTUNITY_ALIGNMENT.level());
                metadata.put(DEGRADED_FROM, DecisionPriority.OPPORTUNITY_ALIGNMENT.level());
            }
        }

        // A rejected branch action skips the parsed command and resolves at rule 4 or 5.
        boolean branchActionRejected = false;
        boolean staleBranchAction = false;
        if (interpretation != null && interpretation.hasAlignedBranchAction()) {
            String action = interpretation.alignedBranchAction().trim();
            if (!context.hasActiveBranch()) {
                metadata.put(BRANCH_ACTION_REJECTION, NO_ACTIVE_BRANCH);
                branchActionRejected = true;
                log.debug("[Decision] Branch action {} rejected: no active branch", action);
            } else if (context.currentStage() == null || !context.currentStage().allows(action)) {
                metadata.put(BRANCH_ACTION_REJECTION, ACTION_NOT_AVAILABLE_IN_STAGE);
                metadata.put("rejectedBranchAction", action);
                branchActionRejected = true;
                staleBranchAction = true;
                log.debug("[Decision] Branch action {} not available in stage {}", action,
                        context.currentStage() != null ? context.currentStage().stageId() : null);
            } else {
                ActionResult result = executor(ActionType.BRANCH_ACTION).execute(context, action);
                metadata.put("branchId", context.currentBranchId());
                metadata.put("stageId", context.currentStage().stageId());
                return decision(DecisionPriority.BRANCH_ACTION_ALIGNMENT, result, responses.branchAction(result),
                        responses.branchEnhancements(result), false, metadata);
            }
        }

        ParsedCommand command = context.parsedCommand();
        if (!branchActionRejected && command != null && command.isUnambiguous()) {
            ActionResult result = executor(ActionType.PARSED_COMMAND).execute(context, command.action());
            return decision(DecisionPriority.PARSED_COMMAND, result, responses.parsedCommand(result),
                    responses.commandEnhancements(), false, metadata);
        }

        if (staleBranchAction || interpretation != null && interpretation.hasGeneralInterpretation()) {
            ActionResult result = executor(ActionType.GENERAL_INTERPRETATION).execute(context, null);
            boolean followup = interpretation != null && interpretation.followupRequested();
            return decision(DecisionPriority.GENERAL_INTERPRETATION, result,
                    responses.generalInterpretation(interpretation), responses.interpretationEnhancements(),
                    followup, metadata);
        }

        ActionResult result = executor(ActionType.FALLBACK_RESPONSE).execute(context, null);
        return decision(DecisionPriority.FALLBACK, result, responses.fallback(interpretation), List.of(), true,
                metadata);
    }

    private ActionExecutor executor(ActionType type) {
        return executors.get(type);
    }

    private DecisionResult decision(DecisionPriority priority, ActionResult result, String response,
            List<String> enhancements, boolean requiresFollowup, Map<String, Object> metadata) {
        log.debug("[Decision] Priority {} -> {} ({})", priority.level(), result.outcome().value(),
                result.actionType().value());
        return DecisionResult.builder()
                .priorityUsed(priority)
                .actionResult(result)
                .gmResponseBase(response)
                .narrativeEnhancements(enhancements)
                .requiresFollowup(requiresFollowup)
                .metadata(metadata)
                .build();
    }

    private DecisionResult errorDecision(String errorMessage) {
        ActionResult result = ActionResult.builder()
                .outcome(ActionOutcome.INVALID)
                .actionType(ActionType.ERROR)
                .details(Map.of("error", errorMessage))
                .mechanicsTriggered(false)
                .errorMessage(errorMessage)
                .build();
        return DecisionResult.builder()
                .priorityUsed(DecisionPriority.FALLBACK)
                .actionResult(result)
                .gmResponseBase(responses.error())
                .narrativeEnhancements(responses.errorEnhancements())
                .requiresFollowup(true)
                .metadata(Map.of("error", true))
                .build();
    }

    private void recordDecision(DecisionContext context, DecisionResult result) {
        Map<String, Object> eventContext = new LinkedHashMap<>();
        eventContext.put("priorityUsed", result.priorityUsed().name());
        eventContext.put("outcome", result.outcome().value());
        eventContext.put("actionType", result.actionResult().actionType().value());
        eventContext.put("rawInput", context.rawInput());
        eventRecorder.record(context.sessionId(), GameEventType.DECISION_MADE, context.playerId(), eventContext);
    }
}
