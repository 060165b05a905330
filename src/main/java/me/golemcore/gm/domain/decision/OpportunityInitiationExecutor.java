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
import me.golemcore.gm.domain.model.BranchInitiationResult;
import me.golemcore.gm.domain.model.BranchRejectionReason;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.Opportunity;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.port.outbound.BranchHandlerPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts the narrative branch behind an opportunity the interpreter aligned
 * the input with.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpportunityInitiationExecutor implements ActionExecutor {

    private final BranchHandlerPort branchHandler;
    private final GameEventRecorder eventRecorder;

    @Override
    public ActionType type() {
        return ActionType.OPPORTUNITY_INITIATION;
    }

    @Override
    public ActionResult execute(DecisionContext context, String opportunityId) {
        BranchInitiationResult initiation;
        try {
            initiation = branchHandler.attemptInitiate(opportunityId, context.playerId(), context.sessionId());
        } catch (RuntimeException e) {
            throw new CollaboratorException("Branch handler failed for opportunity " + opportunityId, e);
        }
        if (initiation == null) {
            throw new CollaboratorException("Branch handler returned no result for opportunity " + opportunityId,
                    null);
        }

        String branchName = opportunityName(context, opportunityId);
        if (initiation.success()) {
            Map<String, Object> eventContext = new LinkedHashMap<>();
            eventContext.put("opportunityId", opportunityId);
            eventContext.put("branchId", initiation.newBranchId());
            eventContext.put("branchName", branchName);
            eventContext.put("message", initiation.message());
            eventRecorder.record(context.sessionId(), GameEventType.NARRATIVE_BRANCH_INITIATED,
                    context.playerId(), eventContext);
            log.info("[Decision] Opportunity {} started branch {}", opportunityId, initiation.newBranchId());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("opportunityId", opportunityId);
            details.put("branchName", branchName);
            details.put("message", initiation.message());
            details.put("newBranchId", initiation.newBranchId());
            return ActionResult.builder()
                    .outcome(ActionOutcome.SUCCESS)
                    .actionType(ActionType.OPPORTUNITY_INITIATION)
                    .details(details)
                    .mechanicsTriggered(true)
                    .branchId(initiation.newBranchId())
                    .narrativeContext(Map.of("opportunityAccepted", true, "newNarrativePath", true))
                    .build();
        }

        BranchRejectionReason reason = BranchRejectionReason.fromValue(initiation.rejectionReason());
        log.info("[Decision] Opportunity {} rejected: {}", opportunityId, reason.value());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("opportunityId", opportunityId);
        details.put("failureReason", reason.value());
        details.put("message", initiation.message());
        return ActionResult.builder()
                .outcome(ActionOutcome.FAILURE)
                .actionType(ActionType.OPPORTUNITY_INITIATION)
                .details(details)
                .mechanicsTriggered(false)
                .errorMessage(reason.value())
                .narrativeContext(Map.of("opportunityBlocked", true, "reason", reason.value()))
                .build();
    }

    private String opportunityName(DecisionContext context, String opportunityId) {
        return context.pendingOpportunities().stream()
                .filter(opportunity -> opportunityId.equals(opportunity.opportunityId()))
                .map(Opportunity::name)
                .filter(name -> name != null && !name.isBlank())
                .findFirst()
                .orElse(opportunityId);
    }
}
