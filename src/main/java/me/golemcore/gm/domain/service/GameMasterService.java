package me.golemcore.gm.domain.service;

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
import me.golemcore.gm.domain.decision.DecisionEngine;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.pacing.PacingIntegration;
import org.springframework.stereotype.Service;

/**
 * Turn pipeline for one player input: stamp the input, decide, then feed the
 * decision into pacing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameMasterService {

    private final DecisionEngine decisionEngine;
    private final PacingIntegration pacingIntegration;

    public DecisionResult handleInput(DecisionContext decisionContext, GameContext gameContext) {
        if (decisionContext == null) {
            return decisionEngine.decide(null);
        }
        String sessionId = decisionContext.sessionId();
        pacingIntegration.onPlayerInput(sessionId);
        DecisionResult result = decisionEngine.decide(decisionContext);
        try {
            pacingIntegration.onResponse(sessionId, decisionContext.rawInput(), result, gameContext);
        } catch (RuntimeException e) {
            log.warn("[GameMaster] Pacing update failed for session {}: {}", sessionId, e.getMessage());
        }
        log.debug("[GameMaster] Session {} input handled at priority {}", sessionId,
                result.priorityUsed().level());
        return result;
    }
}
