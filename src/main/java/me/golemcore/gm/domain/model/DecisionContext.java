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

import java.util.List;

/**
 * Immutable input of one decision: everything the external parser, the
 * interpreter and the narrative branch state reported for a single player
 * input.
 *
 * <p>
 * {@code sessionId} and {@code playerId} are required. Every other field is
 * optional and normalized so that absence never breaks the decision ladder.
 */
@Builder
public record DecisionContext(
        String sessionId,
        String playerId,
        String rawInput,
        ParsedCommand parsedCommand,
        InterpreterOutput interpreterOutput,
        String currentBranchId,
        BranchStage currentStage,
        WorldState worldState,
        PlayerContext playerContext,
        List<Opportunity> pendingOpportunities) {

    public DecisionContext {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("playerId is required");
        }
        rawInput = rawInput != null ? rawInput : "";
        worldState = worldState != null ? worldState : WorldState.stable();
        playerContext = playerContext != null ? playerContext : PlayerContext.empty();
        pendingOpportunities = pendingOpportunities != null ? List.copyOf(pendingOpportunities) : List.of();
    }

    public boolean hasActiveBranch() {
        return currentBranchId != null && !currentBranchId.isBlank();
    }

    public boolean hasInterpreterOutput() {
        return interpreterOutput != null;
    }
}
