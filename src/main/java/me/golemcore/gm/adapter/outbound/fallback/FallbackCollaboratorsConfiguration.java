package me.golemcore.gm.adapter.outbound.fallback;

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
import me.golemcore.gm.domain.model.BranchInitiationResult;
import me.golemcore.gm.domain.model.BranchRejectionReason;
import me.golemcore.gm.port.outbound.BranchHandlerPort;
import me.golemcore.gm.port.outbound.DialogueGeneratorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Stand-ins for collaborators the host did not provide. Without a branch
 * system no opportunity can start; without a dialogue renderer NPCs stay
 * silent.
 */
@Configuration
@Slf4j
public class FallbackCollaboratorsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BranchHandlerPort branchHandlerPort() {
        log.info("[Fallback] No branch handler provided, opportunities will be rejected");
        return (opportunityId, playerId, sessionId) -> BranchInitiationResult.rejected(
                BranchRejectionReason.CONDITIONS_NOT_MET, "No narrative branch system is configured");
    }

    @Bean
    @ConditionalOnMissingBean
    public DialogueGeneratorPort dialogueGeneratorPort() {
        log.info("[Fallback] No dialogue generator provided, NPC initiatives disabled");
        return (npcId, themes, context) -> null;
    }
}
