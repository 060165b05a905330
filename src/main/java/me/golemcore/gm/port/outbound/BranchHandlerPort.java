package me.golemcore.gm.port.outbound;

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

import me.golemcore.gm.domain.model.BranchInitiationResult;

/**
 * Port to the narrative branch system that owns branch state.
 */
public interface BranchHandlerPort {

    /**
     * Attempts to start the branch behind an opportunity.
     *
     * @param opportunityId
     *            the opportunity the player aligned with
     * @param playerId
     *            the acting player
     * @param sessionId
     *            the session
     * @return the initiation result; a rejection carries a machine-readable
     *         reason
     */
    BranchInitiationResult attemptInitiate(String opportunityId, String playerId, String sessionId);
}
