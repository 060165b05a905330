package me.golemcore.gm.domain.pacing;

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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.gm.domain.model.AmbientTrigger;
import me.golemcore.gm.domain.model.LedgerEntry;
import me.golemcore.gm.domain.model.NpcInitiativeState;
import me.golemcore.gm.domain.model.PacingMetrics;
import me.golemcore.gm.domain.model.PacingState;
import me.golemcore.gm.domain.model.StorySummary;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All pacing-side state of one game session: pacing metrics, NPC initiative
 * bookkeeping and the event ledger with its running digest. The host drives a
 * session from one thread at a time, so nothing here is synchronized.
 */
@Getter
public class PacingSession {

    private static final Duration INITIAL_SUMMARY_AGE = Duration.ofDays(1);

    private final String sessionId;
    private final Instant createdAt;
    private final PacingMetrics metrics;

    private final Map<AmbientTrigger, Long> triggerUsage = new EnumMap<>(AmbientTrigger.class);
    private final Map<PacingState, Long> stateChanges = new EnumMap<>(PacingState.class);
    private long totalInjections;
    private long templatingFailures;

    private final Map<String, NpcInitiativeState> npcStates = new LinkedHashMap<>();
    private int sessionInitiativeCount;

    private final List<LedgerEntry> ledger = new ArrayList<>();
    @Setter
    private StorySummary summary;
    @Setter
    private Instant lastSummaryAt;
    private long summariesCreated;
    private long eventsSummarized;
    private long tokensSavedEstimate;

    private long inputsProcessed;
    private long ambientDelivered;
    private long npcInitiativesDelivered;

    public PacingSession(String sessionId, Instant now) {
        this.sessionId = sessionId;
        this.createdAt = now;
        this.metrics = PacingMetrics.startingAt(now);
        this.lastSummaryAt = now.minus(INITIAL_SUMMARY_AGE);
    }

    public Map<AmbientTrigger, Long> getTriggerUsage() {
        return Collections.unmodifiableMap(triggerUsage);
    }

    public Map<PacingState, Long> getStateChanges() {
        return Collections.unmodifiableMap(stateChanges);
    }

    public Map<String, NpcInitiativeState> getNpcStates() {
        return Collections.unmodifiableMap(npcStates);
    }

    /**
     * Read-only view of the pending ledger, oldest first.
     */
    public List<LedgerEntry> getLedger() {
        return Collections.unmodifiableList(ledger);
    }

    void appendToLedger(LedgerEntry entry) {
        ledger.add(entry);
    }

    void clearLedger() {
        ledger.clear();
    }

    void recordStateChange(PacingState state) {
        stateChanges.merge(state, 1L, Long::sum);
    }

    void recordInjection(AmbientTrigger trigger) {
        totalInjections++;
        triggerUsage.merge(trigger, 1L, Long::sum);
    }

    void recordTemplatingFailure() {
        templatingFailures++;
    }

    NpcInitiativeState npcState(String npcId) {
        return npcStates.computeIfAbsent(npcId, id -> new NpcInitiativeState());
    }

    void recordNpcInitiative(String npcId, Instant now) {
        npcState(npcId).recordInitiative(now);
        sessionInitiativeCount++;
    }

    void recordSummary(int events, long tokensSaved) {
        summariesCreated++;
        eventsSummarized += events;
        tokensSavedEstimate += tokensSaved;
    }

    void recordInputProcessed() {
        inputsProcessed++;
    }

    void recordAmbientDelivered() {
        ambientDelivered++;
    }

    void recordNpcInitiativeDelivered() {
        npcInitiativesDelivered++;
    }
}
