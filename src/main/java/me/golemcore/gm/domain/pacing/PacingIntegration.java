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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.AmbientDecision;
import me.golemcore.gm.domain.model.AmbientNarration;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.model.GameEvent;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.NpcInitiative;
import me.golemcore.gm.domain.model.NpcInitiativeCandidate;
import me.golemcore.gm.domain.model.PacingIntegrationStats;
import me.golemcore.gm.domain.model.StoryContext;
import me.golemcore.gm.domain.model.SummaryResult;
import me.golemcore.gm.infrastructure.config.GmProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Feeds decisions into the pacing components and exposes the polling entry
 * points the host calls on its own cadence.
 *
 * <pre>
 * input → onPlayerInput → decide → onResponse
 * host timer → checkAmbient / checkNpcInitiative / checkSummary
 * </pre>
 */
@Service
@Slf4j
public class PacingIntegration {

    private final PacingSessionRegistry registry;
    private final PacingManager pacingManager;
    private final IdleNpcManager idleNpcManager;
    private final EventSummarizer eventSummarizer;
    private final Clock clock;
    private final GmProperties.IntegrationProperties settings;

    public PacingIntegration(PacingSessionRegistry registry, PacingManager pacingManager,
            IdleNpcManager idleNpcManager, EventSummarizer eventSummarizer, Clock clock,
            GmProperties properties) {
        this.registry = registry;
        this.pacingManager = pacingManager;
        this.idleNpcManager = idleNpcManager;
        this.eventSummarizer = eventSummarizer;
        this.clock = clock;
        this.settings = properties.getIntegration();
    }

    public void onPlayerInput(String sessionId) {
        pacingManager.recordPlayerInput(sessionId);
    }

    /**
     * Updates pacing after a decision and records the derived ledger event.
     */
    public void onResponse(String sessionId, String rawInput, DecisionResult result, GameContext context) {
        registry.session(sessionId).recordInputProcessed();
        pacingManager.updateActivity(sessionId, result, context);
        toLedgerEvent(sessionId, result).ifPresent(event -> eventSummarizer.addEvent(sessionId, event));
        log.debug("[Pacing] Processed input '{}' for session {}", rawInput, sessionId);
    }

    /**
     * Records how the world reacted to the player. An attitude shift counts as
     * a significant event.
     */
    public void recordWorldReaction(String sessionId, String targetEntity, boolean attitudeShift) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("targetEntity", targetEntity);
        context.put("attitudeShift", attitudeShift);
        eventSummarizer.addEvent(sessionId, GameEvent.builder()
                .sessionId(sessionId)
                .eventType(GameEventType.WORLD_REACTION_ASSESSED)
                .actor(targetEntity)
                .context(context)
                .timestamp(clock.instant())
                .build());
        if (attitudeShift) {
            pacingManager.markSignificantEvent(sessionId);
        }
    }

    public Optional<AmbientNarration> checkAmbient(String sessionId, GameContext context) {
        AmbientDecision decision = pacingManager.shouldInjectAmbient(sessionId, context);
        if (!decision.inject()) {
            return Optional.empty();
        }
        String content = pacingManager.generateAmbientContent(sessionId, decision.trigger(), context);
        if (content == null) {
            return Optional.empty();
        }
        registry.session(sessionId).recordAmbientDelivered();
        return Optional.of(new AmbientNarration(sessionId, decision.trigger(), content, clock.instant()));
    }

    /**
     * Lets the first eligible present NPC speak up, measuring idle time from
     * the last player input.
     */
    public Optional<NpcInitiative> checkNpcInitiative(String sessionId, GameContext context) {
        PacingSession session = registry.session(sessionId);
        Duration idle = session.getMetrics().sincePlayerInput(clock.instant());
        Optional<NpcInitiativeCandidate> candidate = idleNpcManager.firstEligible(sessionId, context, idle);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        Optional<NpcInitiative> initiative = idleNpcManager.generateInitiative(sessionId,
                candidate.get().npcId(), candidate.get().theme(), context);
        initiative.ifPresent(delivered -> {
            session.recordNpcInitiativeDelivered();
            eventSummarizer.addEvent(sessionId, initiativeEvent(sessionId, delivered));
        });
        return initiative;
    }

    private GameEvent initiativeEvent(String sessionId, NpcInitiative initiative) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("npcName", initiative.npcName());
        context.put("dialogueTheme", initiative.theme().value());
        return GameEvent.builder()
                .sessionId(sessionId)
                .eventType(GameEventType.NPC_INITIATED_DIALOGUE)
                .actor(initiative.npcId())
                .context(context)
                .timestamp(clock.instant())
                .build();
    }

    public Optional<SummaryResult> checkSummary(String sessionId) {
        if (!eventSummarizer.shouldSummarize(sessionId)) {
            return Optional.empty();
        }
        return eventSummarizer.createSummary(sessionId);
    }

    public StoryContext storyContext(String sessionId) {
        return eventSummarizer.storyContext(sessionId);
    }

    /**
     * A session is stale when no input arrived within the stale threshold.
     * Unknown sessions are never stale.
     */
    public boolean isSessionStale(String sessionId) {
        Instant now = clock.instant();
        return registry.find(sessionId)
                .map(session -> session.getMetrics().sincePlayerInput(now)
                        .compareTo(settings.getStaleSessionThreshold()) > 0)
                .orElse(false);
    }

    public PacingIntegrationStats statistics(String sessionId) {
        PacingSession session = registry.session(sessionId);
        return new PacingIntegrationStats(
                pacingManager.statistics(sessionId),
                idleNpcManager.statistics(sessionId),
                eventSummarizer.statistics(sessionId),
                session.getInputsProcessed(),
                session.getAmbientDelivered(),
                session.getNpcInitiativesDelivered());
    }

    public boolean endSession(String sessionId) {
        boolean removed = registry.remove(sessionId);
        if (removed) {
            log.info("[Pacing] Session {} ended", sessionId);
        }
        return removed;
    }

    private Optional<GameEvent> toLedgerEvent(String sessionId, DecisionResult result) {
        if (result == null || !result.hasActionResult()) {
            return Optional.empty();
        }
        ActionResult action = result.actionResult();
        Map<String, Object> context = new LinkedHashMap<>();
        GameEventType type;
        switch (action.actionType()) {
        case OPPORTUNITY_INITIATION:
            if (!action.isSuccess()) {
                return Optional.empty();
            }
            type = GameEventType.NARRATIVE_BRANCH_INITIATED;
            context.put("branchId", action.branchId());
            context.put("branchName", action.details().getOrDefault("branchName", action.branchId()));
            break;
        case BRANCH_ACTION:
            type = GameEventType.BRANCH_ACTION_EXECUTED;
            context.put("action", action.details().get("action"));
            context.put("success", action.isSuccess());
            break;
        case PARSED_COMMAND:
            type = GameEventType.COMMAND_EXECUTED;
            context.put("action", action.details().get("command"));
            context.put("target", action.details().get("target"));
            context.put("success", action.isSuccess());
            break;
        default:
            return Optional.empty();
        }
        return Optional.of(GameEvent.builder()
                .sessionId(sessionId)
                .eventType(type)
                .context(context)
                .timestamp(clock.instant())
                .build());
    }
}
