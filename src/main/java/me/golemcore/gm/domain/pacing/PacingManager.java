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
import me.golemcore.gm.domain.model.AmbientDecision;
import me.golemcore.gm.domain.model.AmbientTrigger;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.PacingMetrics;
import me.golemcore.gm.domain.model.PacingState;
import me.golemcore.gm.domain.model.PacingStats;
import me.golemcore.gm.domain.model.WorldState;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.infrastructure.config.GmProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Keeps the rhythm of a session and decides when ambient narration is
 * injected.
 *
 * <p>
 * The pacing state is recomputed on every update and refreshed lazily before
 * each ambient check, so a host that only polls still sees elapsed time. State
 * order: STAGNANT (no branch progression), LULL (no significant event), ACTIVE
 * (enough interactions in the rolling hour), otherwise SETTLING.
 */
@Service
@Slf4j
public class PacingManager {

    public static final String ATTITUDE_SHIFT = "attitudeShift";

    private static final Set<String> NOTABLE_SEASONS = Set.of("autumn", "winter");
    private static final String DEFAULT_TIME_OF_DAY = "day";

    private final PacingSessionRegistry registry;
    private final AmbientTemplateEngine templateEngine;
    private final GameEventRecorder eventRecorder;
    private final Clock clock;
    private final Random random;
    private final GmProperties.PacingProperties settings;

    public PacingManager(PacingSessionRegistry registry, AmbientTemplateEngine templateEngine,
            GameEventRecorder eventRecorder, Clock clock, Random random, GmProperties properties) {
        this.registry = registry;
        this.templateEngine = templateEngine;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.random = random;
        this.settings = properties.getPacing();
    }

    /**
     * Stamps a player input as soon as it arrives, before it is decided.
     */
    public void recordPlayerInput(String sessionId) {
        registry.session(sessionId).getMetrics().touchInput(clock.instant());
    }

    /**
     * Updates pacing after a decided input.
     *
     * @return the pacing state after the update
     */
    public PacingState updateActivity(String sessionId, DecisionResult result, GameContext context) {
        PacingSession session = registry.session(sessionId);
        PacingMetrics metrics = session.getMetrics();
        Instant now = clock.instant();

        metrics.recordInput(now);
        if (isSignificant(result)) {
            metrics.setLastSignificantEventAt(now);
            log.debug("[Pacing] Significant event in session {}", sessionId);
        }
        if (isBranchProgression(result)) {
            metrics.setLastBranchProgressionAt(now);
            log.debug("[Pacing] Branch progression in session {}", sessionId);
        }

        String location = context != null ? context.currentLocation() : null;
        if (!Objects.equals(location, metrics.getCurrentLocation())) {
            metrics.setCurrentLocation(location);
            metrics.setLocationEnteredAt(now);
        }
        return refreshState(session, now);
    }

    /**
     * Marks a significant event outside the decision flow, e.g. a world
     * reaction with an attitude shift.
     */
    public void markSignificantEvent(String sessionId) {
        registry.session(sessionId).getMetrics().setLastSignificantEventAt(clock.instant());
    }

    public PacingState refreshState(String sessionId) {
        return refreshState(registry.session(sessionId), clock.instant());
    }

    /**
     * Decides whether ambient narration should be injected now. Always
     * declines within the ambient cooldown.
     */
    public AmbientDecision shouldInjectAmbient(String sessionId, GameContext context) {
        PacingSession session = registry.session(sessionId);
        Instant now = clock.instant();
        PacingState state = refreshState(session, now);
        PacingMetrics metrics = session.getMetrics();

        if (metrics.sinceAmbientInjection(now).compareTo(settings.getAmbientCooldown()) < 0) {
            return AmbientDecision.none();
        }
        if (state.wantsAmbient() || shouldInjectDespitePacing(metrics, context, now)) {
            return AmbientDecision.inject(determineTrigger(context));
        }
        return AmbientDecision.none();
    }

    /**
     * Renders ambient narration for the trigger.
     *
     * @return the narration, or null when the template could not be filled
     */
    public String generateAmbientContent(String sessionId, AmbientTrigger trigger, GameContext context) {
        PacingSession session = registry.session(sessionId);
        List<String> family = AmbientTemplates.FAMILIES.get(trigger);
        String template = family.get(random.nextInt(family.size()));

        String content;
        try {
            content = templateEngine.render(template, buildSlots(trigger, context));
        } catch (AmbientTemplateException e) {
            session.recordTemplatingFailure();
            log.warn("[Pacing] Ambient {} for session {} not rendered: {}", trigger, sessionId, e.getMessage());
            return null;
        }

        Instant now = clock.instant();
        session.getMetrics().setLastAmbientInjectionAt(now);
        session.recordInjection(trigger);

        Map<String, Object> eventContext = new LinkedHashMap<>();
        eventContext.put("trigger", trigger.name());
        eventContext.put("pacingState", session.getMetrics().getCurrentPacingState().name());
        eventContext.put("content", content);
        eventRecorder.record(sessionId, GameEventType.AMBIENT_CONTENT_INJECTED, "pacing_manager", eventContext);
        log.info("[Pacing] Ambient content ({}) for session {}: {}", trigger, sessionId, content);
        return content;
    }

    public PacingStats statistics(String sessionId) {
        PacingSession session = registry.session(sessionId);
        Instant now = clock.instant();
        PacingState state = refreshState(session, now);
        PacingMetrics metrics = session.getMetrics();
        return PacingStats.builder()
                .currentState(state)
                .sinceSignificantEvent(metrics.sinceSignificantEvent(now))
                .sinceBranchProgression(metrics.sinceBranchProgression(now))
                .inCurrentLocation(metrics.inCurrentLocation(now))
                .totalInjections(session.getTotalInjections())
                .triggerUsage(session.getTriggerUsage())
                .stateChanges(session.getStateChanges())
                .templatingFailures(session.getTemplatingFailures())
                .build();
    }

    AmbientTrigger determineTrigger(GameContext context) {
        if (context == null) {
            return AmbientTrigger.TIME_BASED;
        }
        if (!context.presentNpcs().isEmpty()) {
            return AmbientTrigger.NPC_BASED;
        }
        if (context.worldState().isUnstable()) {
            return AmbientTrigger.WORLD_STATE_BASED;
        }
        if (context.hasDistinctiveAura()) {
            return AmbientTrigger.LOCATION_BASED;
        }
        if (context.season() != null && NOTABLE_SEASONS.contains(context.season().toLowerCase(Locale.ROOT))) {
            return AmbientTrigger.SEASONAL;
        }
        return AmbientTrigger.TIME_BASED;
    }

    private PacingState refreshState(PacingSession session, Instant now) {
        PacingMetrics metrics = session.getMetrics();
        PacingState previous = metrics.getCurrentPacingState();
        PacingState current = calculateState(metrics, now);
        if (current != previous) {
            metrics.setCurrentPacingState(current);
            session.recordStateChange(current);
            log.info("[Pacing] Session {} state changed: {} -> {}", session.getSessionId(), previous, current);
        }
        return current;
    }

    private PacingState calculateState(PacingMetrics metrics, Instant now) {
        if (metrics.sinceBranchProgression(now).compareTo(settings.getStagnationThreshold()) > 0) {
            return PacingState.STAGNANT;
        }
        if (metrics.sinceSignificantEvent(now).compareTo(settings.getLullThreshold()) > 0) {
            return PacingState.LULL;
        }
        if (metrics.interactionsLastHour(now) >= settings.getActiveInteractionThreshold()) {
            return PacingState.ACTIVE;
        }
        return PacingState.SETTLING;
    }

    private boolean shouldInjectDespitePacing(PacingMetrics metrics, GameContext context, Instant now) {
        if (metrics.inCurrentLocation(now).compareTo(settings.getLocationDwellThreshold()) > 0) {
            return true;
        }
        WorldState worldState = context != null ? context.worldState() : null;
        return worldState != null && worldState.politicalStability().isOpenConflict();
    }

    private boolean isSignificant(DecisionResult result) {
        if (result == null) {
            return false;
        }
        if (result.priorityUsed() != null && result.priorityUsed().isNarrativeAlignment()) {
            return true;
        }
        if (result.hasActionResult() && result.actionResult().isSuccess()) {
            return true;
        }
        return Boolean.TRUE.equals(result.metadata().get(ATTITUDE_SHIFT));
    }

    private boolean isBranchProgression(DecisionResult result) {
        return result != null && result.hasActionResult()
                && result.actionResult().isSuccess()
                && result.actionResult().actionType().progressesBranch();
    }

    private Map<String, String> buildSlots(AmbientTrigger trigger, GameContext context) {
        Map<String, String> slots = new HashMap<>();
        for (Map.Entry<String, List<String>> phrases : AmbientTemplates.PHRASES.entrySet()) {
            List<String> pool = phrases.getValue();
            slots.put(phrases.getKey(), pool.get(random.nextInt(pool.size())));
        }
        if (context == null) {
            slots.put("location", "this place");
            slots.put("time_of_day", DEFAULT_TIME_OF_DAY);
            return slots;
        }

        slots.put("location", context.locationName());
        slots.put("time_of_day", context.timeOfDay() != null ? context.timeOfDay() : DEFAULT_TIME_OF_DAY);
        if (context.season() != null && !context.season().isBlank()) {
            String season = context.season().toLowerCase(Locale.ROOT);
            slots.put("season", season);
            slots.put("seasonal_phrase", AmbientTemplates.seasonalPhrase(season));
        }
        if (context.hasDistinctiveAura()) {
            slots.put("aura", context.locationAura().toLowerCase(Locale.ROOT));
            slots.put("aura_sound", AmbientTemplates.auraSound(context.locationAura()));
        }
        slots.put("world_situation", AmbientTemplates.worldSituation(context.worldState()));
        if (trigger == AmbientTrigger.NPC_BASED && !context.presentNpcs().isEmpty()) {
            String npcId = context.presentNpcs().get(random.nextInt(context.presentNpcs().size()));
            slots.put("npc_name", context.npc(npcId).displayName());
        }
        return slots;
    }
}
