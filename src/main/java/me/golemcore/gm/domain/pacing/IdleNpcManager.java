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
import me.golemcore.gm.domain.model.DialogueTheme;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.IdleNpcStats;
import me.golemcore.gm.domain.model.InitiativeDecision;
import me.golemcore.gm.domain.model.NpcInitiative;
import me.golemcore.gm.domain.model.NpcInitiativeCandidate;
import me.golemcore.gm.domain.model.NpcInitiativeState;
import me.golemcore.gm.domain.model.NpcProfile;
import me.golemcore.gm.domain.model.PoliticalStability;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.infrastructure.config.GmProperties;
import me.golemcore.gm.port.outbound.DialogueGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lets present NPCs start a conversation when the player has been idle.
 *
 * <p>
 * An NPC speaks up only when it is present, the idle time exceeds its own
 * threshold, its personal cooldown has elapsed, the session cap is not
 * reached, and it has something to talk about. The threshold follows the
 * NPC's personality: talkative NPCs speak up sooner, reserved ones wait up to
 * the maximum idle time.
 */
@Service
@Slf4j
public class IdleNpcManager {

    private static final Map<String, Double> PERSONALITY_RATES = Map.of(
            "friendly", 0.8,
            "helpful", 0.7,
            "curious", 0.9,
            "shy", 0.3,
            "suspicious", 0.4,
            "professional", 0.5,
            "gruff", 0.2,
            "wise", 0.6);

    private static final double DEFAULT_RATE = 0.5;
    private static final double MIN_RATE = 0.1;

    private static final Set<String> FRIENDLY_PERSONALITIES = Set.of("friendly", "helpful");
    private static final Set<String> KNOWLEDGEABLE_PERSONALITIES = Set.of("wise", "scholarly");
    private static final Set<String> CURIOUS_PERSONALITIES = Set.of("curious", "inquisitive");
    private static final Set<String> PROFESSIONAL_PERSONALITIES = Set.of("professional", "merchant");

    private final PacingSessionRegistry registry;
    private final DialogueGeneratorPort dialogueGenerator;
    private final GameEventRecorder eventRecorder;
    private final Clock clock;
    private final GmProperties.IdleNpcProperties settings;

    public IdleNpcManager(PacingSessionRegistry registry, DialogueGeneratorPort dialogueGenerator,
            GameEventRecorder eventRecorder, Clock clock, GmProperties properties) {
        this.registry = registry;
        this.dialogueGenerator = dialogueGenerator;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.settings = properties.getIdleNpc();
    }

    public InitiativeDecision shouldInitiate(String sessionId, String npcId, GameContext context,
            Duration idleDuration) {
        if (context == null || !context.isPresent(npcId) || idleDuration == null) {
            return InitiativeDecision.none();
        }
        PacingSession session = registry.session(sessionId);
        if (session.getSessionInitiativeCount() >= settings.getMaxInitiativesPerSession()) {
            return InitiativeDecision.none();
        }

        NpcProfile profile = context.npc(npcId);
        if (idleDuration.compareTo(initiativeThreshold(profile, context)) <= 0) {
            return InitiativeDecision.none();
        }

        NpcInitiativeState state = session.getNpcStates().get(npcId);
        if (state != null && state.getLastInitiatedAt() != null) {
            Duration sinceLast = Duration.between(state.getLastInitiatedAt(), clock.instant());
            if (sinceLast.compareTo(settings.getInitiativeCooldown()) < 0) {
                return InitiativeDecision.none();
            }
        }

        return determineTheme(profile, context)
                .map(InitiativeDecision::initiate)
                .orElse(InitiativeDecision.none());
    }

    /**
     * Finds the first present NPC, in the host's order, that may start a
     * conversation.
     */
    public Optional<NpcInitiativeCandidate> firstEligible(String sessionId, GameContext context,
            Duration idleDuration) {
        if (context == null) {
            return Optional.empty();
        }
        for (String npcId : context.presentNpcs()) {
            InitiativeDecision decision = shouldInitiate(sessionId, npcId, context, idleDuration);
            if (decision.initiate()) {
                return Optional.of(new NpcInitiativeCandidate(npcId, decision.theme()));
            }
        }
        return Optional.empty();
    }

    /**
     * Renders the NPC's line through the dialogue generator. The NPC's cooldown
     * starts only when a line was produced.
     */
    public Optional<NpcInitiative> generateInitiative(String sessionId, String npcId, DialogueTheme theme,
            GameContext context) {
        String dialogueText;
        try {
            dialogueText = dialogueGenerator.generate(npcId, theme.topics(), context);
        } catch (RuntimeException e) {
            log.warn("[IdleNpc] Dialogue generation failed for {}: {}", npcId, e.getMessage());
            return Optional.empty();
        }
        if (dialogueText == null || dialogueText.isBlank()) {
            log.debug("[IdleNpc] No dialogue generated for {}", npcId);
            return Optional.empty();
        }

        PacingSession session = registry.session(sessionId);
        session.recordNpcInitiative(npcId, clock.instant());
        String npcName = context != null ? context.npc(npcId).displayName() : NpcProfile.of(npcId).displayName();

        Map<String, Object> eventContext = new LinkedHashMap<>();
        eventContext.put("npcName", npcName);
        eventContext.put("dialogueTheme", theme.value());
        eventContext.put("dialogueText", dialogueText);
        eventContext.put("location", context != null ? context.currentLocation() : null);
        eventContext.put("initiativeCount", session.getSessionInitiativeCount());
        eventRecorder.record(sessionId, GameEventType.NPC_INITIATED_DIALOGUE, npcId, eventContext);

        log.info("[IdleNpc] {} initiated dialogue with theme {}", npcName, theme.value());
        return Optional.of(new NpcInitiative(npcId, npcName, theme, dialogueText.trim()));
    }

    public IdleNpcStats statistics(String sessionId) {
        PacingSession session = registry.session(sessionId);
        Map<String, Instant> lastInitiated = new LinkedHashMap<>();
        session.getNpcStates().forEach((npcId, state) -> {
            if (state.getLastInitiatedAt() != null) {
                lastInitiated.put(npcId, state.getLastInitiatedAt());
            }
        });
        return new IdleNpcStats(session.getSessionInitiativeCount(), lastInitiated.size(), lastInitiated);
    }

    /**
     * Idle time after which the NPC speaks up: the profile override when set,
     * otherwise the minimum idle time divided by the NPC's initiative rate,
     * capped at the maximum idle time.
     */
    Duration initiativeThreshold(NpcProfile profile, GameContext context) {
        if (profile.initiativeThreshold() != null) {
            return profile.initiativeThreshold();
        }
        double rate = PERSONALITY_RATES.getOrDefault(profile.personalityKey(), DEFAULT_RATE)
                + contextModifier(context);
        rate = Math.max(MIN_RATE, Math.min(1.0, rate));
        Duration threshold = Duration.ofMillis(Math.round(settings.getMinimumIdleTime().toMillis() / rate));
        return threshold.compareTo(settings.getMaximumIdleTime()) > 0 ? settings.getMaximumIdleTime() : threshold;
    }

    private double contextModifier(GameContext context) {
        double modifier = 0.0;
        String reputation = reputation(context);
        if (reputation.contains("disliked") || reputation.contains("despised")) {
            modifier -= 0.3;
        } else if (reputation.contains("respected") || reputation.contains("liked")) {
            modifier += 0.2;
        }

        PoliticalStability stability = context.worldState().politicalStability();
        if (stability == PoliticalStability.UNREST || stability == PoliticalStability.REBELLION) {
            modifier += 0.1;
        }

        String aura = context.locationAura() != null ? context.locationAura().toLowerCase(Locale.ROOT) : "";
        if ("friendly".equals(aura)) {
            modifier += 0.1;
        } else if ("ominous".equals(aura)) {
            modifier -= 0.2;
        }
        return modifier;
    }

    private Optional<DialogueTheme> determineTheme(NpcProfile profile, GameContext context) {
        if (profile.busy()) {
            return Optional.empty();
        }
        if (context.worldState().politicalStability().isTurbulent()) {
            return Optional.of(DialogueTheme.WORLD_EVENTS_CONCERN);
        }

        String personality = profile.personalityKey();
        if (FRIENDLY_PERSONALITIES.contains(personality)) {
            return Optional.of(DialogueTheme.FRIENDLY_CHECK_IN);
        }
        if (KNOWLEDGEABLE_PERSONALITIES.contains(personality)) {
            return Optional.of(DialogueTheme.LOCAL_KNOWLEDGE);
        }
        if (CURIOUS_PERSONALITIES.contains(personality)) {
            return Optional.of(DialogueTheme.CURIOUS_OBSERVATION);
        }
        if (PROFESSIONAL_PERSONALITIES.contains(personality)) {
            return Optional.of(DialogueTheme.PROFESSIONAL_INQUIRY);
        }

        String reputation = reputation(context);
        if (reputation.contains("disliked") || reputation.contains("despised") || reputation.contains("concerned")) {
            return Optional.of(DialogueTheme.CONCERN_FOR_PLAYER);
        }
        return Optional.of(DialogueTheme.FRIENDLY_CHECK_IN);
    }

    private static String reputation(GameContext context) {
        String summary = context.playerReputationSummary();
        return summary != null ? summary.toLowerCase(Locale.ROOT) : "";
    }
}
