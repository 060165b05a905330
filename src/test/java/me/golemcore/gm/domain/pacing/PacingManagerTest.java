package me.golemcore.gm.domain.pacing;

import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.AmbientDecision;
import me.golemcore.gm.domain.model.AmbientTrigger;
import me.golemcore.gm.domain.model.DecisionPriority;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.EconomicStatus;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.NpcProfile;
import me.golemcore.gm.domain.model.PacingState;
import me.golemcore.gm.domain.model.PacingStats;
import me.golemcore.gm.domain.model.PoliticalStability;
import me.golemcore.gm.domain.model.WorldState;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.infrastructure.config.GmProperties;
import me.golemcore.gm.port.outbound.EventLogPort;
import me.golemcore.gm.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PacingManagerTest {

    private static final String SESSION = "session-1";

    private MutableClock clock;
    private EventLogPort eventLog;
    private PacingSessionRegistry registry;
    private PacingManager pacingManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        eventLog = mock(EventLogPort.class);
        registry = new PacingSessionRegistry(clock);
        pacingManager = newManager(new Random(42));
    }

    private PacingManager newManager(Random random) {
        return new PacingManager(registry, new AmbientTemplateEngine(),
                new GameEventRecorder(clock, List.of(eventLog)), clock, random, new GmProperties());
    }

    private static DecisionResult decision(DecisionPriority priority, ActionType type, ActionOutcome outcome) {
        return DecisionResult.builder()
                .priorityUsed(priority)
                .actionResult(ActionResult.builder().actionType(type).outcome(outcome).build())
                .build();
    }

    private static DecisionResult fallback() {
        return decision(DecisionPriority.FALLBACK, ActionType.FALLBACK_RESPONSE, ActionOutcome.REQUIRES_FOLLOWUP);
    }

    private static DecisionResult branchSuccess() {
        return decision(DecisionPriority.BRANCH_ACTION_ALIGNMENT, ActionType.BRANCH_ACTION, ActionOutcome.SUCCESS);
    }

    private static GameContext.GameContextBuilder scene() {
        return GameContext.builder().sessionId(SESSION).playerId("player-1").currentLocation("market_square")
                .timeOfDay("evening");
    }

    @Test
    void shouldSettleFreshSessionWithoutAmbient() {
        assertEquals(PacingState.SETTLING, pacingManager.refreshState(SESSION));
        assertFalse(pacingManager.shouldInjectAmbient(SESSION, scene().build()).inject());
    }

    @Test
    void shouldBecomeActiveAfterThreeInteractions() {
        GameContext context = scene().build();
        pacingManager.updateActivity(SESSION, fallback(), context);
        pacingManager.updateActivity(SESSION, fallback(), context);

        assertEquals(PacingState.ACTIVE, pacingManager.updateActivity(SESSION, fallback(), context));
        assertFalse(pacingManager.shouldInjectAmbient(SESSION, context).inject());
    }

    @Test
    void shouldEnterLullWithoutSignificantEvents() {
        GameContext context = scene().build();
        pacingManager.updateActivity(SESSION, branchSuccess(), context);
        clock.advance(Duration.ofMinutes(11));
        pacingManager.updateActivity(SESSION, fallback(), context);

        assertEquals(PacingState.LULL, pacingManager.refreshState(SESSION));
        assertEquals(AmbientDecision.inject(AmbientTrigger.TIME_BASED),
                pacingManager.shouldInjectAmbient(SESSION, context));
    }

    @Test
    void shouldNotEnterLullAtExactThreshold() {
        pacingManager.refreshState(SESSION);
        clock.advance(Duration.ofMinutes(10));

        assertEquals(PacingState.SETTLING, pacingManager.refreshState(SESSION));
    }

    @Test
    void shouldStagnateAndInjectOnceWithinCooldown() {
        GameContext context = scene().build();
        pacingManager.refreshState(SESSION);
        clock.advance(Duration.ofMinutes(20));

        AmbientDecision decision = pacingManager.shouldInjectAmbient(SESSION, context);
        assertTrue(decision.inject());
        assertEquals(PacingState.STAGNANT, pacingManager.refreshState(SESSION));

        String content = pacingManager.generateAmbientContent(SESSION, decision.trigger(), context);
        assertNotNull(content);
        assertFalse(pacingManager.shouldInjectAmbient(SESSION, context).inject());

        clock.advance(Duration.ofMinutes(4));
        assertFalse(pacingManager.shouldInjectAmbient(SESSION, context).inject());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(pacingManager.shouldInjectAmbient(SESSION, context).inject());
    }

    @Test
    void shouldInjectDespiteActivePacingAfterLongDwell() {
        GameContext context = scene().build();
        for (int minute = 0; minute <= 21; minute += 3) {
            pacingManager.updateActivity(SESSION, branchSuccess(), context);
            clock.advance(Duration.ofMinutes(3));
        }

        assertEquals(PacingState.ACTIVE, pacingManager.refreshState(SESSION));
        assertEquals(AmbientDecision.inject(AmbientTrigger.TIME_BASED),
                pacingManager.shouldInjectAmbient(SESSION, context));
    }

    @Test
    void shouldInjectDuringOpenConflictEvenWhenActive() {
        GameContext context = scene().worldState(WorldState.of(PoliticalStability.WAR)).build();
        pacingManager.updateActivity(SESSION, branchSuccess(), context);
        pacingManager.updateActivity(SESSION, branchSuccess(), context);
        pacingManager.updateActivity(SESSION, branchSuccess(), context);

        assertEquals(AmbientDecision.inject(AmbientTrigger.WORLD_STATE_BASED),
                pacingManager.shouldInjectAmbient(SESSION, context));
    }

    @Test
    void shouldResetLocationDwellOnMove() {
        pacingManager.updateActivity(SESSION, fallback(), scene().build());
        clock.advance(Duration.ofMinutes(7));
        pacingManager.updateActivity(SESSION, fallback(), scene().currentLocation("harbor").build());

        PacingStats stats = pacingManager.statistics(SESSION);
        assertEquals(Duration.ZERO, stats.inCurrentLocation());
        assertEquals(Duration.ofMinutes(7), stats.sinceBranchProgression());
    }

    @Test
    void shouldTreatAttitudeShiftAsSignificant() {
        DecisionResult result = DecisionResult.builder()
                .priorityUsed(DecisionPriority.GENERAL_INTERPRETATION)
                .metadata(Map.of(PacingManager.ATTITUDE_SHIFT, true))
                .build();
        pacingManager.refreshState(SESSION);
        clock.advance(Duration.ofMinutes(9));
        pacingManager.updateActivity(SESSION, result, scene().build());
        clock.advance(Duration.ofMinutes(5));

        assertEquals(Duration.ofMinutes(5), pacingManager.statistics(SESSION).sinceSignificantEvent());
    }

    @Test
    void shouldPickTriggerByPrecedence() {
        GameContext full = scene()
                .presentNpcs(List.of("innkeeper"))
                .worldState(WorldState.of(PoliticalStability.UNREST))
                .locationAura("ominous")
                .season("winter")
                .build();

        assertEquals(AmbientTrigger.NPC_BASED, pacingManager.determineTrigger(full));
        assertEquals(AmbientTrigger.WORLD_STATE_BASED,
                pacingManager.determineTrigger(scene().worldState(new WorldState(PoliticalStability.STABLE,
                        EconomicStatus.RECESSION)).locationAura("ominous").build()));
        assertEquals(AmbientTrigger.LOCATION_BASED,
                pacingManager.determineTrigger(scene().locationAura("mystical").season("autumn").build()));
        assertEquals(AmbientTrigger.SEASONAL,
                pacingManager.determineTrigger(scene().locationAura("neutral").season("Autumn").build()));
        assertEquals(AmbientTrigger.TIME_BASED, pacingManager.determineTrigger(scene().season("spring").build()));
        assertEquals(AmbientTrigger.TIME_BASED, pacingManager.determineTrigger(null));
    }

    @Test
    void shouldRenderNpcAmbientWithPresentNpcName() {
        GameContext context = scene()
                .presentNpcs(List.of("old_tom"))
                .npcs(Map.of("old_tom", NpcProfile.builder().npcId("old_tom").name("Old Tom").build()))
                .build();

        String content = pacingManager.generateAmbientContent(SESSION, AmbientTrigger.NPC_BASED, context);

        assertNotNull(content);
        assertTrue(content.contains("Old Tom"), content);
        assertFalse(content.contains("{{"), content);
    }

    @Test
    void shouldRenderLocationAmbientWithAuraSound() {
        GameContext context = scene().locationAura("ominous").build();

        String content = pacingManager.generateAmbientContent(SESSION, AmbientTrigger.LOCATION_BASED, context);

        assertNotNull(content);
        assertTrue(content.endsWith("An unsettling silence presses in."), content);
    }

    @Test
    void shouldRecordInjectionAndEvent() {
        pacingManager.generateAmbientContent(SESSION, AmbientTrigger.TIME_BASED, scene().build());

        PacingStats stats = pacingManager.statistics(SESSION);
        assertEquals(1, stats.totalInjections());
        assertEquals(1L, stats.triggerUsage().get(AmbientTrigger.TIME_BASED));
        verify(eventLog).saveEvent(argThat(event -> event.eventType() == GameEventType.AMBIENT_CONTENT_INJECTED
                && "pacing_manager".equals(event.actor())));
    }

    @Test
    void shouldReturnNullAndCountFailureWhenSlotIsMissing() {
        String content = pacingManager.generateAmbientContent(SESSION, AmbientTrigger.SEASONAL, scene().build());

        assertNull(content);
        PacingStats stats = pacingManager.statistics(SESSION);
        assertEquals(1, stats.templatingFailures());
        assertEquals(0, stats.totalInjections());
        verify(eventLog, never()).saveEvent(any());
    }

    @Test
    void shouldKeepCooldownAfterTemplatingFailure() {
        pacingManager.refreshState(SESSION);
        clock.advance(Duration.ofMinutes(20));
        pacingManager.generateAmbientContent(SESSION, AmbientTrigger.WORLD_STATE_BASED, scene().build());

        assertTrue(pacingManager.shouldInjectAmbient(SESSION, scene().build()).inject());
    }

    @Test
    void shouldProduceSameContentForSameSeed() {
        GameContext context = scene().season("winter").build();
        String first = newManager(new Random(5)).generateAmbientContent("a", AmbientTrigger.SEASONAL, context);
        String second = newManager(new Random(5)).generateAmbientContent("b", AmbientTrigger.SEASONAL, context);

        assertEquals(first, second);
    }

    @Test
    void shouldCountStateChanges() {
        pacingManager.refreshState(SESSION);
        clock.advance(Duration.ofMinutes(11));
        pacingManager.refreshState(SESSION);
        clock.advance(Duration.ofMinutes(5));
        pacingManager.refreshState(SESSION);

        PacingStats stats = pacingManager.statistics(SESSION);
        assertEquals(PacingState.STAGNANT, stats.currentState());
        assertNull(stats.stateChanges().get(PacingState.SETTLING));
        assertEquals(1L, stats.stateChanges().get(PacingState.LULL));
        assertEquals(1L, stats.stateChanges().get(PacingState.STAGNANT));
    }

    @Test
    void shouldNotCountStateChangeForFreshSession() {
        assertEquals(PacingState.SETTLING, pacingManager.refreshState(SESSION));

        PacingStats stats = pacingManager.statistics(SESSION);
        assertEquals(PacingState.SETTLING, stats.currentState());
        assertTrue(stats.stateChanges().isEmpty());
    }
}
