package me.golemcore.gm.domain.pacing;

import me.golemcore.gm.domain.model.DialogueTheme;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.IdleNpcStats;
import me.golemcore.gm.domain.model.InitiativeDecision;
import me.golemcore.gm.domain.model.NpcInitiative;
import me.golemcore.gm.domain.model.NpcInitiativeCandidate;
import me.golemcore.gm.domain.model.NpcProfile;
import me.golemcore.gm.domain.model.PoliticalStability;
import me.golemcore.gm.domain.model.WorldState;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.infrastructure.config.GmProperties;
import me.golemcore.gm.port.outbound.DialogueGeneratorPort;
import me.golemcore.gm.port.outbound.EventLogPort;
import me.golemcore.gm.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IdleNpcManagerTest {

    private static final String SESSION = "session-1";
    private static final Duration LONG_IDLE = Duration.ofMinutes(9);

    private MutableClock clock;
    private DialogueGeneratorPort dialogueGenerator;
    private EventLogPort eventLog;
    private IdleNpcManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        dialogueGenerator = mock(DialogueGeneratorPort.class);
        eventLog = mock(EventLogPort.class);
        manager = new IdleNpcManager(new PacingSessionRegistry(clock), dialogueGenerator,
                new GameEventRecorder(clock, List.of(eventLog)), clock, new GmProperties());
    }

    private static NpcProfile npc(String id, String personality) {
        return NpcProfile.builder().npcId(id).personality(personality).build();
    }

    private static GameContext.GameContextBuilder scene(NpcProfile... profiles) {
        List<String> present = Arrays.stream(profiles).map(NpcProfile::npcId).toList();
        Map<String, NpcProfile> npcs = new LinkedHashMap<>();
        for (NpcProfile profile : profiles) {
            npcs.put(profile.npcId(), profile);
        }
        return GameContext.builder()
                .sessionId(SESSION)
                .playerId("player-1")
                .currentLocation("rusty_anchor_inn")
                .presentNpcs(present)
                .npcs(npcs);
    }

    @Test
    void shouldApplyCooldownPerNpcOnly() {
        GameContext context = scene(npc("npc_a", "friendly"), npc("npc_b", "friendly")).build();
        when(dialogueGenerator.generate(eq("npc_a"), anyList(), any())).thenReturn("Evening, traveler!");

        InitiativeDecision first = manager.shouldInitiate(SESSION, "npc_a", context, Duration.ofMinutes(5));
        assertTrue(first.initiate());
        assertTrue(manager.generateInitiative(SESSION, "npc_a", first.theme(), context).isPresent());

        clock.advance(Duration.ofSeconds(1));

        assertFalse(manager.shouldInitiate(SESSION, "npc_a", context, Duration.ofMinutes(5)).initiate());
        assertTrue(manager.shouldInitiate(SESSION, "npc_b", context, Duration.ofMinutes(5)).initiate());
    }

    @Test
    void shouldAllowNpcAgainAfterCooldown() {
        GameContext context = scene(npc("npc_a", "friendly")).build();
        when(dialogueGenerator.generate(any(), anyList(), any())).thenReturn("Hello again.");
        manager.generateInitiative(SESSION, "npc_a", DialogueTheme.FRIENDLY_CHECK_IN, context);

        clock.advance(Duration.ofMinutes(5));

        assertTrue(manager.shouldInitiate(SESSION, "npc_a", context, LONG_IDLE).initiate());
    }

    @Test
    void shouldRequireIdleTimeStrictlyAboveThreshold() {
        GameContext context = scene(npc("npc_a", "friendly")).build();

        assertEquals(Duration.ofSeconds(225), manager.initiativeThreshold(context.npc("npc_a"), context));
        assertFalse(manager.shouldInitiate(SESSION, "npc_a", context, Duration.ofSeconds(225)).initiate());
        assertTrue(manager.shouldInitiate(SESSION, "npc_a", context, Duration.ofSeconds(226)).initiate());
    }

    @Test
    void shouldDeriveThresholdFromPersonalityAndContext() {
        GameContext plain = scene().build();
        assertEquals(Duration.ofMinutes(6), manager.initiativeThreshold(npc("x", null), plain));
        assertEquals(Duration.ofMinutes(8), manager.initiativeThreshold(npc("x", "gruff"), plain));

        GameContext respected = scene().playerReputationSummary("Respected by the guards").build();
        assertEquals(Duration.ofMinutes(3), manager.initiativeThreshold(npc("x", "friendly"), respected));

        GameContext disliked = scene().playerReputationSummary("disliked in the docks").build();
        assertEquals(Duration.ofMinutes(6), manager.initiativeThreshold(npc("x", "friendly"), disliked));

        GameContext ominous = scene().locationAura("ominous").build();
        assertEquals(Duration.ofMinutes(5), manager.initiativeThreshold(npc("x", "friendly"), ominous));
    }

    @Test
    void shouldPreferProfileThresholdOverride() {
        NpcProfile eager = NpcProfile.builder().npcId("npc_a").personality("gruff")
                .initiativeThreshold(Duration.ofSeconds(30)).build();
        GameContext context = scene(eager).build();

        assertTrue(manager.shouldInitiate(SESSION, "npc_a", context, Duration.ofSeconds(31)).initiate());
    }

    @Test
    void shouldNeverInitiateForBusyOrAbsentNpc() {
        NpcProfile busy = NpcProfile.builder().npcId("smith").personality("friendly").busy(true).build();
        GameContext context = scene(busy).build();

        assertFalse(manager.shouldInitiate(SESSION, "smith", context, LONG_IDLE).initiate());
        assertFalse(manager.shouldInitiate(SESSION, "ghost", context, LONG_IDLE).initiate());
        assertFalse(manager.shouldInitiate(SESSION, "smith", null, LONG_IDLE).initiate());
    }

    @Test
    void shouldStopAtSessionCap() {
        GameContext context = scene(npc("npc_a", "friendly"), npc("npc_b", "friendly")).build();
        when(dialogueGenerator.generate(any(), anyList(), any())).thenReturn("Hello.");
        for (int i = 0; i < 5; i++) {
            manager.generateInitiative(SESSION, "npc_a", DialogueTheme.FRIENDLY_CHECK_IN, context);
        }

        assertFalse(manager.shouldInitiate(SESSION, "npc_b", context, LONG_IDLE).initiate());
        assertEquals(5, manager.statistics(SESSION).sessionInitiativeCount());
    }

    @Test
    void shouldChooseThemeFromWorldPersonalityAndReputation() {
        assertEquals(DialogueTheme.WORLD_EVENTS_CONCERN, theme(npc("a", "wise"),
                scene(npc("a", "wise")).worldState(WorldState.of(PoliticalStability.UNREST))));
        assertEquals(DialogueTheme.LOCAL_KNOWLEDGE, theme(npc("a", "Scholarly"), scene(npc("a", "Scholarly"))));
        assertEquals(DialogueTheme.CURIOUS_OBSERVATION, theme(npc("a", "inquisitive"),
                scene(npc("a", "inquisitive"))));
        assertEquals(DialogueTheme.PROFESSIONAL_INQUIRY, theme(npc("a", "merchant"), scene(npc("a", "merchant"))));
        assertEquals(DialogueTheme.FRIENDLY_CHECK_IN, theme(npc("a", "helpful"), scene(npc("a", "helpful"))));
        assertEquals(DialogueTheme.CONCERN_FOR_PLAYER, theme(npc("a", "shy"),
                scene(npc("a", "shy")).playerReputationSummary("despised by the merchants")));
        assertEquals(DialogueTheme.FRIENDLY_CHECK_IN, theme(npc("a", "shy"), scene(npc("a", "shy"))));
    }

    private DialogueTheme theme(NpcProfile profile, GameContext.GameContextBuilder scene) {
        InitiativeDecision decision = manager.shouldInitiate(SESSION, profile.npcId(), scene.build(), LONG_IDLE);
        assertTrue(decision.initiate());
        return decision.theme();
    }

    @Test
    void shouldPickFirstEligibleNpcInHostOrder() {
        NpcProfile busy = NpcProfile.builder().npcId("smith").busy(true).build();
        GameContext context = scene(busy, npc("innkeeper", "friendly"), npc("bard", "curious")).build();

        Optional<NpcInitiativeCandidate> candidate = manager.firstEligible(SESSION, context, LONG_IDLE);

        assertEquals(Optional.of(new NpcInitiativeCandidate("innkeeper", DialogueTheme.FRIENDLY_CHECK_IN)),
                candidate);
        assertTrue(manager.firstEligible(SESSION, context, Duration.ofSeconds(10)).isEmpty());
    }

    @Test
    void shouldRecordInitiativeAndEvent() {
        NpcProfile innkeeper = NpcProfile.builder().npcId("innkeeper").name("Martha").personality("friendly")
                .build();
        GameContext context = scene(innkeeper).build();
        when(dialogueGenerator.generate("innkeeper", DialogueTheme.FRIENDLY_CHECK_IN.topics(), context))
                .thenReturn("  Another round, dear?  ");

        NpcInitiative initiative = manager
                .generateInitiative(SESSION, "innkeeper", DialogueTheme.FRIENDLY_CHECK_IN, context)
                .orElseThrow();

        assertEquals("Martha", initiative.npcName());
        assertEquals("Another round, dear?", initiative.dialogueText());
        assertEquals("Martha Another round, dear?", initiative.responseText());
        IdleNpcStats stats = manager.statistics(SESSION);
        assertEquals(1, stats.sessionInitiativeCount());
        assertEquals(1, stats.uniqueNpcsInitiated());
        assertEquals(clock.instant(), stats.lastInitiatedAt().get("innkeeper"));
        verify(eventLog).saveEvent(argThat(event -> event.eventType() == GameEventType.NPC_INITIATED_DIALOGUE
                && "innkeeper".equals(event.actor())
                && "friendly_check_in".equals(event.context().get("dialogueTheme"))));
    }

    @Test
    void shouldNotStartCooldownWhenGenerationFails() {
        GameContext context = scene(npc("npc_a", "friendly")).build();
        when(dialogueGenerator.generate(any(), anyList(), any()))
                .thenThrow(new IllegalStateException("model offline"))
                .thenReturn("   ");

        assertTrue(manager.generateInitiative(SESSION, "npc_a", DialogueTheme.FRIENDLY_CHECK_IN, context).isEmpty());
        assertTrue(manager.generateInitiative(SESSION, "npc_a", DialogueTheme.FRIENDLY_CHECK_IN, context).isEmpty());
        assertTrue(manager.shouldInitiate(SESSION, "npc_a", context, LONG_IDLE).initiate());
        assertEquals(0, manager.statistics(SESSION).sessionInitiativeCount());
        verifyNoInteractions(eventLog);
    }
}
