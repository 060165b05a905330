package me.golemcore.gm.domain.pacing;

import me.golemcore.gm.domain.model.GameEvent;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.LedgerEntry;
import me.golemcore.gm.domain.model.StoryContext;
import me.golemcore.gm.domain.model.SummaryResponse;
import me.golemcore.gm.domain.model.SummaryResult;
import me.golemcore.gm.domain.model.SummaryStats;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.infrastructure.config.GmProperties;
import me.golemcore.gm.port.outbound.EventLogPort;
import me.golemcore.gm.port.outbound.InterpreterPort;
import me.golemcore.gm.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class EventSummarizerTest {

    private static final String SESSION = "session-1";
    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final String LONG_QUEST = String.join(" ", Collections.nCopies(160, "quest"));

    private MutableClock clock;
    private InterpreterPort interpreter;
    private EventLogPort eventLog;
    private PacingSessionRegistry registry;
    private GmProperties properties;
    private EventSummarizer summarizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        interpreter = mock(InterpreterPort.class);
        eventLog = mock(EventLogPort.class);
        registry = new PacingSessionRegistry(clock);
        properties = new GmProperties();
        properties.getSummary().setTimeout(Duration.ofMillis(50));
        summarizer = new EventSummarizer(registry, interpreter, new GameEventRecorder(clock, List.of(eventLog)),
                clock, new Random(42), properties);
    }

    private static GameEvent event(GameEventType type, Map<String, Object> context) {
        return GameEvent.builder()
                .sessionId(SESSION)
                .eventType(type)
                .actor("player-1")
                .context(context)
                .timestamp(NOW)
                .build();
    }

    private void addLongBranchEvents(int count) {
        for (int i = 0; i < count; i++) {
            summarizer.addEvent(SESSION, event(GameEventType.NARRATIVE_BRANCH_INITIATED,
                    Map.of("branchName", LONG_QUEST)));
        }
    }

    @Test
    void shouldSummarizeLargeLedgerAfterCooldownAndClearIt() {
        addLongBranchEvents(10);
        registry.session(SESSION).setLastSummaryAt(NOW.minus(Duration.ofHours(3)));

        assertTrue(summarizer.shouldSummarize(SESSION));

        Optional<SummaryResult> result = summarizer.createSummary(SESSION);

        assertTrue(result.isPresent());
        assertEquals(10, result.get().eventsSummarized());
        assertTrue(registry.session(SESSION).getLedger().isEmpty());
        assertFalse(summarizer.shouldSummarize(SESSION));
        verify(eventLog).saveEvent(argThat(e -> e.eventType() == GameEventType.EVENT_SUMMARY_CREATED
                && "event_summarizer".equals(e.actor())));
    }

    @Test
    void shouldWaitForCooldown() {
        addLongBranchEvents(10);
        registry.session(SESSION).setLastSummaryAt(NOW.minus(Duration.ofMinutes(90)));

        assertFalse(summarizer.shouldSummarize(SESSION));
    }

    @Test
    void shouldRequireEnoughEvents() {
        addLongBranchEvents(9);

        assertFalse(summarizer.shouldSummarize(SESSION));
    }

    @Test
    void shouldRequireEnoughTokens() {
        for (int i = 0; i < 12; i++) {
            summarizer.addEvent(SESSION, event(GameEventType.NARRATIVE_BRANCH_INITIATED,
                    Map.of("branchName", "the hunt")));
        }

        assertTrue(summarizer.pendingTokens(SESSION) < 2000);
        assertFalse(summarizer.shouldSummarize(SESSION));
    }

    @Test
    void shouldReturnEmptyForEmptyLedger() {
        assertTrue(summarizer.createSummary(SESSION).isEmpty());
        verifyNoInteractions(interpreter);
    }

    @Test
    void shouldNotSummarizeSameLedgerTwice() {
        addLongBranchEvents(10);

        assertTrue(summarizer.createSummary(SESSION).isPresent());
        assertTrue(summarizer.createSummary(SESSION).isEmpty());
        assertEquals(1, summarizer.statistics(SESSION).summariesCreated());
    }

    @Test
    void shouldUseInterpreterSummary() {
        when(interpreter.isAvailable()).thenReturn(true);
        when(interpreter.summarize(anyString()))
                .thenReturn(CompletableFuture.completedFuture(SummaryResponse.success("  The hero rose.  ")));
        addLongBranchEvents(10);

        SummaryResult result = summarizer.createSummary(SESSION).orElseThrow();

        assertEquals("The hero rose.", result.summary());
        assertTrue(result.generatedByInterpreter());
        assertEquals(2102, result.tokensSaved());
        assertEquals("The hero rose.", summarizer.storyContext(SESSION).summary());

        SummaryStats stats = summarizer.statistics(SESSION);
        assertEquals(1, stats.summariesCreated());
        assertEquals(10, stats.eventsSummarized());
        assertEquals(2102, stats.tokensSavedEstimate());
        assertEquals(NOW, stats.lastSummaryAt());
        assertEquals(10.0, stats.eventsPerSummary());
    }

    @Test
    void shouldFoldPreviousSummaryIntoNextPrompt() {
        when(interpreter.isAvailable()).thenReturn(true);
        when(interpreter.summarize(anyString()))
                .thenReturn(CompletableFuture.completedFuture(SummaryResponse.success("The hero rose.")));
        addLongBranchEvents(1);
        summarizer.createSummary(SESSION);
        addLongBranchEvents(1);
        summarizer.createSummary(SESSION);

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(interpreter, times(2)).summarize(prompts.capture());
        assertTrue(prompts.getAllValues().get(0).contains("Previous Summary (if any): No previous summary."));
        assertTrue(prompts.getAllValues().get(1).contains("Previous Summary (if any): The hero rose."));
    }

    @Test
    void shouldFallBackWhenInterpreterTimesOut() {
        CompletableFuture<SummaryResponse> pending = new CompletableFuture<>();
        when(interpreter.isAvailable()).thenReturn(true);
        when(interpreter.summarize(anyString())).thenReturn(pending);
        addLongBranchEvents(10);

        SummaryResult result = summarizer.createSummary(SESSION).orElseThrow();

        assertFalse(result.generatedByInterpreter());
        assertEquals(EventSummarizer.QUEST_SUMMARY, result.summary());
        assertTrue(pending.isCancelled());
        assertTrue(registry.session(SESSION).getLedger().isEmpty());
    }

    @Test
    void shouldFallBackWhenInterpreterFails() {
        when(interpreter.isAvailable()).thenReturn(true);
        when(interpreter.summarize(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));
        addLongBranchEvents(10);

        SummaryResult result = summarizer.createSummary(SESSION).orElseThrow();

        assertFalse(result.generatedByInterpreter());
        assertEquals(EventSummarizer.QUEST_SUMMARY, result.summary());
    }

    @Test
    void shouldFallBackWhenInterpreterReportsFailure() {
        when(interpreter.isAvailable()).thenReturn(true);
        when(interpreter.summarize(anyString()))
                .thenReturn(CompletableFuture.completedFuture(SummaryResponse.failure("no credits")));
        addLongBranchEvents(2);

        assertFalse(summarizer.createSummary(SESSION).orElseThrow().generatedByInterpreter());
    }

    @Test
    void shouldSkipUnavailableInterpreter() {
        addLongBranchEvents(2);

        assertFalse(summarizer.createSummary(SESSION).orElseThrow().generatedByInterpreter());
        verify(interpreter, never()).summarize(anyString());
    }

    @Test
    void shouldDescribeLedgerEvents() {
        assertEquals("Player began The Midnight Heist", summarizer.addEvent(SESSION,
                event(GameEventType.NARRATIVE_BRANCH_INITIATED, Map.of("branchName", "The Midnight Heist")))
                .orElseThrow().description());
        assertEquals("Player unsuccessfully attempted pick_lock", summarizer.addEvent(SESSION,
                event(GameEventType.BRANCH_ACTION_EXECUTED, Map.of("action", "pick_lock", "success", false)))
                .orElseThrow().description());
        assertEquals("World reacted to player's interaction with the mayor", summarizer.addEvent(SESSION,
                event(GameEventType.WORLD_REACTION_ASSESSED, Map.of("targetEntity", "the mayor")))
                .orElseThrow().description());
        assertEquals("Player performed take on lantern", summarizer.addEvent(SESSION,
                event(GameEventType.COMMAND_EXECUTED, Map.of("action", "take", "target", "lantern", "success", true)))
                .orElseThrow().description());
        assertEquals("Old Tom initiated friendly_check_in with player", summarizer.addEvent(SESSION,
                event(GameEventType.NPC_INITIATED_DIALOGUE,
                        Map.of("npcName", "Old Tom", "dialogueTheme", "friendly_check_in")))
                .orElseThrow().description());
    }

    @Test
    void shouldRateSignificanceByEventType() {
        LedgerEntry entry = summarizer.addEvent(SESSION,
                event(GameEventType.BRANCH_ACTION_EXECUTED, Map.of("action", "pick_lock", "success", true)))
                .orElseThrow();

        assertEquals(4, entry.significance());
    }

    @Test
    void shouldIgnoreUnsuccessfulCommandsAndBookkeepingEvents() {
        assertTrue(summarizer.addEvent(SESSION,
                event(GameEventType.COMMAND_EXECUTED, Map.of("action", "dance", "success", false))).isEmpty());
        assertTrue(summarizer.addEvent(SESSION, event(GameEventType.DECISION_MADE, Map.of())).isEmpty());
        assertTrue(summarizer.addEvent(SESSION, event(GameEventType.AMBIENT_CONTENT_INJECTED, Map.of())).isEmpty());
        assertTrue(summarizer.addEvent(SESSION, null).isEmpty());
        assertEquals(0, summarizer.storyContext(SESSION).pendingEvents());
    }

    @Test
    void shouldReturnFiveMostRecentEventsNewestFirst() {
        for (int i = 1; i <= 7; i++) {
            summarizer.addEvent(SESSION, event(GameEventType.WORLD_REACTION_ASSESSED,
                    Map.of("targetEntity", "npc" + i)));
        }

        StoryContext context = summarizer.storyContext(SESSION);

        assertFalse(context.hasSummary());
        assertEquals("", context.summary());
        assertEquals(7, context.pendingEvents());
        assertEquals(5, context.recentEvents().size());
        assertTrue(context.recentEvents().get(0).description().endsWith("npc7"));
        assertTrue(context.recentEvents().get(4).description().endsWith("npc3"));
    }

    @Test
    void shouldOrderPromptBySignificanceThenRecency() {
        Instant first = Instant.parse("2026-01-01T10:00:00Z");
        Instant second = Instant.parse("2026-01-01T10:30:00Z");
        List<LedgerEntry> ledger = List.of(
                new LedgerEntry(first, GameEventType.COMMAND_EXECUTED, "Player performed look", 2),
                new LedgerEntry(first, GameEventType.NARRATIVE_BRANCH_INITIATED, "Player began the hunt", 5),
                new LedgerEntry(second, GameEventType.COMMAND_EXECUTED, "Player performed take", 2));

        String prompt = summarizer.buildPrompt(ledger, null);

        assertTrue(prompt.contains("Recent Event Log:\n"
                + "[2026-01-01 10:00] ***** Player began the hunt\n"
                + "[2026-01-01 10:30] ** Player performed take\n"
                + "[2026-01-01 10:00] ** Player performed look\n"), prompt);
        assertTrue(prompt.contains("Max 3-4 sentences."));
    }

    @Test
    void shouldPickFallbackByLedgerContent() {
        assertEquals(EventSummarizer.COMBAT_SUMMARY, summarizer.fallbackSummary(List.of(
                new LedgerEntry(NOW, GameEventType.WORLD_REACTION_ASSESSED,
                        "World reacted to player's interaction with the battle lines", 3))));
        assertEquals(EventSummarizer.DIALOGUE_SUMMARY, summarizer.fallbackSummary(List.of(
                new LedgerEntry(NOW, GameEventType.WORLD_REACTION_ASSESSED,
                        "World reacted to player's interaction with a conversation", 3))));
        assertEquals(EventSummarizer.QUEST_SUMMARY, summarizer.fallbackSummary(List.of(
                new LedgerEntry(NOW, GameEventType.NARRATIVE_BRANCH_INITIATED, "Player began the hunt", 5))));
        assertEquals(EventSummarizer.MAJOR_SUMMARY, summarizer.fallbackSummary(List.of(
                new LedgerEntry(NOW, GameEventType.WORLD_REACTION_ASSESSED, "The mayor resigned", 4),
                new LedgerEntry(NOW, GameEventType.WORLD_REACTION_ASSESSED, "The guild collapsed", 4))));
        assertTrue(EventSummarizer.GENERIC_SUMMARIES.contains(summarizer.fallbackSummary(List.of(
                new LedgerEntry(NOW, GameEventType.COMMAND_EXECUTED, "Player performed attack", 2)))));
    }
}
