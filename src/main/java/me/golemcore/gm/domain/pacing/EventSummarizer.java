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
import me.golemcore.gm.domain.model.GameEvent;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.LedgerEntry;
import me.golemcore.gm.domain.model.StoryContext;
import me.golemcore.gm.domain.model.StorySummary;
import me.golemcore.gm.domain.model.SummaryResponse;
import me.golemcore.gm.domain.model.SummaryResult;
import me.golemcore.gm.domain.model.SummaryStats;
import me.golemcore.gm.domain.service.GameEventRecorder;
import me.golemcore.gm.infrastructure.config.GmProperties;
import me.golemcore.gm.port.outbound.InterpreterPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Compresses the per-session event ledger into a short running digest so the
 * story context stays bounded. Uses the interpreter when it is available and
 * falls back to rule-based summaries otherwise.
 */
@Service
@Slf4j
public class EventSummarizer {

    private static final int RECENT_EVENTS = 5;
    private static final int MAJOR_SIGNIFICANCE = 4;
    private static final int NOTABLE_SIGNIFICANCE = 3;
    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    private static final String PROMPT_INSTRUCTIONS = """
            Condense the new events and integrate them with the previous summary into a concise narrative \
            recap of what has happened. Max 3-4 sentences.

            Focus on:
            - Major story developments and player achievements
            - Important character interactions and relationships
            - Significant world events or changes
            - Player's overall progress and current situation

            Provide a flowing narrative summary, not a list of events.""";

    static final String COMBAT_SUMMARY = "The adventurer has been engaged in various battles and conflicts, "
            + "facing enemies and emerging victorious.";
    static final String DIALOGUE_SUMMARY = "Important conversations have taken place, revealing crucial "
            + "information and establishing relationships with key characters.";
    static final String QUEST_SUMMARY = "New quests and adventures have begun, setting the hero on a path "
            + "toward new discoveries and challenges.";
    static final String MAJOR_SUMMARY = "Major developments have occurred, drastically changing the course "
            + "of the adventure and opening new possibilities.";
    static final List<String> GENERIC_SUMMARIES = List.of(
            "The adventurer has been exploring the area, encountering various challenges and interacting "
                    + "with locals.",
            "After traveling through different locations, the hero has made progress in understanding the "
                    + "local situation.",
            "Recent events have included conversations with important figures and discoveries about the "
                    + "current state of affairs.",
            "The journey continues with new revelations about the world and its inhabitants as the "
                    + "adventurer moves forward.");

    private final PacingSessionRegistry registry;
    private final InterpreterPort interpreter;
    private final GameEventRecorder eventRecorder;
    private final Clock clock;
    private final Random random;
    private final GmProperties.SummaryProperties settings;

    public EventSummarizer(PacingSessionRegistry registry, InterpreterPort interpreter,
            GameEventRecorder eventRecorder, Clock clock, Random random, GmProperties properties) {
        this.registry = registry;
        this.interpreter = interpreter;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.random = random;
        this.settings = properties.getSummary();
    }

    /**
     * Adds an event to the ledger when it is worth summarizing.
     *
     * @return the ledger entry, or empty when the event was not kept
     */
    public Optional<LedgerEntry> addEvent(String sessionId, GameEvent event) {
        if (event == null || !isWorthSummarizing(event)) {
            return Optional.empty();
        }
        LedgerEntry entry = new LedgerEntry(
                event.timestamp() != null ? event.timestamp() : clock.instant(),
                event.eventType(),
                describe(event),
                event.eventType().significance());
        registry.session(sessionId).appendToLedger(entry);
        log.debug("[Summary] Ledger entry for session {}: {}", sessionId, entry.description());
        return Optional.of(entry);
    }

    /**
     * True when the cooldown since the last digest has elapsed and the pending
     * ledger is both long and large enough to be worth compressing.
     */
    public boolean shouldSummarize(String sessionId) {
        PacingSession session = registry.session(sessionId);
        Duration sinceLast = Duration.between(session.getLastSummaryAt(), clock.instant());
        if (sinceLast.compareTo(settings.getInterval()) < 0) {
            return false;
        }
        if (session.getLedger().size() < settings.getMinEvents()) {
            return false;
        }
        return estimateTokens(session.getLedger()) >= settings.getMinTokens();
    }

    /**
     * Folds the pending ledger into a new digest. Waits for the interpreter at
     * most the configured timeout, then falls back to a rule-based summary.
     *
     * @return the result, or empty when the ledger was empty
     */
    public Optional<SummaryResult> createSummary(String sessionId) {
        PacingSession session = registry.session(sessionId);
        List<LedgerEntry> ledger = session.getLedger();
        if (ledger.isEmpty()) {
            return Optional.empty();
        }

        String previous = session.getSummary() != null ? session.getSummary().text() : null;
        String summary = summarizeWithInterpreter(sessionId, buildPrompt(ledger, previous));
        boolean generatedByInterpreter = summary != null;
        if (summary == null) {
            summary = fallbackSummary(ledger);
        }

        int eventCount = ledger.size();
        double originalTokens = estimateTokens(ledger);
        double summaryTokens = wordCount(summary) * settings.getTokensPerWord();
        long tokensSaved = Math.max(0L, Math.round(originalTokens - summaryTokens));

        Instant now = clock.instant();
        session.clearLedger();
        session.setSummary(new StorySummary(summary, now));
        session.setLastSummaryAt(now);
        session.recordSummary(eventCount, tokensSaved);

        Map<String, Object> eventContext = new LinkedHashMap<>();
        eventContext.put("summary", summary);
        eventContext.put("eventsSummarized", eventCount);
        eventContext.put("estimatedTokensSaved", tokensSaved);
        eventContext.put("summaryLength", summary.length());
        eventContext.put("generatedByInterpreter", generatedByInterpreter);
        eventRecorder.record(sessionId, GameEventType.EVENT_SUMMARY_CREATED, "event_summarizer", eventContext);

        log.info("[Summary] Session {}: summarized {} events, ~{} tokens saved", sessionId, eventCount,
                tokensSaved);
        return Optional.of(new SummaryResult(summary, eventCount, tokensSaved, generatedByInterpreter));
    }

    public StoryContext storyContext(String sessionId) {
        PacingSession session = registry.session(sessionId);
        List<LedgerEntry> ledger = session.getLedger();
        List<LedgerEntry> recent = new ArrayList<>(ledger.subList(Math.max(0, ledger.size() - RECENT_EVENTS),
                ledger.size()));
        Collections.reverse(recent);
        StorySummary summary = session.getSummary();
        return new StoryContext(summary != null ? summary.text() : "", recent, summary != null, ledger.size());
    }

    public SummaryStats statistics(String sessionId) {
        PacingSession session = registry.session(sessionId);
        StorySummary summary = session.getSummary();
        return new SummaryStats(
                session.getSummariesCreated(),
                session.getEventsSummarized(),
                session.getTokensSavedEstimate(),
                summary != null ? summary.text().length() : 0,
                session.getLedger().size(),
                session.getSummariesCreated() > 0 ? session.getLastSummaryAt() : null);
    }

    /**
     * Estimated prompt tokens of the pending ledger.
     */
    public double pendingTokens(String sessionId) {
        return estimateTokens(registry.session(sessionId).getLedger());
    }

    String buildPrompt(List<LedgerEntry> ledger, String previousSummary) {
        String eventLog = ledger.stream()
                .sorted(Comparator.comparingInt(LedgerEntry::significance)
                        .thenComparing(LedgerEntry::timestamp)
                        .reversed())
                .map(entry -> "[" + LOG_TIME.format(entry.timestamp()) + "] "
                        + "*".repeat(entry.significance()) + " " + entry.description())
                .collect(Collectors.joining("\n"));
        String previous = previousSummary != null && !previousSummary.isBlank()
                ? previousSummary
                : "No previous summary.";
        return "You are an assistant that summarizes game events.\n\n"
                + "Recent Event Log:\n" + eventLog + "\n\n"
                + "Previous Summary (if any): " + previous + "\n\n"
                + PROMPT_INSTRUCTIONS;
    }

    String fallbackSummary(List<LedgerEntry> ledger) {
        List<LedgerEntry> notable = ledger.stream()
                .filter(entry -> entry.significance() >= NOTABLE_SIGNIFICANCE)
                .toList();
        if (!notable.isEmpty()) {
            String text = notable.stream()
                    .map(entry -> entry.eventType().name() + " " + entry.description())
                    .collect(Collectors.joining(" "))
                    .toLowerCase(Locale.ROOT);
            if (containsAny(text, "combat", "battle", "attack", "fight")) {
                return COMBAT_SUMMARY;
            }
            if (containsAny(text, "dialogue", "conversation")) {
                return DIALOGUE_SUMMARY;
            }
            if (containsAny(text, "quest", "mission", "branch")) {
                return QUEST_SUMMARY;
            }
            long major = notable.stream().filter(entry -> entry.significance() >= MAJOR_SIGNIFICANCE).count();
            if (major >= 2) {
                return MAJOR_SUMMARY;
            }
        }
        return GENERIC_SUMMARIES.get(random.nextInt(GENERIC_SUMMARIES.size()));
    }

    private String summarizeWithInterpreter(String sessionId, String prompt) {
        if (interpreter == null || !interpreter.isAvailable()) {
            log.debug("[Summary] Interpreter not available, using fallback summary");
            return null;
        }

        CompletableFuture<SummaryResponse> future = null;
        try {
            long start = clock.millis();
            future = interpreter.summarize(prompt);
            SummaryResponse response = future.get(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (response == null || !response.hasContent()) {
                log.warn("[Summary] Interpreter returned no summary for session {}", sessionId);
                return null;
            }
            log.debug("[Summary] Interpreter answered in {}ms", clock.millis() - start);
            return response.content().trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Summary] Summarization interrupted: {}", e.getMessage());
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Summary] Summarization timed out after {}", settings.getTimeout());
            return null;
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Summary] Summarization failed: {}", e.getMessage());
            return null;
        }
    }

    private boolean isWorthSummarizing(GameEvent event) {
        GameEventType type = event.eventType();
        if (type == null || !type.isSummarizable()) {
            return false;
        }
        return type != GameEventType.COMMAND_EXECUTED || event.flag("success");
    }

    private String describe(GameEvent event) {
        switch (event.eventType()) {
        case NARRATIVE_BRANCH_INITIATED:
            return "Player began " + event.attribute("branchName", "unknown quest");
        case BRANCH_ACTION_EXECUTED:
            return "Player " + (event.flag("success") ? "successfully" : "unsuccessfully") + " attempted "
                    + event.attribute("action", "an action");
        case WORLD_REACTION_ASSESSED:
            return "World reacted to player's interaction with " + event.attribute("targetEntity", "someone");
        case COMMAND_EXECUTED:
            String target = event.attribute("target", null);
            String action = event.attribute("action", "an action");
            return target != null ? "Player performed " + action + " on " + target : "Player performed " + action;
        case NPC_INITIATED_DIALOGUE:
            return event.attribute("npcName", event.actor()) + " initiated "
                    + event.attribute("dialogueTheme", "conversation") + " with player";
        default:
            return "Player " + event.eventType().name().toLowerCase(Locale.ROOT).replace('_', ' ');
        }
    }

    private double estimateTokens(List<LedgerEntry> ledger) {
        int words = 0;
        for (LedgerEntry entry : ledger) {
            words += entry.wordCount();
        }
        return words * settings.getTokensPerWord();
    }

    private static int wordCount(String text) {
        return text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
