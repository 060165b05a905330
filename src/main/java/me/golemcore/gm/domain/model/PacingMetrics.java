package me.golemcore.gm.domain.model;

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

import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Live pacing metrics of one session. Mutated only by the pacing manager, one
 * writer per session.
 */
@Data
public class PacingMetrics {

    private static final Duration INTERACTION_WINDOW = Duration.ofHours(1);

    private Instant lastSignificantEventAt;
    private Instant lastBranchProgressionAt;
    private Instant lastPlayerInputAt;
    private Instant lastAmbientInjectionAt;
    private Instant locationEnteredAt;
    private String currentLocation;
    private PacingState currentPacingState = PacingState.SETTLING;
    private final Deque<Instant> recentInputs = new ArrayDeque<>();

    /**
     * Creates metrics for a session that starts now, in the state a fresh
     * session computes to. The last ambient injection is placed an hour back
     * so the first ambient check is not held by the cooldown.
     */
    public static PacingMetrics startingAt(Instant now) {
        PacingMetrics metrics = new PacingMetrics();
        metrics.setLastSignificantEventAt(now);
        metrics.setLastBranchProgressionAt(now);
        metrics.setLastPlayerInputAt(now);
        metrics.setLastAmbientInjectionAt(now.minus(INTERACTION_WINDOW));
        metrics.setLocationEnteredAt(now);
        return metrics;
    }

    /**
     * Stamps the time of the latest player input without counting an
     * interaction.
     */
    public void touchInput(Instant now) {
        lastPlayerInputAt = now;
    }

    /**
     * Stamps the input and counts it as an interaction of the rolling hour.
     */
    public void recordInput(Instant now) {
        lastPlayerInputAt = now;
        recentInputs.addLast(now);
        pruneInputs(now);
    }

    /**
     * Number of inputs recorded in the hour before {@code now}.
     */
    public int interactionsLastHour(Instant now) {
        pruneInputs(now);
        return recentInputs.size();
    }

    public Duration sinceSignificantEvent(Instant now) {
        return Duration.between(lastSignificantEventAt, now);
    }

    public Duration sinceBranchProgression(Instant now) {
        return Duration.between(lastBranchProgressionAt, now);
    }

    public Duration sincePlayerInput(Instant now) {
        return Duration.between(lastPlayerInputAt, now);
    }

    public Duration sinceAmbientInjection(Instant now) {
        return Duration.between(lastAmbientInjectionAt, now);
    }

    public Duration inCurrentLocation(Instant now) {
        return Duration.between(locationEnteredAt, now);
    }

    private void pruneInputs(Instant now) {
        Instant windowStart = now.minus(INTERACTION_WINDOW);
        while (!recentInputs.isEmpty() && recentInputs.peekFirst().isBefore(windowStart)) {
            recentInputs.pollFirst();
        }
    }
}
