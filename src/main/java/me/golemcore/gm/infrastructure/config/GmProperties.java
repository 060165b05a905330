package me.golemcore.gm.infrastructure.config;

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
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties of the game master core, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code gm.*} prefix, one nested class per
 * subsystem:
 * <ul>
 * <li>{@link DecisionProperties} - skill check tuning of the decision
 * ladder</li>
 * <li>{@link PacingProperties} - pacing thresholds and ambient cooldown</li>
 * <li>{@link IdleNpcProperties} - NPC initiative timing</li>
 * <li>{@link SummaryProperties} - event digest cadence</li>
 * <li>{@link IntegrationProperties} - session housekeeping</li>
 * <li>{@link LlmProperties} - interpreter model used for digests</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "gm")
@Data
public class GmProperties {

    private DecisionProperties decision = new DecisionProperties();
    private PacingProperties pacing = new PacingProperties();
    private IdleNpcProperties idleNpc = new IdleNpcProperties();
    private SummaryProperties summary = new SummaryProperties();
    private IntegrationProperties integration = new IntegrationProperties();
    private LlmProperties llm = new LlmProperties();

    /**
     * Seed of the shared random source. Unset means a time-based seed.
     */
    private Long randomSeed;

    @Data
    public static class DecisionProperties {
        private double baseSuccessChance = 0.7;
        private double unrestPenalty = 0.1;
        private int skillCheckDifficulty = 12;
    }

    @Data
    public static class PacingProperties {
        private Duration lullThreshold = Duration.ofMinutes(10);
        private Duration stagnationThreshold = Duration.ofMinutes(15);
        private int activeInteractionThreshold = 3;
        private Duration ambientCooldown = Duration.ofMinutes(5);
        private Duration locationDwellThreshold = Duration.ofMinutes(20);
    }

    @Data
    public static class IdleNpcProperties {
        private Duration minimumIdleTime = Duration.ofMinutes(3);
        private Duration maximumIdleTime = Duration.ofMinutes(8);
        private Duration initiativeCooldown = Duration.ofMinutes(5);
        private int maxInitiativesPerSession = 5;
    }

    @Data
    public static class SummaryProperties {
        private Duration interval = Duration.ofHours(2);
        private int minEvents = 10;
        private int minTokens = 2000;
        private double tokensPerWord = 1.3;
        private Duration timeout = Duration.ofSeconds(15);
    }

    @Data
    public static class IntegrationProperties {
        private Duration staleSessionThreshold = Duration.ofMinutes(30);
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
