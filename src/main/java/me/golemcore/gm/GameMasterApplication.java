package me.golemcore.gm;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class of the GolemCore game master core.
 *
 * <p>
 * The core arbitrates, for every player input, which signal source governs
 * the next action (structured parser, language-model interpreter, active
 * narrative branch), and independently controls the timing of ambient
 * narration, NPC initiated dialogue and event digests.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → DecisionEngine, PacingManager, IdleNpcManager, EventSummarizer
 * Orchestration      → GameMasterService, PacingIntegration
 * Infrastructure     → Interpreter (langchain4j), event log, Spring event bus
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the {@code gm.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GameMasterApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameMasterApplication.class, args);
    }

}
