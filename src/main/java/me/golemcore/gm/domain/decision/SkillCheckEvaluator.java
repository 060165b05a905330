package me.golemcore.gm.domain.decision;

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

import me.golemcore.gm.domain.model.PoliticalStability;
import me.golemcore.gm.domain.model.SkillCheckResult;
import me.golemcore.gm.domain.model.WorldState;
import me.golemcore.gm.infrastructure.config.GmProperties;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Skill check for branch actions: a base chance reduced during unrest, plus a
 * d20 roll against a fixed difficulty for the renderer.
 */
@Component
public class SkillCheckEvaluator {

    private static final int DIE_SIDES = 20;

    private final Random random;
    private final GmProperties.DecisionProperties settings;

    public SkillCheckEvaluator(Random random, GmProperties properties) {
        this.random = random;
        this.settings = properties.getDecision();
    }

    public SkillCheckResult evaluate(WorldState worldState) {
        double chance = successChance(worldState);
        boolean success = random.nextDouble() < chance;
        int roll = random.nextInt(DIE_SIDES) + 1;
        return new SkillCheckResult(success, roll, settings.getSkillCheckDifficulty(), chance);
    }

    double successChance(WorldState worldState) {
        double chance = settings.getBaseSuccessChance();
        if (worldState != null && worldState.politicalStability() == PoliticalStability.UNREST) {
            chance -= settings.getUnrestPenalty();
        }
        return chance;
    }
}
