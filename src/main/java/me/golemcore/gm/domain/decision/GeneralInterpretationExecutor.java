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

import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.InterpreterOutput;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepts the interpreter's general reading of the input. No game mechanics
 * are touched.
 */
@Component
public class GeneralInterpretationExecutor implements ActionExecutor {

    private static final String DEFAULT_INTENT = "General interaction";
    private static final String DEFAULT_NATURE = "conversational";

    @Override
    public ActionType type() {
        return ActionType.GENERAL_INTERPRETATION;
    }

    @Override
    public ActionResult execute(DecisionContext context, String argument) {
        InterpreterOutput interpretation = context.interpreterOutput();
        String intent = DEFAULT_INTENT;
        String nature = DEFAULT_NATURE;
        if (interpretation != null) {
            if (interpretation.hasIntentSummary()) {
                intent = interpretation.intentSummary();
            }
            if (interpretation.inputNature() != null && !interpretation.inputNature().isBlank()) {
                nature = interpretation.inputNature();
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("intent", intent);
        details.put("nature", nature);
        return ActionResult.builder()
                .outcome(ActionOutcome.SUCCESS)
                .actionType(ActionType.GENERAL_INTERPRETATION)
                .details(details)
                .mechanicsTriggered(false)
                .narrativeContext(Map.of("conversationalResponse", true, "noMechanics", true))
                .build();
    }
}
