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
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last rung of the ladder: the input could not be acted on and the player is
 * asked to clarify.
 */
@Component
public class FallbackResponseExecutor implements ActionExecutor {

    @Override
    public ActionType type() {
        return ActionType.FALLBACK_RESPONSE;
    }

    @Override
    public ActionResult execute(DecisionContext context, String argument) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", "unclear_input");
        details.put("parserError", context.parsedCommand() != null ? context.parsedCommand().errorMessage() : null);
        return ActionResult.builder()
                .outcome(ActionOutcome.REQUIRES_FOLLOWUP)
                .actionType(ActionType.FALLBACK_RESPONSE)
                .details(details)
                .mechanicsTriggered(false)
                .narrativeContext(Map.of("clarificationNeeded", true, "unclearInput", true))
                .build();
    }
}
