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

import lombok.RequiredArgsConstructor;
import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.GameEventType;
import me.golemcore.gm.domain.model.ParsedCommand;
import me.golemcore.gm.domain.service.GameEventRecorder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes an unambiguous parsed command through the closed verb table.
 */
@Component
@RequiredArgsConstructor
public class ParsedCommandExecutor implements ActionExecutor {

    static final String NOT_RECOGNIZED = "Action not recognized.";

    private final GameEventRecorder eventRecorder;

    @Override
    public ActionType type() {
        return ActionType.PARSED_COMMAND;
    }

    @Override
    public ActionResult execute(DecisionContext context, String argument) {
        ParsedCommand command = context.parsedCommand();
        Optional<CommandVerb> verb = CommandVerb.fromAction(command.action());
        boolean success = verb.isPresent();
        String description = verb.map(CommandVerb::description).orElse(NOT_RECOGNIZED);

        Map<String, Object> executionResult = new LinkedHashMap<>();
        executionResult.put("success", success);
        executionResult.put("description", description);

        Map<String, Object> eventContext = new LinkedHashMap<>();
        eventContext.put("action", command.action());
        eventContext.put("target", command.directObject());
        eventContext.put("success", success);
        eventRecorder.record(context.sessionId(), GameEventType.COMMAND_EXECUTED, context.playerId(), eventContext);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", verb.map(CommandVerb::value).orElse(command.action()));
        details.put("target", command.directObject());
        details.put("executionResult", executionResult);
        return ActionResult.builder()
                .outcome(success ? ActionOutcome.SUCCESS : ActionOutcome.FAILURE)
                .actionType(ActionType.PARSED_COMMAND)
                .details(details)
                .mechanicsTriggered(true)
                .errorMessage(success ? null : NOT_RECOGNIZED)
                .narrativeContext(Map.of("commandExecuted", true, "mechanicalAction", true))
                .build();
    }
}
