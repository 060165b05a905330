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
import me.golemcore.gm.domain.model.BranchRejectionReason;
import me.golemcore.gm.domain.model.InterpreterOutput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fixed response texts and narrative enhancement pools used to build the base
 * GM response of a decision. The prose renderer elaborates on these.
 */
@Component
public class NarrativeResponseComposer {

    static final List<String> FALLBACK_FILLERS = List.of(
            "I'm not quite sure what you're trying to do. Could you be more specific?",
            "Your intentions aren't entirely clear to me. Perhaps you could rephrase that?",
            "I want to help, but I need a clearer understanding of what you want to accomplish.",
            "That's an interesting thought. Could you elaborate on what you'd like to do?");

    static final String ERROR_RESPONSE = "I apologize, but I'm having trouble processing your request right now.";

    private static final List<String> OPPORTUNITY_SUCCESS = List.of(
            "A new path opens before you.",
            "Your decision sets events in motion.",
            "The world responds to your choice.");
    private static final List<String> OPPORTUNITY_FAILURE = List.of(
            "Perhaps another time would be more suitable.",
            "The moment doesn't seem quite right for such an endeavor.",
            "Other considerations weigh on your mind.");
    private static final List<String> BRANCH_SUCCESS = List.of(
            "Your skills serve you well in this endeavor.",
            "Progress is made through careful action.",
            "Each step brings you closer to your goal.");
    private static final List<String> BRANCH_FAILURE = List.of(
            "Not every attempt meets with success.",
            "Experience is gained even through setbacks.",
            "The challenge proves more difficult than expected.");
    private static final List<String> COMMAND = List.of(
            "Your actions have immediate effect.",
            "The world responds to your direct approach.",
            "Simple actions often yield clear results.");
    private static final List<String> INTERPRETATION = List.of(
            "Your thoughts are acknowledged and considered.",
            "The conversation flows naturally.",
            "Understanding builds between you and the world around you.");
    private static final List<String> ERROR = List.of("Please try again with a different approach.");

    private final Random random;

    public NarrativeResponseComposer(Random random) {
        this.random = random;
    }

    public String opportunityStarted(InterpreterOutput interpretation, ActionResult result) {
        String acknowledgement = acknowledgement(interpretation);
        String message = stringDetail(result.details(), "message");
        if (acknowledgement != null && message != null) {
            return acknowledgement + "\n\n" + message;
        }
        if (message != null) {
            return message;
        }
        return acknowledgement != null ? acknowledgement : "Your initiative opens up new possibilities...";
    }

    public String opportunityRejected(InterpreterOutput interpretation, ActionResult result) {
        String phrase = BranchRejectionReason.fromValue(result.errorMessage()).narrativePhrase();
        String acknowledgement = acknowledgement(interpretation);
        if (acknowledgement != null) {
            return stripTrailingPunctuation(acknowledgement) + ", " + phrase + ".";
        }
        return "You consider that course of action, " + phrase + ".";
    }

    public String branchAction(ActionResult result) {
        String action = humanize(stringDetail(result.details(), "action"));
        if (result.outcome() == ActionOutcome.SUCCESS) {
            return "You successfully " + action + ". Your efforts pay off as you make meaningful progress.";
        }
        if (result.outcome() == ActionOutcome.FAILURE) {
            return "You attempt to " + action + ", but " + BranchActionExecutor.FAILURE_REASON + ".";
        }
        return "You try to " + action + ", but the outcome is unclear.";
    }

    @SuppressWarnings("unchecked")
    public String parsedCommand(ActionResult result) {
        Object executionResult = result.details().get("executionResult");
        if (executionResult instanceof Map<?, ?> map) {
            String description = stringDetail((Map<String, Object>) map, "description");
            if (description != null) {
                return description;
            }
        }
        return "You complete the action.";
    }

    public String generalInterpretation(InterpreterOutput interpretation) {
        String acknowledgement = acknowledgement(interpretation);
        return acknowledgement != null ? acknowledgement : "The world takes note of your intent.";
    }

    public String fallback(InterpreterOutput interpretation) {
        String acknowledgement = acknowledgement(interpretation);
        return acknowledgement != null ? acknowledgement : FALLBACK_FILLERS.get(random.nextInt(FALLBACK_FILLERS.size()));
    }

    public String error() {
        return ERROR_RESPONSE;
    }

    public List<String> opportunityEnhancements(ActionResult result) {
        return result.isSuccess() ? OPPORTUNITY_SUCCESS : OPPORTUNITY_FAILURE;
    }

    public List<String> branchEnhancements(ActionResult result) {
        return result.isSuccess() ? BRANCH_SUCCESS : BRANCH_FAILURE;
    }

    public List<String> commandEnhancements() {
        return COMMAND;
    }

    public List<String> interpretationEnhancements() {
        return INTERPRETATION;
    }

    public List<String> errorEnhancements() {
        return ERROR;
    }

    private static String acknowledgement(InterpreterOutput interpretation) {
        if (interpretation == null || !interpretation.hasAcknowledgement()) {
            return null;
        }
        return interpretation.suggestedAcknowledgement().trim();
    }

    private static String stringDetail(Map<String, Object> details, String key) {
        Object value = details.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }

    private static String stripTrailingPunctuation(String text) {
        String result = text;
        while (!result.isEmpty() && ".!?".indexOf(result.charAt(result.length() - 1)) >= 0) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String humanize(String action) {
        return action != null ? action.replace('_', ' ') : "act";
    }
}
