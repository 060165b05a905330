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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed table of verbs the core can execute from a parsed command.
 */
public enum CommandVerb {

    LOOK("You observe your surroundings carefully.", "look", "examine", "inspect", "l"),
    TAKE("You pick up the item.", "take", "get", "grab", "pick"),
    GO("You move in the specified direction.", "go", "move", "walk", "travel"),
    ATTACK("You strike at your target.", "attack", "hit", "strike", "fight"),
    USE("You use the item.", "use", "apply"),
    TALK("You engage in conversation.", "talk", "speak", "ask", "chat");

    private final String description;
    private final Set<String> aliases;

    CommandVerb(String description, String... aliases) {
        this.description = description;
        this.aliases = Set.of(aliases);
    }

    public String description() {
        return description;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandVerb> fromAction(String action) {
        if (action == null || action.isBlank()) {
            return Optional.empty();
        }
        String normalized = action.trim().toLowerCase(Locale.ROOT);
        for (CommandVerb verb : values()) {
            if (verb.aliases.contains(normalized)) {
                return Optional.of(verb);
            }
        }
        return Optional.empty();
    }
}
