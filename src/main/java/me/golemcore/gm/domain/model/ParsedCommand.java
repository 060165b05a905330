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

/**
 * Output of the external structured command parser.
 *
 * @param action
 *            the verb the parser recognized (e.g. "look", "take")
 * @param directObject
 *            the object of the verb, if any
 * @param hasError
 *            whether the parser failed on the input
 * @param needsDisambiguation
 *            whether the parser found several candidate targets
 * @param errorMessage
 *            parser error text, if any
 */
public record ParsedCommand(
        String action,
        String directObject,
        boolean hasError,
        boolean needsDisambiguation,
        String errorMessage) {

    public static ParsedCommand of(String action) {
        return new ParsedCommand(action, null, false, false, null);
    }

    public static ParsedCommand of(String action, String directObject) {
        return new ParsedCommand(action, directObject, false, false, null);
    }

    public static ParsedCommand error(String errorMessage) {
        return new ParsedCommand(null, null, true, false, errorMessage);
    }

    public static ParsedCommand ambiguous(String action, String errorMessage) {
        return new ParsedCommand(action, null, false, true, errorMessage);
    }

    /**
     * A command is executable when the parser neither failed nor asked for
     * disambiguation.
     */
    public boolean isUnambiguous() {
        return !hasError && !needsDisambiguation && action != null && !action.isBlank();
    }
}
