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

import lombok.Builder;

import java.util.Locale;
import java.util.Set;

/**
 * Structured output of the language-model interpreter for one player input.
 * Every field is optional. The interpreter writes the literal strings "null"
 * or "none" when it finds no alignment; those are treated as absent.
 */
@Builder
public record InterpreterOutput(
        String alignedOpportunityId,
        String alignedBranchAction,
        String suggestedAcknowledgement,
        String intentSummary,
        String inputNature,
        Double confidence,
        Boolean requiresFollowup) {

    private static final Set<String> SENTINELS = Set.of("null", "none");

    public boolean hasAlignedOpportunity() {
        return isPresent(alignedOpportunityId);
    }

    public boolean hasAlignedBranchAction() {
        return isPresent(alignedBranchAction);
    }

    public boolean hasAcknowledgement() {
        return isPresent(suggestedAcknowledgement);
    }

    public boolean hasIntentSummary() {
        return isPresent(intentSummary);
    }

    /**
     * Whether the interpreter understood the input in a general, non-aligned
     * way.
     */
    public boolean hasGeneralInterpretation() {
        return hasIntentSummary() || hasAcknowledgement();
    }

    public boolean followupRequested() {
        return Boolean.TRUE.equals(requiresFollowup);
    }

    public double confidenceOrDefault() {
        return confidence != null ? confidence : 0.5;
    }

    static boolean isPresent(String value) {
        return value != null && !value.isBlank() && !SENTINELS.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
