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
 * Outcome of one summarization pass.
 *
 * @param summary
 *            the new digest text
 * @param eventsSummarized
 *            ledger entries folded into the digest
 * @param tokensSaved
 *            estimated tokens saved, never negative
 * @param generatedByInterpreter
 *            false when the rule-based fallback produced the text
 */
public record SummaryResult(String summary, int eventsSummarized, long tokensSaved, boolean generatedByInterpreter) {
}
