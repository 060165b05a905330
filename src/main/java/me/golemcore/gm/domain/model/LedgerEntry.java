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

import java.time.Instant;

/**
 * One rated entry of the per-session event ledger.
 */
public record LedgerEntry(Instant timestamp, GameEventType eventType, String description, int significance) {

    public LedgerEntry {
        if (significance < 1 || significance > 5) {
            throw new IllegalArgumentException("significance must be within 1..5: " + significance);
        }
    }

    public int wordCount() {
        if (description == null || description.isBlank()) {
            return 0;
        }
        return description.trim().split("\\s+").length;
    }
}
