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

import java.util.Locale;

public enum PoliticalStability {

    STABLE,
    UNREST,
    REBELLION,
    WAR;

    public boolean isTurbulent() {
        return this == UNREST || this == REBELLION || this == WAR;
    }

    /**
     * Open conflict; forces ambient narration regardless of pacing.
     */
    public boolean isOpenConflict() {
        return this == REBELLION || this == WAR;
    }

    public String descriptor() {
        return name().toLowerCase(Locale.ROOT);
    }
}
