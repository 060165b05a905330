package me.golemcore.gm.domain.pacing;

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
 * An ambient template referenced a slot the context could not fill.
 */
public class AmbientTemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String slot;

    public AmbientTemplateException(String slot, String template) {
        super("Unfilled slot '" + slot + "' in template: " + template);
        this.slot = slot;
    }

    public String getSlot() {
        return slot;
    }
}
