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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict template engine for ambient narration. Substitutes {{slot}}
 * placeholders with values from the slot map. Narration is never delivered
 * with an unfilled placeholder, so a missing or blank slot value fails the
 * whole rendering.
 */
@Component
public class AmbientTemplateEngine {

    private static final Pattern SLOT_PATTERN = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

    /**
     * Renders a template.
     *
     * @param template
     *            the template with {{slot}} placeholders
     * @param slots
     *            slot name-to-value mapping
     * @return the rendered text
     * @throws AmbientTemplateException
     *             if a placeholder has no value
     */
    public String render(String template, Map<String, String> slots) {
        if (template == null) {
            return null;
        }

        Matcher matcher = SLOT_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String slot = matcher.group(1);
            String value = slots != null ? slots.get(slot) : null;
            if (value == null || value.isBlank()) {
                throw new AmbientTemplateException(slot, template);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
