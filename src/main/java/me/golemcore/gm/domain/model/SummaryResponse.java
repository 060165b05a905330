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
 * Answer of the interpreter to a summarization prompt.
 */
public record SummaryResponse(boolean success, String content) {

    public static SummaryResponse success(String content) {
        return new SummaryResponse(true, content);
    }

    public static SummaryResponse failure(String error) {
        return new SummaryResponse(false, error);
    }

    public boolean hasContent() {
        return success && content != null && !content.isBlank();
    }
}
