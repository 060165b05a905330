package me.golemcore.gm.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gm.domain.model.SummaryResponse;
import me.golemcore.gm.infrastructure.config.GmProperties;
import me.golemcore.gm.port.outbound.InterpreterPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Interpreter adapter over a langchain4j OpenAI-compatible chat model.
 *
 * <p>
 * The model is built lazily from {@code gm.llm.*}. Without an API key the
 * adapter reports itself unavailable and the summarizer uses its rule-based
 * fallback.
 */
@Component
@Slf4j
public class Langchain4jInterpreterAdapter implements InterpreterPort {

    private static final String SYSTEM_PROMPT = "You summarize tabletop role-playing sessions for a game master. "
            + "Answer with the summary only.";

    private final GmProperties.LlmProperties settings;
    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Autowired
    public Langchain4jInterpreterAdapter(GmProperties properties) {
        this.settings = properties.getLlm();
    }

    Langchain4jInterpreterAdapter(GmProperties properties, ChatModel chatModel) {
        this.settings = properties.getLlm();
        this.chatModel = chatModel;
        this.initialized = true;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    @Override
    public CompletableFuture<SummaryResponse> summarize(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                return SummaryResponse.failure("Interpreter not configured");
            }
            List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt));
            try {
                ChatResponse response = chatModel.chat(messages);
                AiMessage aiMessage = response != null ? response.aiMessage() : null;
                String text = aiMessage != null ? aiMessage.text() : null;
                if (text == null || text.isBlank()) {
                    return SummaryResponse.failure("Empty response");
                }
                return SummaryResponse.success(text.trim());
            } catch (RuntimeException e) {
                log.warn("[Interpreter] Summarization call failed: {}", e.getMessage());
                return SummaryResponse.failure(e.getMessage());
            }
        });
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.info("[Interpreter] No API key configured, interpreter disabled");
            return;
        }
        try {
            var builder = OpenAiChatModel.builder()
                    .apiKey(settings.getApiKey())
                    .modelName(settings.getModel())
                    .temperature(settings.getTemperature())
                    .maxRetries(0)
                    .timeout(settings.getTimeout());
            if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
                builder.baseUrl(settings.getBaseUrl());
            }
            this.chatModel = builder.build();
            log.info("[Interpreter] Initialized with model: {}", settings.getModel());
        } catch (RuntimeException e) {
            log.warn("[Interpreter] Failed to initialize chat model: {}", e.getMessage());
        }
    }
}
