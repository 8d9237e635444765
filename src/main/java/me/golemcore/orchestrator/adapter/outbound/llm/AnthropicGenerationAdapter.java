package me.golemcore.orchestrator.adapter.outbound.llm;

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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import me.golemcore.orchestrator.cache.ResponseCacheRegistry;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class AnthropicGenerationAdapter extends Langchain4jGenerationAdapter {

    public AnthropicGenerationAdapter(OrchestratorProperties properties, ResponseCacheRegistry cacheRegistry,
            Clock clock) {
        super(properties, cacheRegistry, clock);
    }

    @Override
    public AiProvider getProvider() {
        return AiProvider.ANTHROPIC;
    }

    @Override
    protected OrchestratorProperties.ProviderProperties providerConfig() {
        return properties.getProviders().getAnthropic();
    }

    @Override
    protected ChatModel createChatModel(OrchestratorProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(config.getMaxTokens())
                .timeout(properties.getLlm().getTimeout());

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }
}
