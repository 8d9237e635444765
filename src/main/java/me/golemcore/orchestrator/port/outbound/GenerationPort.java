package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.GenerationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for a single text generation provider: given a prompt and options,
 * return a text result or fail.
 */
public interface GenerationPort {

    /**
     * Provider this port talks to.
     */
    AiProvider getProvider();

    /**
     * Generate a response. Failures complete the future exceptionally with a
     * {@link me.golemcore.orchestrator.domain.model.ProviderCallException}.
     */
    CompletableFuture<String> generate(GenerationRequest request);

    /**
     * Check if the provider has usable configuration (e.g., API key is set).
     */
    boolean isAvailable();
}
