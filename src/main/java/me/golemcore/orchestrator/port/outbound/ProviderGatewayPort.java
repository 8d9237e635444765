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

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the set of configured generation providers. Tracks which providers
 * are reachable and dispatches generation calls by provider.
 */
public interface ProviderGatewayPort {

    /**
     * Probe every provider for usable configuration and rebuild the reachable
     * set.
     *
     * @return the new reachable set
     */
    Set<AiProvider> refreshAvailability();

    Set<AiProvider> getReachableProviders();

    boolean isReachable(AiProvider provider);

    /**
     * Generate with the given provider. Completes exceptionally with
     * {@link me.golemcore.orchestrator.domain.model.ProviderUnavailableException}
     * when the provider is not reachable.
     */
    CompletableFuture<String> generate(AiProvider provider, GenerationRequest request);
}
