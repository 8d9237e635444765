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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.AiProvider;
import me.golemcore.orchestrator.domain.model.GenerationRequest;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.port.outbound.ProviderGatewayPort;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of generation adapters indexed by provider.
 *
 * <p>
 * A provider is reachable when an adapter exists for it and reports usable
 * configuration. Providers without an adapter (speech synthesis) are never
 * reachable. The reachable set is replaced atomically on every refresh.
 */
@Component
@Slf4j
public class ProviderRegistry implements ProviderGatewayPort {

    private final List<GenerationProviderAdapter> adapters;
    private final Map<AiProvider, GenerationProviderAdapter> adaptersByProvider = new EnumMap<>(AiProvider.class);

    private volatile Set<AiProvider> reachable = Collections.unmodifiableSet(EnumSet.noneOf(AiProvider.class));

    public ProviderRegistry(List<GenerationProviderAdapter> adapters) {
        this.adapters = adapters;
    }

    @PostConstruct
    public void init() {
        for (GenerationProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProvider(), adapter);
            log.debug("[LLM] Registered adapter: {}", adapter.getProvider().getId());
        }
        refreshAvailability();
    }

    @Override
    public synchronized Set<AiProvider> refreshAvailability() {
        Set<AiProvider> available = EnumSet.noneOf(AiProvider.class);
        for (Map.Entry<AiProvider, GenerationProviderAdapter> entry : adaptersByProvider.entrySet()) {
            try {
                if (entry.getValue().isAvailable()) {
                    available.add(entry.getKey());
                }
            } catch (RuntimeException e) { // NOSONAR - a broken probe marks the provider unreachable
                log.warn("[LLM] Availability probe failed for {}: {}", entry.getKey().getId(), e.getMessage());
            }
        }
        reachable = Collections.unmodifiableSet(available);
        log.info("[LLM] Reachable providers: {}", available);
        return reachable;
    }

    @Override
    public Set<AiProvider> getReachableProviders() {
        return reachable;
    }

    @Override
    public boolean isReachable(AiProvider provider) {
        return provider != null && reachable.contains(provider);
    }

    @Override
    public CompletableFuture<String> generate(AiProvider provider, GenerationRequest request) {
        GenerationProviderAdapter adapter = adaptersByProvider.get(provider);
        if (adapter == null || !isReachable(provider)) {
            return CompletableFuture.failedFuture(new ProviderUnavailableException(provider));
        }
        return adapter.generate(request);
    }
}
