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

import me.golemcore.orchestrator.port.outbound.GenerationPort;

/**
 * A generation port backed by one concrete provider SDK. All adapters are
 * Spring beans; {@link ProviderRegistry} indexes them by provider.
 */
public interface GenerationProviderAdapter extends GenerationPort {

    /**
     * Initialize the adapter. Called the first time the adapter is used.
     */
    default void initialize() {
        // Default no-op
    }
}
