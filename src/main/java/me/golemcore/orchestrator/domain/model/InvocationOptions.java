package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call options for the fallback executor.
 *
 * <ul>
 * <li>{@code forceProvider} - used as primary when currently reachable</li>
 * <li>{@code confidenceThreshold} - enables the low-confidence upgrade
 * attempt; {@code null} disables it</li>
 * <li>{@code timeout} - hard per-provider-call timeout; {@code null} means the
 * configured default</li>
 * <li>{@code systemPrompt} - optional system instructions passed to the
 * provider</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class InvocationOptions {

    AiProvider forceProvider;
    Double confidenceThreshold;
    Duration timeout;
    String systemPrompt;

    public static InvocationOptions defaults() {
        return InvocationOptions.builder().build();
    }
}
