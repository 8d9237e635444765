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

/**
 * A provider invocation failed (network, timeout, remote error). Carries the
 * provider and a machine-readable failure code. Absorbed by the fallback
 * executor and never propagated past it.
 */
public class ProviderCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AiProvider provider;
    private final String code;

    public ProviderCallException(AiProvider provider, String code, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.code = code;
    }

    public ProviderCallException(AiProvider provider, String code, String message) {
        this(provider, code, message, null);
    }

    public AiProvider getProvider() {
        return provider;
    }

    public String getCode() {
        return code;
    }
}
