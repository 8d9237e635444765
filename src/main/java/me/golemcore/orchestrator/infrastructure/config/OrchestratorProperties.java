package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the orchestrator, bound from
 * {@code application.properties} under the {@code orchestrator.*} prefix.
 *
 * <p>
 * Groups:
 * <ul>
 * <li>{@code providers.*} - credentials and model per provider family</li>
 * <li>{@code llm.*} - call timeout and rate-limit retries</li>
 * <li>{@code cache.*} - response cache capacity and TTL</li>
 * <li>{@code routing.*} - optimization thresholds and fallback policy</li>
 * <li>{@code tasks.*} - task state machine limits and worker pool</li>
 * <li>{@code storage.*} - local workspace location</li>
 * <li>{@code notifications.*} - task update sink</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private ProvidersProperties providers = new ProvidersProperties();
    private LlmProperties llm = new LlmProperties();
    private CacheProperties cache = new CacheProperties();
    private RoutingProperties routing = new RoutingProperties();
    private TasksProperties tasks = new TasksProperties();
    private StorageProperties storage = new StorageProperties();
    private NotificationProperties notifications = new NotificationProperties();

    // ==================== PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private ProviderProperties openai = new ProviderProperties(null, "gpt-4o");
        private ProviderProperties anthropic = new ProviderProperties(null, "claude-3-7-sonnet-20250219");
        private ProviderProperties perplexity = new ProviderProperties("https://api.perplexity.ai", "sonar");
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private String model;
        private int maxTokens = 1024;
        private Double temperature = 0.7;

        public ProviderProperties() {
        }

        public ProviderProperties(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    // ==================== LLM CALLS ====================

    @Data
    public static class LlmProperties {
        /** Hard timeout of a single provider call. */
        private Duration timeout = Duration.ofSeconds(30);

        /** Retries of rate-limited calls inside an adapter, with exponential backoff. */
        private int maxRetries = 3;

        private Duration initialBackoff = Duration.ofSeconds(2);
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private int maxSize = 100;

        /** Age after which a cached provider response is ignored. */
        private Duration ttl = Duration.ofMinutes(60);
    }

    // ==================== ROUTING ====================

    @Data
    public static class RoutingProperties {
        /** Minimum recorded interactions before the routing table is re-ranked. */
        private int minInteractions = 50;

        /** Minimum usages of a provider in a category before it may win that category. */
        private int minUsage = 5;

        private Duration optimizationCooldown = Duration.ofDays(7);

        /** Latency treated as the worst case when scoring providers. */
        private Duration latencyNormalization = Duration.ofSeconds(10);

        /**
         * Responses shorter than this are treated as low confidence when the caller
         * supplies a confidence threshold. A proxy, misfires on legitimately short
         * answers.
         */
        private int lowConfidenceLength = 20;

        private double defaultConfidenceThreshold = 0.7;
        private int historySize = 1000;

        /** Persist the routing state every N interactions. */
        private int saveEvery = 10;
    }

    // ==================== TASKS ====================

    @Data
    public static class TasksProperties {
        /** Upper bound of steps per task; reaching it fails the task. */
        private int maxStepsPerTask = 20;

        private int resultPreviewLength = 200;

        /** Re-run tasks left PENDING by a previous crash when the service starts. */
        private boolean resumeOnStartup = false;

        private ExecutorProperties executor = new ExecutorProperties();
    }

    @Data
    public static class ExecutorProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 8;
        private int queueCapacity = 100;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/orchestrator";
    }

    // ==================== NOTIFICATIONS ====================

    @Data
    public static class NotificationProperties {
        private boolean enabled = true;
    }
}
