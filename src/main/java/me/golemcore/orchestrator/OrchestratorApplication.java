package me.golemcore.orchestrator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the GolemCore intelligence orchestrator.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Command routing</b> - keyword classification of requests into
 * categories, each mapped to a preferred LLM provider</li>
 * <li><b>Fallback execution</b> - ordered alternates per category, hard
 * timeouts and low-confidence upgrades</li>
 * <li><b>Performance-driven optimization</b> - per provider and category
 * metrics re-rank the routing table</li>
 * <li><b>Multi-agent tasks</b> - role-based steps (coordinator, planner,
 * researcher, ...) that pause for user input and recover from failures</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → IntelligenceController, TasksController
 * Domain Layer       → FallbackExecutionService, TaskService, TaskExecutionService
 * Infrastructure     → LLM/Storage/Notification Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code orchestrator.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

}
