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
 * Classification bucket for an incoming request. Used as the routing key of the
 * provider routing table and, through {@link AgentRole#getCategory()}, as the
 * routing context of task steps.
 */
public enum CommandCategory {
    CREATIVE, STRATEGIC, INFORMATIONAL, EMOTIONAL, TECHNICAL, VOICE
}
