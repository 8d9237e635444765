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

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Port for durable typed records keyed by name: tasks, orchestrator state and
 * the interaction log. Writes to different keys are independent; no
 * cross-key transactions.
 */
public interface RecordStorePort {

    /**
     * Load the value stored under {@code key}, or {@code defaultValue} when nothing
     * is stored or the stored content cannot be read.
     */
    <T> T load(String key, TypeReference<T> type, T defaultValue);

    /**
     * Replace the value stored under {@code key}.
     */
    <T> void save(String key, T value);

    /**
     * Append one record to the log stored under {@code key}.
     */
    <T> void append(String key, T record);
}
