package me.golemcore.orchestrator.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.port.outbound.RecordStorePort;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Record store on top of {@link StoragePort}. A key {@code "state/tasks"} maps
 * to the snapshot file {@code state/tasks.json}; appends go to the JSONL log
 * {@code state/tasks.jsonl}.
 *
 * <p>
 * Failures are logged and never propagated: a failed load yields the default
 * value, a failed write leaves the previous snapshot in place.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonRecordStoreAdapter implements RecordStorePort {

    private static final String SNAPSHOT_SUFFIX = ".json";
    private static final String LOG_SUFFIX = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public <T> T load(String key, TypeReference<T> type, T defaultValue) {
        RecordKey recordKey = RecordKey.parse(key);
        try {
            String json = storagePort.getText(recordKey.directory(), recordKey.name() + SNAPSHOT_SUFFIX).join();
            if (json == null || json.isBlank()) {
                return defaultValue;
            }
            T value = objectMapper.readValue(json, type);
            return value != null ? value : defaultValue;
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[Storage] Failed to load '{}', using defaults: {}", key, e.getMessage());
            return defaultValue;
        }
    }

    @Override
    public <T> void save(String key, T value) {
        RecordKey recordKey = RecordKey.parse(key);
        try {
            String json = objectMapper.writeValueAsString(value);
            storagePort.putTextAtomic(recordKey.directory(), recordKey.name() + SNAPSHOT_SUFFIX, json, true).join();
            log.debug("[Storage] Saved '{}'", key);
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - persistence must not break callers
            log.error("[Storage] Failed to save '{}'", key, e);
        }
    }

    @Override
    public <T> void append(String key, T record) {
        RecordKey recordKey = RecordKey.parse(key);
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            storagePort.appendText(recordKey.directory(), recordKey.name() + LOG_SUFFIX, line).join();
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - persistence must not break callers
            log.warn("[Storage] Failed to append to '{}': {}", key, e.getMessage());
        }
    }

    record RecordKey(String directory, String name) {

        static RecordKey parse(String key) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Record key must not be blank");
            }
            int slash = key.indexOf('/');
            if (slash <= 0 || slash == key.length() - 1) {
                throw new IllegalArgumentException("Record key must be '<directory>/<name>': " + key);
            }
            return new RecordKey(key.substring(0, slash), key.substring(slash + 1));
        }
    }
}
