package me.golemcore.orchestrator.cache;

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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe key/value cache with a fixed capacity and least-recently-used
 * eviction.
 *
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}:
 * <ul>
 * <li>{@link #get(String)} and {@link #set(String, Object)} refresh the
 * entry's access position</li>
 * <li>{@link #has(String)} does not</li>
 * <li>storing a new key into a full cache silently evicts the least recently
 * accessed entry</li>
 * </ul>
 *
 * <p>
 * There is no time-based expiry. Callers needing a TTL store a timestamp
 * inside the value and compare it themselves (see {@link CachedResponse}).
 *
 * @param <V>
 *            value type
 * @since 1.0
 */
@Slf4j
public class BoundedResponseCache<V> {

    private static final float LOAD_FACTOR = 0.75f;

    private final String name;
    private final int maxSize;
    private final LinkedHashMap<String, V> entries;

    private long hits;
    private long misses;
    private long evictions;

    public BoundedResponseCache(String name, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, LOAD_FACTOR, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                if (size() > BoundedResponseCache.this.maxSize) {
                    evictions++;
                    log.trace("[Cache] '{}' evicted least recently used key: {}", BoundedResponseCache.this.name,
                            eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    public synchronized void set(String key, V value) {
        Objects.requireNonNull(value, "value");
        entries.put(key, value);
    }

    public synchronized Optional<V> get(String key) {
        V value = entries.get(key);
        if (value == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(value);
    }

    public synchronized boolean has(String key) {
        return entries.containsKey(key);
    }

    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
        log.debug("[Cache] '{}' cleared", name);
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Keys from least to most recently accessed.
     */
    public synchronized List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized CacheStats getStats() {
        return new CacheStats(name, entries.size(), maxSize, (double) entries.size() / maxSize, hits, misses,
                evictions);
    }

    public String getName() {
        return name;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
