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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the named response caches used by provider adapters. A cache is created
 * on first request; the size argument is ignored for caches that already
 * exist.
 */
@Component
@Slf4j
public class ResponseCacheRegistry {

    private final Map<String, BoundedResponseCache<?>> caches = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <V> BoundedResponseCache<V> getCache(String name, int maxSize) {
        return (BoundedResponseCache<V>) caches.computeIfAbsent(name, key -> {
            log.info("[Cache] '{}' created with capacity {}", key, maxSize);
            return new BoundedResponseCache<>(key, maxSize);
        });
    }

    public boolean removeCache(String name) {
        BoundedResponseCache<?> removed = caches.remove(name);
        if (removed == null) {
            return false;
        }
        removed.clear();
        log.info("[Cache] '{}' removed", name);
        return true;
    }

    public void clearAll() {
        caches.values().forEach(BoundedResponseCache::clear);
    }

    public List<CacheStats> getStats() {
        return caches.values().stream()
                .map(BoundedResponseCache::getStats)
                .toList();
    }
}
