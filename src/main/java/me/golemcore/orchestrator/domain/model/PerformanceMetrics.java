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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Rolling aggregate for one (category, provider) pair. Every average is
 * maintained incrementally, {@code newAvg = (oldAvg * (n - 1) + value) / n},
 * so no raw history is needed to reconstruct it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private long usageCount;
    private double averageLatencyMs;
    private double averageConfidence;
    private double successRate;
    private Instant lastUsed;

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics();
    }

    /**
     * Folds one interaction outcome into the aggregate.
     */
    public void record(long latencyMs, double confidence, boolean success, Instant timestamp) {
        usageCount++;
        long n = usageCount;
        averageLatencyMs = (averageLatencyMs * (n - 1) + latencyMs) / n;
        averageConfidence = (averageConfidence * (n - 1) + confidence) / n;
        long successes = Math.round(successRate * (n - 1)) + (success ? 1 : 0);
        successRate = (double) successes / n;
        lastUsed = timestamp;
    }

    public PerformanceMetrics copy() {
        return new PerformanceMetrics(usageCount, averageLatencyMs, averageConfidence, successRate, lastUsed);
    }
}
