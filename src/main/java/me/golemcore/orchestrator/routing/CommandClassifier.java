package me.golemcore.orchestrator.routing;

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

import me.golemcore.orchestrator.domain.model.CommandCategory;

/**
 * Assigns a {@link CommandCategory} to a free-text request so that it can be
 * routed to the provider mapped for that category.
 *
 * @see KeywordCommandClassifier
 */
public interface CommandClassifier {

    /**
     * Classify a request. Never returns {@code null}.
     *
     * @param text
     *            request text, may be {@code null} or blank
     * @return the detected category, {@link CommandCategory#INFORMATIONAL} when
     *         nothing matches
     */
    CommandCategory classify(String text);
}
