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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.CommandCategory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-count classifier. Counts substring hits of each category's keywords
 * in the lower-cased text; the highest count wins. A shared top count or no
 * hit at all falls back to INFORMATIONAL.
 */
@Component
@Slf4j
public class KeywordCommandClassifier implements CommandClassifier {

    private static final CommandCategory DEFAULT_CATEGORY = CommandCategory.INFORMATIONAL;

    private static final Map<CommandCategory, List<String>> KEYWORDS = new EnumMap<>(CommandCategory.class);

    static {
        KEYWORDS.put(CommandCategory.CREATIVE,
                List.of("criar", "imaginar", "inventar", "criativo", "ideia", "inovação"));
        KEYWORDS.put(CommandCategory.STRATEGIC,
                List.of("estratégia", "negócio", "planejar", "competidor", "mercado", "análise"));
        KEYWORDS.put(CommandCategory.INFORMATIONAL,
                List.of("informação", "pesquisar", "dados", "fatos", "notícia", "atual"));
        KEYWORDS.put(CommandCategory.EMOTIONAL,
                List.of("motivação", "sentimento", "ânimo", "conselho", "suporte", "ajuda"));
        KEYWORDS.put(CommandCategory.TECHNICAL,
                List.of("código", "programação", "técnico", "implementar", "explicar", "como"));
        KEYWORDS.put(CommandCategory.VOICE,
                List.of("falar", "voz", "sintetizar", "áudio", "pronunciar", "escutar"));
    }

    @Override
    public CommandCategory classify(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT_CATEGORY;
        }
        String lowerText = text.toLowerCase(Locale.ROOT);

        CommandCategory best = DEFAULT_CATEGORY;
        int bestCount = 0;
        boolean tied = false;
        for (Map.Entry<CommandCategory, List<String>> entry : KEYWORDS.entrySet()) {
            int count = 0;
            for (String keyword : entry.getValue()) {
                if (lowerText.contains(keyword)) {
                    count++;
                }
            }
            if (count > bestCount) {
                bestCount = count;
                best = entry.getKey();
                tied = false;
            } else if (count > 0 && count == bestCount) {
                tied = true;
            }
        }
        if (tied) {
            best = DEFAULT_CATEGORY;
        }
        log.debug("[Routing] Classified request as {} ({} keyword hits)", best, bestCount);
        return best;
    }
}
