package me.golemcore.orchestrator.domain.interpret;

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
import me.golemcore.orchestrator.domain.model.AgentRole;
import me.golemcore.orchestrator.domain.model.NextStepProposal;
import me.golemcore.orchestrator.domain.model.ResponseInterpretation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Marker-based interpreter for the Portuguese conventions the agent prompts
 * ask for, such as {@code "pergunta para o usuário: ... [fim da pergunta]"},
 * {@code "próximo agente: researcher - ..."} and
 * {@code "1. Levantar custos - finance_expert"}.
 */
@Component
@Slf4j
public class MarkerResponseInterpreter implements ResponseInterpreter {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final int MIN_FUZZY_TOKEN_LENGTH = 4;

    private static final List<Pattern> INPUT_MARKERS = List.of(
            Pattern.compile("\\[input do usuário necessário\\]", FLAGS),
            Pattern.compile("\\[requer informação do usuário\\]", FLAGS),
            Pattern.compile("\\[aguardando resposta do usuário\\]", FLAGS),
            Pattern.compile("pergunta para o usuário:", FLAGS),
            Pattern.compile("o usuário precisa fornecer:", FLAGS),
            Pattern.compile("preciso que o usuário informe:", FLAGS),
            Pattern.compile("necessito da seguinte informação do usuário:", FLAGS));

    private static final List<Pattern> PROMPT_PATTERNS = List.of(
            Pattern.compile("pergunta para o usuário:(.*?)(?:\\[fim da pergunta\\]|$)", FLAGS | Pattern.DOTALL),
            Pattern.compile("o usuário precisa fornecer:(.*?)(?:\\[fim\\]|$)", FLAGS | Pattern.DOTALL),
            Pattern.compile("preciso que o usuário informe:(.*?)(?:\\[fim\\]|$)", FLAGS | Pattern.DOTALL),
            Pattern.compile("necessito da seguinte informação do usuário:(.*?)(?:\\[fim\\]|$)",
                    FLAGS | Pattern.DOTALL));

    private static final List<String> BRACKET_MARKERS = List.of(
            "[input do usuário necessário]",
            "[requer informação do usuário]",
            "[aguardando resposta do usuário]");

    private static final String GENERIC_PROMPT_PREFIX = "Por favor, forneça informações adicionais: ";

    private static final Pattern DELEGATION = Pattern.compile(
            "(?:próximo agente|agente recomendado|delegar para|usar o agente):\\s*([a-z_]+)(?:\\s*-\\s*(.+?))?(?:\\n|$)",
            FLAGS);

    private static final List<Pattern> SECTIONS = List.of(
            Pattern.compile("próximos passos:(.*?)(?:\\n\\s*\\n|$)", FLAGS | Pattern.DOTALL),
            Pattern.compile("agentes necessários:(.*?)(?:\\n\\s*\\n|$)", FLAGS | Pattern.DOTALL));

    private static final Pattern LIST_BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s*");
    private static final Pattern SECTION_ITEM_SEPARATOR = Pattern.compile("\\s+-\\s+|:\\s+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}_]+");

    private static final List<Pattern> PLAN_PATTERNS = List.of(
            Pattern.compile("(\\d+)\\.\\s*([^-\\n]+)\\s*-\\s*([a-z_]+)", FLAGS),
            Pattern.compile("etapa\\s*(\\d+)\\s*:\\s*([^(]+)\\s*\\(([a-z_]+)\\)", FLAGS),
            Pattern.compile("passo\\s*(\\d+)\\s*:\\s*([^(]+)\\s*\\(([a-z_]+)\\)", FLAGS));

    @Override
    public ResponseInterpretation interpret(String text) {
        if (text == null || text.isBlank()) {
            return ResponseInterpretation.plain();
        }
        if (requiresUserInput(text)) {
            return ResponseInterpretation.needsInput(extractInputPrompt(text));
        }
        List<NextStepProposal> nextRoles = parseNextRoles(text);
        if (!nextRoles.isEmpty()) {
            return ResponseInterpretation.nextSteps(nextRoles);
        }
        return ResponseInterpretation.plain();
    }

    boolean requiresUserInput(String text) {
        return INPUT_MARKERS.stream().anyMatch(p -> p.matcher(text).find());
    }

    String extractInputPrompt(String text) {
        for (Pattern pattern : PROMPT_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String prompt = matcher.group(1).trim();
                if (!prompt.isEmpty()) {
                    return prompt;
                }
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        int markerIndex = -1;
        for (String marker : BRACKET_MARKERS) {
            markerIndex = Math.max(markerIndex, lower.indexOf(marker));
        }
        if (markerIndex >= 0) {
            return text.substring(markerIndex).trim();
        }
        return GENERIC_PROMPT_PREFIX + text;
    }

    // ==================== DELEGATION ====================

    @Override
    public List<NextStepProposal> parseNextRoles(String text) {
        List<NextStepProposal> proposals = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return proposals;
        }
        Set<AgentRole> seen = EnumSet.noneOf(AgentRole.class);

        Matcher matcher = DELEGATION.matcher(text);
        while (matcher.find()) {
            Optional<AgentRole> role = AgentRole.fromId(matcher.group(1));
            if (role.isPresent()) {
                proposals.add(new NextStepProposal(role.get(), blankToNull(matcher.group(2))));
                seen.add(role.get());
            } else {
                log.debug("[TaskExec] Ignoring delegation to unknown agent '{}'", matcher.group(1));
            }
        }

        for (Pattern section : SECTIONS) {
            Matcher sectionMatcher = section.matcher(text);
            if (!sectionMatcher.find()) {
                continue;
            }
            for (String line : sectionMatcher.group(1).split("\\R")) {
                parseSectionLine(line).ifPresent(proposal -> {
                    if (seen.add(proposal.role())) {
                        proposals.add(proposal);
                    }
                });
            }
        }
        return proposals;
    }

    private Optional<NextStepProposal> parseSectionLine(String line) {
        String item = LIST_BULLET.matcher(line).replaceFirst("").trim();
        if (item.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = SECTION_ITEM_SEPARATOR.split(item, 2);
        String head = parts[0].trim();
        String description = parts.length > 1 ? blankToNull(parts[1]) : null;

        Optional<AgentRole> role = resolveSectionRole(head);
        return role.map(r -> new NextStepProposal(r, description));
    }

    private Optional<AgentRole> resolveSectionRole(String head) {
        Optional<AgentRole> exact = AgentRole.fromId(head);
        if (exact.isPresent()) {
            return exact;
        }
        for (AgentRole role : AgentRole.values()) {
            if (role.getDisplayName().equalsIgnoreCase(head)) {
                return Optional.of(role);
            }
        }
        for (String token : TOKEN_SPLIT.split(head.toLowerCase(Locale.ROOT))) {
            if (token.length() < MIN_FUZZY_TOKEN_LENGTH) {
                continue;
            }
            for (AgentRole role : AgentRole.values()) {
                if (token.contains(role.getId())) {
                    return Optional.of(role);
                }
            }
        }
        return Optional.empty();
    }

    // ==================== PLANS ====================

    @Override
    public List<NextStepProposal> parsePlannedSteps(String text) {
        List<NextStepProposal> steps = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return steps;
        }
        for (Pattern pattern : PLAN_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String description = matcher.group(2) != null ? matcher.group(2).trim() : "";
                String roleToken = matcher.group(3);
                if (description.isEmpty() || roleToken == null) {
                    continue;
                }
                resolvePlanRole(roleToken)
                        .ifPresent(role -> steps.add(new NextStepProposal(role, description)));
            }
            if (!steps.isEmpty()) {
                break;
            }
        }
        return steps;
    }

    private Optional<AgentRole> resolvePlanRole(String token) {
        Optional<AgentRole> exact = AgentRole.fromId(token);
        if (exact.isPresent()) {
            return exact;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() < MIN_FUZZY_TOKEN_LENGTH) {
            return Optional.empty();
        }
        for (AgentRole role : AgentRole.values()) {
            if (role.getId().contains(normalized) || normalized.contains(role.getId())) {
                return Optional.of(role);
            }
        }
        for (AgentRole role : AgentRole.values()) {
            String displayName = role.getDisplayName().toLowerCase(Locale.ROOT);
            if (displayName.contains(normalized) || normalized.contains(displayName)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
