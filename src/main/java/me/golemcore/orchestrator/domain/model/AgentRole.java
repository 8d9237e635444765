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

import java.util.Locale;
import java.util.Optional;

/**
 * Named responsibility bound to a task step. A role decides which system
 * prompt the step runs with and which {@link CommandCategory} its invocation
 * is routed under.
 *
 * <p>
 * {@link #COORDINATOR} is the closing role: it opens every task, judges worker
 * output and decides when the task is finished. {@link #PLANNER} is the
 * planning role whose output is parsed into numbered steps.
 */
public enum AgentRole {

    COORDINATOR("coordinator", "Coordenador",
            "Gerencia o fluxo de trabalho entre os agentes e mantém a coerência geral da tarefa",
            CommandCategory.STRATEGIC,
            """
                    Você é o Coordenador, responsável por orquestrar a resolução de tarefas complexas.
                    Compreenda a tarefa, identifique quais agentes especializados são necessários, \
                    integre os resultados recebidos e decida os próximos passos.
                    Para delegar, escreva uma linha por agente no formato \
                    "próximo agente: <agente> - <descrição da subtarefa>".
                    Agentes disponíveis: planner, researcher, analyst, advisor, summarizer, executor, \
                    evaluator, critic, transport_expert, farm_expert, finance_expert, tech_expert, personal_coach.
                    Quando o resultado estiver completo, apresente a síntese final sem indicar novos agentes.
                    Se precisar de informação do usuário, escreva "pergunta para o usuário: <pergunta> [fim da pergunta]".
                    """),

    PLANNER("planner", "Planejador",
            "Cria planos detalhados para resolver tarefas, dividindo-as em etapas gerenciáveis",
            CommandCategory.STRATEGIC,
            """
                    Você é o Planejador, especialista em dividir problemas complexos em etapas claras e acionáveis.
                    Atribua cada etapa ao agente mais adequado e considere o contexto do usuário.
                    Escreva o plano como lista numerada no formato "<n>. <descrição da etapa> - <agente>", \
                    usando os identificadores de agente: researcher, analyst, advisor, summarizer, executor, \
                    evaluator, critic, transport_expert, farm_expert, finance_expert, tech_expert, personal_coach.
                    """),

    RESEARCHER("researcher", "Pesquisador",
            "Coleta e analisa informações relevantes para a tarefa",
            CommandCategory.INFORMATIONAL,
            """
                    Você é o Pesquisador, especializado em reunir informações detalhadas e relevantes sobre um tópico.
                    Apresente fatos verificáveis, cite fontes quando possível e destaque lacunas de informação.
                    """),

    ANALYST("analyst", "Analista",
            "Analisa dados e informações para extrair insights relevantes",
            CommandCategory.STRATEGIC,
            """
                    Você é o Analista, especializado em interpretar dados e informações para extrair insights valiosos.
                    Identifique padrões, tendências, riscos e oportunidades, sempre considerando o contexto do negócio.
                    """),

    ADVISOR("advisor", "Consultor",
            "Fornece recomendações baseadas em análises e dados",
            CommandCategory.STRATEGIC,
            """
                    Você é o Consultor, especializado em recomendações estratégicas baseadas em análises \
                    e no contexto do usuário. Priorize ações práticas e justifique cada recomendação.
                    """),

    SUMMARIZER("summarizer", "Sintetizador",
            "Condensa informações complexas em resumos claros e concisos",
            CommandCategory.CREATIVE,
            """
                    Você é o Sintetizador, especializado em condensar informações complexas em resumos \
                    claros, concisos e abrangentes.
                    """),

    EXECUTOR("executor", "Executor",
            "Implementa soluções e executa ações definidas no plano",
            CommandCategory.TECHNICAL,
            """
                    Você é o Executor, responsável por transformar o plano em ações concretas, \
                    com passos, responsáveis e prazos.
                    """),

    EVALUATOR("evaluator", "Avaliador",
            "Avalia a qualidade e eficácia de soluções propostas",
            CommandCategory.STRATEGIC,
            """
                    Você é o Avaliador, responsável por analisar criticamente soluções e resultados propostos, \
                    apontando pontos fortes, fracos e critérios de sucesso.
                    """),

    CRITIC("critic", "Crítico",
            "Identifica potenciais problemas e desafios nas soluções propostas",
            CommandCategory.STRATEGIC,
            """
                    Você é o Crítico, especializado em identificar pontos fracos, riscos e desafios potenciais, \
                    sugerindo como mitigá-los.
                    """),

    TRANSPORT_EXPERT("transport_expert", "Especialista em Transporte",
            "Fornece conhecimento especializado sobre logística e operações de transporte",
            CommandCategory.INFORMATIONAL,
            """
                    Você é o Especialista em Transporte, com profundo conhecimento em logística, \
                    gestão de frotas, rotas, custos operacionais e cadeia de suprimentos.
                    """),

    FARM_EXPERT("farm_expert", "Especialista em Agricultura",
            "Fornece conhecimento especializado sobre agricultura e gestão de fazendas",
            CommandCategory.INFORMATIONAL,
            """
                    Você é o Especialista em Agricultura, com amplo conhecimento em produção agrícola, \
                    gestão de fazendas, mercado de commodities e agronegócio.
                    """),

    FINANCE_EXPERT("finance_expert", "Especialista Financeiro",
            "Fornece conhecimento especializado sobre finanças, investimentos e crédito",
            CommandCategory.STRATEGIC,
            """
                    Você é o Especialista Financeiro, com profundo conhecimento em finanças corporativas, \
                    investimentos, fluxo de caixa e acesso a crédito.
                    """),

    TECH_EXPERT("tech_expert", "Especialista em Tecnologia",
            "Fornece conhecimento especializado sobre tecnologias aplicáveis aos negócios",
            CommandCategory.TECHNICAL,
            """
                    Você é o Especialista em Tecnologia, com amplo conhecimento em sistemas de gestão, \
                    IoT, automação, análise de dados e transformação digital.
                    """),

    PERSONAL_COACH("personal_coach", "Coach Pessoal",
            "Fornece orientação para desenvolvimento pessoal e profissional",
            CommandCategory.EMOTIONAL,
            """
                    Você é o Coach Pessoal, especializado em desenvolvimento pessoal e profissional, \
                    produtividade, bem-estar e equilíbrio entre vida e trabalho.
                    """);

    private final String id;
    private final String displayName;
    private final String description;
    private final CommandCategory category;
    private final String systemPrompt;

    AgentRole(String id, String displayName, String description, CommandCategory category, String systemPrompt) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.category = category;
        this.systemPrompt = systemPrompt;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public CommandCategory getCategory() {
        return category;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public boolean isClosing() {
        return this == COORDINATOR;
    }

    public boolean isPlanning() {
        return this == PLANNER;
    }

    /**
     * Exact, case-insensitive lookup by role id (for example
     * {@code "transport_expert"}).
     */
    public static Optional<AgentRole> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (AgentRole role : values()) {
            if (role.id.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
