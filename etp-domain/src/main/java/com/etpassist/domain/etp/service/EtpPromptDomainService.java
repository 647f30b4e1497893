package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * ETP 提示词领域服务：每个生成场景都要求严格 JSON 输出并禁止开场白。
 */
@Service
public class EtpPromptDomainService {

    private static final String SYSTEM_PROMPT = "Você é um consultor especialista em contratações públicas brasileiras "
            + "(Lei 14.133/2021) e apoia a elaboração do Estudo Técnico Preliminar (ETP). "
            + "Responda sempre em português do Brasil, de forma objetiva, sem perguntas e sem textos de abertura. "
            + "Retorne apenas o JSON solicitado, sem comentários fora dele.";

    private static final String FORBIDDEN_BLOCK = "É EXPRESSAMENTE PROIBIDO incluir:\n"
            + "- \"Descrição da Necessidade\"\n"
            + "- \"Justificativa da Contratação\" (em qualquer forma)\n"
            + "- Frases como \"Vamos começar\", \"Posso seguir\", \"Posso avançar\"\n";

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildRequirementsPrompt(String necessity) {
        StringBuilder builder = new StringBuilder();
        builder.append("Necessidade da contratação: ").append(safeText(necessity)).append("\n\n");
        builder.append("Gere APENAS uma lista de 8 a 12 requisitos técnicos e operacionais, sem perguntas e sem textos de abertura. ");
        builder.append("Cada item deve incluir critério de verificação/auditoria.\n");
        builder.append(FORBIDDEN_BLOCK);
        builder.append("\nSaída OBRIGATÓRIA (JSON estrito):\n");
        builder.append("{\"intro\": \"...\", \"requisitos\": [\"...\", \"...\"], \"rationale\": \"...\"}");
        return builder.toString();
    }

    public String buildRegeneratePrompt(String necessity, List<String> currentRequirements) {
        StringBuilder builder = new StringBuilder(buildRequirementsPrompt(necessity));
        builder.append("\n\nO usuário pediu uma nova versão. Não repita literalmente a lista anterior:\n");
        appendNumbered(builder, currentRequirements);
        return builder.toString();
    }

    public String buildStrategiesPrompt(String necessity, List<String> requirements) {
        StringBuilder builder = new StringBuilder();
        builder.append("Necessidade da contratação: ").append(safeText(necessity)).append("\n");
        builder.append("Requisitos aprovados:\n");
        appendNumbered(builder, requirements);
        builder.append("\nProponha APENAS 2 a 4 estratégias de contratação coerentes com a necessidade e os requisitos aprovados. ");
        builder.append("Para cada estratégia retorne título, quando é indicada, vantagens e riscos (bullets curtos).\n");
        builder.append("PROIBIDO nesta etapa: justificativas narrativas, \"recomendação final\" e onboarding.\n");
        builder.append("\nSaída JSON estrita:\n");
        builder.append("{\"estrategias\": [{\"titulo\": \"...\", \"quando_indicado\": \"...\", ");
        builder.append("\"vantagens\": [\"...\"], \"riscos\": [\"...\"]}]}");
        return builder.toString();
    }

    public String buildRewritePrompt(String necessity, RequirementItem item) {
        StringBuilder builder = new StringBuilder();
        builder.append("Necessidade da contratação: ").append(safeText(necessity)).append("\n");
        builder.append("Requisito atual ").append(item == null ? "" : safeText(item.getId())).append(": ");
        builder.append(item == null ? "" : safeText(item.getText())).append("\n\n");
        builder.append("Reescreva este requisito de forma mais objetiva e verificável, em uma única frase, sem numeração.\n");
        builder.append("Saída JSON estrita: {\"requisito\": \"...\"}");
        return builder.toString();
    }

    public String buildSummaryPrompt(EtpSessionEntity session, String adjustment, List<String> references) {
        EtpAnswers answers = session.answersOrEmpty();
        StringBuilder builder = new StringBuilder();
        builder.append("Redija o resumo executivo final do ETP, coerente com as etapas anteriores. Sem onboarding.\n\n");
        builder.append("Necessidade: ").append(safeText(session.getNecessity())).append("\n");
        builder.append("Requisitos:\n");
        appendNumbered(builder, session.requirementTexts());
        builder.append("Estratégia escolhida: ").append(safeText(answers.getChosenStrategy())).append("\n");
        builder.append("PCA: ").append(safeText(answers.getPcaStatus()));
        if (answers.getPcaDetail() != null) {
            builder.append(" (").append(answers.getPcaDetail()).append(")");
        }
        builder.append("\n");
        builder.append("Pesquisa de preços: ").append(safeText(answers.getPriceResearchMethod())).append("\n");
        builder.append("Base legal: ").append(safeText(answers.getLegalBasisText())).append("\n");
        builder.append("Parcelamento: ").append(safeText(answers.getInstallmentDecision())).append("\n");
        if (adjustment != null && !adjustment.trim().isEmpty()) {
            builder.append("\nAjuste solicitado pelo usuário: ").append(adjustment.trim()).append("\n");
        }
        if (references != null && !references.isEmpty()) {
            builder.append("\nTrechos de ETPs de referência (use apenas como inspiração de estilo):\n");
            for (String reference : references) {
                builder.append("- ").append(reference).append("\n");
            }
        }
        builder.append("\nSaída JSON: {\"executive_summary\": \"...\"}");
        return builder.toString();
    }

    private void appendNumbered(StringBuilder builder, List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            builder.append("(nenhum)\n");
            return;
        }
        for (int i = 0; i < lines.size(); i++) {
            builder.append(i + 1).append(". ").append(lines.get(i)).append("\n");
        }
    }

    private String safeText(String value) {
        return value == null || value.trim().isEmpty() ? "não informado" : value.trim();
    }
}
