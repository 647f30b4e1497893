package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.EtpParts;
import com.etpassist.domain.etp.model.valobj.LegalNorm;
import com.etpassist.domain.etp.model.valobj.QuantityValueEstimate;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.domain.etp.model.valobj.ValueItem;
import com.etpassist.types.common.Constants;
import com.etpassist.types.enums.DocSectionEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ETP 文档组装领域服务，章节正文的唯一写入方。
 * <p>
 * 对话阶段只累积结构化数据，预览与导出都以本服务的输出为准；来源为空的章节不出现。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-14
 */
@Service
public class EtpDocumentAssemblerDomainService {

    public Map<DocSectionEnum, String> assemble(EtpParts parts) {
        Map<DocSectionEnum, String> sections = new LinkedHashMap<>();
        if (parts == null) {
            return sections;
        }

        putIfPresent(sections, DocSectionEnum.INTRODUCAO, parts.getExecutiveSummary());
        putIfPresent(sections, DocSectionEnum.OBJETO_DESC_NECESSIDADE, parts.getNecessityText());
        putIfPresent(sections, DocSectionEnum.OBJETO_PCA, parts.getPcaText());

        if (parts.getRequirements() != null && !parts.getRequirements().isEmpty()) {
            sections.put(DocSectionEnum.REQ_TECNICOS, String.join("\n", parts.getRequirements()));
        }
        if (parts.getNorms() != null && !parts.getNorms().isEmpty()) {
            List<String> lines = new ArrayList<>();
            for (LegalNorm norm : parts.getNorms()) {
                lines.add("- " + nullToEmpty(norm.getRef()) + ": " + nullToEmpty(norm.getApplies()));
            }
            sections.put(DocSectionEnum.REQ_NORMATIVOS, String.join("\n", lines));
        }

        if (parts.getValueItems() != null && !parts.getValueItems().isEmpty()) {
            List<String> lines = new ArrayList<>();
            for (ValueItem item : parts.getValueItems()) {
                lines.add("- " + nullToEmpty(item.getDescription()) + ": "
                        + nullToEmpty(item.getQuantity()) + " x " + nullToEmpty(item.getUnitValue()));
            }
            String table = String.join("\n", lines);
            sections.put(DocSectionEnum.ESTIMATIVA_QTD, table);
            sections.put(DocSectionEnum.ESTIMATIVA_VALOR, table);
        }
        if (hasText(parts.getValueMethodology())) {
            String current = sections.getOrDefault(DocSectionEnum.ESTIMATIVA_VALOR, "");
            sections.put(DocSectionEnum.ESTIMATIVA_VALOR, (current + "\n\nMetodologia: " + parts.getValueMethodology()).trim());
        }

        putIfPresent(sections, DocSectionEnum.SOLUCAO_COMO_UM_TODO, parts.getRecommendation());

        if (hasText(parts.getInstallmentDecision()) || hasText(parts.getInstallmentText())) {
            sections.put(DocSectionEnum.JUSTIFICATIVA_PARCELAMENTO,
                    (nullToEmpty(parts.getInstallmentDecision()) + "\n" + nullToEmpty(parts.getInstallmentText())).trim());
        }
        return sections;
    }

    /**
     * 把会话中累积的答案转换为组装输入。待定标记与“não informado”按原样保留。
     */
    public EtpParts buildParts(EtpSessionEntity session) {
        if (session == null) {
            throw new IllegalStateException("session 不能为空");
        }
        EtpAnswers answers = session.answersOrEmpty();

        List<String> requirementLines = new ArrayList<>();
        if (session.getRequirements() != null) {
            for (RequirementItem item : session.getRequirements()) {
                requirementLines.add(item.getId() + " — " + item.getText());
            }
        }

        return EtpParts.builder()
                .necessityText(session.getNecessity())
                .requirements(requirementLines)
                .strategies(answers.getOfferedStrategies() == null
                        ? new ArrayList<>() : new ArrayList<>(answers.getOfferedStrategies()))
                .recommendation(recommendation(answers))
                .pcaStatus(answers.getPcaStatus())
                .pcaText(pcaText(answers))
                .norms(norms(answers))
                .valueItems(valueItems(answers.getQuantityValue()))
                .valueMethodology(answers.getValueMethodology())
                .installmentDecision(installmentDecision(answers.getInstallmentDecision()))
                .installmentText(answers.getInstallmentText())
                .executiveSummary(answers.getExecutiveSummary())
                .build();
    }

    private String recommendation(EtpAnswers answers) {
        String chosen = answers.getChosenStrategy();
        if (!hasText(chosen)) {
            return answers.getStrategyRecommendation();
        }
        if (answers.getOfferedStrategies() != null) {
            for (StrategyOption option : answers.getOfferedStrategies()) {
                if (chosen.equals(option.getTitle()) && hasText(option.getWhenIndicated())) {
                    return chosen + ". " + option.getWhenIndicated();
                }
            }
        }
        return chosen;
    }

    private String pcaText(EtpAnswers answers) {
        String status = answers.getPcaStatus();
        String detail = answers.getPcaDetail();
        if (!hasText(status) && !hasText(detail)) {
            return null;
        }
        String base;
        if ("sim".equals(status)) {
            base = "A contratação está prevista no Plano de Contratações Anual.";
        } else if ("nao".equals(status)) {
            base = "A contratação não está prevista no Plano de Contratações Anual.";
        } else if (hasText(status)) {
            base = "Previsão no PCA: " + status;
        } else {
            base = "";
        }
        return hasText(detail) ? (base + " " + detail).trim() : base;
    }

    private List<LegalNorm> norms(EtpAnswers answers) {
        List<LegalNorm> norms = new ArrayList<>();
        if (answers.getLegalNorms() != null && !answers.getLegalNorms().isEmpty()) {
            norms.addAll(answers.getLegalNorms());
            return norms;
        }
        String text = answers.getLegalBasisText();
        if (!hasText(text)) {
            return norms;
        }
        String applies = hasText(answers.getLegalBasisNotes()) ? answers.getLegalBasisNotes() : "aplicável à contratação";
        for (String part : text.split("[;\\n]")) {
            String ref = part.trim();
            if (!ref.isEmpty()) {
                norms.add(new LegalNorm(ref, applies));
            }
        }
        return norms;
    }

    private List<ValueItem> valueItems(QuantityValueEstimate estimate) {
        List<ValueItem> items = new ArrayList<>();
        if (estimate == null || estimate.hasNoData()) {
            return items;
        }
        String description = hasText(estimate.getDescription()) ? estimate.getDescription() : "Objeto da contratação";
        String quantity = estimate.getQuantity() == null
                ? Constants.NOT_INFORMED
                : estimate.getQuantity() + (hasText(estimate.getUnit()) ? " " + estimate.getUnit() : "");
        String unitValue;
        if (estimate.getValue() == null) {
            unitValue = Constants.NOT_INFORMED;
        } else {
            unitValue = "R$ " + estimate.getValue().toPlainString()
                    + (hasText(estimate.getPeriod()) ? "/" + estimate.getPeriod() : "");
        }
        items.add(new ValueItem(description, quantity, unitValue));
        return items;
    }

    private String installmentDecision(String decision) {
        if ("sim".equals(decision)) {
            return "Haverá parcelamento da solução.";
        }
        if ("nao".equals(decision)) {
            return "Não haverá parcelamento da solução.";
        }
        return decision;
    }

    private void putIfPresent(Map<DocSectionEnum, String> sections, DocSectionEnum section, String value) {
        if (hasText(value)) {
            sections.put(section, value);
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
