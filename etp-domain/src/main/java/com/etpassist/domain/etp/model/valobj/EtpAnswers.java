package com.etpassist.domain.etp.model.valobj;

import com.etpassist.types.enums.AnswerTopicEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话答案包：按阶段收集的结构化字段，整体以 answersJSON 持久化。
 */
@Data
public class EtpAnswers {

    /**
     * generate_document 阶段的当前子游标
     */
    private AnswerTopicEnum currentTopic;

    // 采购策略
    private List<StrategyOption> offeredStrategies = new ArrayList<>();
    private String chosenStrategy;
    private String strategyRecommendation;

    // PCA：sim / nao / nao_informado / Pendente
    private String pcaStatus;
    private String pcaDetail;

    // 价格调研
    private String priceResearchMethod;
    private Integer supplierCount;
    private List<String> evidenceLinks = new ArrayList<>();

    // 法律依据
    private String legalBasisText;
    private String legalBasisNotes;
    private List<LegalNorm> legalNorms = new ArrayList<>();

    // 数量与金额
    private QuantityValueEstimate quantityValue;
    private String valueMethodology;

    // 分包：sim / nao / Pendente
    private String installmentDecision;
    private String installmentText;

    // 摘要
    private String executiveSummary;
    private List<String> summaryAdjustments = new ArrayList<>();

    /**
     * 非空字段快照，用于响应增量与会话查询。
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        putIfPresent(snapshot, "currentTopic", currentTopic == null ? null : currentTopic.getCode());
        if (offeredStrategies != null && !offeredStrategies.isEmpty()) {
            List<String> titles = new ArrayList<>();
            for (StrategyOption option : offeredStrategies) {
                titles.add(option.getTitle());
            }
            snapshot.put("offeredStrategies", titles);
        }
        putIfPresent(snapshot, "chosenStrategy", chosenStrategy);
        putIfPresent(snapshot, "strategyRecommendation", strategyRecommendation);
        putIfPresent(snapshot, "pcaStatus", pcaStatus);
        putIfPresent(snapshot, "pcaDetail", pcaDetail);
        putIfPresent(snapshot, "priceResearchMethod", priceResearchMethod);
        putIfPresent(snapshot, "supplierCount", supplierCount);
        if (evidenceLinks != null && !evidenceLinks.isEmpty()) {
            snapshot.put("evidenceLinks", new ArrayList<>(evidenceLinks));
        }
        putIfPresent(snapshot, "legalBasisText", legalBasisText);
        putIfPresent(snapshot, "legalBasisNotes", legalBasisNotes);
        if (quantityValue != null && !quantityValue.hasNoData()) {
            Map<String, Object> estimate = new LinkedHashMap<>();
            putIfPresent(estimate, "quantity", quantityValue.getQuantity());
            putIfPresent(estimate, "unit", quantityValue.getUnit());
            putIfPresent(estimate, "value", quantityValue.getValue());
            putIfPresent(estimate, "period", quantityValue.getPeriod());
            putIfPresent(estimate, "description", quantityValue.getDescription());
            snapshot.put("quantityValue", estimate);
        }
        putIfPresent(snapshot, "valueMethodology", valueMethodology);
        putIfPresent(snapshot, "installmentDecision", installmentDecision);
        putIfPresent(snapshot, "installmentText", installmentText);
        putIfPresent(snapshot, "executiveSummary", executiveSummary);
        return snapshot;
    }

    private void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String text && text.trim().isEmpty()) {
            return;
        }
        target.put(key, value);
    }
}
