package com.etpassist.domain.etp.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 文档组装输入：各阶段累积的结构化数据。阶段本身从不直接产出章节正文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtpParts {

    private String necessityText;

    @Builder.Default
    private List<String> requirements = new ArrayList<>();

    @Builder.Default
    private List<StrategyOption> strategies = new ArrayList<>();

    private String recommendation;

    private String pcaStatus;

    private String pcaText;

    @Builder.Default
    private List<LegalNorm> norms = new ArrayList<>();

    @Builder.Default
    private List<ValueItem> valueItems = new ArrayList<>();

    private String valueMethodology;

    private String installmentDecision;

    private String installmentText;

    private String executiveSummary;
}
