package com.etpassist.test.support;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.RequirementsPayload;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.domain.etp.service.EtpContentGenerationService;
import com.etpassist.domain.etp.service.ResponsePayloadGuardDomainService;

import java.util.List;

/**
 * 确定性内容生成：全部走守卫回填，改写结果可预设。
 */
public class FixedContentGenerationService implements EtpContentGenerationService {

    private final ResponsePayloadGuardDomainService payloadGuard = new ResponsePayloadGuardDomainService();

    private String rewriteResult;
    private String summary;
    private boolean configured;
    private int suggestCalls;
    private int regenerateCalls;

    @Override
    public RequirementsPayload suggestRequirements(String necessity) {
        suggestCalls++;
        return payloadGuard.ensureRequirements(null, necessity);
    }

    @Override
    public RequirementsPayload regenerateRequirements(String necessity, List<String> currentRequirements) {
        regenerateCalls++;
        return payloadGuard.ensureRequirements(null, necessity);
    }

    @Override
    public List<StrategyOption> suggestStrategies(String necessity, List<String> requirements) {
        return payloadGuard.ensureStrategies(null, necessity);
    }

    @Override
    public String rewriteRequirement(String necessity, RequirementItem item) {
        return rewriteResult;
    }

    @Override
    public String composeExecutiveSummary(EtpSessionEntity session, String adjustment) {
        if (summary != null) {
            return adjustment == null ? summary : summary + " (" + adjustment + ")";
        }
        return payloadGuard.ensureSummary(null, session.getNecessity());
    }

    @Override
    public boolean isGeneratorConfigured() {
        return configured;
    }

    public void setRewriteResult(String rewriteResult) {
        this.rewriteResult = rewriteResult;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public void setConfigured(boolean configured) {
        this.configured = configured;
    }

    public int getSuggestCalls() {
        return suggestCalls;
    }

    public int getRegenerateCalls() {
        return regenerateCalls;
    }
}
