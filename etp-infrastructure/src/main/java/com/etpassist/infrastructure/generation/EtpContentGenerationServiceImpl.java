package com.etpassist.infrastructure.generation;

import com.etpassist.domain.etp.adapter.gateway.IKnowledgeRetriever;
import com.etpassist.domain.etp.adapter.gateway.ITextGenerator;
import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.RequirementsPayload;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.domain.etp.service.EtpContentGenerationService;
import com.etpassist.domain.etp.service.EtpPromptDomainService;
import com.etpassist.domain.etp.service.ResponsePayloadGuardDomainService;
import com.etpassist.infrastructure.ai.config.EtpGenerationProperties;
import com.etpassist.infrastructure.util.JsonCodec;
import com.etpassist.types.enums.GenerationProfileEnum;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * ETP 内容生成服务实现。
 * <p>
 * 调用链：提示词构建 -> 文本生成 -> 宽松 JSON 解析 -> 载荷守卫。
 * 任一环节失败都记录回退原因并返回守卫生成的确定性结果，不向对话层抛出异常。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-16
 */
@Slf4j
@Service
public class EtpContentGenerationServiceImpl implements EtpContentGenerationService {

    private static final String METRIC_FALLBACK_TOTAL = "etp.generation.fallback.total";

    private static final String REASON_UNCONFIGURED = "generator_unconfigured";
    private static final String REASON_CALL_FAILED = "generator_call_failed";
    private static final String REASON_EMPTY = "empty_output";
    private static final String REASON_PARSE_FAILED = "parse_failed";

    private final ITextGenerator textGenerator;
    private final IKnowledgeRetriever knowledgeRetriever;
    private final EtpPromptDomainService promptDomainService;
    private final ResponsePayloadGuardDomainService payloadGuard;
    private final JsonCodec jsonCodec;
    private final EtpGenerationProperties properties;
    private final MeterRegistry meterRegistry;

    public EtpContentGenerationServiceImpl(ITextGenerator textGenerator,
                                           IKnowledgeRetriever knowledgeRetriever,
                                           EtpPromptDomainService promptDomainService,
                                           ResponsePayloadGuardDomainService payloadGuard,
                                           JsonCodec jsonCodec,
                                           EtpGenerationProperties properties) {
        this.textGenerator = textGenerator;
        this.knowledgeRetriever = knowledgeRetriever;
        this.promptDomainService = promptDomainService;
        this.payloadGuard = payloadGuard;
        this.jsonCodec = jsonCodec;
        this.properties = properties;
        this.meterRegistry = Metrics.globalRegistry;
    }

    @Override
    public RequirementsPayload suggestRequirements(String necessity) {
        Map<String, Object> payload = generateJson("suggest_requirements",
                promptDomainService.buildRequirementsPrompt(necessity), GenerationProfileEnum.CONVERSATIONAL);
        RequirementsPayload result = payloadGuard.ensureRequirements(
                payloadGuard.extractRequirementsPayload(payload), necessity);
        if (result.isBackfilled() && payload != null) {
            recordFallback("suggest_requirements", "payload_incomplete");
        }
        return result;
    }

    @Override
    public RequirementsPayload regenerateRequirements(String necessity, List<String> currentRequirements) {
        Map<String, Object> payload = generateJson("regenerate_requirements",
                promptDomainService.buildRegeneratePrompt(necessity, currentRequirements),
                GenerationProfileEnum.CONVERSATIONAL);
        return payloadGuard.ensureRequirements(payloadGuard.extractRequirementsPayload(payload), necessity);
    }

    @Override
    public List<StrategyOption> suggestStrategies(String necessity, List<String> requirements) {
        Map<String, Object> payload = generateJson("suggest_strategies",
                promptDomainService.buildStrategiesPrompt(necessity, requirements),
                GenerationProfileEnum.CONVERSATIONAL);
        return payloadGuard.ensureStrategies(payloadGuard.extractStrategies(payload), necessity);
    }

    @Override
    public String rewriteRequirement(String necessity, RequirementItem item) {
        String content = generate("rewrite_requirement",
                promptDomainService.buildRewritePrompt(necessity, item), GenerationProfileEnum.CONVERSATIONAL);
        if (StringUtils.isBlank(content)) {
            return null;
        }
        Map<String, Object> payload = parsePayload(content);
        String rewritten = payload == null ? content : payloadGuard.extractRewrite(payload);
        return payloadGuard.cleanSingleRequirement(rewritten);
    }

    @Override
    public String composeExecutiveSummary(EtpSessionEntity session, String adjustment) {
        List<String> references = retrieveReferences(session.getNecessity());
        Map<String, Object> payload = generateJson("executive_summary",
                promptDomainService.buildSummaryPrompt(session, adjustment, references),
                GenerationProfileEnum.SYNTHESIS);
        return payloadGuard.ensureSummary(payloadGuard.extractSummary(payload), session.getNecessity());
    }

    @Override
    public boolean isGeneratorConfigured() {
        return textGenerator.isConfigured();
    }

    private List<String> retrieveReferences(String necessity) {
        if (!Boolean.TRUE.equals(properties.getRetrievalEnabled()) || StringUtils.isBlank(necessity)) {
            return Collections.emptyList();
        }
        Integer topK = properties.getRetrievalTopK();
        return knowledgeRetriever.retrieve(necessity, topK == null ? 4 : topK);
    }

    private Map<String, Object> generateJson(String operation, String userPrompt, GenerationProfileEnum profile) {
        String content = generate(operation, userPrompt, profile);
        if (StringUtils.isBlank(content)) {
            return null;
        }
        Map<String, Object> payload = parsePayload(content);
        if (payload == null) {
            recordFallback(operation, REASON_PARSE_FAILED);
        }
        return payload;
    }

    private String generate(String operation, String userPrompt, GenerationProfileEnum profile) {
        if (!textGenerator.isConfigured()) {
            recordFallback(operation, REASON_UNCONFIGURED);
            return null;
        }
        try {
            String content = textGenerator.generate(promptDomainService.systemPrompt(), userPrompt,
                    resolveTemperature(profile), profile);
            if (StringUtils.isBlank(content)) {
                recordFallback(operation, REASON_EMPTY);
                return null;
            }
            return content;
        } catch (Exception ex) {
            log.warn("ETP generator call failed. operation={}, profile={}, reason={}", operation, profile, ex.getMessage());
            recordFallback(operation, REASON_CALL_FAILED);
            return null;
        }
    }

    /**
     * 宽松解析：先整体解析，失败后截取第一个 '{' 到最后一个 '}' 再试。
     */
    private Map<String, Object> parsePayload(String content) {
        Map<String, Object> payload = tryReadMap(content.trim());
        if (payload != null) {
            return payload;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return tryReadMap(content.substring(start, end + 1));
        }
        return null;
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return jsonCodec.readMap(text);
        } catch (Exception ex) {
            log.debug("Failed to parse generator json: {}", ex.getMessage());
            return null;
        }
    }

    private double resolveTemperature(GenerationProfileEnum profile) {
        Double configured = profile == GenerationProfileEnum.SYNTHESIS
                ? properties.getSynthesisTemperature()
                : properties.getConversationalTemperature();
        return configured == null ? 0.3D : configured;
    }

    private void recordFallback(String operation, String reason) {
        log.info("ETP_GENERATION_FALLBACK operation={}, reason={}", operation, reason);
        meterRegistry.counter(METRIC_FALLBACK_TOTAL, "operation", operation, "reason", reason).increment();
    }
}
