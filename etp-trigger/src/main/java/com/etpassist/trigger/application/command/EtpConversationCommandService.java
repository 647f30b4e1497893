package com.etpassist.trigger.application.command;

import com.etpassist.domain.etp.adapter.repository.IEtpSessionRepository;
import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.service.EtpTurnDomainService;
import com.etpassist.types.enums.EtpStageEnum;
import com.etpassist.types.enums.ResponseCode;
import com.etpassist.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * ETP 对话写用例：加载或创建会话、执行单轮处理、持久化与失败兜底。
 * <p>
 * 单轮处理失败时不保存会话，返回带原阶段的错误回复，客户端可以直接重试。
 * </p>
 */
@Slf4j
@Service
public class EtpConversationCommandService {

    private static final String ERROR_REPLY_TEMPLATE =
            "Ocorreu um erro ao processar sua solicitação: %s. Por favor, tente novamente.";

    private final IEtpSessionRepository etpSessionRepository;
    private final EtpTurnDomainService etpTurnDomainService;
    private final Counter processedCounter;
    private final Counter failedCounter;

    public EtpConversationCommandService(IEtpSessionRepository etpSessionRepository,
                                         EtpTurnDomainService etpTurnDomainService) {
        this.etpSessionRepository = etpSessionRepository;
        this.etpTurnDomainService = etpTurnDomainService;
        this.processedCounter = Counter.builder("etp.turn.processed.total")
                .description("Processed ETP conversation turns")
                .register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("etp.turn.failed.total")
                .description("Failed ETP conversation turns")
                .register(Metrics.globalRegistry);
    }

    public ProcessMessageResult processMessage(String sessionId, String userText) {
        if (StringUtils.isBlank(userText)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "message 不能为空");
        }
        EtpSessionEntity session = loadOrCreate(sessionId);
        EtpStageEnum previousStage = session.getStage();
        try {
            EtpTurnDomainService.TurnOutcome outcome = etpTurnDomainService.process(session, userText);
            etpSessionRepository.save(outcome.session());
            processedCounter.increment();
            log.info("ETP_TURN_PROCESSED sessionId={}, fromStage={}, toStage={}, stateChanged={}, clarification={}",
                    session.getSessionId(),
                    previousStage.getCode(),
                    outcome.session().getStage().getCode(),
                    outcome.stateChanged(),
                    outcome.requiresClarification());

            ProcessMessageResult result = new ProcessMessageResult();
            result.setSuccess(true);
            result.setSessionId(session.getSessionId());
            result.setAiResponseText(outcome.reply());
            result.setStage(outcome.session().getStage().getCode());
            result.setStructuredDelta(outcome.structuredDelta());
            result.setStateChanged(outcome.stateChanged());
            result.setRequiresClarification(outcome.requiresClarification());
            return result;
        } catch (Exception ex) {
            failedCounter.increment();
            String reason = resolveErrorMessage(ex);
            log.error("ETP_TURN_FAILED sessionId={}, stage={}, reason={}",
                    session.getSessionId(), previousStage.getCode(), reason, ex);

            ProcessMessageResult result = new ProcessMessageResult();
            result.setSuccess(false);
            result.setSessionId(session.getSessionId());
            result.setAiResponseText(String.format(ERROR_REPLY_TEMPLATE, reason));
            result.setStage(previousStage.getCode());
            result.setStructuredDelta(Collections.emptyMap());
            result.setStateChanged(false);
            result.setRequiresClarification(false);
            return result;
        }
    }

    private EtpSessionEntity loadOrCreate(String sessionId) {
        String normalizedId = StringUtils.trimToNull(sessionId);
        if (normalizedId != null) {
            EtpSessionEntity existing = etpSessionRepository.findBySessionId(normalizedId);
            if (existing != null) {
                return existing;
            }
        } else {
            normalizedId = UUID.randomUUID().toString();
        }
        log.info("ETP_SESSION_CREATED sessionId={}", normalizedId);
        return EtpSessionEntity.create(normalizedId);
    }

    private String resolveErrorMessage(Exception ex) {
        if (ex instanceof AppException appException && StringUtils.isNotBlank(appException.getInfo())) {
            return appException.getInfo();
        }
        return StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
    }

    @Data
    public static class ProcessMessageResult {
        private boolean success;
        private String sessionId;
        private String aiResponseText;
        private String stage;
        private Map<String, Object> structuredDelta;
        private boolean stateChanged;
        private boolean requiresClarification;
    }
}
