package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.types.common.Constants;
import com.etpassist.types.common.TextNormalizer;
import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.DecisionOptionEnum;
import com.etpassist.types.enums.EtpStageEnum;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * 三选一决策仲裁：1 接受建议、2 标记待定、3 继续讨论。
 * <p>
 * 存在待决策时，每条用户消息都先经过 {@link #consumeDecision}；无法识别时决策保持挂起。
 * </p>
 */
@Service
public class DecisionArbitrationDomainService {

    public static final String UNCLEAR_CHOICE_MESSAGE = "Não consegui identificar sua escolha. Para confirmar, responda 1 "
            + "(aceitar a proposta), 2 (deixar pendente) ou 3 (discutir mais), ou reformule sua resposta.";

    private static final Pattern DEBATE = Pattern.compile("\\b(discutir|debate|debater|conversar|mais\\s+detalhes|explicar|explique)\\b");

    /** 否定的接受表达，例如 "não aceito"、"não concordo com isso" */
    private static final Pattern NEGATED_ACCEPT = Pattern.compile(
            "\\b(nao|nem|nunca)\\b[ ,]+(\\w+\\s+){0,2}(aceit|concord|confirm|quero|pode|ok\\b|sim\\b|fechado|perfeito)");

    /**
     * 决策仲裁结果。
     *
     * @param option 识别出的选项
     * @param value 写入答案的值（ACCEPT 为建议文本，PENDING 为待定标记，其他为 null）
     * @param message 面向用户的文本
     * @param decision 被处理的决策
     */
    public record DecisionOutcome(DecisionOptionEnum option, String value, String message, PendingDecision decision) {

        public boolean isResolved() {
            return option != DecisionOptionEnum.UNCLEAR;
        }
    }

    /**
     * 挂起一个新决策并返回提问文本。同一会话同一时刻只有一个决策，新决策覆盖旧决策。
     */
    public String askDecision(EtpSessionEntity session, String prompt, String proposal, EtpStageEnum stage, AnswerTopicEnum topic) {
        if (session == null) {
            throw new IllegalStateException("session 不能为空");
        }
        session.setPendingDecision(new PendingDecision(prompt, proposal, stage, topic));
        return prompt + "\n\n**Proposta:** " + proposal
                + "\n\n**Opções:**\n1. Aceitar a proposta\n2. Deixar como pendente\n3. Discutir mais antes de decidir"
                + "\n\nResponda com 1, 2 ou 3.";
    }

    /**
     * 消费待决策。
     *
     * @return 无待决策时返回 null
     */
    public DecisionOutcome consumeDecision(EtpSessionEntity session, String text) {
        if (session == null || !session.hasPendingDecision()) {
            return null;
        }
        PendingDecision decision = session.getPendingDecision();
        DecisionOptionEnum option = classify(text);
        switch (option) {
            case ACCEPT:
                session.setPendingDecision(null);
                return new DecisionOutcome(option, decision.getProposal(),
                        "Perfeito, registrei a proposta: " + decision.getProposal(), decision);
            case PENDING:
                session.setPendingDecision(null);
                return new DecisionOutcome(option, Constants.PENDING_MARKER,
                        "Certo, deixei este ponto registrado como pendente. Podemos voltar a ele depois.", decision);
            case DEBATE:
                session.setPendingDecision(null);
                return new DecisionOutcome(option, null,
                        "Claro, vamos discutir. Me conte o que você sabe até agora ou o que te preocupa neste ponto.", decision);
            default:
                return new DecisionOutcome(DecisionOptionEnum.UNCLEAR, null, UNCLEAR_CHOICE_MESSAGE, decision);
        }
    }

    DecisionOptionEnum classify(String text) {
        Integer number = ConversationSignals.selectNumber(text);
        if (number != null) {
            return DecisionOptionEnum.fromNumber(number);
        }
        String normalized = TextNormalizer.normalize(text);
        if (ConversationSignals.isExplicitPendingRequest(normalized) || normalized.contains("pendente")) {
            return DecisionOptionEnum.PENDING;
        }
        if (DEBATE.matcher(normalized).find()) {
            return DecisionOptionEnum.DEBATE;
        }
        if (NEGATED_ACCEPT.matcher(normalized).find()) {
            return DecisionOptionEnum.UNCLEAR;
        }
        if (ConversationSignals.isConfirmation(normalized) || normalized.contains("aceit")) {
            return DecisionOptionEnum.ACCEPT;
        }
        return DecisionOptionEnum.UNCLEAR;
    }
}
