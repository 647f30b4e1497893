package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.valobj.TransitionDecision;
import com.etpassist.types.enums.EtpStageEnum;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 阶段状态机领域服务：固定邻接表 + 显式确认守卫。
 * <p>
 * 除 refine_requirements 自循环外，任何阶段变化都要求用户消息中带有确认信号；
 * suggest_requirements 到 refine_requirements 是强制边，不受用户消息影响。
 * 校验失败时调用方保持当前阶段并展示 reason，不视为硬错误。
 * </p>
 */
@Service
public class StageTransitionDomainService {

    private static final Map<EtpStageEnum, Set<EtpStageEnum>> TRANSITIONS = buildTransitions();

    public TransitionDecision validateTransition(EtpStageEnum current, EtpStageEnum next, boolean userConfirmed) {
        if (current == null) {
            return TransitionDecision.reject("Estado inválido: " + null);
        }
        if (next == null) {
            return TransitionDecision.reject("Estado de destino inválido: " + null);
        }
        Set<EtpStageEnum> allowed = TRANSITIONS.getOrDefault(current, Collections.emptySet());
        if (!allowed.contains(next)) {
            return TransitionDecision.reject("Transição não permitida de " + current.getCode() + " para " + next.getCode());
        }
        if (current != next && !userConfirmed) {
            return TransitionDecision.reject("Transição requer confirmação explícita do usuário");
        }
        return TransitionDecision.allow();
    }

    /**
     * 按字符串编码校验（外部数据入口），未知编码返回具体原因而不是抛异常。
     */
    public TransitionDecision validateTransition(String currentCode, String nextCode, boolean userConfirmed) {
        EtpStageEnum current = resolve(currentCode);
        if (current == null) {
            return TransitionDecision.reject("Estado inválido: " + currentCode);
        }
        EtpStageEnum next = resolve(nextCode);
        if (next == null) {
            return TransitionDecision.reject("Estado de destino inválido: " + nextCode);
        }
        return validateTransition(current, next, userConfirmed);
    }

    public boolean isUserConfirmed(String userMessage) {
        return ConversationSignals.isConfirmation(userMessage);
    }

    /**
     * suggest_requirements 之后无条件进入 refine_requirements。
     */
    public EtpStageEnum advanceAfterSuggestion(EtpStageEnum current) {
        if (current == EtpStageEnum.SUGGEST_REQUIREMENTS) {
            return EtpStageEnum.REFINE_REQUIREMENTS;
        }
        return current;
    }

    /**
     * 文档生成只允许在 confirm_requirements 且用户已确认时进行。
     */
    public TransitionDecision canGenerate(EtpStageEnum current, boolean userConfirmed) {
        if (current != EtpStageEnum.CONFIRM_REQUIREMENTS) {
            return TransitionDecision.reject("Geração de ETP só é permitida no estado 'confirm_requirements'. Estado atual: "
                    + (current == null ? null : current.getCode()));
        }
        if (!userConfirmed) {
            return TransitionDecision.reject("Geração de ETP requer confirmação explícita do usuário");
        }
        return TransitionDecision.allow();
    }

    public Set<EtpStageEnum> allowedTargets(EtpStageEnum current) {
        Set<EtpStageEnum> allowed = TRANSITIONS.get(current);
        return allowed == null ? Collections.emptySet() : Collections.unmodifiableSet(allowed);
    }

    public boolean isTerminal(EtpStageEnum stage) {
        return allowedTargets(stage).isEmpty();
    }

    private EtpStageEnum resolve(String code) {
        if (code == null) {
            return null;
        }
        try {
            return EtpStageEnum.fromCode(code);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static Map<EtpStageEnum, Set<EtpStageEnum>> buildTransitions() {
        Map<EtpStageEnum, Set<EtpStageEnum>> transitions = new EnumMap<>(EtpStageEnum.class);
        transitions.put(EtpStageEnum.COLLECT_NEED, EnumSet.of(EtpStageEnum.SUGGEST_REQUIREMENTS));
        transitions.put(EtpStageEnum.SUGGEST_REQUIREMENTS, EnumSet.of(EtpStageEnum.REFINE_REQUIREMENTS));
        transitions.put(EtpStageEnum.REFINE_REQUIREMENTS,
                EnumSet.of(EtpStageEnum.REFINE_REQUIREMENTS, EtpStageEnum.CONFIRM_REQUIREMENTS));
        transitions.put(EtpStageEnum.CONFIRM_REQUIREMENTS, EnumSet.of(EtpStageEnum.GENERATE_DOCUMENT));
        transitions.put(EtpStageEnum.GENERATE_DOCUMENT, EnumSet.of(EtpStageEnum.PREVIEW));
        transitions.put(EtpStageEnum.PREVIEW, EnumSet.of(EtpStageEnum.FINALIZE));
        transitions.put(EtpStageEnum.FINALIZE, EnumSet.noneOf(EtpStageEnum.class));
        return transitions;
    }
}
