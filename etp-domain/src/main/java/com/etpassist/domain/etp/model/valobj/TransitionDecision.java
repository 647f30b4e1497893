package com.etpassist.domain.etp.model.valobj;

/**
 * 状态迁移校验结果；拒绝时 reason 为面向用户的具体原因。
 */
public record TransitionDecision(boolean allowed, String reason) {

    public static TransitionDecision allow() {
        return new TransitionDecision(true, null);
    }

    public static TransitionDecision reject(String reason) {
        return new TransitionDecision(false, reason);
    }
}
