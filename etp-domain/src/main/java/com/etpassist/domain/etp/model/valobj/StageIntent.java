package com.etpassist.domain.etp.model.valobj;

import com.etpassist.types.enums.AnswerIntentEnum;

import java.util.Map;

/**
 * 阶段答案解析结果。
 *
 * @param intent 意图
 * @param message 面向用户的确认或澄清文本
 * @param payload 解析出的结构化数据，可为空
 */
public record StageIntent(AnswerIntentEnum intent,
                          String message,
                          Map<String, Object> payload) {

    public StageIntent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static StageIntent of(AnswerIntentEnum intent, String message) {
        return new StageIntent(intent, message, null);
    }

    public static StageIntent of(AnswerIntentEnum intent, String message, Map<String, Object> payload) {
        return new StageIntent(intent, message, payload);
    }

    public boolean isUnclear() {
        return intent == AnswerIntentEnum.UNCLEAR;
    }

    public String payloadText(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
