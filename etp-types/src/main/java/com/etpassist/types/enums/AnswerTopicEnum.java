package com.etpassist.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * generate_document 阶段内的答案收集子游标，按声明顺序推进。
 *
 * @author etpassist
 * @since 2025-03-12
 */
public enum AnswerTopicEnum {

    SOLUTION_STRATEGY("solution_strategy"),
    PCA("pca"),
    PRICE_RESEARCH("price_research"),
    LEGAL_BASIS("legal_basis"),
    QUANTITY_VALUE("quantity_value"),
    INSTALLMENT("installment"),
    SUMMARY("summary");

    private final String code;

    AnswerTopicEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 下一个子游标；SUMMARY 之后返回 null。
     */
    public AnswerTopicEnum next() {
        AnswerTopicEnum[] values = AnswerTopicEnum.values();
        int index = ordinal() + 1;
        return index < values.length ? values[index] : null;
    }

    public static AnswerTopicEnum first() {
        return SOLUTION_STRATEGY;
    }

    public static AnswerTopicEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AnswerTopicEnum topic : AnswerTopicEnum.values()) {
            if (topic.code.equals(code)) {
                return topic;
            }
        }
        throw new IllegalArgumentException("Unknown answer topic code: " + code);
    }
}
