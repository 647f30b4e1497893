package com.etpassist.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ETP 对话阶段枚举
 *
 * @author etpassist
 * @since 2025-03-10
 */
public enum EtpStageEnum {

    /**
     * 收集需求描述
     */
    COLLECT_NEED("collect_need"),

    /**
     * 已给出建议需求，等待用户首次回应
     */
    SUGGEST_REQUIREMENTS("suggest_requirements"),

    /**
     * 需求调整循环
     */
    REFINE_REQUIREMENTS("refine_requirements"),

    /**
     * 需求已确认并锁定，等待生成许可
     */
    CONFIRM_REQUIREMENTS("confirm_requirements"),

    /**
     * 逐项收集文档答案（策略、PCA、价格调研、法律依据、数量金额、分包、摘要）
     */
    GENERATE_DOCUMENT("generate_document"),

    /**
     * 文档预览
     */
    PREVIEW("preview"),

    /**
     * 终态
     */
    FINALIZE("finalize");

    private final String code;

    EtpStageEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EtpStageEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EtpStageEnum stage : EtpStageEnum.values()) {
            if (stage.code.equals(code)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown etp stage code: " + code);
    }
}
