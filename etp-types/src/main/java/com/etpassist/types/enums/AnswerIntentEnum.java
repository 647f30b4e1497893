package com.etpassist.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 各阶段答案解析器的意图集合（封闭集合）。
 *
 * @author etpassist
 * @since 2025-03-12
 */
public enum AnswerIntentEnum {

    // PCA
    PCA_YES("pca_yes"),
    PCA_NO("pca_no"),
    PCA_UNKNOWN("pca_unknown"),
    PCA_DETAILS("pca_details"),
    PROCEED_NEXT("proceed_next"),

    // 价格调研
    METHOD_SELECT("method_select"),
    SUPPLIER_COUNT("supplier_count"),
    LINK_EVIDENCE("link_evidence"),
    MARK_DONE("mark_done"),

    // 法律依据
    LEGAL_BASIS_SET("legal_basis_set"),
    LEGAL_BASIS_NOTES("legal_basis_notes"),
    FINALIZE("finalize"),

    // 采购策略
    SELECT_STRATEGY("select_strategy"),
    CHOOSE_PATH("choose_path"),
    REQUEST_RECOMMENDATION("request_recommendation"),

    // 数量与金额
    QUANTITY_VALUE("quantity_value"),

    // 分包
    INSTALLMENT_YES("installment_yes"),
    INSTALLMENT_NO("installment_no"),

    // 摘要
    SUMMARY_ADJUST("summary_adjust"),

    // 通用
    CONFIRM("confirm"),
    UNCERTAIN("uncertain"),
    UNCLEAR("unclear");

    private final String code;

    AnswerIntentEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
