package com.etpassist.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 待决策选项：1 接受建议，2 标记待定，3 继续讨论；无法识别时为 UNCLEAR。
 *
 * @author etpassist
 * @since 2025-03-12
 */
public enum DecisionOptionEnum {

    ACCEPT("accept", 1),
    PENDING("pendente", 2),
    DEBATE("debate", 3),
    UNCLEAR("unclear", 0);

    private final String code;
    private final int number;

    DecisionOptionEnum(String code, int number) {
        this.code = code;
        this.number = number;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getNumber() {
        return number;
    }

    public static DecisionOptionEnum fromNumber(int number) {
        for (DecisionOptionEnum option : DecisionOptionEnum.values()) {
            if (option.number == number && option != UNCLEAR) {
                return option;
            }
        }
        return UNCLEAR;
    }
}
