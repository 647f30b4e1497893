package com.etpassist.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 需求编辑命令类型
 *
 * @author etpassist
 * @since 2025-03-10
 */
public enum CommandTypeEnum {

    ACCEPT_ALL("accept_all"),
    REPLACE_ONE("replace_one"),
    REMOVE_ONE("remove_one"),
    APPEND_ONE("append_one"),
    REGENERATE_ALL("regenerate_all"),
    KEEP_ONLY("keep_only"),
    RESTART_NECESSITY("restart_necessity"),
    CONFIRM("confirm"),
    EDIT("edit"),
    UNCLEAR("unclear");

    private final String code;

    CommandTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为确认类命令（confirm / accept_all）。
     */
    public boolean isConfirmation() {
        return this == CONFIRM || this == ACCEPT_ALL;
    }

    public static CommandTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CommandTypeEnum type : CommandTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown command type code: " + code);
    }
}
