package com.etpassist.domain.etp.model.valobj;

import com.etpassist.types.enums.CommandTypeEnum;

import java.util.List;

/**
 * 需求编辑命令。targets 为解析时刻列表上的 1 基位置。
 *
 * @param type 命令类型
 * @param targets 目标位置
 * @param payload 新文本，可为空
 * @param message 面向用户的说明（unclear 时为澄清问题）
 */
public record RequirementCommand(CommandTypeEnum type,
                                 List<Integer> targets,
                                 String payload,
                                 String message) {

    public RequirementCommand {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static RequirementCommand of(CommandTypeEnum type, List<Integer> targets, String payload) {
        return new RequirementCommand(type, targets, payload, null);
    }

    public static RequirementCommand unclear(String message) {
        return new RequirementCommand(CommandTypeEnum.UNCLEAR, List.of(), null, message);
    }

    public boolean hasPayload() {
        return payload != null && !payload.trim().isEmpty();
    }
}
