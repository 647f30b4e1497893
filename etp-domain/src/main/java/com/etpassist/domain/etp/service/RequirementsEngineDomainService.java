package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.valobj.RequirementCommand;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.types.common.Constants;
import com.etpassist.types.enums.CommandTypeEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 需求列表编辑引擎：对命令做纯函数式应用，返回新列表，输入列表从不修改。
 * 每次操作后编号都重新计算为 R1..Rn。
 */
@Service
public class RequirementsEngineDomainService {

    public List<RequirementItem> apply(RequirementCommand command, List<RequirementItem> current) {
        List<RequirementItem> base = copyOf(current);
        if (command == null || command.type() == null) {
            return base;
        }
        CommandTypeEnum type = command.type();
        switch (type) {
            case REMOVE_ONE:
                return remove(base, command.targets());
            case KEEP_ONLY:
                return keepOnly(base, command.targets());
            case APPEND_ONE:
                return append(base, command.payload());
            case REPLACE_ONE:
                return replace(base, command.targets(), command.payload());
            case EDIT:
                if (!command.hasPayload()) {
                    return base;
                }
                return replace(base, command.targets(), command.payload());
            default:
                return base;
        }
    }

    /**
     * 生成面向用户的操作结果描述。
     */
    public String describe(RequirementCommand command, List<RequirementItem> before, List<RequirementItem> after) {
        int beforeSize = before == null ? 0 : before.size();
        int afterSize = after == null ? 0 : after.size();
        switch (command.type()) {
            case REMOVE_ONE:
                return "Removidos " + (beforeSize - afterSize) + " requisito(s). Lista atualizada com " + afterSize + " requisitos.";
            case KEEP_ONLY:
                return "Mantidos apenas " + afterSize + " requisito(s) conforme solicitado.";
            case APPEND_ONE:
                return "Requisito adicionado como R" + afterSize + ".";
            case REPLACE_ONE:
            case EDIT:
                Integer target = firstInRange(command.targets(), beforeSize);
                return target == null
                        ? "Nenhum requisito foi alterado: posição fora da lista atual."
                        : "Requisito R" + target + " atualizado.";
            default:
                return "Lista de requisitos mantida.";
        }
    }

    public List<RequirementItem> fromTexts(List<String> texts) {
        List<RequirementItem> items = new ArrayList<>();
        if (texts != null) {
            for (String text : texts) {
                items.add(new RequirementItem(null, text));
            }
        }
        return renumber(items);
    }

    /**
     * 按位置重新计算编号，返回新列表。
     */
    public List<RequirementItem> renumber(List<RequirementItem> items) {
        List<RequirementItem> result = new ArrayList<>();
        if (items == null) {
            return result;
        }
        int position = 1;
        for (RequirementItem item : items) {
            result.add(new RequirementItem(Constants.REQUIREMENT_ID_PREFIX + position++, item.getText()));
        }
        return result;
    }

    private List<RequirementItem> remove(List<RequirementItem> base, List<Integer> targets) {
        Set<Integer> drop = new HashSet<>(targets);
        List<RequirementItem> kept = new ArrayList<>();
        for (int i = 0; i < base.size(); i++) {
            if (!drop.contains(i + 1)) {
                kept.add(base.get(i));
            }
        }
        return renumber(kept);
    }

    private List<RequirementItem> keepOnly(List<RequirementItem> base, List<Integer> targets) {
        List<RequirementItem> kept = new ArrayList<>();
        for (int i = 0; i < base.size(); i++) {
            if (targets.contains(i + 1)) {
                kept.add(base.get(i));
            }
        }
        if (kept.isEmpty()) {
            return renumber(base);
        }
        return renumber(kept);
    }

    private List<RequirementItem> append(List<RequirementItem> base, String payload) {
        String text = payload == null || payload.trim().isEmpty() ? Constants.REQUIREMENT_PLACEHOLDER : payload.trim();
        base.add(new RequirementItem(null, text));
        return renumber(base);
    }

    private List<RequirementItem> replace(List<RequirementItem> base, List<Integer> targets, String payload) {
        if (payload == null || payload.trim().isEmpty()) {
            return renumber(base);
        }
        Integer target = firstInRange(targets, base.size());
        if (target == null) {
            return renumber(base);
        }
        base.set(target - 1, new RequirementItem(null, payload.trim()));
        return renumber(base);
    }

    private Integer firstInRange(List<Integer> targets, int size) {
        if (targets == null) {
            return null;
        }
        for (Integer target : targets) {
            if (target != null && target >= 1 && target <= size) {
                return target;
            }
        }
        return null;
    }

    private List<RequirementItem> copyOf(List<RequirementItem> items) {
        List<RequirementItem> copy = new ArrayList<>();
        if (items != null) {
            for (RequirementItem item : items) {
                copy.add(item.copy());
            }
        }
        return copy;
    }
}
