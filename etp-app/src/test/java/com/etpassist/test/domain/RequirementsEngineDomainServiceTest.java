package com.etpassist.test.domain;

import com.etpassist.domain.etp.model.valobj.RequirementCommand;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.service.RequirementsEngineDomainService;
import com.etpassist.types.common.Constants;
import com.etpassist.types.enums.CommandTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class RequirementsEngineDomainServiceTest {

    private final RequirementsEngineDomainService engine = new RequirementsEngineDomainService();

    @Test
    public void shouldRenumberAfterRemove() {
        List<RequirementItem> current = engine.fromTexts(List.of("A", "B", "C", "D", "E"));

        List<RequirementItem> after = engine.apply(
                RequirementCommand.of(CommandTypeEnum.REMOVE_ONE, List.of(2, 4), null), current);

        Assertions.assertEquals(3, after.size());
        Assertions.assertEquals("R1", after.get(0).getId());
        Assertions.assertEquals("A", after.get(0).getText());
        Assertions.assertEquals("R2", after.get(1).getId());
        Assertions.assertEquals("C", after.get(1).getText());
        Assertions.assertEquals("R3", after.get(2).getId());
        Assertions.assertEquals("E", after.get(2).getText());
        Assertions.assertEquals(5, current.size());
        Assertions.assertEquals("B", current.get(1).getText());
    }

    @Test
    public void shouldKeepOnlySelected() {
        List<RequirementItem> current = engine.fromTexts(List.of("A", "B", "C"));

        List<RequirementItem> after = engine.apply(
                RequirementCommand.of(CommandTypeEnum.KEEP_ONLY, List.of(1, 3), null), current);

        Assertions.assertEquals(2, after.size());
        Assertions.assertEquals("R2", after.get(1).getId());
        Assertions.assertEquals("C", after.get(1).getText());
        Assertions.assertEquals("Mantidos apenas 2 requisito(s) conforme solicitado.",
                engine.describe(RequirementCommand.of(CommandTypeEnum.KEEP_ONLY, List.of(1, 3), null), current, after));
    }

    @Test
    public void shouldAppendPlaceholderWhenPayloadMissing() {
        List<RequirementItem> current = engine.fromTexts(List.of("A", "B"));
        RequirementCommand command = RequirementCommand.of(CommandTypeEnum.APPEND_ONE, List.of(), null);

        List<RequirementItem> after = engine.apply(command, current);

        Assertions.assertEquals(3, after.size());
        Assertions.assertEquals("R3", after.get(2).getId());
        Assertions.assertEquals(Constants.REQUIREMENT_PLACEHOLDER, after.get(2).getText());
        Assertions.assertEquals("Requisito adicionado como R3.", engine.describe(command, current, after));
    }

    @Test
    public void shouldReplaceTargetText() {
        List<RequirementItem> current = engine.fromTexts(List.of("A", "B", "C"));
        RequirementCommand command = RequirementCommand.of(CommandTypeEnum.EDIT, List.of(2), "  Novo B  ");

        List<RequirementItem> after = engine.apply(command, current);

        Assertions.assertEquals("Novo B", after.get(1).getText());
        Assertions.assertEquals("R2", after.get(1).getId());
        Assertions.assertEquals("Requisito R2 atualizado.", engine.describe(command, current, after));
    }

    @Test
    public void shouldIgnoreOutOfRangeTargets() {
        List<RequirementItem> current = engine.fromTexts(List.of("A", "B"));
        RequirementCommand command = RequirementCommand.of(CommandTypeEnum.REMOVE_ONE, List.of(7), null);

        List<RequirementItem> after = engine.apply(command, current);

        Assertions.assertEquals(2, after.size());
        Assertions.assertEquals("Removidos 0 requisito(s). Lista atualizada com 2 requisitos.",
                engine.describe(command, current, after));
    }

    @Test
    public void shouldRenumberArbitraryIds() {
        List<RequirementItem> items = List.of(new RequirementItem("R9", "X"), new RequirementItem(null, "Y"));

        List<RequirementItem> renumbered = engine.renumber(items);

        Assertions.assertEquals("R1", renumbered.get(0).getId());
        Assertions.assertEquals("R2", renumbered.get(1).getId());
        Assertions.assertEquals("R9", items.get(0).getId());
    }
}
