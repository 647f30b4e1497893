package com.etpassist.test.domain;

import com.etpassist.domain.etp.model.valobj.RequirementCommand;
import com.etpassist.domain.etp.service.RequirementCommandInterpreter;
import com.etpassist.types.enums.CommandTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class RequirementCommandInterpreterTest {

    private final RequirementCommandInterpreter interpreter = new RequirementCommandInterpreter();

    @Test
    public void shouldResolveLastAsEditWithoutPayload() {
        RequirementCommand command = interpreter.interpret("ajustar o último", 5);

        Assertions.assertEquals(CommandTypeEnum.EDIT, command.type());
        Assertions.assertEquals(List.of(5), command.targets());
        Assertions.assertNull(command.payload());
    }

    @Test
    public void shouldRemoveMultipleTargets() {
        RequirementCommand command = interpreter.interpret("remover 2 e 4", 5);

        Assertions.assertEquals(CommandTypeEnum.REMOVE_ONE, command.type());
        Assertions.assertEquals(List.of(2, 4), command.targets());
    }

    @Test
    public void shouldSplitTargetAndPayloadOnColon() {
        RequirementCommand command = interpreter.interpret("trocar 3: novo texto aqui", 5);

        Assertions.assertEquals(CommandTypeEnum.EDIT, command.type());
        Assertions.assertEquals(List.of(3), command.targets());
        Assertions.assertEquals("novo texto aqui", command.payload());
    }

    @Test
    public void shouldIgnoreNumbersInsidePayload() {
        RequirementCommand command = interpreter.interpret("alterar o 2 para garantia de 3 anos", 5);

        Assertions.assertEquals(CommandTypeEnum.EDIT, command.type());
        Assertions.assertEquals(List.of(2), command.targets());
        Assertions.assertEquals("garantia de 3 anos", command.payload());
    }

    @Test
    public void shouldReadKeepPhraseAsConfirmation() {
        RequirementCommand command = interpreter.interpret("pode manter", 5);

        Assertions.assertEquals(CommandTypeEnum.CONFIRM, command.type());
        Assertions.assertTrue(command.targets().isEmpty());
    }

    @Test
    public void shouldDetectAcceptAll() {
        RequirementCommand command = interpreter.interpret("ok, aceito todos", 8);

        Assertions.assertEquals(CommandTypeEnum.ACCEPT_ALL, command.type());
        Assertions.assertTrue(command.type().isConfirmation());
    }

    @Test
    public void shouldRestartNecessityWithPayload() {
        RequirementCommand command = interpreter.interpret("nova necessidade: gestão de frota", 5);

        Assertions.assertEquals(CommandTypeEnum.RESTART_NECESSITY, command.type());
        Assertions.assertEquals("gestão de frota", command.payload());
    }

    @Test
    public void shouldKeepOnlySelectedTargets() {
        RequirementCommand command = interpreter.interpret("manter apenas 1 e 3", 5);

        Assertions.assertEquals(CommandTypeEnum.KEEP_ONLY, command.type());
        Assertions.assertEquals(List.of(1, 3), command.targets());
    }

    @Test
    public void shouldExpandRangeWithinCurrentSize() {
        RequirementCommand command = interpreter.interpret("remover 2-4", 5);

        Assertions.assertEquals(List.of(2, 3, 4), command.targets());
    }

    @Test
    public void shouldKeepOutOfRangeRequirementReference() {
        RequirementCommand command = interpreter.interpret("remover R7", 5);

        Assertions.assertEquals(CommandTypeEnum.REMOVE_ONE, command.type());
        Assertions.assertEquals(List.of(7), command.targets());
    }

    @Test
    public void shouldAppendWithPayload() {
        RequirementCommand command = interpreter.interpret("adicionar: suporte remoto 24x7", 5);

        Assertions.assertEquals(CommandTypeEnum.APPEND_ONE, command.type());
        Assertions.assertEquals("suporte remoto 24x7", command.payload());
    }

    @Test
    public void shouldRegenerateAll() {
        Assertions.assertEquals(CommandTypeEnum.REGENERATE_ALL, interpreter.interpret("refazer tudo", 5).type());
    }

    @Test
    public void shouldAskWhichRequirementWhenRemoveHasNoTarget() {
        RequirementCommand command = interpreter.interpret("remover", 5);

        Assertions.assertEquals(CommandTypeEnum.UNCLEAR, command.type());
        Assertions.assertTrue(command.message().contains("Qual requisito"));
    }

    @Test
    public void shouldReturnUnclearForFreeText() {
        RequirementCommand command = interpreter.interpret("hmm, será?", 5);

        Assertions.assertEquals(CommandTypeEnum.UNCLEAR, command.type());
        Assertions.assertEquals(RequirementCommandInterpreter.UNCLEAR_MESSAGE, command.message());
    }
}
