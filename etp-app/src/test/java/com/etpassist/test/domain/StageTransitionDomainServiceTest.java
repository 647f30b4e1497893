package com.etpassist.test.domain;

import com.etpassist.domain.etp.model.valobj.TransitionDecision;
import com.etpassist.domain.etp.service.StageTransitionDomainService;
import com.etpassist.types.enums.EtpStageEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StageTransitionDomainServiceTest {

    private final StageTransitionDomainService service = new StageTransitionDomainService();

    @Test
    public void shouldAllowRefineSelfLoopWithoutConfirmation() {
        TransitionDecision decision = service.validateTransition(
                EtpStageEnum.REFINE_REQUIREMENTS, EtpStageEnum.REFINE_REQUIREMENTS, false);

        Assertions.assertTrue(decision.allowed());
        Assertions.assertNull(decision.reason());
    }

    @Test
    public void shouldRejectStageChangeWithoutConfirmation() {
        TransitionDecision decision = service.validateTransition(
                EtpStageEnum.REFINE_REQUIREMENTS, EtpStageEnum.CONFIRM_REQUIREMENTS, false);

        Assertions.assertFalse(decision.allowed());
        Assertions.assertEquals("Transição requer confirmação explícita do usuário", decision.reason());
    }

    @Test
    public void shouldRejectEdgeOutsideAdjacency() {
        TransitionDecision decision = service.validateTransition(
                EtpStageEnum.COLLECT_NEED, EtpStageEnum.GENERATE_DOCUMENT, true);

        Assertions.assertFalse(decision.allowed());
        Assertions.assertEquals("Transição não permitida de collect_need para generate_document", decision.reason());
    }

    @Test
    public void shouldRejectUnknownStageCode() {
        TransitionDecision decision = service.validateTransition("drafting", "preview", true);

        Assertions.assertFalse(decision.allowed());
        Assertions.assertEquals("Estado inválido: drafting", decision.reason());
    }

    @Test
    public void shouldValidateByStageCode() {
        Assertions.assertTrue(service.validateTransition("preview", "finalize", true).allowed());
        Assertions.assertFalse(service.validateTransition("preview", "finalize", false).allowed());
    }

    @Test
    public void shouldForceSuggestIntoRefine() {
        Assertions.assertEquals(EtpStageEnum.REFINE_REQUIREMENTS,
                service.advanceAfterSuggestion(EtpStageEnum.SUGGEST_REQUIREMENTS));
        Assertions.assertEquals(EtpStageEnum.PREVIEW, service.advanceAfterSuggestion(EtpStageEnum.PREVIEW));
    }

    @Test
    public void shouldGateGenerationOnConfirmedRequirements() {
        Assertions.assertTrue(service.canGenerate(EtpStageEnum.CONFIRM_REQUIREMENTS, true).allowed());

        TransitionDecision unconfirmed = service.canGenerate(EtpStageEnum.CONFIRM_REQUIREMENTS, false);
        Assertions.assertFalse(unconfirmed.allowed());
        Assertions.assertEquals("Geração de ETP requer confirmação explícita do usuário", unconfirmed.reason());

        TransitionDecision wrongStage = service.canGenerate(EtpStageEnum.REFINE_REQUIREMENTS, true);
        Assertions.assertFalse(wrongStage.allowed());
        Assertions.assertTrue(wrongStage.reason().contains("refine_requirements"));
    }

    @Test
    public void shouldTreatFinalizeAsTerminal() {
        Assertions.assertTrue(service.isTerminal(EtpStageEnum.FINALIZE));
        Assertions.assertFalse(service.isTerminal(EtpStageEnum.PREVIEW));
        Assertions.assertTrue(service.allowedTargets(EtpStageEnum.FINALIZE).isEmpty());
    }

    @Test
    public void shouldDetectConfirmationAsWholeWord() {
        Assertions.assertTrue(service.isUserConfirmed("Pode gerar"));
        Assertions.assertTrue(service.isUserConfirmed("ok, está bom"));
        Assertions.assertFalse(service.isUserConfirmed("bookmark"));
    }
}
