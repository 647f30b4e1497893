package com.etpassist.test.domain;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.service.DecisionArbitrationDomainService;
import com.etpassist.domain.etp.service.EtpReplyDomainService;
import com.etpassist.domain.etp.service.EtpTurnDomainService;
import com.etpassist.domain.etp.service.RequirementCommandInterpreter;
import com.etpassist.test.support.EtpDomainServices;
import com.etpassist.test.support.FixedContentGenerationService;
import com.etpassist.types.common.Constants;
import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.EtpStageEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class EtpTurnDomainServiceTest {

    private static final String NECESSITY = "Manutenção preventiva da frota de veículos oficiais";

    private FixedContentGenerationService generationService;
    private EtpTurnDomainService service;
    private EtpSessionEntity session;

    @BeforeEach
    public void setUp() {
        generationService = new FixedContentGenerationService();
        service = EtpDomainServices.turnService(generationService);
        session = EtpSessionEntity.create("s-turn");
    }

    @Test
    public void shouldRejectBlankMessage() {
        Assertions.assertThrows(IllegalStateException.class, () -> service.process(session, "   "));
        Assertions.assertThrows(IllegalStateException.class, () -> service.process(null, "oi"));
    }

    @Test
    public void shouldGreetOnVagueFirstMessage() {
        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "ok");

        Assertions.assertEquals(EtpReplyDomainService.GREETING, outcome.reply());
        Assertions.assertEquals(EtpStageEnum.COLLECT_NEED, session.getStage());
        Assertions.assertTrue(outcome.requiresClarification());
        Assertions.assertFalse(outcome.stateChanged());
        Assertions.assertNull(session.getNecessity());
    }

    @Test
    public void shouldCaptureNecessityAndSuggestRequirements() {
        EtpTurnDomainService.TurnOutcome outcome = service.process(session, NECESSITY);

        Assertions.assertEquals(EtpStageEnum.SUGGEST_REQUIREMENTS, session.getStage());
        Assertions.assertEquals(EtpStageEnum.COLLECT_NEED, outcome.previousStage());
        Assertions.assertTrue(outcome.stateChanged());
        Assertions.assertEquals(NECESSITY, session.getNecessity());
        Assertions.assertTrue(session.getRequirements().size() >= Constants.MIN_REQUIREMENTS);
        for (int i = 0; i < session.getRequirements().size(); i++) {
            Assertions.assertEquals("R" + (i + 1), session.getRequirements().get(i).getId());
        }
        Assertions.assertEquals("suggest_requirements", outcome.structuredDelta().get("stage"));
        Assertions.assertEquals(Boolean.TRUE, outcome.structuredDelta().get("backfilled"));
        Assertions.assertTrue(outcome.reply().contains("R1 — "));
    }

    @Test
    public void shouldStripRestartPrefixFromFirstNecessity() {
        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "nova necessidade: gestão de frota");

        Assertions.assertEquals("gestão de frota", session.getNecessity());
        Assertions.assertEquals(EtpStageEnum.SUGGEST_REQUIREMENTS, session.getStage());
        Assertions.assertEquals("gestão de frota", outcome.structuredDelta().get("necessity"));
    }

    @Test
    public void shouldTakeForcedEdgeFromSuggestToRefine() {
        service.process(session, NECESSITY);

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "ok");

        Assertions.assertEquals(EtpStageEnum.REFINE_REQUIREMENTS, session.getStage());
        Assertions.assertFalse(Boolean.TRUE.equals(session.getRequirementsLocked()));
        Assertions.assertTrue(outcome.reply().contains("confirmo"));
    }

    @Test
    public void shouldApplyEditCommandsInsideRefine() {
        moveToRefine();
        int before = session.getRequirements().size();

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "remover 2 e 4");

        Assertions.assertEquals(before - 2, session.getRequirements().size());
        Assertions.assertEquals(EtpStageEnum.REFINE_REQUIREMENTS, session.getStage());
        Assertions.assertEquals("remove_one", outcome.structuredDelta().get("command"));
        Assertions.assertEquals("R" + (before - 2), session.getRequirements().get(before - 3).getId());
        Assertions.assertTrue(outcome.reply().startsWith("Removidos 2 requisito(s)."));
    }

    @Test
    public void shouldRewriteTargetWhenEditHasNoPayload() {
        moveToRefine();
        generationService.setRewriteResult("Garantia estendida de 24 meses para peças e serviços");
        int size = session.getRequirements().size();

        service.process(session, "ajustar o último");

        Assertions.assertEquals(size, session.getRequirements().size());
        Assertions.assertEquals("Garantia estendida de 24 meses para peças e serviços",
                session.getRequirements().get(size - 1).getText());
    }

    @Test
    public void shouldAskForTextWhenRewriteUnavailable() {
        moveToRefine();
        List<RequirementItem> before = copy(session.getRequirements());

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "ajustar o 3");

        Assertions.assertTrue(outcome.requiresClarification());
        Assertions.assertTrue(outcome.reply().contains("R3"));
        Assertions.assertEquals(before, session.getRequirements());
    }

    @Test
    public void shouldAskClarificationOnUnclearRefineMessage() {
        moveToRefine();

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "hmm, será?");

        Assertions.assertEquals(RequirementCommandInterpreter.UNCLEAR_MESSAGE, outcome.reply());
        Assertions.assertTrue(outcome.requiresClarification());
    }

    @Test
    public void shouldLockOnAcceptAllWithoutTouchingRequirements() {
        moveToRefine();
        List<RequirementItem> before = copy(session.getRequirements());

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "ok, aceito todos");

        Assertions.assertEquals(EtpStageEnum.CONFIRM_REQUIREMENTS, session.getStage());
        Assertions.assertTrue(session.getRequirementsLocked());
        Assertions.assertEquals(before, session.getRequirements());
        Assertions.assertEquals(Boolean.TRUE, outcome.structuredDelta().get("requirementsLocked"));
    }

    @Test
    public void shouldRegenerateRequirements() {
        moveToRefine();
        service.process(session, "remover 1");

        service.process(session, "refazer tudo");

        Assertions.assertEquals(1, generationService.getRegenerateCalls());
        Assertions.assertEquals(12, session.getRequirements().size());
    }

    @Test
    public void shouldGateGenerationOnExplicitConfirmation() {
        moveToConfirmRequirements();

        EtpTurnDomainService.TurnOutcome unclear = service.process(session, "talvez mais tarde");
        Assertions.assertEquals(EtpStageEnum.CONFIRM_REQUIREMENTS, session.getStage());
        Assertions.assertTrue(unclear.requiresClarification());
        Assertions.assertTrue(unclear.reply().startsWith("Geração de ETP requer confirmação explícita do usuário"));

        EtpTurnDomainService.TurnOutcome edit = service.process(session, "remover 2");
        Assertions.assertEquals(EtpStageEnum.CONFIRM_REQUIREMENTS, session.getStage());
        Assertions.assertTrue(edit.reply().startsWith("Transição não permitida de confirm_requirements para refine_requirements"));

        EtpTurnDomainService.TurnOutcome generate = service.process(session, "pode gerar");
        Assertions.assertEquals(EtpStageEnum.GENERATE_DOCUMENT, session.getStage());
        Assertions.assertTrue(generate.reply().startsWith(EtpReplyDomainService.GENERATOR_UNAVAILABLE_NOTICE));
        Assertions.assertEquals(AnswerTopicEnum.SOLUTION_STRATEGY, session.getAnswers().getCurrentTopic());
        Assertions.assertEquals(4, session.getAnswers().getOfferedStrategies().size());
    }

    @Test
    public void shouldOmitNoticeWhenGeneratorConfigured() {
        generationService.setConfigured(true);
        moveToConfirmRequirements();

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "pode gerar");

        Assertions.assertFalse(outcome.reply().contains(EtpReplyDomainService.GENERATOR_UNAVAILABLE_NOTICE));
    }

    @Test
    public void shouldRestartNecessityWithPayload() {
        moveToRefine();
        service.process(session, "remover 1");

        EtpTurnDomainService.TurnOutcome outcome = service.process(session, "nova necessidade: gestão de frota");

        Assertions.assertEquals("gestão de frota", session.getNecessity());
        Assertions.assertEquals(EtpStageEnum.SUGGEST_REQUIREMENTS, session.getStage());
        Assertions.assertEquals(12, session.getRequirements().size());
        Assertions.assertEquals(Boolean.TRUE, outcome.structuredDelta().get("necessityRestarted"));
        Assertions.assertTrue(outcome.reply().startsWith("Certo, registrei a nova necessidade"));
    }

    @Test
    public void shouldRestartNecessityWithoutPayload() {
        moveToConfirmRequirements();

        service.process(session, "preciso trocar a necessidade");

        Assertions.assertEquals(EtpStageEnum.COLLECT_NEED, session.getStage());
        Assertions.assertNull(session.getNecessity());
        Assertions.assertTrue(session.getRequirements().isEmpty());
        Assertions.assertFalse(session.getRequirementsLocked());
    }

    @Test
    public void shouldResolvePendingDecisionBeforeAnythingElse() {
        moveToGenerateDocument();
        service.process(session, "1");
        Assertions.assertEquals(AnswerTopicEnum.PCA, session.getAnswers().getCurrentTopic());

        EtpTurnDomainService.TurnOutcome ask = service.process(session, "Não sei te dizer");
        Assertions.assertTrue(session.hasPendingDecision());
        Assertions.assertTrue(ask.reply().contains("Responda com 1, 2 ou 3."));
        Assertions.assertNotNull(ask.structuredDelta().get("pendingDecision"));

        EtpTurnDomainService.TurnOutcome unclear = service.process(session, "nova necessidade: outra coisa");
        Assertions.assertEquals(DecisionArbitrationDomainService.UNCLEAR_CHOICE_MESSAGE, unclear.reply());
        Assertions.assertTrue(session.hasPendingDecision());
        Assertions.assertEquals(NECESSITY, session.getNecessity());

        EtpTurnDomainService.TurnOutcome pending = service.process(session, "2");
        Assertions.assertFalse(session.hasPendingDecision());
        Assertions.assertEquals(Constants.PENDING_MARKER, session.getAnswers().getPcaStatus());
        Assertions.assertEquals(AnswerTopicEnum.PRICE_RESEARCH, session.getAnswers().getCurrentTopic());
        Assertions.assertEquals("pendente", pending.structuredDelta().get("decision"));
    }

    @Test
    public void shouldWalkFullConversationToFinalize() {
        moveToGenerateDocument();

        service.process(session, "1");
        Assertions.assertEquals("Contrato por Desempenho (Performance-Based)", session.getAnswers().getChosenStrategy());

        service.process(session, "Não sei te dizer");
        service.process(session, "1");
        Assertions.assertEquals("Não previsto no PCA atual; inclusão via atualização do plano", session.getAnswers().getPcaStatus());

        service.process(session, "Painel de Preços");
        Assertions.assertEquals(AnswerTopicEnum.PRICE_RESEARCH, session.getAnswers().getCurrentTopic());
        service.process(session, "concluído");
        Assertions.assertEquals(AnswerTopicEnum.LEGAL_BASIS, session.getAnswers().getCurrentTopic());

        service.process(session, "Lei 14.133/2021");
        service.process(session, "seguir");
        Assertions.assertEquals(AnswerTopicEnum.QUANTITY_VALUE, session.getAnswers().getCurrentTopic());

        service.process(session, "20 unidades, R$ 500 mil por ano");
        Assertions.assertEquals(20, session.getAnswers().getQuantityValue().getQuantity());

        service.process(session, "não haverá parcelamento");
        Assertions.assertEquals(AnswerTopicEnum.SUMMARY, session.getAnswers().getCurrentTopic());
        Assertions.assertNotNull(session.getAnswers().getExecutiveSummary());
        Assertions.assertEquals(EtpStageEnum.GENERATE_DOCUMENT, session.getStage());

        EtpTurnDomainService.TurnOutcome preview = service.process(session, "ok");
        Assertions.assertEquals(EtpStageEnum.PREVIEW, session.getStage());
        @SuppressWarnings("unchecked")
        Map<String, String> sections = (Map<String, String>) preview.structuredDelta().get("sections");
        Assertions.assertEquals(NECESSITY, sections.get("2_4_descricao_necessidade"));
        Assertions.assertTrue(sections.containsKey("3_1_requisitos_tecnicos"));
        Assertions.assertTrue(sections.containsKey("8_justificativa_parcelamento"));

        EtpTurnDomainService.TurnOutcome waiting = service.process(session, "deixa eu ler com calma");
        Assertions.assertEquals(EtpStageEnum.PREVIEW, session.getStage());
        Assertions.assertTrue(waiting.requiresClarification());

        service.process(session, "aprovado");
        Assertions.assertEquals(EtpStageEnum.FINALIZE, session.getStage());

        EtpTurnDomainService.TurnOutcome after = service.process(session, "nova necessidade: outra");
        Assertions.assertEquals(EtpStageEnum.FINALIZE, session.getStage());
        Assertions.assertEquals(NECESSITY, session.getNecessity());
        Assertions.assertFalse(after.stateChanged());
    }

    private void moveToRefine() {
        service.process(session, NECESSITY);
        service.process(session, "ok");
        Assertions.assertEquals(EtpStageEnum.REFINE_REQUIREMENTS, session.getStage());
    }

    private void moveToConfirmRequirements() {
        moveToRefine();
        service.process(session, "confirmo");
        Assertions.assertEquals(EtpStageEnum.CONFIRM_REQUIREMENTS, session.getStage());
    }

    private void moveToGenerateDocument() {
        moveToConfirmRequirements();
        service.process(session, "pode gerar");
        Assertions.assertEquals(EtpStageEnum.GENERATE_DOCUMENT, session.getStage());
    }

    private List<RequirementItem> copy(List<RequirementItem> items) {
        List<RequirementItem> result = new ArrayList<>();
        for (RequirementItem item : items) {
            result.add(item.copy());
        }
        return result;
    }
}
