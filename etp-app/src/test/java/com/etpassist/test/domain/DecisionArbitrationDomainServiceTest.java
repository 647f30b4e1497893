package com.etpassist.test.domain;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.service.DecisionArbitrationDomainService;
import com.etpassist.types.common.Constants;
import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.DecisionOptionEnum;
import com.etpassist.types.enums.EtpStageEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DecisionArbitrationDomainServiceTest {

    private final DecisionArbitrationDomainService service = new DecisionArbitrationDomainService();

    private EtpSessionEntity session;

    @BeforeEach
    public void setUp() {
        session = EtpSessionEntity.create("s-decision");
        session.setStage(EtpStageEnum.GENERATE_DOCUMENT);
    }

    @Test
    public void shouldRenderThreeNumberedOptions() {
        String message = service.askDecision(session, "Sobre o PCA:", "Não previsto no PCA atual",
                EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        Assertions.assertTrue(message.contains("**Opções:**"));
        Assertions.assertTrue(message.contains("Responda com 1, 2 ou 3."));
        Assertions.assertTrue(session.hasPendingDecision());
        Assertions.assertEquals(AnswerTopicEnum.PCA, session.getPendingDecision().getTopic());
    }

    @Test
    public void shouldAcceptProposalOnOption1() {
        service.askDecision(session, "Sobre o PCA:", "Não previsto", EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        DecisionArbitrationDomainService.DecisionOutcome outcome = service.consumeDecision(session, "1");

        Assertions.assertEquals(DecisionOptionEnum.ACCEPT, outcome.option());
        Assertions.assertEquals("Não previsto", outcome.value());
        Assertions.assertEquals("Perfeito, registrei a proposta: Não previsto", outcome.message());
        Assertions.assertFalse(session.hasPendingDecision());
    }

    @Test
    public void shouldMarkPendingOnOption2() {
        service.askDecision(session, "Sobre o PCA:", "Não previsto", EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        DecisionArbitrationDomainService.DecisionOutcome outcome = service.consumeDecision(session, "2");

        Assertions.assertEquals(DecisionOptionEnum.PENDING, outcome.option());
        Assertions.assertEquals(Constants.PENDING_MARKER, outcome.value());
        Assertions.assertFalse(session.hasPendingDecision());
    }

    @Test
    public void shouldClearDecisionOnDebate() {
        service.askDecision(session, "Sobre o PCA:", "Não previsto", EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        DecisionArbitrationDomainService.DecisionOutcome outcome = service.consumeDecision(session, "3");

        Assertions.assertEquals(DecisionOptionEnum.DEBATE, outcome.option());
        Assertions.assertNull(outcome.value());
        Assertions.assertFalse(session.hasPendingDecision());
    }

    @Test
    public void shouldKeepDecisionPendingOnFreeText() {
        service.askDecision(session, "Sobre o PCA:", "Não previsto", EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        DecisionArbitrationDomainService.DecisionOutcome outcome = service.consumeDecision(session, "o orçamento vem do FNDE");

        Assertions.assertEquals(DecisionOptionEnum.UNCLEAR, outcome.option());
        Assertions.assertFalse(outcome.isResolved());
        Assertions.assertTrue(outcome.message().contains("confirmar"));
        Assertions.assertTrue(session.hasPendingDecision());
    }

    @Test
    public void shouldNotAcceptNegatedReply() {
        service.askDecision(session, "Sobre o PCA:", "Não previsto no PCA", EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        DecisionArbitrationDomainService.DecisionOutcome refused = service.consumeDecision(session, "não aceito essa proposta");
        DecisionArbitrationDomainService.DecisionOutcome disagreed = service.consumeDecision(session, "Não concordo com isso");

        Assertions.assertEquals(DecisionOptionEnum.UNCLEAR, refused.option());
        Assertions.assertNull(refused.value());
        Assertions.assertEquals(DecisionOptionEnum.UNCLEAR, disagreed.option());
        Assertions.assertTrue(session.hasPendingDecision());
        Assertions.assertEquals("Não previsto no PCA", session.getPendingDecision().getProposal());
    }

    @Test
    public void shouldStillAcceptPlainAgreement() {
        service.askDecision(session, "Sobre o PCA:", "Não previsto", EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA);

        DecisionArbitrationDomainService.DecisionOutcome outcome = service.consumeDecision(session, "aceito a proposta");

        Assertions.assertEquals(DecisionOptionEnum.ACCEPT, outcome.option());
        Assertions.assertFalse(session.hasPendingDecision());
    }

    @Test
    public void shouldReturnNullWithoutPendingDecision() {
        Assertions.assertNull(service.consumeDecision(session, "1"));
    }
}
