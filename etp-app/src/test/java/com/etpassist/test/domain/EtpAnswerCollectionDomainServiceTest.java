package com.etpassist.test.domain;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.domain.etp.service.EtpAnswerCollectionDomainService;
import com.etpassist.test.support.EtpDomainServices;
import com.etpassist.test.support.FixedContentGenerationService;
import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.EtpStageEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EtpAnswerCollectionDomainServiceTest {

    private FixedContentGenerationService generationService;
    private EtpAnswerCollectionDomainService service;
    private EtpSessionEntity session;

    @BeforeEach
    public void setUp() {
        generationService = new FixedContentGenerationService();
        service = EtpDomainServices.answerCollection(generationService);
        session = EtpSessionEntity.create("s-answers");
        session.setNecessity("Aquisição de notebooks");
        session.setStage(EtpStageEnum.GENERATE_DOCUMENT);
    }

    @Test
    public void shouldOfferStrategiesOnBegin() {
        String prompt = service.begin(session);

        Assertions.assertEquals(AnswerTopicEnum.SOLUTION_STRATEGY, session.getAnswers().getCurrentTopic());
        Assertions.assertTrue(prompt.contains("1. **"));
        Assertions.assertTrue(prompt.contains("Aquisição de notebooks"));
    }

    @Test
    public void shouldRecommendFirstStrategyAndConfirmIt() {
        service.begin(session);

        EtpAnswerCollectionDomainService.TopicResult recommendation = service.handle(session, "me recomende uma");
        Assertions.assertTrue(recommendation.reply().startsWith("Recomendo **"));
        Assertions.assertEquals(AnswerTopicEnum.SOLUTION_STRATEGY, session.getAnswers().getCurrentTopic());

        service.handle(session, "ok");
        Assertions.assertEquals(session.getAnswers().getStrategyRecommendation(), session.getAnswers().getChosenStrategy());
        Assertions.assertEquals(AnswerTopicEnum.PCA, session.getAnswers().getCurrentTopic());
    }

    @Test
    public void shouldClarifyWithoutAdvancing() {
        service.begin(session);
        session.getAnswers().setCurrentTopic(AnswerTopicEnum.INSTALLMENT);

        EtpAnswerCollectionDomainService.TopicResult result = service.handle(session, "hmm");

        Assertions.assertTrue(result.requiresClarification());
        Assertions.assertEquals(AnswerTopicEnum.INSTALLMENT, session.getAnswers().getCurrentTopic());
    }

    @Test
    public void shouldRecomposeSummaryOnAdjustment() {
        generationService.setSummary("Resumo base");
        session.answersOrEmpty().setCurrentTopic(AnswerTopicEnum.SUMMARY);

        EtpAnswerCollectionDomainService.TopicResult result = service.handle(session, "ajustar o prazo de entrega");

        Assertions.assertFalse(result.readyForPreview());
        Assertions.assertEquals("Resumo base (ajustar o prazo de entrega)", session.getAnswers().getExecutiveSummary());
        Assertions.assertEquals(1, session.getAnswers().getSummaryAdjustments().size());
        Assertions.assertTrue(result.reply().startsWith("Ajuste aplicado ao resumo."));
    }

    @Test
    public void shouldSignalPreviewOnSummaryConfirmation() {
        session.answersOrEmpty().setCurrentTopic(AnswerTopicEnum.SUMMARY);

        EtpAnswerCollectionDomainService.TopicResult result = service.handle(session, "pode gerar");

        Assertions.assertTrue(result.readyForPreview());
        Assertions.assertNotNull(session.getAnswers().getExecutiveSummary());
    }

    @Test
    public void shouldApplyAcceptedDecisionAndAdvance() {
        session.answersOrEmpty().setCurrentTopic(AnswerTopicEnum.INSTALLMENT);
        PendingDecision decision = new PendingDecision("Parcelamento?", "Contratação única (sem parcelamento)",
                EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.INSTALLMENT);

        String reply = service.applyDecision(session, decision, decision.getProposal(), "Perfeito.");

        Assertions.assertEquals("Contratação única (sem parcelamento)", session.getAnswers().getInstallmentDecision());
        Assertions.assertEquals(AnswerTopicEnum.SUMMARY, session.getAnswers().getCurrentTopic());
        Assertions.assertTrue(reply.startsWith("Perfeito.\n\nPronto! Aqui está o resumo do ETP"));
    }

    @Test
    public void shouldProposeDefaultsPerTopic() {
        Assertions.assertEquals("Lei 14.133/2021; Decreto 11.462/2023; IN SEGES 65/2021",
                service.defaultProposal(AnswerTopicEnum.LEGAL_BASIS, session.answersOrEmpty()));
        Assertions.assertEquals("Contrato por Desempenho (Performance-Based)",
                service.defaultProposal(AnswerTopicEnum.SOLUTION_STRATEGY, session.answersOrEmpty()));
    }
}
