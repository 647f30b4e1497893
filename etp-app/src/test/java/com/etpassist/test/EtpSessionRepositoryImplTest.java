package com.etpassist.test;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.infrastructure.dao.EtpSessionDao;
import com.etpassist.infrastructure.dao.po.EtpSessionPO;
import com.etpassist.infrastructure.repository.etp.EtpSessionRepositoryImpl;
import com.etpassist.infrastructure.util.JsonCodec;
import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.EtpStageEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EtpSessionRepositoryImplTest {

    private EtpSessionDao dao;
    private EtpSessionRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        dao = mock(EtpSessionDao.class);
        repository = new EtpSessionRepositoryImpl(dao, new JsonCodec(new ObjectMapper()));
    }

    @Test
    public void shouldInsertWhenSessionIsNew() {
        EtpSessionEntity session = EtpSessionEntity.create("s-new");
        session.setNecessity("Compra de notebooks");
        session.setRequirements(List.of(new RequirementItem("R1", "Processador com 8 núcleos")));

        repository.save(session);

        ArgumentCaptor<EtpSessionPO> captor = ArgumentCaptor.forClass(EtpSessionPO.class);
        verify(dao).insert(captor.capture());
        verify(dao, never()).update(any(EtpSessionPO.class));
        Assertions.assertEquals("collect_need", captor.getValue().getStage());
        Assertions.assertTrue(captor.getValue().getRequirementsJson().contains("Processador com 8 núcleos"));
        Assertions.assertFalse(captor.getValue().getRequirementsLocked());
    }

    @Test
    public void shouldUpdateKeepingIdAndCreationTime() {
        LocalDateTime createdAt = LocalDateTime.of(2025, 3, 1, 9, 30);
        EtpSessionPO existing = EtpSessionPO.builder()
                .id(42L)
                .sessionId("s-old")
                .stage("collect_need")
                .createdAt(createdAt)
                .build();
        when(dao.selectBySessionId("s-old")).thenReturn(existing);
        EtpSessionEntity session = EtpSessionEntity.create("s-old");
        session.setStage(EtpStageEnum.SUGGEST_REQUIREMENTS);

        repository.save(session);

        ArgumentCaptor<EtpSessionPO> captor = ArgumentCaptor.forClass(EtpSessionPO.class);
        verify(dao).update(captor.capture());
        verify(dao, never()).insert(any(EtpSessionPO.class));
        Assertions.assertEquals(42L, captor.getValue().getId());
        Assertions.assertEquals(createdAt, captor.getValue().getCreatedAt());
        Assertions.assertEquals("suggest_requirements", captor.getValue().getStage());
    }

    @Test
    public void shouldRestoreAnswersAndPendingDecision() {
        EtpSessionEntity session = EtpSessionEntity.create("s-full");
        session.setStage(EtpStageEnum.GENERATE_DOCUMENT);
        session.setNecessity("Compra de notebooks");
        session.setRequirements(List.of(new RequirementItem("R1", "Processador com 8 núcleos")));
        session.setRequirementsLocked(true);
        session.getAnswers().setCurrentTopic(AnswerTopicEnum.PCA);
        session.getAnswers().setChosenStrategy("Pregão eletrônico");
        session.setPendingDecision(new PendingDecision("Qual situação do PCA?", "Previsto e aprovado",
                EtpStageEnum.GENERATE_DOCUMENT, AnswerTopicEnum.PCA));

        ArgumentCaptor<EtpSessionPO> captor = ArgumentCaptor.forClass(EtpSessionPO.class);
        repository.save(session);
        verify(dao).insert(captor.capture());
        when(dao.selectBySessionId("s-full")).thenReturn(captor.getValue());

        EtpSessionEntity restored = repository.findBySessionId("s-full");

        Assertions.assertEquals(EtpStageEnum.GENERATE_DOCUMENT, restored.getStage());
        Assertions.assertTrue(restored.getRequirementsLocked());
        Assertions.assertEquals("R1", restored.getRequirements().get(0).getId());
        Assertions.assertEquals(AnswerTopicEnum.PCA, restored.getAnswers().getCurrentTopic());
        Assertions.assertEquals("Pregão eletrônico", restored.getAnswers().getChosenStrategy());
        Assertions.assertEquals("Previsto e aprovado", restored.getPendingDecision().getProposal());
        Assertions.assertEquals(AnswerTopicEnum.PCA, restored.getPendingDecision().getTopic());
    }

    @Test
    public void shouldReturnNullForUnknownSession() {
        Assertions.assertNull(repository.findBySessionId("missing"));
    }
}
