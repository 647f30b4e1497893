package com.etpassist.test;

import com.etpassist.api.dto.EtpDocumentDTO;
import com.etpassist.api.dto.EtpSessionDTO;
import com.etpassist.domain.etp.service.EtpDocumentAssemblerDomainService;
import com.etpassist.test.support.EtpDomainServices;
import com.etpassist.test.support.FixedContentGenerationService;
import com.etpassist.test.support.InMemoryEtpSessionRepository;
import com.etpassist.trigger.application.command.EtpConversationCommandService;
import com.etpassist.trigger.application.query.EtpSessionQueryService;
import com.etpassist.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EtpSessionQueryServiceTest {

    private EtpConversationCommandService commandService;
    private EtpSessionQueryService queryService;

    @BeforeEach
    public void setUp() {
        InMemoryEtpSessionRepository repository = new InMemoryEtpSessionRepository();
        commandService = new EtpConversationCommandService(repository,
                EtpDomainServices.turnService(new FixedContentGenerationService()));
        queryService = new EtpSessionQueryService(repository, new EtpDocumentAssemblerDomainService());
    }

    @Test
    public void shouldExposeSessionSnapshot() {
        commandService.processMessage("s-q", "Locação de impressoras multifuncionais");

        EtpSessionDTO session = queryService.getSession("s-q");

        Assertions.assertEquals("suggest_requirements", session.getStage());
        Assertions.assertEquals("Locação de impressoras multifuncionais", session.getNecessity());
        Assertions.assertEquals("R1", session.getRequirements().get(0).getId());
        Assertions.assertFalse(session.getRequirementsLocked());
        Assertions.assertNull(session.getPendingDecision());
    }

    @Test
    public void shouldPreviewOnlyPopulatedSections() {
        commandService.processMessage("s-doc", "Locação de impressoras multifuncionais");

        EtpDocumentDTO document = queryService.previewDocument("s-doc");

        Assertions.assertEquals(2, document.getSections().size());
        Assertions.assertEquals("2_4_descricao_necessidade", document.getSections().get(0).getCode());
        Assertions.assertEquals("Descrição da Necessidade", document.getSections().get(0).getTitle());
        Assertions.assertEquals("3_1_requisitos_tecnicos", document.getSections().get(1).getCode());
    }

    @Test
    public void shouldRejectUnknownSession() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> queryService.getSession("nope"));

        Assertions.assertEquals("会话不存在", ex.getInfo());
    }
}
