package com.etpassist.trigger.application.query;

import com.etpassist.api.dto.EtpDocumentDTO;
import com.etpassist.api.dto.EtpSectionDTO;
import com.etpassist.api.dto.EtpSessionDTO;
import com.etpassist.api.dto.PendingDecisionDTO;
import com.etpassist.api.dto.RequirementDTO;
import com.etpassist.domain.etp.adapter.repository.IEtpSessionRepository;
import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.service.EtpDocumentAssemblerDomainService;
import com.etpassist.types.enums.DocSectionEnum;
import com.etpassist.types.enums.ResponseCode;
import com.etpassist.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ETP 会话读用例：会话快照与文档章节预览。
 */
@Service
public class EtpSessionQueryService {

    private final IEtpSessionRepository etpSessionRepository;
    private final EtpDocumentAssemblerDomainService documentAssembler;

    public EtpSessionQueryService(IEtpSessionRepository etpSessionRepository,
                                  EtpDocumentAssemblerDomainService documentAssembler) {
        this.etpSessionRepository = etpSessionRepository;
        this.documentAssembler = documentAssembler;
    }

    public EtpSessionDTO getSession(String sessionId) {
        EtpSessionEntity session = requireSession(sessionId);
        EtpSessionDTO dto = new EtpSessionDTO();
        dto.setSessionId(session.getSessionId());
        dto.setStage(session.getStage().getCode());
        dto.setNecessity(session.getNecessity());
        List<RequirementDTO> requirements = new ArrayList<>();
        if (session.getRequirements() != null) {
            for (RequirementItem item : session.getRequirements()) {
                requirements.add(new RequirementDTO(item.getId(), item.getText()));
            }
        }
        dto.setRequirements(requirements);
        dto.setRequirementsLocked(Boolean.TRUE.equals(session.getRequirementsLocked()));
        dto.setAnswers(session.answersOrEmpty().toSnapshot());
        dto.setPendingDecision(toPendingDecisionDTO(session.getPendingDecision()));
        dto.setCreatedAt(session.getCreatedAt());
        dto.setUpdatedAt(session.getUpdatedAt());
        return dto;
    }

    public EtpDocumentDTO previewDocument(String sessionId) {
        EtpSessionEntity session = requireSession(sessionId);
        Map<DocSectionEnum, String> assembled = documentAssembler.assemble(documentAssembler.buildParts(session));
        List<EtpSectionDTO> sections = new ArrayList<>();
        for (Map.Entry<DocSectionEnum, String> entry : assembled.entrySet()) {
            sections.add(new EtpSectionDTO(entry.getKey().getCode(), entry.getKey().getTitle(), entry.getValue()));
        }
        EtpDocumentDTO dto = new EtpDocumentDTO();
        dto.setSessionId(session.getSessionId());
        dto.setStage(session.getStage().getCode());
        dto.setSections(sections);
        return dto;
    }

    private EtpSessionEntity requireSession(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "sessionId 不能为空");
        }
        EtpSessionEntity session = etpSessionRepository.findBySessionId(sessionId.trim());
        if (session == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "会话不存在");
        }
        return session;
    }

    private PendingDecisionDTO toPendingDecisionDTO(PendingDecision decision) {
        if (decision == null) {
            return null;
        }
        PendingDecisionDTO dto = new PendingDecisionDTO();
        dto.setPrompt(decision.getPrompt());
        dto.setProposal(decision.getProposal());
        dto.setStage(decision.getStage() == null ? null : decision.getStage().getCode());
        dto.setTopic(decision.getTopic() == null ? null : decision.getTopic().getCode());
        return dto;
    }
}
