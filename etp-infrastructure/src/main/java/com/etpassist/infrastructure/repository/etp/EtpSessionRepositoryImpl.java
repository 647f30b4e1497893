package com.etpassist.infrastructure.repository.etp;

import com.etpassist.domain.etp.adapter.repository.IEtpSessionRepository;
import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.infrastructure.dao.EtpSessionDao;
import com.etpassist.infrastructure.dao.po.EtpSessionPO;
import com.etpassist.infrastructure.util.JsonCodec;
import com.etpassist.types.enums.EtpStageEnum;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * ETP 会话仓储实现类。
 * <p>
 * 会话以单行持久化：需求列表、阶段答案与待决策分别序列化为 JSON 列。
 * 保存时按会话 ID 判断插入或更新。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-14
 */
@Slf4j
@Repository
public class EtpSessionRepositoryImpl implements IEtpSessionRepository {

    private static final TypeReference<List<RequirementItem>> REQUIREMENTS_REF = new TypeReference<List<RequirementItem>>() {};
    private static final TypeReference<EtpAnswers> ANSWERS_REF = new TypeReference<EtpAnswers>() {};
    private static final TypeReference<PendingDecision> PENDING_REF = new TypeReference<PendingDecision>() {};

    private final EtpSessionDao etpSessionDao;
    private final JsonCodec jsonCodec;

    public EtpSessionRepositoryImpl(EtpSessionDao etpSessionDao, JsonCodec jsonCodec) {
        this.etpSessionDao = etpSessionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public EtpSessionEntity findBySessionId(String sessionId) {
        return toEntity(etpSessionDao.selectBySessionId(sessionId));
    }

    /**
     * 保存实体（不存在则插入，存在则更新）。
     */
    @Override
    public EtpSessionEntity save(EtpSessionEntity entity) {
        entity.validate();
        EtpSessionPO po = toPO(entity);
        EtpSessionPO existing = etpSessionDao.selectBySessionId(entity.getSessionId());
        if (existing == null) {
            etpSessionDao.insert(po);
            log.debug("ETP session inserted. sessionId={}, stage={}", po.getSessionId(), po.getStage());
        } else {
            po.setId(existing.getId());
            po.setCreatedAt(existing.getCreatedAt());
            etpSessionDao.update(po);
        }
        return toEntity(po);
    }

    /**
     * PO 转换为 Entity
     */
    private EtpSessionEntity toEntity(EtpSessionPO po) {
        if (po == null) {
            return null;
        }
        EtpSessionEntity entity = new EtpSessionEntity();
        entity.setSessionId(po.getSessionId());
        entity.setStage(EtpStageEnum.fromCode(po.getStage()));
        entity.setNecessity(po.getNecessity());
        List<RequirementItem> requirements = jsonCodec.readValue(po.getRequirementsJson(), REQUIREMENTS_REF);
        entity.setRequirements(requirements == null ? new ArrayList<>() : requirements);
        entity.setRequirementsLocked(Boolean.TRUE.equals(po.getRequirementsLocked()));
        EtpAnswers answers = jsonCodec.readValue(po.getAnswersJson(), ANSWERS_REF);
        entity.setAnswers(answers == null ? new EtpAnswers() : answers);
        entity.setPendingDecision(jsonCodec.readValue(po.getPendingDecisionJson(), PENDING_REF));
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private EtpSessionPO toPO(EtpSessionEntity entity) {
        return EtpSessionPO.builder()
                .sessionId(entity.getSessionId())
                .stage(entity.getStage().getCode())
                .necessity(entity.getNecessity())
                .requirementsJson(jsonCodec.writeValue(entity.getRequirements() == null ? new ArrayList<>() : entity.getRequirements()))
                .requirementsLocked(Boolean.TRUE.equals(entity.getRequirementsLocked()))
                .answersJson(jsonCodec.writeValue(entity.answersOrEmpty()))
                .pendingDecisionJson(jsonCodec.writeValue(entity.getPendingDecision()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
