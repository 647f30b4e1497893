package com.etpassist.domain.etp.model.entity;

import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.types.enums.EtpStageEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * ETP 会话领域实体（聚合根）
 *
 * @author etpassist
 * @since 2025-03-10
 */
@Data
public class EtpSessionEntity {

    /**
     * 会话 ID（不可变）
     */
    private String sessionId;

    /**
     * 当前对话阶段
     */
    private EtpStageEnum stage;

    /**
     * 需求描述，首次捕获后锁定
     */
    private String necessity;

    /**
     * 有序需求列表
     */
    private List<RequirementItem> requirements = new ArrayList<>();

    /**
     * 需求是否已确认锁定
     */
    private Boolean requirementsLocked;

    /**
     * 阶段答案
     */
    private EtpAnswers answers = new EtpAnswers();

    /**
     * 待决策（同一时刻至多一个）
     */
    private PendingDecision pendingDecision;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static EtpSessionEntity create(String sessionId) {
        EtpSessionEntity session = new EtpSessionEntity();
        session.setSessionId(sessionId);
        session.setStage(EtpStageEnum.COLLECT_NEED);
        session.setRequirementsLocked(false);
        LocalDateTime now = LocalDateTime.now();
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        return session;
    }

    /**
     * 验证会话是否有效
     */
    public void validate() {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalStateException("Session id cannot be empty");
        }
        if (stage == null) {
            throw new IllegalStateException("Session stage cannot be null");
        }
    }

    /**
     * 捕获需求描述；已存在时不允许静默覆盖。
     */
    public void captureNecessity(String text) {
        if (hasNecessity()) {
            throw new IllegalStateException("necessity 已锁定，只能通过显式重启需求来修改");
        }
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalStateException("necessity 不能为空");
        }
        this.necessity = text.trim();
    }

    /**
     * 显式重启需求：清空需求描述及其下游数据，回到 collect_need。
     */
    public void restartNecessity() {
        this.necessity = null;
        this.requirements = new ArrayList<>();
        this.requirementsLocked = false;
        this.answers = new EtpAnswers();
        this.pendingDecision = null;
        this.stage = EtpStageEnum.COLLECT_NEED;
    }

    public void replaceRequirements(List<RequirementItem> items) {
        if (Boolean.TRUE.equals(requirementsLocked)) {
            throw new IllegalStateException("需求已锁定，不能修改");
        }
        List<RequirementItem> copy = new ArrayList<>();
        if (items != null) {
            for (RequirementItem item : items) {
                copy.add(item.copy());
            }
        }
        this.requirements = copy;
    }

    public void lockRequirements() {
        this.requirementsLocked = true;
    }

    public void moveTo(EtpStageEnum target) {
        if (target == null) {
            throw new IllegalStateException("Target stage cannot be null");
        }
        this.stage = target;
    }

    public void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    public boolean hasNecessity() {
        return necessity != null && !necessity.trim().isEmpty();
    }

    public boolean hasPendingDecision() {
        return pendingDecision != null;
    }

    public List<String> requirementTexts() {
        List<String> texts = new ArrayList<>();
        if (requirements != null) {
            for (RequirementItem item : requirements) {
                texts.add(item.getText());
            }
        }
        return texts;
    }

    public EtpAnswers answersOrEmpty() {
        if (answers == null) {
            answers = new EtpAnswers();
        }
        return answers;
    }
}
