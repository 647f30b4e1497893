package com.etpassist.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * ETP 会话快照。
 */
@Data
public class EtpSessionDTO {

    private String sessionId;
    private String stage;
    private String necessity;
    private List<RequirementDTO> requirements;
    private Boolean requirementsLocked;

    /**
     * 各阶段答案（键为答案字段名）。
     */
    private Map<String, Object> answers;
    private PendingDecisionDTO pendingDecision;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
