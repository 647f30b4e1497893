package com.etpassist.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * ETP 会话 PO
 *
 * @author etpassist
 * @since 2025-03-14
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtpSessionPO {

    /**
     * 主键ID
     */
    private Long id;

    /**
     * 会话 ID（业务键）
     */
    private String sessionId;

    /**
     * 阶段编码
     */
    private String stage;

    private String necessity;

    /**
     * 需求列表 (JSON)
     */
    private String requirementsJson;

    private Boolean requirementsLocked;

    /**
     * 阶段答案 (JSON)
     */
    private String answersJson;

    /**
     * 待决策 (JSON)
     */
    private String pendingDecisionJson;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
