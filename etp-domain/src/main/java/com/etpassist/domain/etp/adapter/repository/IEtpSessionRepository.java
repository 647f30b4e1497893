package com.etpassist.domain.etp.adapter.repository;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;

/**
 * ETP 会话仓储接口。同一会话的并发写入由存储层串行化。
 */
public interface IEtpSessionRepository {

    /**
     * 按会话 ID 查询，不存在时返回 null。
     */
    EtpSessionEntity findBySessionId(String sessionId);

    /**
     * 保存会话（不存在则插入，存在则更新）。
     */
    EtpSessionEntity save(EtpSessionEntity entity);
}
