package com.etpassist.test.support;

import com.etpassist.domain.etp.adapter.repository.IEtpSessionRepository;
import com.etpassist.domain.etp.model.entity.EtpSessionEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内存 ETP 会话仓储。
 */
public class InMemoryEtpSessionRepository implements IEtpSessionRepository {

    private final Map<String, EtpSessionEntity> store = new LinkedHashMap<>();
    private int saveCount;

    @Override
    public EtpSessionEntity findBySessionId(String sessionId) {
        return store.get(sessionId);
    }

    @Override
    public EtpSessionEntity save(EtpSessionEntity entity) {
        entity.validate();
        store.put(entity.getSessionId(), entity);
        saveCount++;
        return entity;
    }

    public int getSaveCount() {
        return saveCount;
    }

    public int size() {
        return store.size();
    }
}
