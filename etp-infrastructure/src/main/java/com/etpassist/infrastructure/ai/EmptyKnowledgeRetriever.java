package com.etpassist.infrastructure.ai;

import com.etpassist.domain.etp.adapter.gateway.IKnowledgeRetriever;

import java.util.Collections;
import java.util.List;

/**
 * 未配置向量库时的检索器。
 */
public class EmptyKnowledgeRetriever implements IKnowledgeRetriever {

    @Override
    public List<String> retrieve(String query, int limit) {
        return Collections.emptyList();
    }
}
