package com.etpassist.domain.etp.adapter.gateway;

import java.util.List;

/**
 * 知识检索端口：返回按相关度排序的文本片段。
 */
public interface IKnowledgeRetriever {

    /**
     * 检索片段。无结果时返回空列表，不应阻塞对话。
     *
     * @param query 查询文本
     * @param limit 最大条数
     * @return 片段列表
     */
    List<String> retrieve(String query, int limit);
}
