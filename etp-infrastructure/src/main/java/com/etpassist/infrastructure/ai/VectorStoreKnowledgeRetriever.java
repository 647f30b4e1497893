package com.etpassist.infrastructure.ai;

import com.etpassist.domain.etp.adapter.gateway.IKnowledgeRetriever;
import com.etpassist.infrastructure.ai.config.EtpGenerationProperties;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于 VectorStore 的知识检索器。
 * <p>
 * 检索失败只记录日志并返回空列表；结果按 "limit:query" 缓存。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-16
 */
@Slf4j
public class VectorStoreKnowledgeRetriever implements IKnowledgeRetriever {

    private final VectorStore vectorStore;
    private final Cache<String, List<String>> retrievalCache;
    private final EtpGenerationProperties properties;

    public VectorStoreKnowledgeRetriever(VectorStore vectorStore,
                                         Cache<String, List<String>> retrievalCache,
                                         EtpGenerationProperties properties) {
        this.vectorStore = vectorStore;
        this.retrievalCache = retrievalCache;
        this.properties = properties;
    }

    @Override
    public List<String> retrieve(String query, int limit) {
        if (StringUtils.isBlank(query) || limit <= 0) {
            return Collections.emptyList();
        }
        int topK = resolveTopK(limit);
        String cacheKey = topK + ":" + query.trim();
        List<String> cached = retrievalCache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached;
        }
        try {
            List<Document> documents = vectorStore.similaritySearch(buildSearchRequest(query.trim(), topK));
            List<String> snippets = toSnippets(documents, topK);
            retrievalCache.put(cacheKey, snippets);
            return snippets;
        } catch (Exception ex) {
            log.warn("ETP_RETRIEVAL_FAILED topK={}, reason={}", topK, ex.getMessage());
            return Collections.emptyList();
        }
    }

    private SearchRequest buildSearchRequest(String query, int topK) {
        SearchRequest.Builder builder = SearchRequest.builder();
        builder.query(query);
        builder.topK(topK);
        Double threshold = properties.getRetrievalSimilarityThreshold();
        if (threshold != null && threshold > 0D) {
            builder.similarityThreshold(threshold);
        }
        return builder.build();
    }

    private int resolveTopK(int limit) {
        Integer configured = properties.getRetrievalTopK();
        if (configured == null || configured <= 0) {
            return limit;
        }
        return Math.min(limit, configured);
    }

    private List<String> toSnippets(List<Document> documents, int topK) {
        if (documents == null || documents.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> snippets = new ArrayList<>();
        for (Document document : documents) {
            if (document == null || StringUtils.isBlank(document.getText())) {
                continue;
            }
            snippets.add(document.getText().trim());
            if (snippets.size() >= topK) {
                break;
            }
        }
        return Collections.unmodifiableList(snippets);
    }
}
