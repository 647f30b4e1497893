package com.etpassist.config;

import com.etpassist.domain.etp.adapter.gateway.IKnowledgeRetriever;
import com.etpassist.domain.etp.adapter.gateway.ITextGenerator;
import com.etpassist.infrastructure.ai.EmptyKnowledgeRetriever;
import com.etpassist.infrastructure.ai.FallbackTextGenerator;
import com.etpassist.infrastructure.ai.SpringAiTextGenerator;
import com.etpassist.infrastructure.ai.VectorStoreKnowledgeRetriever;
import com.etpassist.infrastructure.ai.config.EtpGenerationProperties;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 生成器与检索器选择配置。
 * <p>
 * 启动时选定一次实现：存在 ChatModel 且 etp.generation.enabled=true 时使用 Spring AI 生成器，
 * 否则使用确定性回退；存在 VectorStore 时启用向量检索，否则返回空结果。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-16
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EtpGenerationProperties.class)
public class EtpCollaboratorConfig {

    @Bean
    public ITextGenerator etpTextGenerator(ObjectProvider<ChatModel> chatModelProvider,
                                           @Qualifier("commonThreadPoolExecutor") ThreadPoolExecutor executor,
                                           EtpGenerationProperties properties) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null || !Boolean.TRUE.equals(properties.getEnabled())) {
            log.warn("ETP text generator not configured, using deterministic fallback. chatModelPresent={}, enabled={}",
                    chatModel != null, properties.getEnabled());
            return new FallbackTextGenerator();
        }
        log.info("ETP text generator configured. model={}", chatModel.getClass().getSimpleName());
        return new SpringAiTextGenerator(chatModel, executor, properties);
    }

    @Bean
    public IKnowledgeRetriever etpKnowledgeRetriever(ObjectProvider<VectorStore> vectorStoreProvider,
                                                     @Qualifier("retrievalCache") Cache<String, List<String>> retrievalCache,
                                                     EtpGenerationProperties properties) {
        VectorStore vectorStore = vectorStoreProvider.getIfAvailable();
        if (vectorStore == null || !Boolean.TRUE.equals(properties.getRetrievalEnabled())) {
            log.info("ETP knowledge retriever disabled. vectorStorePresent={}", vectorStore != null);
            return new EmptyKnowledgeRetriever();
        }
        return new VectorStoreKnowledgeRetriever(vectorStore, retrievalCache, properties);
    }
}
