package com.etpassist.config;

import com.etpassist.infrastructure.ai.config.EtpGenerationProperties;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 *
 * @author etpassist
 * @since 2025-03-16
 */
@Configuration
public class GuavaConfig {

    /**
     * 知识检索结果缓存，写入后按 etp.generation.retrieval-cache-ttl-seconds 过期。
     */
    @Bean(name = "retrievalCache")
    public Cache<String, List<String>> retrievalCache(EtpGenerationProperties properties) {
        Long ttl = properties.getRetrievalCacheTtlSeconds();
        return CacheBuilder.newBuilder()
                .maximumSize(512)
                .expireAfterWrite(ttl == null || ttl <= 0L ? 300L : ttl, TimeUnit.SECONDS)
                .build();
    }

}
