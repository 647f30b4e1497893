package com.etpassist.infrastructure.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 内容生成配置属性，前缀 etp.generation。
 *
 * @author etpassist
 * @since 2025-03-15
 */
@Data
@ConfigurationProperties(prefix = "etp.generation", ignoreInvalidFields = true)
public class EtpGenerationProperties {

    /** 是否启用真实生成器；关闭或未配置 ChatModel 时走确定性回退 */
    private Boolean enabled = true;

    /** 对话轮次的采样温度 */
    private Double conversationalTemperature = 0.3D;

    /** 摘要等综合生成的采样温度 */
    private Double synthesisTemperature = 0.7D;

    /** 对话轮次超时（毫秒） */
    private Long conversationalTimeoutMs = 20000L;

    /** 综合生成超时（毫秒） */
    private Long synthesisTimeoutMs = 60000L;

    /** 是否启用知识检索 */
    private Boolean retrievalEnabled = true;

    /** 检索条数上限 */
    private Integer retrievalTopK = 4;

    /** 检索相似度阈值 */
    private Double retrievalSimilarityThreshold = 0.5D;

    /** 检索结果缓存时间（秒） */
    private Long retrievalCacheTtlSeconds = 300L;
}
