package com.etpassist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性类，配置前缀为 thread.pool.executor.config。
 *
 * @author etpassist
 * @since 2025-03-10
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 8;

    /** 最大线程数 */
    private Integer maxPoolSize = 32;

    /** 空闲线程最大存活时间（秒） */
    private Long keepAliveTime = 30L;

    /** 阻塞队列最大容量 */
    private Integer blockQueueSize = 500;

    /** 拒绝策略：AbortPolicy / DiscardPolicy / DiscardOldestPolicy / CallerRunsPolicy */
    private String policy = "CallerRunsPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "etp-generation-";

}
