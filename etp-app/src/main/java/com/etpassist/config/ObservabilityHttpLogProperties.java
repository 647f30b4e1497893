package com.etpassist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ETP 接口链路日志配置，前缀 observability.http-log。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    private boolean enabled = true;

    /** 记录链路日志的路径，默认只覆盖 ETP 接口 */
    private List<String> includePathPatterns = new ArrayList<>(List.of("/api/**"));

    private List<String> excludePathPatterns = new ArrayList<>(List.of("/actuator/**"));

    /** 超过该耗时（毫秒）的请求在 HTTP_OUT 中标记 slow=true */
    private long slowRequestThresholdMs = 3000L;
}
