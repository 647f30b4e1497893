package com.etpassist.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * ETP 接口链路日志：traceId/requestId 写入 MDC 与响应头，会话路径额外写入 sessionId，
 * 并按 HTTP_IN/HTTP_OUT 输出业务响应码与耗时。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_SESSION_ID = "sessionId";
    private static final String SESSION_PATH_PATTERN = "/api/v1/etp/sessions/{sessionId}/**";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper, ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        return matchesAny(path, properties.getExcludePathPatterns())
                || !matchesAny(path, properties.getIncludePathPatterns());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrNewId(request, HEADER_TRACE_ID);
        String requestId = headerOrNewId(request, HEADER_REQUEST_ID);
        String path = request.getRequestURI();
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        String sessionId = sessionIdFromPath(path);
        if (sessionId != null) {
            MDC.put(MDC_SESSION_ID, sessionId);
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        long start = System.currentTimeMillis();
        log.info("HTTP_IN method={}, path={}", method, path);
        try {
            filterChain.doFilter(request, wrapper);
        } catch (ServletException | IOException | RuntimeException ex) {
            log.warn("HTTP_OUT method={}, path={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                    method, path, System.currentTimeMillis() - start, ex.getClass().getSimpleName(), ex.getMessage());
            throw ex;
        } finally {
            MDC.remove(MDC_SESSION_ID);
        }
        long costMs = System.currentTimeMillis() - start;
        try {
            log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}",
                    method, path, wrapper.getStatus(), responseCode(wrapper), costMs,
                    costMs >= properties.getSlowRequestThresholdMs());
            wrapper.copyBodyToResponse();
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String headerOrNewId(HttpServletRequest request, String header) {
        String value = StringUtils.trimToNull(request.getHeader(header));
        return value != null ? value : UUID.randomUUID().toString().replace("-", "");
    }

    private String sessionIdFromPath(String path) {
        if (path == null || !pathMatcher.match(SESSION_PATH_PATTERN, path)) {
            return null;
        }
        Map<String, String> variables = pathMatcher.extractUriTemplateVariables(SESSION_PATH_PATTERN, path);
        return StringUtils.trimToNull(variables.get(MDC_SESSION_ID));
    }

    /**
     * 读取 Response 包体中的业务码；非 JSON 或无法解析时返回 "-"。
     */
    private String responseCode(ContentCachingResponseWrapper wrapper) {
        byte[] body = wrapper.getContentAsByteArray();
        String contentType = wrapper.getContentType();
        if (body.length == 0 || contentType == null || !contentType.contains(MediaType.APPLICATION_JSON_VALUE)) {
            return "-";
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null || code.isNull() ? "-" : code.asText();
        } catch (IOException ex) {
            log.debug("Failed to read response code: {}", ex.getMessage());
            return "-";
        }
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}
