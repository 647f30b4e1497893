package com.etpassist.infrastructure.ai;

import com.etpassist.domain.etp.adapter.gateway.ITextGenerator;
import com.etpassist.infrastructure.ai.config.EtpGenerationProperties;
import com.etpassist.types.enums.GenerationProfileEnum;
import com.etpassist.types.enums.ResponseCode;
import com.etpassist.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI ChatClient 的文本生成器。
 * <p>
 * 每次调用提交到公共线程池并按档位施加软超时：
 * 对话档默认 20 秒，综合档默认 60 秒。超时后取消任务并抛出 {@link AppException}，
 * 由上层回退到确定性路径。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-15
 */
@Slf4j
public class SpringAiTextGenerator implements ITextGenerator {

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final EtpGenerationProperties properties;

    public SpringAiTextGenerator(ChatModel chatModel,
                                 ExecutorService executor,
                                 EtpGenerationProperties properties) {
        if (chatModel == null) {
            throw new IllegalStateException("ChatModel 不能为空");
        }
        this.chatClient = ChatClient.builder(chatModel).build();
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, double temperature, GenerationProfileEnum profile) {
        long timeoutMs = resolveTimeoutMs(profile);
        Future<String> future = executor.submit(() -> call(systemPrompt, userPrompt, temperature));
        try {
            return StringUtils.defaultString(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("ETP_GENERATION_TIMEOUT profile={}, timeoutMs={}", profile, timeoutMs);
            throw new AppException(ResponseCode.UPSTREAM_ERROR.getCode(),
                    "Text generation timed out after " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.UPSTREAM_ERROR.getCode(), "Text generation interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new AppException(ResponseCode.UPSTREAM_ERROR.getCode(),
                    "Text generation failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    private String call(String systemPrompt, String userPrompt, double temperature) {
        ChatClient.ChatClientRequestSpec request = chatClient.prompt();
        if (StringUtils.isNotBlank(systemPrompt)) {
            request = request.system(systemPrompt);
        }
        return request.user(userPrompt)
                .options(ChatOptions.builder().temperature(temperature).build())
                .call()
                .content();
    }

    private long resolveTimeoutMs(GenerationProfileEnum profile) {
        Long configured = profile == GenerationProfileEnum.SYNTHESIS
                ? properties.getSynthesisTimeoutMs()
                : properties.getConversationalTimeoutMs();
        return configured == null || configured <= 0L ? 20000L : configured;
    }
}
