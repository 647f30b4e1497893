package com.etpassist.domain.etp.adapter.gateway;

import com.etpassist.types.enums.GenerationProfileEnum;

/**
 * 文本生成端口：LLM 等外部生成器的窄接口。
 */
public interface ITextGenerator {

    /**
     * 生成文本。实现可以抛出异常或超时，调用方负责回退到确定性路径。
     *
     * @param systemPrompt 系统提示词
     * @param userPrompt 用户提示词
     * @param temperature 采样温度
     * @param profile 调用档位，决定超时上限
     * @return 生成文本，可能为空
     */
    String generate(String systemPrompt, String userPrompt, double temperature, GenerationProfileEnum profile);

    /**
     * 是否配置了真实生成器（false 表示当前为确定性回退实现）。
     */
    boolean isConfigured();
}
