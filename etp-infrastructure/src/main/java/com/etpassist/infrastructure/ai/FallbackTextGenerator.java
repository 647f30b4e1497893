package com.etpassist.infrastructure.ai;

import com.etpassist.domain.etp.adapter.gateway.ITextGenerator;
import com.etpassist.types.enums.GenerationProfileEnum;

/**
 * 未配置 ChatModel 时使用的生成器：始终返回空文本，由载荷守卫回填模板。
 */
public class FallbackTextGenerator implements ITextGenerator {

    @Override
    public String generate(String systemPrompt, String userPrompt, double temperature, GenerationProfileEnum profile) {
        return "";
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
