package com.etpassist.types.enums;

/**
 * 生成调用档位：对话轮次使用短超时，整文档综合使用长超时。
 *
 * @author etpassist
 * @since 2025-03-12
 */
public enum GenerationProfileEnum {

    CONVERSATIONAL,

    SYNTHESIS

}
