package com.etpassist.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 *
 * @author etpassist
 * @since 2025-03-10
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 外部协作方（生成器/检索）调用失败 */
    UPSTREAM_ERROR("0003", "外部服务调用失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
