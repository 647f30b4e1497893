package com.etpassist.api.dto;

import lombok.Data;

/**
 * ETP 对话消息请求。
 */
@Data
public class EtpMessageRequestDTO {

    /**
     * 会话 ID，为空时创建新会话。
     */
    private String sessionId;
    private String message;
}
