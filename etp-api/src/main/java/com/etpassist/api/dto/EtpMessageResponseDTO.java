package com.etpassist.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * ETP 对话消息响应。
 */
@Data
public class EtpMessageResponseDTO {

    private Boolean success;
    private String sessionId;
    private String aiResponse;
    private String stage;
    private Boolean stateChanged;
    private Boolean requiresClarification;

    /**
     * 本轮对结构化状态的增量（需求列表、答案字段等）。
     */
    private Map<String, Object> structuredDelta;
}
