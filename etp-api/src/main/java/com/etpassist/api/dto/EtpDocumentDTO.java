package com.etpassist.api.dto;

import lombok.Data;

import java.util.List;

/**
 * ETP 文档预览：仅包含已有内容的章节，顺序与正式文档一致。
 */
@Data
public class EtpDocumentDTO {

    private String sessionId;
    private String stage;
    private List<EtpSectionDTO> sections;
}
