package com.etpassist.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EtpSectionDTO {

    private String code;
    private String title;
    private String content;
}
