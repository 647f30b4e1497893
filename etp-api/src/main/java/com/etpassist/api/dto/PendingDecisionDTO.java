package com.etpassist.api.dto;

import lombok.Data;

@Data
public class PendingDecisionDTO {

    private String prompt;
    private String proposal;
    private String stage;
    private String topic;
}
