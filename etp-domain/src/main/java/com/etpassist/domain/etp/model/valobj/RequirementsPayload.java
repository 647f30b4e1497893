package com.etpassist.domain.etp.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 需求生成载荷：引导语 + 需求列表 + 简短理由。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequirementsPayload {

    private String intro;

    @Builder.Default
    private List<String> requirements = new ArrayList<>();

    private String rationale;

    /**
     * 是否使用了确定性模板回填
     */
    private boolean backfilled;
}
