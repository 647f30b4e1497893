package com.etpassist.domain.etp.model.valobj;

import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.EtpStageEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 等待用户在三个编号选项中做出选择的单槽决策。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingDecision {

    private String prompt;

    /**
     * 选项 1 被接受时写入答案的建议文本
     */
    private String proposal;

    private EtpStageEnum stage;

    /**
     * 发起决策时所在的答案子游标（stage 为 generate_document 时有效）
     */
    private AnswerTopicEnum topic;
}
