package com.etpassist.domain.etp.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 需求条目。编号是位置性的（R1..Rn），任何增删改之后都会重新计算。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RequirementItem {

    /**
     * 位置编号，形如 R3
     */
    private String id;

    /**
     * 需求正文
     */
    private String text;

    public RequirementItem copy() {
        return new RequirementItem(id, text);
    }
}
