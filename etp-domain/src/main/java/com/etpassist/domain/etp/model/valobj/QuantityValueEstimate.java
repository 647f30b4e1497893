package com.etpassist.domain.etp.model.valobj;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 数量与金额估算。任一字段都可能为空，description 保存用户原始描述。
 */
@Data
public class QuantityValueEstimate {

    private Integer quantity;

    /**
     * 数量单位，如 unidades / servidores
     */
    private String unit;

    private BigDecimal value;

    /**
     * ano / mes
     */
    private String period;

    private String description;

    public boolean hasNoData() {
        return quantity == null && value == null && period == null
                && (description == null || description.trim().isEmpty());
    }
}
