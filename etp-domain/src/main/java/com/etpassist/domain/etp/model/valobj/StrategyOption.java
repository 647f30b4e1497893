package com.etpassist.domain.etp.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 采购策略候选项。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyOption {

    private String title;

    /**
     * 适用场景
     */
    private String whenIndicated;

    @Builder.Default
    private List<String> advantages = new ArrayList<>();

    @Builder.Default
    private List<String> risks = new ArrayList<>();
}
