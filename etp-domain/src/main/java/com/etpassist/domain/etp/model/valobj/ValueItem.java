package com.etpassist.domain.etp.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValueItem {

    private String description;

    private String quantity;

    private String unitValue;
}
