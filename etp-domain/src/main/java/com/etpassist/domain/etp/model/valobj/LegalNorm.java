package com.etpassist.domain.etp.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LegalNorm {

    private String ref;

    private String applies;
}
