package com.etpassist.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * ETP 文档章节，声明顺序即文档顺序。
 *
 * @author etpassist
 * @since 2025-03-14
 */
@Getter
public enum DocSectionEnum {

    INTRODUCAO("1_introducao", "Introdução"),
    OBJETO_ESPEC("2_objeto_especificacoes", "Objeto e Especificações"),
    OBJETO_LOCAL("2_1_local_execucao", "Local de Execução"),
    OBJETO_NATUREZA_FINALIDADE("2_2_natureza_finalidade", "Natureza e Finalidade"),
    OBJETO_SIGILO("2_3_classificacao_sigilo", "Classificação de Sigilo"),
    OBJETO_DESC_NECESSIDADE("2_4_descricao_necessidade", "Descrição da Necessidade"),
    OBJETO_PCA("2_5_previsao_pca", "Previsão no Plano de Contratações Anual"),
    REQUISITOS("3_requisitos", "Requisitos da Contratação"),
    REQ_TECNICOS("3_1_requisitos_tecnicos", "Requisitos Técnicos"),
    REQ_SUSTENTABILIDADE("3_2_requisitos_sustentabilidade", "Requisitos de Sustentabilidade"),
    REQ_NORMATIVOS("3_3_requisitos_normativos", "Requisitos Normativos"),
    ESTIMATIVA_QTD("4_estimativa_quantidades", "Estimativa das Quantidades"),
    LEVANTAMENTO_MERCADO("5_levantamento_mercado", "Levantamento de Mercado"),
    ESTIMATIVA_VALOR("6_estimativa_valor", "Estimativa do Valor da Contratação"),
    SOLUCAO_COMO_UM_TODO("7_solucao_como_um_todo", "Descrição da Solução como um Todo"),
    JUSTIFICATIVA_PARCELAMENTO("8_justificativa_parcelamento", "Justificativa para o Parcelamento ou não da Solução"),
    RESULTADOS_PRETENDIDOS("9_resultados_pretendidos", "Resultados Pretendidos"),
    PROVIDENCIAS_PREVIAS("10_providencias_previas", "Providências Prévias ao Contrato"),
    CONTRATACOES_CORRELATAS("11_contratacoes_correlatas", "Contratações Correlatas e/ou Interdependentes"),
    IMPACTOS_AMBIENTAIS("12_impactos_ambientais", "Impactos Ambientais"),
    MAPA_RISCOS("13_mapa_de_riscos", "Mapa de Riscos"),
    POSICIONAMENTO_CONCLUSIVO("14_posicionamento_conclusivo", "Posicionamento Conclusivo");

    private final String code;
    private final String title;

    DocSectionEnum(String code, String title) {
        this.code = code;
        this.title = title;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
