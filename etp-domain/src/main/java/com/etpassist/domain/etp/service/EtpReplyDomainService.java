package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.QuantityValueEstimate;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.types.common.Constants;
import com.etpassist.types.enums.AnswerTopicEnum;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 面向用户的回复文本。只描述状态，不写任何文档章节正文。
 */
@Service
public class EtpReplyDomainService {

    public static final String GREETING = "Olá! Para começar, me descreva qual a necessidade desta contratação.";

    public static final String GENERATOR_UNAVAILABLE_NOTICE = "Não consegui carregar o gerador consultivo. Continuo aqui. "
            + "Quer que eu tente gerar o ETP diretamente ou ajustamos os requisitos antes?";

    public String greeting() {
        return GREETING;
    }

    public String requirementsSuggested(String intro, List<RequirementItem> items) {
        StringBuilder builder = new StringBuilder();
        if (intro != null && !intro.trim().isEmpty()) {
            builder.append(intro.trim()).append("\n\n");
        }
        builder.append("Baseado na sua necessidade, sugiro estes requisitos:\n\n");
        builder.append(requirementLines(items));
        builder.append("\n\nEles cobrem os aspectos principais de conformidade, operação e suporte. ");
        builder.append("Se quiser que eu ajuste algo, me diga naturalmente o que mudar. ");
        builder.append("Caso contrário, posso seguir para as estratégias de contratação.");
        return builder.toString();
    }

    public String requirementsUpdated(String description, List<RequirementItem> items) {
        return description + "\n\n" + requirementLines(items)
                + "\n\nQuer ajustar mais alguma coisa ou posso seguir?";
    }

    public String requirementsReadyToConfirm(List<RequirementItem> items) {
        return "Perfeito! Esta é a lista atual de requisitos:\n\n" + requirementLines(items)
                + "\n\nPara fechar a lista, responda \"confirmo\". Se quiser, ainda posso ajustar algo "
                + "(ex.: \"remover 3\", \"ajustar o último\").";
    }

    public String requirementsConfirmed(List<RequirementItem> items) {
        return "Perfeito! Requisitos confirmados e registrados:\n\n" + requirementLines(items)
                + "\n\nPosso seguir para a elaboração do ETP (estratégia de contratação, PCA, pesquisa de preços, "
                + "base legal, quantitativos e parcelamento)? Responda \"pode gerar\" para continuar.";
    }

    public String askRequirementText(int position) {
        return "Não consegui reescrever o R" + position + " automaticamente. Me diga o novo texto "
                + "(ex.: \"ajustar " + position + ": novo texto\").";
    }

    public String necessityRestarted(boolean hasPayload) {
        if (hasPayload) {
            return "Certo, registrei a nova necessidade e refiz os requisitos.";
        }
        return "Certo, vamos recomeçar. Me descreva a nova necessidade desta contratação.";
    }

    /**
     * 当前子游标的提问文本。
     */
    public String topicPrompt(AnswerTopicEnum topic, EtpSessionEntity session) {
        if (topic == null) {
            return summaryPrompt(session);
        }
        switch (topic) {
            case SOLUTION_STRATEGY:
                return strategyPrompt(session.getNecessity(), session.answersOrEmpty().getOfferedStrategies());
            case PCA:
                return "Sobre o PCA (Plano de Contratações Anual): essa demanda já aparece no seu planejamento deste ano? "
                        + "Se não tiver certeza, eu explico rapidamente e te proponho dois caminhos simples.";
            case PRICE_RESEARCH:
                return "Pesquisa de preços: como você pretende levantar os preços de referência? "
                        + "As opções usuais são Painel de Preços, cotações com fornecedores, histórico de contratações "
                        + "(pregões anteriores) ou marketplace. Você também pode me enviar links de evidências e quantos "
                        + "fornecedores consultou. Quando terminar, diga \"concluído\".";
            case LEGAL_BASIS:
                return "Normas e base legal: posso te sugerir um pacote inicial típico do setor (Lei 14.133/2021 + "
                        + "regulatórias aplicáveis) e você me diz se mantemos, ajustamos ou deixamos como rascunho?";
            case QUANTITY_VALUE:
                return "Sobre quantitativo e valor: dá para chutar uma ordem de grandeza? Se estiver nebuloso, eu te mostro "
                        + "duas formas rápidas de chegar a um número defensável e já deixo uma faixa inicial para você aprovar.";
            case INSTALLMENT:
                return "Sobre parcelamento: você acha que faz sentido dividir em lotes ou fases? Se não tiver certeza, "
                        + "eu explico os prós e contras rapidamente e te ajudo a escolher o melhor para o seu caso.";
            default:
                return summaryPrompt(session);
        }
    }

    /**
     * 用户表示不确定时的解释文本，作为决策提问的正文。
     */
    public String topicHelp(AnswerTopicEnum topic, EtpSessionEntity session) {
        switch (topic) {
            case SOLUTION_STRATEGY:
                return "Sem problema. Considerando a necessidade e os requisitos, a opção mais comum é a primeira da lista.";
            case PCA:
                return "Entendo. O PCA (Plano de Contratações Anual) é o cronograma de contratações da organização. "
                        + "Situações comuns:\n\n"
                        + "1. **Não previsto no PCA atual**: precisará incluir via atualização do plano\n"
                        + "2. **Previsto para o segundo semestre**: aguardando aprovação e liberação de verba\n"
                        + "3. **Previsto e aprovado**: pode seguir com o processo imediatamente";
            case PRICE_RESEARCH:
                return "Sem problema. A forma mais defensável é combinar o Painel de Preços com cotações diretas.";
            case LEGAL_BASIS:
                return "Sem problema. Para " + safe(session.getNecessity(), "esse objeto") + ", as normas mais comuns são:\n\n"
                        + "1. **Lei 14.133/2021** (Nova Lei de Licitações): base geral para contratações públicas\n"
                        + "2. **Decreto 11.462/2023**: regulamenta o sistema de registro de preços\n"
                        + "3. **IN SEGES 65/2021**: pesquisa de preços para aquisição de bens e contratação de serviços\n"
                        + "4. **Normas técnicas ABNT**: específicas do objeto";
            case QUANTITY_VALUE:
                return "Entendo que ainda não tem o valor definido. Abordagens de estimativa:\n\n"
                        + "1. **Estimativa conservadora**: média de mercado acrescida de 20-30% de margem de segurança\n"
                        + "2. **Estimativa equilibrada**: pesquisa de preço em 3 fornecedores + média ajustada\n"
                        + "3. **Estimativa agressiva**: menor preço de mercado com negociação forte";
            case INSTALLMENT:
                return "Vou explicar as opções de parcelamento:\n\n"
                        + "**Prós do parcelamento (por lotes/fases):**\n"
                        + "- Reduz risco de fornecedor único\n- Permite ajustes entre fases\n- Facilita planejamento orçamentário\n\n"
                        + "**Contras:**\n"
                        + "- Maior complexidade de gestão\n- Possível variação de preços entre lotes\n- Necessita múltiplos processos\n\n"
                        + "Recomendo **não parcelar** se o valor total couber no orçamento e a entrega for rápida (< 6 meses).";
            default:
                return "Posso registrar o resumo como está.";
        }
    }

    public String strategyPrompt(String necessity, List<StrategyOption> strategies) {
        StringBuilder builder = new StringBuilder();
        builder.append("Agora vamos definir a melhor estratégia de contratação para \"")
                .append(safe(necessity, "sua necessidade")).append("\". Posso sugerir algumas opções:\n\n");
        if (strategies != null) {
            for (int i = 0; i < strategies.size(); i++) {
                StrategyOption option = strategies.get(i);
                builder.append(i + 1).append(". **").append(option.getTitle()).append("**");
                if (option.getWhenIndicated() != null) {
                    builder.append(": ").append(option.getWhenIndicated());
                }
                builder.append("\n   Vantagens: ").append(String.join("; ", option.getAdvantages()));
                builder.append("\n   Riscos: ").append(String.join("; ", option.getRisks())).append("\n");
            }
        }
        builder.append("\nQual dessas faz mais sentido para o seu caso? Ou quer que eu recomende com base no contexto?");
        return builder.toString();
    }

    public String summaryPrompt(EtpSessionEntity session) {
        EtpAnswers answers = session.answersOrEmpty();
        int count = session.getRequirements() == null ? 0 : session.getRequirements().size();
        StringBuilder builder = new StringBuilder();
        builder.append("Pronto! Aqui está o resumo do ETP:\n\n");
        builder.append("**Necessidade:** ").append(safe(session.getNecessity(), Constants.NOT_INFORMED)).append("\n");
        builder.append("**Requisitos:** ").append(count > 0 ? count + " requisitos definidos" : "requisitos pendentes").append("\n");
        builder.append("**Estratégia de contratação:** ").append(safe(answers.getChosenStrategy(), Constants.NOT_INFORMED)).append("\n");
        builder.append("**PCA:** ").append(safe(answers.getPcaStatus(), Constants.NOT_INFORMED)).append("\n");
        builder.append("**Pesquisa de preços:** ").append(safe(answers.getPriceResearchMethod(), Constants.NOT_INFORMED)).append("\n");
        builder.append("**Normas legais:** ").append(safe(answers.getLegalBasisText(), Constants.NOT_INFORMED)).append("\n");
        builder.append("**Quantitativo/Valor:** ").append(quantityValueText(answers.getQuantityValue())).append("\n");
        builder.append("**Parcelamento:** ").append(safe(answers.getInstallmentDecision(), Constants.NOT_INFORMED)).append("\n");
        if (answers.getExecutiveSummary() != null) {
            builder.append("\n").append(answers.getExecutiveSummary()).append("\n");
        }
        builder.append("\nTudo certo? Se sim, posso gerar a prévia do documento.");
        return builder.toString();
    }

    public String preview() {
        return "Aqui está a prévia do ETP gerado com todas as informações que coletamos. "
                + "Revise as seções e, se estiver tudo certo, confirme para finalizar.";
    }

    public String finalized() {
        return "ETP finalizado! O documento está consolidado e pode ser exportado a partir da prévia.";
    }

    public String alreadyFinalized() {
        return "Este ETP já foi finalizado. Para uma nova contratação, inicie uma nova sessão.";
    }

    public String previewAwaitingConfirmation() {
        return "A prévia está pronta. Se estiver tudo certo, confirme para finalizar o documento.";
    }

    public String requirementLines(List<RequirementItem> items) {
        StringBuilder builder = new StringBuilder();
        if (items == null) {
            return "";
        }
        for (RequirementItem item : items) {
            if (builder.length() > 0) {
                builder.append("\n");
            }
            builder.append(item.getId()).append(" — ").append(item.getText());
        }
        return builder.toString();
    }

    private String quantityValueText(QuantityValueEstimate estimate) {
        if (estimate == null || estimate.hasNoData()) {
            return Constants.NOT_INFORMED;
        }
        StringBuilder builder = new StringBuilder();
        if (estimate.getQuantity() != null) {
            builder.append(estimate.getQuantity());
            if (estimate.getUnit() != null) {
                builder.append(" ").append(estimate.getUnit());
            }
        }
        if (estimate.getValue() != null) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append("R$ ").append(estimate.getValue().toPlainString());
            if (estimate.getPeriod() != null) {
                builder.append("/").append(estimate.getPeriod());
            }
        }
        if (builder.length() == 0 && estimate.getDescription() != null) {
            builder.append(estimate.getDescription());
        }
        return builder.toString();
    }

    private String safe(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }
}
