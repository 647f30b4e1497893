package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.PendingDecision;
import com.etpassist.domain.etp.model.valobj.QuantityValueEstimate;
import com.etpassist.domain.etp.model.valobj.StageIntent;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.types.common.Constants;
import com.etpassist.types.common.TextNormalizer;
import com.etpassist.types.enums.AnswerIntentEnum;
import com.etpassist.types.enums.AnswerTopicEnum;
import com.etpassist.types.enums.EtpStageEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * generate_document 阶段内的答案收集：按子游标顺序提问、解析、写入答案。
 * <p>
 * 子游标推进不是阶段迁移；只有 summary 子游标上的确认才会请求进入 preview。
 * 用户表示不确定时发起三选一决策，默认建议由本服务给出。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-15
 */
@Service
public class EtpAnswerCollectionDomainService {

    private final AnswerInterpreterDomainService answerInterpreter;
    private final DecisionArbitrationDomainService decisionArbitration;
    private final ResponsePayloadGuardDomainService payloadGuard;
    private final EtpReplyDomainService replyService;
    private final EtpContentGenerationService contentGenerationService;

    public EtpAnswerCollectionDomainService(AnswerInterpreterDomainService answerInterpreter,
                                            DecisionArbitrationDomainService decisionArbitration,
                                            ResponsePayloadGuardDomainService payloadGuard,
                                            EtpReplyDomainService replyService,
                                            EtpContentGenerationService contentGenerationService) {
        this.answerInterpreter = answerInterpreter;
        this.decisionArbitration = decisionArbitration;
        this.payloadGuard = payloadGuard;
        this.replyService = replyService;
        this.contentGenerationService = contentGenerationService;
    }

    /**
     * 子游标处理结果。
     *
     * @param reply 回复文本
     * @param requiresClarification 是否需要用户澄清
     * @param readyForPreview 用户已在摘要处确认，可以请求进入 preview
     */
    public record TopicResult(String reply, boolean requiresClarification, boolean readyForPreview) {

        static TopicResult answered(String reply) {
            return new TopicResult(reply, false, false);
        }

        static TopicResult clarify(String reply) {
            return new TopicResult(reply, true, false);
        }
    }

    /**
     * 进入 generate_document：生成候选策略并把子游标置于第一个主题。
     */
    public String begin(EtpSessionEntity session) {
        EtpAnswers answers = session.answersOrEmpty();
        List<StrategyOption> strategies = payloadGuard.ensureStrategies(
                contentGenerationService.suggestStrategies(session.getNecessity(), session.requirementTexts()),
                session.getNecessity());
        answers.setOfferedStrategies(new ArrayList<>(strategies));
        answers.setCurrentTopic(AnswerTopicEnum.first());
        return replyService.topicPrompt(AnswerTopicEnum.first(), session);
    }

    public TopicResult handle(EtpSessionEntity session, String text) {
        EtpAnswers answers = session.answersOrEmpty();
        AnswerTopicEnum topic = answers.getCurrentTopic();
        if (topic == null) {
            topic = AnswerTopicEnum.first();
            answers.setCurrentTopic(topic);
        }
        StageIntent intent = answerInterpreter.interpret(topic, text, answers);

        if (intent.intent() == AnswerIntentEnum.UNCERTAIN || intent.intent() == AnswerIntentEnum.PCA_UNKNOWN) {
            String message = decisionArbitration.askDecision(session, replyService.topicHelp(topic, session),
                    defaultProposal(topic, answers), EtpStageEnum.GENERATE_DOCUMENT, topic);
            return TopicResult.answered(message);
        }
        if (intent.isUnclear()) {
            return TopicResult.clarify(intent.message());
        }

        switch (topic) {
            case SOLUTION_STRATEGY:
                return handleStrategy(session, intent);
            case PCA:
                return handlePca(session, intent);
            case PRICE_RESEARCH:
                return handlePriceResearch(session, intent);
            case LEGAL_BASIS:
                return handleLegalBasis(session, intent);
            case QUANTITY_VALUE:
                return handleQuantityValue(session, intent);
            case INSTALLMENT:
                return handleInstallment(session, intent);
            default:
                return handleSummary(session, intent);
        }
    }

    /**
     * 把已解决的决策值写回对应主题并推进子游标。DEBATE 不写值。
     */
    public String applyDecision(EtpSessionEntity session, PendingDecision decision, String value, String acknowledgement) {
        AnswerTopicEnum topic = decision.getTopic();
        if (topic == null || decision.getStage() != EtpStageEnum.GENERATE_DOCUMENT) {
            return acknowledgement;
        }
        EtpAnswers answers = session.answersOrEmpty();
        switch (topic) {
            case SOLUTION_STRATEGY:
                answers.setChosenStrategy(value);
                break;
            case PCA:
                answers.setPcaStatus(value);
                break;
            case PRICE_RESEARCH:
                answers.setPriceResearchMethod(value);
                break;
            case LEGAL_BASIS:
                answers.setLegalBasisText(value);
                break;
            case QUANTITY_VALUE:
                answers.setValueMethodology(value);
                break;
            case INSTALLMENT:
                answers.setInstallmentDecision(value);
                break;
            default:
                answers.setExecutiveSummary(value);
                return acknowledgement;
        }
        return advance(session, topic, acknowledgement);
    }

    /**
     * 不确定时的默认建议。
     */
    public String defaultProposal(AnswerTopicEnum topic, EtpAnswers answers) {
        switch (topic) {
            case SOLUTION_STRATEGY:
                if (answers.getOfferedStrategies() != null && !answers.getOfferedStrategies().isEmpty()) {
                    return answers.getOfferedStrategies().get(0).getTitle();
                }
                return "Contrato por Desempenho (Performance-Based)";
            case PCA:
                return "Não previsto no PCA atual; inclusão via atualização do plano";
            case PRICE_RESEARCH:
                return "Painel de Preços + cotações com no mínimo 3 fornecedores";
            case LEGAL_BASIS:
                return "Lei 14.133/2021; Decreto 11.462/2023; IN SEGES 65/2021";
            case QUANTITY_VALUE:
                return "Estimativa equilibrada: pesquisa de preço em 3 fornecedores + média ajustada";
            case INSTALLMENT:
                return "Contratação única (sem parcelamento)";
            default:
                return answers.getExecutiveSummary() == null ? Constants.NOT_INFORMED : answers.getExecutiveSummary();
        }
    }

    private TopicResult handleStrategy(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        List<StrategyOption> offered = answers.getOfferedStrategies() == null ? List.of() : answers.getOfferedStrategies();
        switch (intent.intent()) {
            case SELECT_STRATEGY:
                answers.setChosenStrategy(intent.payloadText("title"));
                return TopicResult.answered(advance(session, AnswerTopicEnum.SOLUTION_STRATEGY, intent.message()));
            case REQUEST_RECOMMENDATION: {
                StrategyOption recommended = offered.isEmpty() ? null : offered.get(0);
                if (recommended == null) {
                    return TopicResult.clarify("Ainda não tenho estratégias para recomendar. Descreva como prefere contratar.");
                }
                answers.setStrategyRecommendation(recommended.getTitle());
                return TopicResult.answered("Recomendo **" + recommended.getTitle() + "**"
                        + (recommended.getWhenIndicated() == null ? "" : ": " + recommended.getWhenIndicated())
                        + ".\n\nPosso registrar essa estratégia? Responda \"ok\" para confirmar ou escolha outra opção.");
            }
            case CHOOSE_PATH: {
                String path = intent.payloadText("path");
                if ("comparar".equals(path)) {
                    return TopicResult.answered("Segue a comparação entre as opções:\n\n"
                            + replyService.strategyPrompt(session.getNecessity(), offered));
                }
                StrategyOption matched = matchPath(offered, path);
                String chosen = matched != null ? matched.getTitle() : pathLabel(path);
                answers.setChosenStrategy(chosen);
                return TopicResult.answered(advance(session, AnswerTopicEnum.SOLUTION_STRATEGY,
                        "Estratégia escolhida: " + chosen + "."));
            }
            case CONFIRM: {
                String chosen = answers.getStrategyRecommendation();
                if (chosen == null && !offered.isEmpty()) {
                    chosen = offered.get(0).getTitle();
                }
                if (chosen == null) {
                    return TopicResult.clarify("Qual estratégia você prefere? Responda com o número da opção.");
                }
                answers.setChosenStrategy(chosen);
                return TopicResult.answered(advance(session, AnswerTopicEnum.SOLUTION_STRATEGY,
                        "Estratégia escolhida: " + chosen + "."));
            }
            default:
                return TopicResult.clarify("Não identifiquei a estratégia. Responda com o número da opção.");
        }
    }

    private TopicResult handlePca(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        switch (intent.intent()) {
            case PCA_YES:
            case PCA_NO:
            case PCA_DETAILS:
                answers.setPcaStatus(intent.payloadText("status"));
                if (intent.payloadText("detail") != null) {
                    answers.setPcaDetail(intent.payloadText("detail"));
                }
                return TopicResult.answered(advance(session, AnswerTopicEnum.PCA, intent.message()));
            case PROCEED_NEXT:
                if (answers.getPcaStatus() == null) {
                    answers.setPcaStatus(Constants.NOT_INFORMED);
                }
                return TopicResult.answered(advance(session, AnswerTopicEnum.PCA, "Certo, seguimos."));
            default:
                return TopicResult.clarify("A contratação está prevista no PCA? Responda sim, não ou não sei.");
        }
    }

    private TopicResult handlePriceResearch(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        String keepGoing = " Algo mais? Quando terminar, diga \"concluído\".";
        switch (intent.intent()) {
            case METHOD_SELECT:
                answers.setPriceResearchMethod(intent.payloadText("method"));
                return TopicResult.answered(intent.message() + keepGoing);
            case SUPPLIER_COUNT:
                answers.setSupplierCount(Integer.valueOf(intent.payloadText("supplierCount")));
                if (intent.payloadText("method") != null && answers.getPriceResearchMethod() == null) {
                    answers.setPriceResearchMethod(intent.payloadText("method"));
                }
                return TopicResult.answered(intent.message() + keepGoing);
            case LINK_EVIDENCE:
                Object links = intent.payload().get("links");
                if (links instanceof List<?> list) {
                    for (Object link : list) {
                        answers.getEvidenceLinks().add(String.valueOf(link));
                    }
                }
                return TopicResult.answered(intent.message() + keepGoing);
            case MARK_DONE:
                if (answers.getPriceResearchMethod() == null) {
                    answers.setPriceResearchMethod(Constants.NOT_INFORMED);
                }
                if (answers.getValueMethodology() == null) {
                    answers.setValueMethodology(priceMethodology(answers));
                }
                return TopicResult.answered(advance(session, AnswerTopicEnum.PRICE_RESEARCH, "Pesquisa de preços registrada."));
            default:
                return TopicResult.clarify("Informe o método de pesquisa de preços ou diga \"concluído\".");
        }
    }

    private TopicResult handleLegalBasis(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        switch (intent.intent()) {
            case LEGAL_BASIS_SET: {
                String current = answers.getLegalBasisText();
                String text = intent.payloadText("text");
                answers.setLegalBasisText(current == null || Constants.NOT_INFORMED.equals(current) ? text : current + "; " + text);
                return TopicResult.answered(intent.message() + " Quer acrescentar alguma observação ou podemos seguir?");
            }
            case LEGAL_BASIS_NOTES:
                answers.setLegalBasisNotes(intent.payloadText("notes"));
                return TopicResult.answered(intent.message() + " Podemos seguir?");
            case FINALIZE:
            case CONFIRM:
                if (answers.getLegalBasisText() == null) {
                    answers.setLegalBasisText(Constants.NOT_INFORMED);
                }
                return TopicResult.answered(advance(session, AnswerTopicEnum.LEGAL_BASIS, "Base legal registrada."));
            default:
                return TopicResult.clarify("Informe a norma aplicável ou diga \"seguir\".");
        }
    }

    private TopicResult handleQuantityValue(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        if (intent.intent() == AnswerIntentEnum.QUANTITY_VALUE) {
            QuantityValueEstimate estimate = answers.getQuantityValue() == null
                    ? new QuantityValueEstimate() : answers.getQuantityValue();
            Object quantity = intent.payload().get("quantity");
            if (quantity instanceof Integer value) {
                estimate.setQuantity(value);
            }
            if (intent.payloadText("unit") != null) {
                estimate.setUnit(intent.payloadText("unit"));
            }
            Object value = intent.payload().get("value");
            if (value instanceof BigDecimal amount) {
                estimate.setValue(amount);
            }
            if (intent.payloadText("period") != null) {
                estimate.setPeriod(intent.payloadText("period"));
            }
            estimate.setDescription(intent.payloadText("description"));
            answers.setQuantityValue(estimate);
            return TopicResult.answered(advance(session, AnswerTopicEnum.QUANTITY_VALUE, intent.message()));
        }
        if (intent.intent() == AnswerIntentEnum.CONFIRM && answers.getQuantityValue() != null) {
            return TopicResult.answered(advance(session, AnswerTopicEnum.QUANTITY_VALUE, "Certo, seguimos."));
        }
        return TopicResult.clarify("Me passe a quantidade e o valor estimado (ex.: \"20 unidades, R$ 500 mil por ano\") "
                + "ou diga \"não sei\" para eu propor uma abordagem.");
    }

    private TopicResult handleInstallment(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        if (intent.intent() == AnswerIntentEnum.INSTALLMENT_YES || intent.intent() == AnswerIntentEnum.INSTALLMENT_NO) {
            answers.setInstallmentDecision(intent.payloadText("decision"));
            answers.setInstallmentText(intent.payloadText("text"));
            return TopicResult.answered(advance(session, AnswerTopicEnum.INSTALLMENT, intent.message()));
        }
        return TopicResult.clarify("Vai dividir em lotes/fases (sim) ou será contratação única (não)?");
    }

    private TopicResult handleSummary(EtpSessionEntity session, StageIntent intent) {
        EtpAnswers answers = session.answersOrEmpty();
        if (intent.intent() == AnswerIntentEnum.CONFIRM) {
            if (answers.getExecutiveSummary() == null) {
                answers.setExecutiveSummary(composeSummary(session, null));
            }
            return new TopicResult(null, false, true);
        }
        if (intent.intent() == AnswerIntentEnum.SUMMARY_ADJUST) {
            String adjustment = intent.payloadText("text");
            answers.getSummaryAdjustments().add(adjustment);
            answers.setExecutiveSummary(composeSummary(session, adjustment));
            return TopicResult.answered("Ajuste aplicado ao resumo.\n\n" + replyService.summaryPrompt(session));
        }
        return TopicResult.clarify("Posso gerar a prévia com este resumo ou você quer ajustar algo?");
    }

    private String advance(EtpSessionEntity session, AnswerTopicEnum from, String acknowledgement) {
        EtpAnswers answers = session.answersOrEmpty();
        AnswerTopicEnum next = from.next();
        if (next == null) {
            next = AnswerTopicEnum.SUMMARY;
        }
        answers.setCurrentTopic(next);
        if (next == AnswerTopicEnum.SUMMARY && answers.getExecutiveSummary() == null) {
            answers.setExecutiveSummary(composeSummary(session, null));
        }
        String prompt = replyService.topicPrompt(next, session);
        if (acknowledgement == null || acknowledgement.trim().isEmpty()) {
            return prompt;
        }
        return acknowledgement + "\n\n" + prompt;
    }

    private String composeSummary(EtpSessionEntity session, String adjustment) {
        return payloadGuard.ensureSummary(contentGenerationService.composeExecutiveSummary(session, adjustment),
                session.getNecessity());
    }

    private StrategyOption matchPath(List<StrategyOption> offered, String path) {
        String[] keywords;
        if ("compra".equals(path)) {
            keywords = new String[]{"compra", "aquisicao"};
        } else if ("locacao".equals(path)) {
            keywords = new String[]{"locacao", "leasing", "aluguel"};
        } else if ("servico".equals(path)) {
            keywords = new String[]{"servico", "outsourcing", "desempenho"};
        } else {
            return null;
        }
        for (StrategyOption option : offered) {
            if (TextNormalizer.containsAny(TextNormalizer.normalize(option.getTitle()), keywords)) {
                return option;
            }
        }
        return null;
    }

    private String pathLabel(String path) {
        if ("compra".equals(path)) {
            return "Aquisição (compra direta)";
        }
        if ("locacao".equals(path)) {
            return "Locação";
        }
        return "Contratação de serviço";
    }

    private String priceMethodology(EtpAnswers answers) {
        String method = answers.getPriceResearchMethod();
        StringBuilder builder = new StringBuilder("Pesquisa de preços: ").append(method == null ? Constants.NOT_INFORMED : method);
        if (answers.getSupplierCount() != null) {
            builder.append(", ").append(answers.getSupplierCount()).append(" fornecedor(es) consultado(s)");
        }
        if (answers.getEvidenceLinks() != null && !answers.getEvidenceLinks().isEmpty()) {
            builder.append(". Evidências: ").append(String.join(", ", answers.getEvidenceLinks()));
        }
        return builder.toString();
    }
}
