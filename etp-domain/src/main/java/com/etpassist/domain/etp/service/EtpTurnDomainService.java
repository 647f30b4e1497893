package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.RequirementCommand;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.RequirementsPayload;
import com.etpassist.domain.etp.model.valobj.TransitionDecision;
import com.etpassist.types.enums.CommandTypeEnum;
import com.etpassist.types.enums.DocSectionEnum;
import com.etpassist.types.enums.EtpStageEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单轮对话处理领域服务。
 * <p>
 * 处理顺序固定：待决策检查 → 重启需求检查 → 按阶段解析命令 → 状态迁移校验 → 输出守卫。
 * 所有修改都作用在传入的会话上，持久化由调用方负责；失败时调用方不保存会话即可保证原子性。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-16
 */
@Service
public class EtpTurnDomainService {

    private final StageTransitionDomainService stageTransition;
    private final RequirementCommandInterpreter commandInterpreter;
    private final RequirementsEngineDomainService requirementsEngine;
    private final DecisionArbitrationDomainService decisionArbitration;
    private final ResponsePayloadGuardDomainService payloadGuard;
    private final EtpAnswerCollectionDomainService answerCollection;
    private final EtpDocumentAssemblerDomainService documentAssembler;
    private final EtpReplyDomainService replyService;
    private final EtpContentGenerationService contentGenerationService;

    public EtpTurnDomainService(StageTransitionDomainService stageTransition,
                                RequirementCommandInterpreter commandInterpreter,
                                RequirementsEngineDomainService requirementsEngine,
                                DecisionArbitrationDomainService decisionArbitration,
                                ResponsePayloadGuardDomainService payloadGuard,
                                EtpAnswerCollectionDomainService answerCollection,
                                EtpDocumentAssemblerDomainService documentAssembler,
                                EtpReplyDomainService replyService,
                                EtpContentGenerationService contentGenerationService) {
        this.stageTransition = stageTransition;
        this.commandInterpreter = commandInterpreter;
        this.requirementsEngine = requirementsEngine;
        this.decisionArbitration = decisionArbitration;
        this.payloadGuard = payloadGuard;
        this.answerCollection = answerCollection;
        this.documentAssembler = documentAssembler;
        this.replyService = replyService;
        this.contentGenerationService = contentGenerationService;
    }

    /**
     * 单轮处理结果。
     */
    public record TurnOutcome(EtpSessionEntity session,
                              String reply,
                              EtpStageEnum previousStage,
                              boolean stateChanged,
                              boolean requiresClarification,
                              Map<String, Object> structuredDelta) {
    }

    private static final class TurnContext {
        private String reply;
        private boolean requiresClarification;
        private final Map<String, Object> delta = new LinkedHashMap<>();
    }

    public TurnOutcome process(EtpSessionEntity session, String userText) {
        if (session == null) {
            throw new IllegalStateException("Session cannot be null");
        }
        if (userText == null || userText.trim().isEmpty()) {
            throw new IllegalStateException("message 不能为空");
        }
        session.validate();
        String text = userText.trim();
        EtpStageEnum previousStage = session.getStage();
        TurnContext context = new TurnContext();

        if (!handlePendingDecision(session, text, context)
                && !handleRestart(session, text, context)) {
            route(session, text, context);
        }

        session.touch();
        context.reply = payloadGuard.ensureNonEmpty(context.reply);
        context.delta.put("stage", session.getStage().getCode());
        if (session.getPendingDecision() != null) {
            context.delta.put("pendingDecision", session.getPendingDecision().getProposal());
        }
        boolean stateChanged = previousStage != session.getStage();
        return new TurnOutcome(session, context.reply, previousStage, stateChanged,
                context.requiresClarification, context.delta);
    }

    private boolean handlePendingDecision(EtpSessionEntity session, String text, TurnContext context) {
        DecisionArbitrationDomainService.DecisionOutcome outcome = decisionArbitration.consumeDecision(session, text);
        if (outcome == null) {
            return false;
        }
        switch (outcome.option()) {
            case ACCEPT:
            case PENDING:
                context.reply = answerCollection.applyDecision(session, outcome.decision(), outcome.value(), outcome.message());
                context.delta.put("answers", session.answersOrEmpty().toSnapshot());
                break;
            case DEBATE:
                context.reply = outcome.message();
                break;
            default:
                context.reply = outcome.message();
                context.requiresClarification = true;
                break;
        }
        context.delta.put("decision", outcome.option().getCode());
        return true;
    }

    private boolean handleRestart(EtpSessionEntity session, String text, TurnContext context) {
        EtpStageEnum stage = session.getStage();
        if (stage == EtpStageEnum.COLLECT_NEED || stageTransition.isTerminal(stage)) {
            return false;
        }
        RequirementCommand command = commandInterpreter.interpret(text, session.getRequirements().size());
        if (command.type() != CommandTypeEnum.RESTART_NECESSITY) {
            return false;
        }
        session.restartNecessity();
        if (command.hasPayload()) {
            captureNecessityAndSuggest(session, command.payload(), context);
            context.reply = replyService.necessityRestarted(true) + "\n\n" + context.reply;
        } else {
            context.reply = replyService.necessityRestarted(false);
        }
        context.delta.put("necessityRestarted", true);
        return true;
    }

    private void route(EtpSessionEntity session, String text, TurnContext context) {
        switch (session.getStage()) {
            case COLLECT_NEED:
                handleCollectNeed(session, text, context);
                break;
            case SUGGEST_REQUIREMENTS:
                handleSuggest(session, text, context);
                break;
            case REFINE_REQUIREMENTS:
                handleRefine(session, commandInterpreter.interpret(text, session.getRequirements().size()), context);
                break;
            case CONFIRM_REQUIREMENTS:
                handleConfirmRequirements(session, text, context);
                break;
            case GENERATE_DOCUMENT:
                handleGenerateDocument(session, text, context);
                break;
            case PREVIEW:
                handlePreview(session, text, context);
                break;
            default:
                context.reply = replyService.alreadyFinalized();
                break;
        }
    }

    private void handleCollectNeed(EtpSessionEntity session, String text, TurnContext context) {
        if (ConversationSignals.isVagueAck(text) || ConversationSignals.isUncertainOrSkip(text)) {
            context.reply = replyService.greeting();
            context.requiresClarification = true;
            return;
        }
        // 首条消息带重启前缀（"nova necessidade: ..."）时只取冒号后的描述
        RequirementCommand command = commandInterpreter.interpret(text, 0);
        if (command.type() == CommandTypeEnum.RESTART_NECESSITY && command.hasPayload()) {
            captureNecessityAndSuggest(session, command.payload(), context);
            return;
        }
        captureNecessityAndSuggest(session, text, context);
    }

    private void captureNecessityAndSuggest(EtpSessionEntity session, String necessity, TurnContext context) {
        session.captureNecessity(necessity);
        RequirementsPayload payload = payloadGuard.ensureRequirements(
                contentGenerationService.suggestRequirements(session.getNecessity()), session.getNecessity());
        session.replaceRequirements(requirementsEngine.fromTexts(payload.getRequirements()));

        // 需求描述被捕获即视为本阶段的确认信号
        TransitionDecision decision = stageTransition.validateTransition(
                EtpStageEnum.COLLECT_NEED, EtpStageEnum.SUGGEST_REQUIREMENTS, true);
        if (decision.allowed()) {
            session.moveTo(EtpStageEnum.SUGGEST_REQUIREMENTS);
        }
        context.reply = replyService.requirementsSuggested(payload.getIntro(), session.getRequirements());
        context.delta.put("necessity", session.getNecessity());
        context.delta.put("requirements", requirementsDelta(session.getRequirements()));
        context.delta.put("rationale", payload.getRationale());
        context.delta.put("backfilled", payload.isBackfilled());
    }

    private void handleSuggest(EtpSessionEntity session, String text, TurnContext context) {
        session.moveTo(stageTransition.advanceAfterSuggestion(session.getStage()));
        RequirementCommand command = commandInterpreter.interpret(text, session.getRequirements().size());
        if (command.type().isConfirmation()) {
            context.reply = replyService.requirementsReadyToConfirm(session.getRequirements());
            return;
        }
        handleRefine(session, command, context);
    }

    private void handleRefine(EtpSessionEntity session, RequirementCommand command, TurnContext context) {
        switch (command.type()) {
            case CONFIRM:
            case ACCEPT_ALL: {
                TransitionDecision decision = stageTransition.validateTransition(
                        session.getStage(), EtpStageEnum.CONFIRM_REQUIREMENTS, true);
                if (!decision.allowed()) {
                    context.reply = decision.reason();
                    return;
                }
                session.lockRequirements();
                session.moveTo(EtpStageEnum.CONFIRM_REQUIREMENTS);
                context.reply = replyService.requirementsConfirmed(session.getRequirements());
                context.delta.put("requirementsLocked", true);
                return;
            }
            case REMOVE_ONE:
            case KEEP_ONLY:
            case APPEND_ONE:
            case REPLACE_ONE:
                applyCommand(session, command, context);
                return;
            case EDIT:
                if (command.hasPayload()) {
                    applyCommand(session, command, context);
                } else {
                    rewriteAndApply(session, command, context);
                }
                return;
            case REGENERATE_ALL: {
                RequirementsPayload payload = payloadGuard.ensureRequirements(
                        contentGenerationService.regenerateRequirements(session.getNecessity(), session.requirementTexts()),
                        session.getNecessity());
                session.replaceRequirements(requirementsEngine.fromTexts(payload.getRequirements()));
                context.reply = replyService.requirementsSuggested(payload.getIntro(), session.getRequirements());
                context.delta.put("requirements", requirementsDelta(session.getRequirements()));
                return;
            }
            default:
                context.reply = command.message() == null
                        ? RequirementCommandInterpreter.UNCLEAR_MESSAGE : command.message();
                context.requiresClarification = true;
        }
    }

    private void applyCommand(EtpSessionEntity session, RequirementCommand command, TurnContext context) {
        List<RequirementItem> before = session.getRequirements();
        List<RequirementItem> after = requirementsEngine.apply(command, before);
        String description = requirementsEngine.describe(command, before, after);
        session.replaceRequirements(after);
        context.reply = replyService.requirementsUpdated(description, session.getRequirements());
        context.delta.put("command", command.type().getCode());
        context.delta.put("requirements", requirementsDelta(session.getRequirements()));
    }

    private void rewriteAndApply(EtpSessionEntity session, RequirementCommand command, TurnContext context) {
        List<RequirementItem> current = session.getRequirements();
        Integer target = null;
        for (Integer candidate : command.targets()) {
            if (candidate >= 1 && candidate <= current.size()) {
                target = candidate;
                break;
            }
        }
        if (target == null) {
            context.reply = "Não encontrei esse requisito na lista atual (R1 a R" + current.size() + "). Qual você quer ajustar?";
            context.requiresClarification = true;
            return;
        }
        String rewritten = payloadGuard.cleanSingleRequirement(
                contentGenerationService.rewriteRequirement(session.getNecessity(), current.get(target - 1)));
        if (rewritten == null) {
            context.reply = replyService.askRequirementText(target);
            context.requiresClarification = true;
            return;
        }
        applyCommand(session, RequirementCommand.of(CommandTypeEnum.REPLACE_ONE, List.of(target), rewritten), context);
    }

    private void handleConfirmRequirements(EtpSessionEntity session, String text, TurnContext context) {
        RequirementCommand command = commandInterpreter.interpret(text, session.getRequirements().size());
        boolean confirmed = command.type().isConfirmation() || stageTransition.isUserConfirmed(text);
        if (confirmed) {
            TransitionDecision decision = stageTransition.canGenerate(session.getStage(), true);
            if (!decision.allowed()) {
                context.reply = decision.reason();
                return;
            }
            session.moveTo(EtpStageEnum.GENERATE_DOCUMENT);
            String prompt = answerCollection.begin(session);
            context.reply = contentGenerationService.isGeneratorConfigured()
                    ? prompt
                    : EtpReplyDomainService.GENERATOR_UNAVAILABLE_NOTICE + "\n\n" + prompt;
            context.delta.put("answers", session.answersOrEmpty().toSnapshot());
            return;
        }
        if (isEditCommand(command.type())) {
            TransitionDecision decision = stageTransition.validateTransition(
                    session.getStage(), EtpStageEnum.REFINE_REQUIREMENTS, true);
            context.reply = decision.reason() + ". Os requisitos já foram confirmados; "
                    + "para alterá-los, informe uma nova necessidade.";
            return;
        }
        TransitionDecision decision = stageTransition.canGenerate(session.getStage(), false);
        context.reply = decision.reason() + ". Responda \"pode gerar\" para seguir com a elaboração do ETP.";
        context.requiresClarification = true;
    }

    private void handleGenerateDocument(EtpSessionEntity session, String text, TurnContext context) {
        EtpAnswerCollectionDomainService.TopicResult result = answerCollection.handle(session, text);
        context.delta.put("answers", session.answersOrEmpty().toSnapshot());
        if (!result.readyForPreview()) {
            context.reply = result.reply();
            context.requiresClarification = result.requiresClarification();
            return;
        }
        TransitionDecision decision = stageTransition.validateTransition(
                session.getStage(), EtpStageEnum.PREVIEW, true);
        if (!decision.allowed()) {
            context.reply = decision.reason();
            return;
        }
        session.moveTo(EtpStageEnum.PREVIEW);
        context.reply = replyService.preview();
        context.delta.put("sections", sectionsDelta(session));
    }

    private void handlePreview(EtpSessionEntity session, String text, TurnContext context) {
        boolean confirmed = stageTransition.isUserConfirmed(text);
        TransitionDecision decision = stageTransition.validateTransition(
                session.getStage(), EtpStageEnum.FINALIZE, confirmed);
        if (!decision.allowed()) {
            context.reply = replyService.previewAwaitingConfirmation();
            context.requiresClarification = true;
            return;
        }
        session.moveTo(EtpStageEnum.FINALIZE);
        context.reply = replyService.finalized();
        context.delta.put("sections", sectionsDelta(session));
    }

    private boolean isEditCommand(CommandTypeEnum type) {
        return type == CommandTypeEnum.REMOVE_ONE
                || type == CommandTypeEnum.KEEP_ONLY
                || type == CommandTypeEnum.APPEND_ONE
                || type == CommandTypeEnum.REPLACE_ONE
                || type == CommandTypeEnum.EDIT
                || type == CommandTypeEnum.REGENERATE_ALL;
    }

    private List<Map<String, String>> requirementsDelta(List<RequirementItem> items) {
        List<Map<String, String>> result = new ArrayList<>();
        for (RequirementItem item : items) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("id", item.getId());
            entry.put("text", item.getText());
            result.add(entry);
        }
        return result;
    }

    private Map<String, String> sectionsDelta(EtpSessionEntity session) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<DocSectionEnum, String> entry : documentAssembler.assemble(documentAssembler.buildParts(session)).entrySet()) {
            result.put(entry.getKey().getCode(), entry.getValue());
        }
        return result;
    }
}
