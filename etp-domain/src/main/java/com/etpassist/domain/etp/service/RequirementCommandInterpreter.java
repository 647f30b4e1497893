package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.valobj.RequirementCommand;
import com.etpassist.types.common.TextNormalizer;
import com.etpassist.types.enums.CommandTypeEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 需求编辑命令解析器。
 * <p>
 * 级联规则自上而下，首个命中即返回：重启需求 → 删除 → 仅保留 → 编辑 → 追加 → 重新生成 → 确认 → 澄清。
 * 目标位置只在负载分隔符（冒号或 para/por/com）之前的文本中提取，避免把新文本里的数字当作目标。
 * 解析永不抛异常，无法识别时返回带具体澄清问题的 UNCLEAR。
 * </p>
 */
@Service
public class RequirementCommandInterpreter {

    public static final String UNCLEAR_MESSAGE = "Não compreendi o comando. Você quer confirmar os requisitos atuais, "
            + "fazer alguma alteração, ou tem alguma dúvida sobre eles? "
            + "Exemplos: \"remover 3\", \"ajustar o último\", \"manter só 1 e 2\"";

    private static final List<Pattern> RESTART_PATTERNS = List.of(
            Pattern.compile("nova\\s*necessidade"),
            Pattern.compile("trocar\\s*a\\s*necessidade"),
            Pattern.compile("na\\s*verdade\\s*a\\s*necessidade\\s*e"),
            Pattern.compile("mudou\\s*a\\s*necessidade"),
            Pattern.compile("preciso\\s*trocar\\s*a\\s*necessidade"));

    private static final Pattern REMOVE_VERBS = Pattern.compile(
            "\\b(remover|remova|remove|tirar|tire|excluir|exclua|deletar|delete|retirar|retire|apagar|apague)\\b");

    private static final Pattern KEEP_ONLY_PHRASES = Pattern.compile(
            "\\b(manter\\s+apenas|mantenha\\s+apenas|so\\s+manter|manter\\s+so|manter\\s+somente|deixar\\s+apenas|deixar\\s+so)\\b");

    private static final Pattern EDIT_VERBS = Pattern.compile(
            "\\b(alterar|altere|modificar|modifique|trocar|troque|mudar|mude|editar|edite|ajustar|ajuste|substituir|substitua|melhorar|melhore|reescrever|reescreva)\\b");

    private static final Pattern ADD_VERBS = Pattern.compile(
            "\\b(adicionar|adicione|incluir|inclua|acrescentar|acrescente|novo\\s+requisito|mais\\s+um)\\b");

    private static final Pattern REGENERATE_PHRASES = Pattern.compile(
            "\\b(refaz\\s+tudo|refazer\\s+tudo|refaca\\s+tudo|gera\\s+tudo\\s+de\\s+novo|gerar\\s+tudo\\s+de\\s+novo"
                    + "|gerar\\s+novamente|gere\\s+novamente|regerar|refazer\\s+os\\s+requisitos)\\b");

    private static final Pattern ALL_WORDS = Pattern.compile("\\b(todos|tudo)\\b");

    private static final Pattern PAYLOAD_WORD_SEPARATOR = Pattern.compile("\\s(para|por|com)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern R_TARGET = Pattern.compile("\\br\\s?(\\d+)\\b");
    private static final Pattern RANGE_TARGET = Pattern.compile("\\b(\\d+)\\s*(?:-|a|ate)\\s*(\\d+)\\b");
    private static final Pattern NUMBER_TARGET = Pattern.compile("\\b(\\d+)\\b");
    private static final Pattern LAST = Pattern.compile("\\bultim[oa]\\b");
    private static final Pattern FIRST = Pattern.compile("\\bprimeir[oa]\\b");
    private static final Pattern PENULTIMATE = Pattern.compile("\\bpenultim[oa]\\b");

    private static final Pattern APPEND_LEADING_NOISE = Pattern.compile(
            "^\\s*[:\\-]?\\s*(?:(?:um|uma)\\s+)?(?:(?:novo|nova)\\s+)?(?:requisito\\s*)?(?:(?:sobre|de|que)\\s+)?[:\\-]?\\s*",
            Pattern.CASE_INSENSITIVE);

    /**
     * 解析用户消息。
     *
     * @param text 原始用户消息
     * @param currentSize 当前需求条数，用于解析序数与范围
     * @return 命令，永不为 null
     */
    public RequirementCommand interpret(String text, int currentSize) {
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return RequirementCommand.unclear(UNCLEAR_MESSAGE);
        }

        for (Pattern pattern : RESTART_PATTERNS) {
            if (pattern.matcher(normalized).find()) {
                return RequirementCommand.of(CommandTypeEnum.RESTART_NECESSITY, List.of(), textAfterColon(text));
            }
        }

        List<Integer> targets = extractTargets(targetScope(normalized), currentSize);

        if (REMOVE_VERBS.matcher(normalized).find()) {
            if (targets.isEmpty()) {
                return RequirementCommand.unclear("Qual requisito você quer remover? Informe o número (ex.: \"remover 3\" ou \"remover R2\").");
            }
            return RequirementCommand.of(CommandTypeEnum.REMOVE_ONE, targets, null);
        }

        if (KEEP_ONLY_PHRASES.matcher(normalized).find()) {
            if (targets.isEmpty()) {
                return RequirementCommand.unclear("Quais requisitos você quer manter? Informe os números (ex.: \"manter só 1 e 2\").");
            }
            return RequirementCommand.of(CommandTypeEnum.KEEP_ONLY, targets, null);
        }

        if (EDIT_VERBS.matcher(normalized).find()) {
            if (targets.isEmpty()) {
                return RequirementCommand.unclear("Qual requisito você quer ajustar? Informe o número e, se quiser, o novo texto "
                        + "(ex.: \"ajustar 2: novo texto\").");
            }
            return RequirementCommand.of(CommandTypeEnum.EDIT, targets, editPayload(text));
        }

        Matcher addMatcher = ADD_VERBS.matcher(normalized);
        if (addMatcher.find()) {
            return RequirementCommand.of(CommandTypeEnum.APPEND_ONE, List.of(), appendPayload(text, normalized, addMatcher.end()));
        }

        if (REGENERATE_PHRASES.matcher(normalized).find()) {
            return RequirementCommand.of(CommandTypeEnum.REGENERATE_ALL, List.of(), null);
        }

        if (ConversationSignals.isConfirmation(normalized)) {
            CommandTypeEnum type = ALL_WORDS.matcher(normalized).find() ? CommandTypeEnum.ACCEPT_ALL : CommandTypeEnum.CONFIRM;
            return RequirementCommand.of(type, List.of(), null);
        }

        return RequirementCommand.unclear(UNCLEAR_MESSAGE);
    }

    /**
     * 从文本中提取 1 基目标位置，升序去重。R&lt;n&gt; 形式即使越界也保留，由引擎决定是否忽略。
     */
    List<Integer> extractTargets(String scope, int currentSize) {
        TreeSet<Integer> targets = new TreeSet<>();
        String remaining = scope;

        Matcher rMatcher = R_TARGET.matcher(remaining);
        while (rMatcher.find()) {
            int value = parseIntSafely(rMatcher.group(1));
            if (value > 0) {
                targets.add(value);
            }
        }
        remaining = R_TARGET.matcher(remaining).replaceAll(" ");

        Matcher rangeMatcher = RANGE_TARGET.matcher(remaining);
        while (rangeMatcher.find()) {
            int from = parseIntSafely(rangeMatcher.group(1));
            int to = parseIntSafely(rangeMatcher.group(2));
            if (from > to) {
                int swap = from;
                from = to;
                to = swap;
            }
            for (int i = Math.max(from, 1); i <= Math.min(to, currentSize); i++) {
                targets.add(i);
            }
        }
        remaining = RANGE_TARGET.matcher(remaining).replaceAll(" ");

        Matcher numberMatcher = NUMBER_TARGET.matcher(remaining);
        while (numberMatcher.find()) {
            int value = parseIntSafely(numberMatcher.group(1));
            if (value >= 1 && value <= currentSize) {
                targets.add(value);
            }
        }

        if (currentSize > 0) {
            if (PENULTIMATE.matcher(scope).find() && currentSize >= 2) {
                targets.add(currentSize - 1);
            }
            if (LAST.matcher(scope).find()) {
                targets.add(currentSize);
            }
            if (FIRST.matcher(scope).find()) {
                targets.add(1);
            }
        }
        return new ArrayList<>(targets);
    }

    private String targetScope(String normalized) {
        int colon = normalized.indexOf(':');
        String scope = colon >= 0 ? normalized.substring(0, colon) : normalized;
        Matcher separator = PAYLOAD_WORD_SEPARATOR.matcher(scope);
        if (separator.find()) {
            scope = scope.substring(0, separator.start());
        }
        return scope;
    }

    private String editPayload(String original) {
        String afterColon = textAfterColon(original);
        if (afterColon != null) {
            return afterColon;
        }
        Matcher separator = PAYLOAD_WORD_SEPARATOR.matcher(original);
        if (separator.find()) {
            return trimToNull(original.substring(separator.end()));
        }
        return null;
    }

    private String appendPayload(String original, String normalized, int verbEnd) {
        String afterColon = textAfterColon(original);
        if (afterColon != null) {
            return afterColon;
        }
        // 归一化只改变大小写和重音，折叠空白后位置可能偏移，因此在原文中按归一化长度定位
        String collapsed = original.trim().replaceAll("\\s+", " ");
        if (collapsed.length() != normalized.length()) {
            return null;
        }
        String tail = collapsed.substring(verbEnd);
        String cleaned = APPEND_LEADING_NOISE.matcher(tail).replaceFirst("");
        return trimToNull(cleaned);
    }

    private String textAfterColon(String original) {
        if (original == null) {
            return null;
        }
        int colon = original.indexOf(':');
        if (colon < 0) {
            return null;
        }
        return trimToNull(original.substring(colon + 1));
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private int parseIntSafely(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
