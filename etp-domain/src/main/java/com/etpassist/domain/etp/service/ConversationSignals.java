package com.etpassist.domain.etp.service;

import com.etpassist.types.common.TextNormalizer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 对话信号词表：确认、不确定、跳过、显式待定、编号选择。
 * <p>
 * 所有匹配都在 {@link TextNormalizer#normalize(String)} 之后进行，词表即契约，不做语义扩展。
 * </p>
 */
public final class ConversationSignals {

    private static final List<Pattern> CONFIRMATION_PATTERNS = compileWords(
            "ok", "seguir", "prosseguir", "manter", "aceito", "acordado", "concordo", "fechou",
            "pode gerar", "pode seguir", "segue", "confirmo", "confirmado", "confirmar",
            "aprovado", "aprovada", "aprove", "pode prosseguir", "pode continuar",
            "sem alteracoes", "sem ajustes", "manter assim", "esta bom", "ta bom",
            "pode manter", "perfeito", "correto", "certo");

    private static final List<Pattern> UNCERTAINTY_PATTERNS = compile(
            "nao\\s+sei",
            "\\bn\\s+sei\\b",
            "\\bns\\b",
            "desconheco",
            "nao\\s+tenho\\s+(certeza|ideia|nocao)",
            "sem\\s+(nocao|ideia|base)",
            "dificil\\s+estimar",
            "nao\\s+faco\\s+ideia",
            "por\\s+enquanto\\s+nada",
            "nao\\s+tenho\\s+isso");

    private static final List<Pattern> SKIP_PATTERNS = compile(
            "\\bpular\\b",
            "\\bpule\\b",
            "deixar\\s+para\\s+depois",
            "sem\\s+informacao",
            "nao\\s+informado");

    private static final List<Pattern> PENDING_PATTERNS = compile(
            "(pode\\s+)?deixar\\s+pendente",
            "aceito?\\s+pendente",
            "registr(e|ar)\\s+(como\\s+)?pendente",
            "marqu(e|ar)\\s+(como\\s+)?pendente",
            "fica\\s+pendente",
            "deixa\\s+pendente");

    private static final Pattern VAGUE_ACK = Pattern.compile(
            "^(ok(ay)?|vamos|pode\\s+(seguir|continuar)|segue|blz|beleza|ta\\s+bom|certo|uai|partiu|entendido|perfeito|manda)\\s*[.!]*$");

    private static final Pattern SINGLE_DIGIT = Pattern.compile("^\\s*([1-9])\\s*[.)]?\\s*$");

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private ConversationSignals() {
    }

    /**
     * 用户是否显式确认（整词匹配，大小写与重音不敏感）。
     */
    public static boolean isConfirmation(String text) {
        return matchesAny(TextNormalizer.normalize(text), CONFIRMATION_PATTERNS);
    }

    /**
     * 用户是否表达“不知道”。
     */
    public static boolean isUncertain(String text) {
        return matchesAny(TextNormalizer.normalize(text), UNCERTAINTY_PATTERNS);
    }

    /**
     * 用户是否要求跳过当前问题。
     */
    public static boolean isSkip(String text) {
        return matchesAny(TextNormalizer.normalize(text), SKIP_PATTERNS);
    }

    public static boolean isUncertainOrSkip(String text) {
        return isUncertain(text) || isSkip(text);
    }

    /**
     * 用户是否显式要求标记为待定。
     */
    public static boolean isExplicitPendingRequest(String text) {
        return matchesAny(TextNormalizer.normalize(text), PENDING_PATTERNS);
    }

    /**
     * 模糊应答（ok / beleza / pode seguir），不应被当作数据保存。
     */
    public static boolean isVagueAck(String text) {
        String normalized = TextNormalizer.normalize(text);
        return !normalized.isEmpty() && VAGUE_ACK.matcher(normalized).matches();
    }

    /**
     * 单个数字选择（1-9），否则返回 null。
     */
    public static Integer selectNumber(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = SINGLE_DIGIT.matcher(text);
        return matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * 按名称匹配候选标题：先子串包含，再按词集合 Jaccard 相似度（≥0.4）。
     *
     * @return 0 基下标，未匹配返回 -1
     */
    public static int selectByName(String text, List<String> titles) {
        String input = TextNormalizer.normalize(text);
        if (input.isEmpty() || titles == null || titles.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < titles.size(); i++) {
            String title = TextNormalizer.normalize(titles.get(i));
            if (title.isEmpty()) {
                continue;
            }
            if (title.contains(input) || input.contains(title)) {
                return i;
            }
        }
        Set<String> inputWords = words(input);
        if (inputWords.isEmpty()) {
            return -1;
        }
        double bestScore = 0D;
        int bestIndex = -1;
        for (int i = 0; i < titles.size(); i++) {
            Set<String> titleWords = words(TextNormalizer.normalize(titles.get(i)));
            if (titleWords.isEmpty()) {
                continue;
            }
            Set<String> intersection = new HashSet<>(inputWords);
            intersection.retainAll(titleWords);
            Set<String> union = new HashSet<>(inputWords);
            union.addAll(titleWords);
            double score = (double) intersection.size() / union.size();
            if (score > bestScore) {
                bestScore = score;
                bestIndex = i;
            }
        }
        return bestScore >= 0.4D ? bestIndex : -1;
    }

    private static Set<String> words(String normalized) {
        Set<String> result = new HashSet<>();
        Matcher matcher = WORD.matcher(normalized);
        while (matcher.find()) {
            result.add(matcher.group());
        }
        return result;
    }

    private static boolean matchesAny(String normalized, List<Pattern> patterns) {
        if (normalized == null || normalized.isEmpty()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileWords(String... phrases) {
        Pattern[] patterns = new Pattern[phrases.length];
        for (int i = 0; i < phrases.length; i++) {
            patterns[i] = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrases[i]) + "(?![\\p{L}\\p{N}])");
        }
        return List.of(patterns);
    }

    private static List<Pattern> compile(String... regexes) {
        Pattern[] patterns = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            patterns[i] = Pattern.compile(regexes[i]);
        }
        return List.of(patterns);
    }
}
