package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.valobj.EtpAnswers;
import com.etpassist.domain.etp.model.valobj.StageIntent;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.types.common.TextNormalizer;
import com.etpassist.types.enums.AnswerIntentEnum;
import com.etpassist.types.enums.AnswerTopicEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * generate_document 阶段的答案解析器集合。
 * <p>
 * 每个子游标对应一个纯函数（文本 + 当前答案 → {@link StageIntent}），通过查找表分发。
 * 不确定信号总是先于否定信号判断；关键词表按字面执行。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-12
 */
@Service
public class AnswerInterpreterDomainService {

    private static final Pattern URL = Pattern.compile("https?://[^\\s,;]+");
    private static final Pattern SUPPLIER_WORD = Pattern.compile("\\b(fornecedor|fornecedores|empresa|empresas|cotacoes|orcamentos)\\b");
    private static final Pattern SMALL_NUMBER = Pattern.compile("\\b(\\d{1,3})\\b");

    private static final Pattern QUANTITY_WITH_UNIT = Pattern.compile(
            "\\b(\\d+)\\s*(unidades|unidade|itens|item|aeronaves|aeronave|servidores|servidor|equipamentos|equipamento"
                    + "|licencas|licenca|usuarios|usuario|veiculos|veiculo|postos|posto)\\b");
    private static final Pattern BARE_INTEGER = Pattern.compile("\\b(\\d+)\\b");
    private static final Pattern CURRENCY_VALUE = Pattern.compile(
            "r\\$\\s*(\\d+(?:[.,]\\d+)*)\\s*(mil|milhao|milhoes|mi|k)?\\b");
    private static final Pattern SCALED_VALUE = Pattern.compile(
            "\\b(\\d+(?:[.,]\\d+)?)\\s*(mil|milhao|milhoes|mi|k)\\b");
    private static final Pattern THOUSANDS_GROUPED = Pattern.compile("\\d{1,3}(\\.\\d{3})+(,\\d+)?");
    private static final Pattern ANY_DIGIT = Pattern.compile("\\d");

    private final Map<AnswerTopicEnum, BiFunction<String, EtpAnswers, StageIntent>> interpreters =
            new EnumMap<>(AnswerTopicEnum.class);

    public AnswerInterpreterDomainService() {
        interpreters.put(AnswerTopicEnum.SOLUTION_STRATEGY, this::interpretStrategy);
        interpreters.put(AnswerTopicEnum.PCA, (text, answers) -> interpretPca(text));
        interpreters.put(AnswerTopicEnum.PRICE_RESEARCH, (text, answers) -> interpretPriceResearch(text));
        interpreters.put(AnswerTopicEnum.LEGAL_BASIS, (text, answers) -> interpretLegalBasis(text));
        interpreters.put(AnswerTopicEnum.QUANTITY_VALUE, (text, answers) -> interpretQuantityValue(text));
        interpreters.put(AnswerTopicEnum.INSTALLMENT, (text, answers) -> interpretInstallment(text));
        interpreters.put(AnswerTopicEnum.SUMMARY, (text, answers) -> interpretSummary(text));
    }

    public StageIntent interpret(AnswerTopicEnum topic, String text, EtpAnswers answers) {
        BiFunction<String, EtpAnswers, StageIntent> interpreter = interpreters.get(topic);
        if (interpreter == null) {
            return StageIntent.of(AnswerIntentEnum.UNCLEAR, "Não entendi. Pode reformular?");
        }
        return interpreter.apply(text, answers == null ? new EtpAnswers() : answers);
    }

    public StageIntent interpretStrategy(String text, EtpAnswers answers) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isUncertainOrSkip(n)) {
            return StageIntent.of(AnswerIntentEnum.UNCERTAIN, null);
        }
        List<StrategyOption> offered = answers.getOfferedStrategies() == null ? List.of() : answers.getOfferedStrategies();

        Integer number = ConversationSignals.selectNumber(text);
        if (number != null) {
            if (number <= offered.size()) {
                return selectStrategy(offered.get(number - 1));
            }
            return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                    "Não encontrei a opção " + number + ". Escolha um número entre 1 e " + offered.size() + ".");
        }

        List<String> titles = new ArrayList<>();
        for (StrategyOption option : offered) {
            titles.add(option.getTitle());
        }
        int byName = ConversationSignals.selectByName(text, titles);
        if (byName >= 0) {
            return selectStrategy(offered.get(byName));
        }

        if (TextNormalizer.containsAny(n, "recomende", "recomenda", "sugira", "sugestao")) {
            return StageIntent.of(AnswerIntentEnum.REQUEST_RECOMMENDATION, null);
        }
        if (TextNormalizer.containsAny(n, "compra", "comprar", "aquisicao")) {
            return choosePath("compra");
        }
        if (TextNormalizer.containsAny(n, "locacao", "aluguel", "alugar", "locar")) {
            return choosePath("locacao");
        }
        if (TextNormalizer.containsAny(n, "servico", "terceirizar", "terceirizado", "gestao")) {
            return choosePath("servico");
        }
        if (TextNormalizer.containsAny(n, "comparar", "comparacao", "compare")) {
            return choosePath("comparar");
        }
        if (ConversationSignals.isConfirmation(n)) {
            return StageIntent.of(AnswerIntentEnum.CONFIRM, null);
        }
        return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                "Não identifiquei a estratégia. Responda com o número da opção, o nome dela ou peça uma recomendação.");
    }

    public StageIntent interpretPca(String text) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isUncertainOrSkip(n)
                || TextNormalizer.containsAnyWord(n, "nao sei", "desconheco", "incerto", "nao tenho")) {
            return StageIntent.of(AnswerIntentEnum.PCA_UNKNOWN, null);
        }
        boolean hasDetails = hasPcaDetailMarkers(n);
        if (TextNormalizer.containsAny(n, "nao esta no pca", "sem pca")
                || (TextNormalizer.containsAnyWord(n, "nao") && n.contains("pca") && !n.contains("nao sei"))) {
            return StageIntent.of(AnswerIntentEnum.PCA_NO, "Registrado: a contratação não está prevista no PCA.",
                    statusPayload("nao", hasDetails ? trimmed(text) : null));
        }
        boolean affirmative = TextNormalizer.containsAnyWord(n, "sim")
                || TextNormalizer.containsAny(n, "esta no pca", "previsto no pca", "conforme pca");
        if (affirmative && !hasDetails) {
            return StageIntent.of(AnswerIntentEnum.PCA_YES, "Registrado: a contratação está prevista no PCA.",
                    statusPayload("sim", null));
        }
        if (hasDetails) {
            return StageIntent.of(AnswerIntentEnum.PCA_DETAILS, "Registrei os detalhes do PCA.",
                    statusPayload("sim", trimmed(text)));
        }
        if (TextNormalizer.containsAnyWord(n, "seguir", "prosseguir", "pode continuar", "avancar")) {
            return StageIntent.of(AnswerIntentEnum.PROCEED_NEXT, null);
        }
        return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                "Não entendi sua resposta sobre o PCA. A contratação está prevista no Plano de Contratações Anual? "
                        + "Responda sim, não ou não sei.");
    }

    public StageIntent interpretPriceResearch(String text) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isUncertainOrSkip(n)) {
            return StageIntent.of(AnswerIntentEnum.UNCERTAIN, null);
        }
        if (SUPPLIER_WORD.matcher(n).find()) {
            Matcher number = SMALL_NUMBER.matcher(n);
            if (number.find()) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("supplierCount", Integer.valueOf(number.group(1)));
                String method = priceMethod(n);
                if (method != null) {
                    payload.put("method", method);
                }
                return StageIntent.of(AnswerIntentEnum.SUPPLIER_COUNT,
                        "Registrei " + number.group(1) + " fornecedor(es) consultado(s).", payload);
            }
        }
        Matcher url = URL.matcher(text == null ? "" : text);
        List<String> links = new ArrayList<>();
        while (url.find()) {
            links.add(url.group());
        }
        if (!links.isEmpty()) {
            return StageIntent.of(AnswerIntentEnum.LINK_EVIDENCE,
                    "Registrei " + links.size() + " link(s) de evidência.", Map.of("links", links));
        }
        String method = priceMethod(n);
        if (method != null) {
            return StageIntent.of(AnswerIntentEnum.METHOD_SELECT, "Método de pesquisa registrado: " + method + ".",
                    Map.of("method", method));
        }
        if (TextNormalizer.containsAnyWord(n, "concluido", "finalizei", "pronto", "seguir", "prosseguir")) {
            return StageIntent.of(AnswerIntentEnum.MARK_DONE, null);
        }
        return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                "Não entendi sua resposta sobre a pesquisa de preços. Informe o método (Painel de Preços, cotações, "
                        + "histórico ou marketplace), o número de fornecedores ou links, ou diga \"concluído\".");
    }

    public StageIntent interpretLegalBasis(String text) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isUncertainOrSkip(n)) {
            return StageIntent.of(AnswerIntentEnum.UNCERTAIN, null);
        }
        if (TextNormalizer.containsAnyWord(n, "lei", "artigo", "inciso", "decreto", "portaria", "estatuto")
                || n.contains("art.")) {
            return StageIntent.of(AnswerIntentEnum.LEGAL_BASIS_SET, "Base legal registrada.",
                    Map.of("text", trimmed(text)));
        }
        if (TextNormalizer.containsAnyWord(n, "observacao", "nota", "comentario")) {
            return StageIntent.of(AnswerIntentEnum.LEGAL_BASIS_NOTES, "Observação registrada.",
                    Map.of("notes", trimmed(text)));
        }
        if (TextNormalizer.containsAnyWord(n, "finalizar", "encerrar", "concluido", "seguir")) {
            return StageIntent.of(AnswerIntentEnum.FINALIZE, null);
        }
        if (ConversationSignals.isConfirmation(n)) {
            return StageIntent.of(AnswerIntentEnum.CONFIRM, null);
        }
        return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                "Não entendi sua informação sobre base legal. Informe a norma (ex.: \"Lei 14.133/2021, art. 18\"), "
                        + "uma observação, ou diga \"seguir\" para avançar.");
    }

    public StageIntent interpretQuantityValue(String text) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isUncertainOrSkip(n)) {
            return StageIntent.of(AnswerIntentEnum.UNCERTAIN, null);
        }
        Map<String, Object> payload = new LinkedHashMap<>();

        Matcher currency = CURRENCY_VALUE.matcher(n);
        Matcher scaled = SCALED_VALUE.matcher(n);
        int valueStart = -1;
        int valueEnd = -1;
        BigDecimal value = null;
        if (currency.find()) {
            value = parseAmount(currency.group(1), currency.group(2));
            valueStart = currency.start();
            valueEnd = currency.end();
        } else if (scaled.find()) {
            value = parseAmount(scaled.group(1), scaled.group(2));
            valueStart = scaled.start();
            valueEnd = scaled.end();
        }
        if (value != null) {
            payload.put("value", value);
        }

        Matcher quantity = QUANTITY_WITH_UNIT.matcher(n);
        if (quantity.find()) {
            if (quantity.group(1).length() <= 9) {
                payload.put("quantity", Integer.valueOf(quantity.group(1)));
            }
            payload.put("unit", quantity.group(2));
        } else {
            Matcher bare = BARE_INTEGER.matcher(n);
            while (bare.find()) {
                if (bare.start() >= valueStart && bare.end() <= valueEnd) {
                    continue;
                }
                if (bare.group(1).length() <= 9) {
                    payload.put("quantity", Integer.valueOf(bare.group(1)));
                }
                break;
            }
        }

        if (TextNormalizer.containsAnyWord(n, "ano", "anual", "anuais") || n.contains("/ano")) {
            payload.put("period", "ano");
        } else if (TextNormalizer.containsAnyWord(n, "mes", "mensal", "mensais") || n.contains("/mes")) {
            payload.put("period", "mes");
        }

        if (payload.isEmpty()) {
            if (ConversationSignals.isConfirmation(n) || ConversationSignals.isVagueAck(n)) {
                return StageIntent.of(AnswerIntentEnum.CONFIRM, null);
            }
            if (n.isEmpty() || ANY_DIGIT.matcher(n).find()) {
                return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                        "Não consegui identificar quantidade ou valor. Ex.: \"20 unidades, R$ 500 mil por ano\".");
            }
        }
        payload.put("description", trimmed(text));
        return StageIntent.of(AnswerIntentEnum.QUANTITY_VALUE, "Quantitativo e valor registrados.", payload);
    }

    public StageIntent interpretInstallment(String text) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isUncertainOrSkip(n)) {
            return StageIntent.of(AnswerIntentEnum.UNCERTAIN, null);
        }
        // 动词前的显式否定（não haverá）优先于肯定词
        if (TextNormalizer.containsAny(n, "nao havera", "nao tera", "nao sera", "sem parcelamento")) {
            return StageIntent.of(AnswerIntentEnum.INSTALLMENT_NO, "Registrado: contratação única, sem parcelamento.",
                    Map.of("decision", "nao", "text", trimmed(text)));
        }
        if (TextNormalizer.containsAnyWord(n, "sim", "havera", "tera", "sera")) {
            return StageIntent.of(AnswerIntentEnum.INSTALLMENT_YES, "Registrado: haverá parcelamento.",
                    Map.of("decision", "sim", "text", trimmed(text)));
        }
        if (TextNormalizer.containsAnyWord(n, "nao")) {
            return StageIntent.of(AnswerIntentEnum.INSTALLMENT_NO, "Registrado: contratação única, sem parcelamento.",
                    Map.of("decision", "nao", "text", trimmed(text)));
        }
        if (TextNormalizer.containsAnyWord(n, "lote", "lotes", "fase", "fases", "regiao", "regioes", "etapa", "etapas")) {
            return StageIntent.of(AnswerIntentEnum.INSTALLMENT_YES, "Registrado: parcelamento por lotes/fases.",
                    Map.of("decision", "sim", "text", trimmed(text)));
        }
        return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                "Não entendi sobre o parcelamento. Vai dividir em lotes/fases (sim) ou será contratação única (não)?");
    }

    public StageIntent interpretSummary(String text) {
        String n = TextNormalizer.normalize(text);
        if (ConversationSignals.isConfirmation(n) || TextNormalizer.containsAnyWord(n, "gerar", "gere")) {
            return StageIntent.of(AnswerIntentEnum.CONFIRM, null);
        }
        if (TextNormalizer.containsAnyWord(n, "mudar", "alterar", "trocar", "ajustar", "corrigir")) {
            return StageIntent.of(AnswerIntentEnum.SUMMARY_ADJUST, null, Map.of("text", trimmed(text)));
        }
        return StageIntent.of(AnswerIntentEnum.UNCLEAR,
                "Não entendi. Posso gerar a prévia com este resumo ou você quer ajustar algo (ex.: \"ajustar a estratégia\")?");
    }

    private String trimmed(String text) {
        return text == null ? "" : text.trim();
    }

    private StageIntent selectStrategy(StrategyOption option) {
        return StageIntent.of(AnswerIntentEnum.SELECT_STRATEGY, "Estratégia escolhida: " + option.getTitle() + ".",
                Map.of("title", option.getTitle()));
    }

    private StageIntent choosePath(String path) {
        return StageIntent.of(AnswerIntentEnum.CHOOSE_PATH, null, Map.of("path", path));
    }

    private boolean hasPcaDetailMarkers(String n) {
        return n.contains("nº") || n.contains("no.")
                || TextNormalizer.containsAnyWord(n, "numero", "ano", "item", "itens", "capitulo", "secao");
    }

    private Map<String, Object> statusPayload(String status, String detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        if (detail != null) {
            payload.put("detail", detail);
        }
        return payload;
    }

    private String priceMethod(String n) {
        List<String> methods = new ArrayList<>();
        if (TextNormalizer.containsAny(n, "painel de precos", "painel")) {
            methods.add("painel_de_precos");
        }
        if (TextNormalizer.containsAny(n, "cotacao", "cotacoes", "fornecedor")) {
            methods.add("cotacoes_fornecedores");
        }
        if (TextNormalizer.containsAny(n, "historico", "pregao anterior")) {
            methods.add("historico_contratos");
        }
        if (n.contains("marketplace")) {
            methods.add("marketplace");
        }
        return methods.isEmpty() ? null : String.join(",", methods);
    }

    private BigDecimal parseAmount(String digits, String scale) {
        String plain;
        if (THOUSANDS_GROUPED.matcher(digits).matches()) {
            plain = digits.replace(".", "").replace(',', '.');
        } else {
            plain = digits.replace(',', '.');
            int firstDot = plain.indexOf('.');
            if (firstDot >= 0 && plain.indexOf('.', firstDot + 1) >= 0) {
                plain = plain.replace(".", "");
            }
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(plain);
        } catch (NumberFormatException ex) {
            return null;
        }
        if (scale == null) {
            return amount;
        }
        switch (scale) {
            case "mil":
            case "k":
                return amount.multiply(BigDecimal.valueOf(1_000L));
            default:
                return amount.multiply(BigDecimal.valueOf(1_000_000L));
        }
    }
}
