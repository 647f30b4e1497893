package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.valobj.RequirementsPayload;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.types.common.Constants;
import com.etpassist.types.common.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 生成结果守卫：清洗、校验并在不足时用确定性模板回填，保证对话永远不会因生成器失败而中断。
 * <p>
 * 解析后的 JSON 只读取预期的键，其余键一律忽略。
 * </p>
 *
 * @author etpassist
 * @since 2025-03-14
 */
@Service
public class ResponsePayloadGuardDomainService {

    public static final String EMPTY_TEXT_FALLBACK = "Para não te deixar sem base, segue uma síntese e próximos passos temporários. "
            + "Se preferir, me diga e eu detalho mais ou ajusto a direção.";

    private static final String DEFAULT_RATIONALE = "Os requisitos priorizam conformidade regulatória, segurança operacional, "
            + "disponibilidade contratual e mensuração por indicadores objetivos.";

    private static final Pattern COMMAND_PATTERN = Pattern.compile("(?i)\\b(adicionar:|remover:|editar:)");
    private static final Pattern NUMBERING_PREFIX = Pattern.compile("^\\s*(?:[-*•]\\s+)?(?:R?\\d+\\s*[.)\\-–—:]+\\s*)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String[] BLOCKED_TITLES = {"justificativa", "nota tecnica"};
    private static final String[] ONBOARDING_FILLER = {"vamos comecar", "posso seguir", "ola", "bem-vindo", "bem vindo"};

    /**
     * 清洗需求列表并保证至少 {@link Constants#MIN_REQUIREMENTS} 条，同时补齐 intro 与 rationale。
     */
    public RequirementsPayload ensureRequirements(RequirementsPayload raw, String necessity) {
        List<String> cleaned = cleanRequirementLines(raw == null ? null : raw.getRequirements());
        boolean backfilled = false;
        if (cleaned.size() < Constants.MIN_REQUIREMENTS) {
            cleaned = fallbackRequirements(necessity);
            backfilled = true;
        }
        String intro = sanitizeText(raw == null ? null : raw.getIntro());
        if (intro.isEmpty() || isOnboarding(TextNormalizer.normalize(intro))) {
            intro = "Entendi sua necessidade: " + truncate(necessity, 80)
                    + ". Vou propor requisitos objetivos e verificáveis alinhados a segurança, disponibilidade e conformidade.";
        }
        String rationale = sanitizeText(raw == null ? null : raw.getRationale());
        if (rationale.isEmpty()) {
            rationale = DEFAULT_RATIONALE;
        }
        return RequirementsPayload.builder()
                .intro(intro)
                .requirements(cleaned)
                .rationale(rationale)
                .backfilled(backfilled || (raw != null && raw.isBackfilled()))
                .build();
    }

    /**
     * 过滤无效策略（缺标题、缺优势或缺风险），不足两条时回填四个模板。
     */
    public List<StrategyOption> ensureStrategies(List<StrategyOption> raw, String necessity) {
        List<StrategyOption> valid = new ArrayList<>();
        if (raw != null) {
            for (StrategyOption option : raw) {
                if (isValidStrategy(option)) {
                    valid.add(option);
                }
            }
        }
        if (valid.size() < Constants.MIN_STRATEGIES) {
            return fallbackStrategies(necessity);
        }
        return valid;
    }

    /**
     * 清洗自由文本：去掉命令模式并折叠多余空行。
     */
    public String sanitizeText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = COMMAND_PATTERN.matcher(text).replaceAll("");
        cleaned = cleaned.replaceAll("[ \\t]+", " ").replaceAll("\\n{3,}", "\n\n");
        return cleaned.trim();
    }

    public String ensureNonEmpty(String text) {
        String cleaned = sanitizeText(text);
        return cleaned.isEmpty() ? EMPTY_TEXT_FALLBACK : cleaned;
    }

    public String ensureSummary(String summary, String necessity) {
        String cleaned = sanitizeText(summary);
        if (!cleaned.isEmpty()) {
            return cleaned;
        }
        String base = necessity == null || necessity.trim().isEmpty() ? Constants.NOT_INFORMED : necessity.trim();
        return "Necessidade: " + base + "\n\nRequisitos e estratégias consolidados estão em elaboração.";
    }

    /**
     * 单条需求改写结果：清洗后的单行文本，无效时返回 null。
     */
    public String cleanSingleRequirement(String text) {
        if (text == null) {
            return null;
        }
        for (String line : text.split("\\r?\\n")) {
            String cleaned = cleanLine(line);
            if (cleaned != null) {
                return cleaned;
            }
        }
        return null;
    }

    /**
     * 从解析后的 JSON 中读取需求载荷，仅识别 requisitos/requirements、intro、rationale/justification。
     */
    public RequirementsPayload extractRequirementsPayload(Map<String, Object> json) {
        if (json == null) {
            return null;
        }
        Object list = firstPresent(json, "requisitos", "requirements");
        List<String> requirements = new ArrayList<>();
        if (list instanceof Collection<?> collection) {
            for (Object element : collection) {
                String text = requirementText(element);
                if (text != null) {
                    requirements.add(text);
                }
            }
        }
        return RequirementsPayload.builder()
                .intro(asText(json.get("intro")))
                .requirements(requirements)
                .rationale(asText(firstPresent(json, "rationale", "justification")))
                .build();
    }

    /**
     * 从解析后的 JSON 中读取策略列表，仅识别 estrategias/strategies 下的标题、适用场景、优势与风险。
     */
    public List<StrategyOption> extractStrategies(Map<String, Object> json) {
        List<StrategyOption> strategies = new ArrayList<>();
        if (json == null) {
            return strategies;
        }
        Object list = firstPresent(json, "estrategias", "strategies");
        if (!(list instanceof Collection<?> collection)) {
            return strategies;
        }
        for (Object element : collection) {
            if (!(element instanceof Map<?, ?> map)) {
                continue;
            }
            strategies.add(StrategyOption.builder()
                    .title(asText(firstPresent(map, "titulo", "title", "name")))
                    .whenIndicated(asText(firstPresent(map, "quando_indicado", "when_indicated", "when")))
                    .advantages(asTextList(firstPresent(map, "vantagens", "advantages", "pros")))
                    .risks(asTextList(firstPresent(map, "riscos", "risks", "cons")))
                    .build());
        }
        return strategies;
    }

    /**
     * 从解析后的 JSON 中读取执行摘要，仅识别 executive_summary/resumo_executivo。
     */
    public String extractSummary(Map<String, Object> json) {
        if (json == null) {
            return null;
        }
        return asText(firstPresent(json, "executive_summary", "resumo_executivo"));
    }

    /**
     * 从解析后的 JSON 中读取单条需求改写结果，仅识别 requirement/requisito。
     */
    public String extractRewrite(Map<String, Object> json) {
        if (json == null) {
            return null;
        }
        return cleanSingleRequirement(asText(firstPresent(json, "requisito", "requirement", "texto", "text")));
    }

    List<String> fallbackRequirements(String necessity) {
        String base = necessity == null || necessity.trim().isEmpty() ? "contratação" : truncate(necessity, 60);
        List<String> requirements = new ArrayList<>();
        requirements.add("Atender plenamente à necessidade de " + base + " conforme especificações técnicas e requisitos funcionais mínimos");
        requirements.add("Garantir conformidade com Lei 14.133/2021, legislação aplicável e normas técnicas do setor");
        requirements.add("Fornecedor com experiência comprovada mínima de 2 anos em contratos similares");
        requirements.add("Disponibilidade mínima de 99,5% mensal, com penalidades proporcionais por descumprimento");
        requirements.add("Garantia contra defeitos de fabricação/execução pelo prazo mínimo de 12 meses");
        requirements.add("Suporte técnico especializado em até 24 horas úteis, com SLA documentado");
        requirements.add("Treinamento de equipe técnica com certificação reconhecida e material didático");
        requirements.add("Documentação técnica completa em português brasileiro, incluindo manuais operacionais");
        requirements.add("Compatibilidade técnica com infraestrutura e sistemas já existentes");
        requirements.add("Relatórios mensais de desempenho, monitoramento e indicadores de qualidade");
        requirements.add("Prazo de entrega ou início de execução em até 60 dias corridos após assinatura");
        requirements.add("Conformidade com LGPD quando houver tratamento de dados pessoais");
        return requirements;
    }

    List<StrategyOption> fallbackStrategies(String necessity) {
        String base = necessity == null || necessity.trim().isEmpty() ? "bem ou serviço" : truncate(necessity, 50);
        List<StrategyOption> strategies = new ArrayList<>();
        strategies.add(StrategyOption.builder()
                .title("Contrato por Desempenho (Performance-Based)")
                .whenIndicated("Quando o foco está em resultados mensuráveis para " + base)
                .advantages(List.of("Pagamento vinculado a resultados", "Incentivo à qualidade", "Redução de riscos operacionais"))
                .risks(List.of("Requer métricas bem definidas", "Dificuldade na mensuração inicial"))
                .build());
        strategies.add(StrategyOption.builder()
                .title("Outsourcing Integral")
                .whenIndicated("Para necessidades que exigem gestão completa e especializada")
                .advantages(List.of("Transferência total da operação", "Equipe dedicada", "Foco no core business"))
                .risks(List.of("Dependência do fornecedor", "Custo recorrente mais alto"))
                .build());
        strategies.add(StrategyOption.builder()
                .title("Locação com Opção de Compra")
                .whenIndicated("Quando há incerteza sobre a necessidade de longo prazo ou teste de viabilidade")
                .advantages(List.of("Menor investimento inicial", "Flexibilidade contratual", "Possibilidade de aquisição futura"))
                .risks(List.of("Custo total pode ser maior", "Limitações contratuais"))
                .build());
        strategies.add(StrategyOption.builder()
                .title("Ata de Registro de Preços (ARP)")
                .whenIndicated("Para demandas recorrentes ou de múltiplos órgãos")
                .advantages(List.of("Flexibilidade de aquisição", "Preços registrados por 12 meses", "Permite carona"))
                .risks(List.of("Requer demanda estimada", "Não garante fornecimento imediato"))
                .build());
        return strategies;
    }

    private List<String> cleanRequirementLines(List<String> lines) {
        List<String> result = new ArrayList<>();
        if (lines == null) {
            return result;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String line : lines) {
            String cleaned = cleanLine(line);
            if (cleaned == null) {
                continue;
            }
            if (seen.add(TextNormalizer.normalize(cleaned))) {
                result.add(cleaned);
            }
        }
        return result;
    }

    private String cleanLine(String line) {
        if (line == null) {
            return null;
        }
        String cleaned = COMMAND_PATTERN.matcher(line).replaceAll("");
        cleaned = NUMBERING_PREFIX.matcher(cleaned).replaceFirst("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.isEmpty() || cleaned.contains("?")) {
            return null;
        }
        String normalized = TextNormalizer.normalize(cleaned);
        for (String title : BLOCKED_TITLES) {
            if (normalized.startsWith(title)) {
                return null;
            }
        }
        if (isOnboarding(normalized)) {
            return null;
        }
        return cleaned;
    }

    private boolean isOnboarding(String normalized) {
        return TextNormalizer.containsAnyWord(normalized, ONBOARDING_FILLER);
    }

    private boolean isValidStrategy(StrategyOption option) {
        return option != null
                && option.getTitle() != null && !option.getTitle().trim().isEmpty()
                && option.getAdvantages() != null && !option.getAdvantages().isEmpty()
                && option.getRisks() != null && !option.getRisks().isEmpty();
    }

    private String requirementText(Object element) {
        if (element instanceof Map<?, ?> map) {
            return asText(firstPresent(map, "descricao", "texto", "text", "description"));
        }
        return asText(element);
    }

    private Object firstPresent(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String asText(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private List<String> asTextList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                String text = asText(element);
                if (text != null) {
                    result.add(text);
                }
            }
        } else {
            String text = asText(value);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    private String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }
}
