package com.etpassist.test;

import com.etpassist.domain.etp.adapter.gateway.ITextGenerator;
import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.RequirementsPayload;
import com.etpassist.domain.etp.model.valobj.StrategyOption;
import com.etpassist.domain.etp.service.EtpPromptDomainService;
import com.etpassist.domain.etp.service.ResponsePayloadGuardDomainService;
import com.etpassist.infrastructure.ai.EmptyKnowledgeRetriever;
import com.etpassist.infrastructure.ai.config.EtpGenerationProperties;
import com.etpassist.infrastructure.generation.EtpContentGenerationServiceImpl;
import com.etpassist.infrastructure.util.JsonCodec;
import com.etpassist.types.enums.GenerationProfileEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EtpContentGenerationServiceImplTest {

    private static final String NECESSITY = "Contratação de serviço de limpeza predial";

    private ITextGenerator textGenerator;
    private EtpContentGenerationServiceImpl service;

    @BeforeEach
    public void setUp() {
        textGenerator = mock(ITextGenerator.class);
        service = new EtpContentGenerationServiceImpl(textGenerator,
                new EmptyKnowledgeRetriever(),
                new EtpPromptDomainService(),
                new ResponsePayloadGuardDomainService(),
                new JsonCodec(new ObjectMapper()),
                new EtpGenerationProperties());
    }

    @Test
    public void shouldFallBackWhenGeneratorNotConfigured() {
        when(textGenerator.isConfigured()).thenReturn(false);

        RequirementsPayload payload = service.suggestRequirements(NECESSITY);

        Assertions.assertTrue(payload.isBackfilled());
        Assertions.assertEquals(12, payload.getRequirements().size());
        Assertions.assertFalse(service.isGeneratorConfigured());
        verify(textGenerator, never()).generate(anyString(), anyString(), anyDouble(), any(GenerationProfileEnum.class));
    }

    @Test
    public void shouldFallBackWhenGeneratorThrows() {
        when(textGenerator.isConfigured()).thenReturn(true);
        when(textGenerator.generate(anyString(), anyString(), anyDouble(), any(GenerationProfileEnum.class)))
                .thenThrow(new IllegalStateException("timeout"));

        RequirementsPayload payload = service.suggestRequirements(NECESSITY);
        List<StrategyOption> strategies = service.suggestStrategies(NECESSITY, payload.getRequirements());

        Assertions.assertTrue(payload.isBackfilled());
        Assertions.assertEquals(4, strategies.size());
        Assertions.assertEquals("Contrato por Desempenho (Performance-Based)", strategies.get(0).getTitle());
    }

    @Test
    public void shouldParseJsonWrappedInProse() {
        when(textGenerator.isConfigured()).thenReturn(true);
        when(textGenerator.generate(anyString(), anyString(), anyDouble(), any(GenerationProfileEnum.class)))
                .thenReturn("Segue a proposta:\n{\"intro\": \"Requisitos para limpeza predial.\", \"requisitos\": ["
                        + "\"1. Equipe com treinamento em NR-35\","
                        + "\"2. Fornecimento de saneantes registrados na ANVISA\","
                        + "\"3. Cobertura diária de segunda a sexta\","
                        + "\"4. Supervisão presencial em tempo integral\","
                        + "\"5. Uniformes e EPIs fornecidos pela contratada\","
                        + "\"6. Relatório mensal de ocorrências\","
                        + "\"7. Coleta seletiva de resíduos\","
                        + "\"8. Reposição de ausências em até 2 horas\","
                        + "\"Justificativa: não deve entrar\"]}\nFim.");

        RequirementsPayload payload = service.suggestRequirements(NECESSITY);

        Assertions.assertFalse(payload.isBackfilled());
        Assertions.assertEquals(8, payload.getRequirements().size());
        Assertions.assertEquals("Equipe com treinamento em NR-35", payload.getRequirements().get(0));
        Assertions.assertEquals("Requisitos para limpeza predial.", payload.getIntro());
    }

    @Test
    public void shouldUsePlainTextRewriteWhenOutputIsNotJson() {
        when(textGenerator.isConfigured()).thenReturn(true);
        when(textGenerator.generate(anyString(), anyString(), anyDouble(), any(GenerationProfileEnum.class)))
                .thenReturn("R3 - Cobertura diária de segunda a sábado, das 6h às 22h");

        String rewritten = service.rewriteRequirement(NECESSITY, new RequirementItem("R3", "Cobertura diária"));

        Assertions.assertEquals("Cobertura diária de segunda a sábado, das 6h às 22h", rewritten);
    }

    @Test
    public void shouldReturnNullRewriteWhenGeneratorUnavailable() {
        when(textGenerator.isConfigured()).thenReturn(false);

        Assertions.assertNull(service.rewriteRequirement(NECESSITY, new RequirementItem("R3", "Cobertura diária")));
    }

    @Test
    public void shouldComposeDeterministicSummaryWhenGeneratorSilent() {
        when(textGenerator.isConfigured()).thenReturn(true);
        when(textGenerator.generate(anyString(), anyString(), anyDouble(), any(GenerationProfileEnum.class)))
                .thenReturn("   ");
        EtpSessionEntity session = EtpSessionEntity.create("s-sum");
        session.setNecessity(NECESSITY);

        String summary = service.composeExecutiveSummary(session, null);

        Assertions.assertTrue(summary.startsWith("Necessidade: " + NECESSITY));
    }
}
