package com.etpassist.domain.etp.service;

import com.etpassist.domain.etp.model.entity.EtpSessionEntity;
import com.etpassist.domain.etp.model.valobj.RequirementItem;
import com.etpassist.domain.etp.model.valobj.RequirementsPayload;
import com.etpassist.domain.etp.model.valobj.StrategyOption;

import java.util.List;

/**
 * ETP content generation service.
 * <p>
 * Wraps the text generator and knowledge retriever. Implementations never throw:
 * generator failures, timeouts and malformed output all fall back to the deterministic guard path.
 * </p>
 *
 * @author etpassist
 * @since 2025-03-15
 */
public interface EtpContentGenerationService {

    /**
     * Suggest the initial requirement list for a necessity.
     *
     * @param necessity captured necessity
     * @return guarded payload with at least the minimum number of requirements
     */
    RequirementsPayload suggestRequirements(String necessity);

    /**
     * Produce a new requirement list replacing the current one.
     *
     * @param necessity captured necessity
     * @param currentRequirements current requirement texts
     * @return guarded payload
     */
    RequirementsPayload regenerateRequirements(String necessity, List<String> currentRequirements);

    /**
     * Suggest procurement strategies for the confirmed requirements.
     *
     * @param necessity captured necessity
     * @param requirements confirmed requirement texts
     * @return at least two valid strategies
     */
    List<StrategyOption> suggestStrategies(String necessity, List<String> requirements);

    /**
     * Rewrite a single requirement.
     *
     * @param necessity captured necessity
     * @param item requirement to rewrite
     * @return rewritten single line, or null when nothing usable was generated
     */
    String rewriteRequirement(String necessity, RequirementItem item);

    /**
     * Compose the executive summary from the accumulated answers.
     *
     * @param session current session
     * @param adjustment optional user adjustment request
     * @return non-empty summary
     */
    String composeExecutiveSummary(EtpSessionEntity session, String adjustment);

    /**
     * Whether a real generator is configured.
     */
    boolean isGeneratorConfigured();
}
