package com.claimstrategy.engine.logger;

import com.claimstrategy.common.synthesis.Recommendation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Observability for one analysis call. Logs each stage without touching the
 * computation.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_VALIDATED}      — inputs accepted, nothing computed yet</li>
 *   <li>{@link #SCENARIOS_MATERIALIZED} — catalog built for this claim</li>
 *   <li>{@link #TREE_BUILT}             — explanatory decision tree assembled</li>
 *   <li>{@link #SCENARIOS_RANKED}       — expected-value ranking done</li>
 *   <li>{@link #RESPONSE_SELECTED}      — best response to the inferred opponent chosen</li>
 *   <li>{@link #SIMULATION_COMPLETED}   — Monte Carlo distribution aggregated</li>
 *   <li>{@link #RECOMMENDATION_CREATED} — final recommendation assembled</li>
 * </ol>
 *
 * <p>The analysis id is bridged into MDC only for the duration of each log call.
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String ANALYSIS_ID_KEY = "analysisId";

    public static final String REQUEST_VALIDATED      = "REQUEST_VALIDATED";
    public static final String SCENARIOS_MATERIALIZED = "SCENARIOS_MATERIALIZED";
    public static final String TREE_BUILT             = "TREE_BUILT";
    public static final String SCENARIOS_RANKED       = "SCENARIOS_RANKED";
    public static final String RESPONSE_SELECTED      = "RESPONSE_SELECTED";
    public static final String SIMULATION_COMPLETED   = "SIMULATION_COMPLETED";
    public static final String RECOMMENDATION_CREATED = "RECOMMENDATION_CREATED";

    private final ObjectMapper objectMapper;

    public AnalysisFlowLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void stage(String stageName, String analysisId, String detail) {
        withMdc(analysisId, () ->
            log.info("[AnalysisFlow] stage={} analysisId={} {}", stageName, analysisId, detail));
    }

    public void warn(String analysisId, String message) {
        withMdc(analysisId, () ->
            log.warn("[AnalysisFlow] analysisId={} {}", analysisId, message));
    }

    /** Dumps the recommendation as JSON at DEBUG. */
    public void recommendation(Recommendation recommendation, String analysisId) {
        if (!log.isDebugEnabled()) return;
        try {
            String json = objectMapper.writeValueAsString(recommendation);
            withMdc(analysisId, () ->
                log.debug("[AnalysisFlow] analysisId={} recommendation={}", analysisId, json));
        } catch (JsonProcessingException e) {
            withMdc(analysisId, () ->
                log.warn("[AnalysisFlow] analysisId={} recommendation not serializable: {}",
                    analysisId, e.getMessage()));
        }
    }

    static void withMdc(String analysisId, Runnable logAction) {
        MDC.put(ANALYSIS_ID_KEY, analysisId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ANALYSIS_ID_KEY);
        }
    }
}
