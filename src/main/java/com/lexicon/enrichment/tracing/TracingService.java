package com.lexicon.enrichment.tracing;

import java.util.Map;

/**
 * Span factory used around pipeline runs and oracle calls.
 * {@link NoOpTracingService} is the default when no tracer is configured.
 */
public interface TracingService {

    String RUN_SPAN = "enrichment.run";
    String ORACLE_CALL_SPAN = "enrichment.oracle.call";
    String PERSIST_SPAN = "enrichment.persist";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
