package com.lexicon.enrichment.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Lexicon Enrichment API",
                version = "1.0.0",
                description = "Control surface of the enrichment pipelines: start a run, follow its progress " +
                        "and inspect the job ledger."
        )
)
public class EnrichmentApplication extends Application {
}
