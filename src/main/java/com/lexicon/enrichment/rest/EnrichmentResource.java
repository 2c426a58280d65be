package com.lexicon.enrichment.rest;

import com.lexicon.enrichment.ledger.JobLedger;
import com.lexicon.enrichment.pipeline.PipelineRunner;
import com.lexicon.enrichment.rest.dto.ErrorResponse;
import com.lexicon.enrichment.rest.dto.StartRequest;
import com.lexicon.enrichment.rest.dto.StatsResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource controlling the translation enrichment pipeline.
 *
 * <p>A start call returns immediately; the run continues in the background and is followed through
 * {@code /progress}.</p>
 */
@Path("/api/v1/enrichment")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Enrichment", description = "Start and monitor enrichment runs")
public class EnrichmentResource {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentResource.class);
    private static final String BASE_PATH = "/api/v1/enrichment";

    private final PipelineRunner runner;
    private final JobLedger ledger;

    @Inject
    public EnrichmentResource(@Named("enrichment") PipelineRunner runner, JobLedger ledger) {
        this.runner = runner;
        this.ledger = ledger;
    }

    /**
     * POST /api/v1/enrichment/start
     */
    @POST
    @Path("/start")
    @Operation(summary = "Start an enrichment run",
            description = "Selects up to 'limit' pending work items and enriches them in the background.")
    @APIResponse(responseCode = "202", description = "Run accepted")
    @APIResponse(responseCode = "400", description = "Missing limit, or a run is already active")
    public Response start(StartRequest request) {
        return RunControl.start(runner, request, BASE_PATH + "/start");
    }

    /**
     * GET /api/v1/enrichment/progress
     */
    @GET
    @Path("/progress")
    @Operation(summary = "Progress of the current or last run")
    @APIResponse(responseCode = "200", description = "Progress snapshot with the most recent log lines")
    public Response progress() {
        return RunControl.progress(runner);
    }

    /**
     * GET /api/v1/enrichment/stats
     */
    @GET
    @Path("/stats")
    @Operation(summary = "Work item counts by status")
    @APIResponse(responseCode = "200", description = "Counts per ledger status")
    public Response stats() {
        try {
            return Response.ok(StatsResponse.from(ledger.countByStatus())).build();
        } catch (Exception e) {
            log.error("stats.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.",
                            BASE_PATH + "/stats"))
                    .build();
        }
    }
}
