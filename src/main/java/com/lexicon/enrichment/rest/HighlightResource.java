package com.lexicon.enrichment.rest;

import com.lexicon.enrichment.pipeline.PipelineRunner;
import com.lexicon.enrichment.rest.dto.StartRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource controlling the highlight cleaning pipeline.
 */
@Path("/api/v1/highlights")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Highlights", description = "Condense raw idiom records into highlights")
public class HighlightResource {
    private static final String BASE_PATH = "/api/v1/highlights";

    private final PipelineRunner runner;

    @Inject
    public HighlightResource(@Named("highlight-cleaning") PipelineRunner runner) {
        this.runner = runner;
    }

    @POST
    @Path("/start")
    @Operation(summary = "Start a highlight cleaning run")
    @APIResponse(responseCode = "202", description = "Run accepted")
    @APIResponse(responseCode = "400", description = "Missing limit, or a run is already active")
    public Response start(StartRequest request) {
        return RunControl.start(runner, request, BASE_PATH + "/start");
    }

    @GET
    @Path("/progress")
    @Operation(summary = "Progress of the current or last highlight cleaning run")
    @APIResponse(responseCode = "200", description = "Progress snapshot with the most recent log lines")
    public Response progress() {
        return RunControl.progress(runner);
    }
}
