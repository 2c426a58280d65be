package com.lexicon.enrichment.rest;

import com.lexicon.enrichment.pipeline.PipelineRunner;
import com.lexicon.enrichment.pipeline.RunAlreadyActiveException;
import com.lexicon.enrichment.rest.dto.ErrorResponse;
import com.lexicon.enrichment.rest.dto.ProgressResponse;
import com.lexicon.enrichment.rest.dto.StartRequest;
import com.lexicon.enrichment.rest.dto.StartResponse;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start and progress handling shared by the pipeline resources.
 */
final class RunControl {
    private static final Logger log = LoggerFactory.getLogger(RunControl.class);

    private RunControl() {
    }

    static Response start(PipelineRunner runner, StartRequest request, String path) {
        if (request == null || request.limit() == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("limit is required", path))
                    .build();
        }
        try {
            PipelineRunner.RunHandle handle = runner.start(request.limit());
            return Response.status(Response.Status.ACCEPTED)
                    .entity(StartResponse.accepted(request.limit(), handle.runId()))
                    .build();
        } catch (RunAlreadyActiveException | IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("run.start_failed pipeline={} error={}", runner.getPipelineName(), e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    static Response progress(PipelineRunner runner) {
        return Response.ok(ProgressResponse.from(runner.progress())).build();
    }
}
