package me.christianrobert.pyibackport.transformer.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.pyibackport.config.service.ConfigService;
import me.christianrobert.pyibackport.transformer.context.TransformationResult;
import me.christianrobert.pyibackport.transformer.service.StubTransformationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for backporting stub files.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/backport/stub?target=3.10" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary @mymodule.pyi
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "stubSource": "...",
 *   "transformedSource": "...",
 *   "targetVersion": "3.10",
 *   "errorKind": null,
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A rejected stub is a valid business outcome, not an HTTP error.
 */
@Path("/api/backport")
@Produces(MediaType.APPLICATION_JSON)
public class StubTransformationResource {

    private static final Logger log = LoggerFactory.getLogger(StubTransformationResource.class);

    @Inject
    StubTransformationService transformationService;

    @Inject
    ConfigService configService;

    /**
     * Backports a stub file.
     *
     * @param target Optional target version (defaults to backport.default-target)
     * @param showAst Optional flag to include the parse tree in the response; falls back to backport.include-ast
     * @param source Stub source (text/plain body)
     * @return TransformationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/stub")
    @Consumes(MediaType.TEXT_PLAIN)
    public TransformationResult backportStub(
            @QueryParam("target") String target,
            @QueryParam("showAst") Boolean showAst,
            String source
    ) {
        log.info("Stub backport request received via REST API");
        log.trace("Stub source: {}", source);

        if (source == null) {
            log.warn("Empty request body received");
            return TransformationResult.failure("", "Stub source cannot be null");
        }

        String targetVersion = target;
        if (targetVersion == null || targetVersion.trim().isEmpty()) {
            targetVersion = configService.getDefaultTarget().toString();
            log.debug("Using default target: {}", targetVersion);
        }

        boolean includeAst = showAst != null
                ? showAst
                : configService.isIncludeAst();

        TransformationResult result = transformationService.transformToResult(source, targetVersion, includeAst,
                configService.getWildcardDenylist());

        if (result.isSuccess()) {
            log.info("Stub backport succeeded for target {}", result.getTargetVersion());
            if (result.hasAstTree()) {
                log.debug("AST tree included in response");
            }
        } else {
            log.warn("Stub backport failed: {}", result.getErrorMessage());
        }

        return result;
    }
}
