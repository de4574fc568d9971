package com.draupnir.policy.api;

import com.draupnir.policy.model.api.HubbleFilter;
import com.draupnir.policy.model.api.ResourceDescriptor;
import com.draupnir.policy.model.report.SearchHit;
import com.draupnir.policy.service.PolicyKnowledgeService;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import javax.inject.Inject;
import javax.ws.rs.*;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * REST API for browsing and searching the data directory
 */
@Slf4j
@Path("/draupnir/api")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Corpus API", description = "List, read and search files in the data directory")
public class CorpusResource {

    @Inject
    PolicyKnowledgeService knowledgeService;

    @GET
    @Path("/health")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Health check", description = "Report the configured data directory")
    public Response health() {
        return Response.ok(knowledgeService.healthcheck()).build();
    }

    /**
     * List files, optionally filtered by a glob
     */
    @GET
    @Path("/files")
    @Operation(summary = "List files",
               description = "List data files as relative paths, optionally filtered by a glob such as **/*.{yml,yaml}")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Files listed"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response listFiles(@QueryParam("pattern") String pattern) {
        try {
            List<String> files = knowledgeService.list(pattern);
            log.info("Listed {} files for pattern '{}'", files.size(), pattern);
            return Response.ok(files).build();
        } catch (Exception e) {
            log.error("Failed to list files", e);
            return ErrorResponses.of(e);
        }
    }

    /**
     * Read one file as UTF-8 text
     */
    @GET
    @Path("/files/content")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Read file", description = "Read a data file as UTF-8 text")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "File content"),
        @APIResponse(responseCode = "400", description = "Missing path"),
        @APIResponse(responseCode = "403", description = "Path outside the data directory"),
        @APIResponse(responseCode = "404", description = "File not found"),
        @APIResponse(responseCode = "500", description = "File could not be read")
    })
    public Response readFile(@QueryParam("path") String path) {
        if (path == null || path.trim().isEmpty()) {
            return ErrorResponses.badRequest("path query parameter is required");
        }
        try {
            return Response.ok(knowledgeService.readText(path)).build();
        } catch (Exception e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/search")
    @Operation(summary = "Search text",
               description = "Case-insensitive substring search across files matching the glob")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Matching lines"),
        @APIResponse(responseCode = "400", description = "Missing query"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response search(@QueryParam("query") String query,
                           @QueryParam("pathGlob") @DefaultValue(PolicyKnowledgeService.DEFAULT_SEARCH_GLOB) String pathGlob) {
        if (query == null || query.isEmpty()) {
            return ErrorResponses.badRequest("query parameter is required");
        }
        try {
            List<SearchHit> hits = knowledgeService.search(query, pathGlob);
            return Response.ok(hits).build();
        } catch (Exception e) {
            log.error("Search failed for '{}'", query, e);
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/resources")
    @Operation(summary = "List resources", description = "Data files published as file:// resources")
    public Response listResources() {
        try {
            List<ResourceDescriptor> resources = knowledgeService.listResources();
            return Response.ok(resources).build();
        } catch (Exception e) {
            log.error("Failed to list resources", e);
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/resources/content")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Read resource", description = "Read a file:// resource inside the data directory")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Resource content"),
        @APIResponse(responseCode = "400", description = "Unsupported URI"),
        @APIResponse(responseCode = "403", description = "Path outside the data directory"),
        @APIResponse(responseCode = "404", description = "Resource not found or resources disabled")
    })
    public Response readResource(@QueryParam("uri") String uri) {
        try {
            return Response.ok(knowledgeService.readResource(uri)).build();
        } catch (Exception e) {
            log.warn("Failed to read resource {}: {}", uri, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/prompts")
    @Operation(summary = "List prompts", description = "Review and authoring prompts")
    public Response listPrompts() {
        return Response.ok(knowledgeService.prompts()).build();
    }

    @GET
    @Path("/prompts/{name}")
    @Operation(summary = "Get prompt", description = "One prompt by name")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Prompt found"),
        @APIResponse(responseCode = "404", description = "Unknown prompt")
    })
    public Response getPrompt(@PathParam("name") String name) {
        return knowledgeService.prompt(name)
                .map(prompt -> Response.ok(prompt).build())
                .orElseGet(() -> ErrorResponses.notFound("Unknown prompt: " + name));
    }

    /**
     * Hubble observe command and filters for a flow between two endpoints
     */
    @GET
    @Path("/hubble")
    @Operation(summary = "Hubble filters", description = "Build a hubble observe command line and structured filters")
    public Response hubbleFilters(@QueryParam("src") String src,
                                  @QueryParam("dst") String dst,
                                  @QueryParam("verdict") String verdict) {
        HubbleFilter filter = knowledgeService.hubbleFilters(src, dst, verdict);
        return Response.ok(filter).build();
    }

    /**
     * Point the server at another data directory
     */
    @POST
    @Path("/reload")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Reload data directory", description = "Switch the server to another data directory")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Reloaded"),
        @APIResponse(responseCode = "400", description = "Missing dataDir")
    })
    public Response reload(Map<String, String> request) {
        String dataDir = request == null ? null : request.get("dataDir");
        if (dataDir == null || dataDir.trim().isEmpty()) {
            return ErrorResponses.badRequest("dataDir is required");
        }
        try {
            knowledgeService.reload(Paths.get(dataDir.trim()));
            return Response.ok(Map.of(
                    "success", true,
                    "dataDir", knowledgeService.getDataDir().toString()
            )).build();
        } catch (Exception e) {
            log.error("Failed to reload data dir {}", dataDir, e);
            return ErrorResponses.of(e);
        }
    }
}
