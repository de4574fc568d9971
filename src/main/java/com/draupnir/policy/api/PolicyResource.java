package com.draupnir.policy.api;

import com.draupnir.policy.model.api.TemplateRequest;
import com.draupnir.policy.model.report.PostureChecklist;
import com.draupnir.policy.model.report.ValidationReport;
import com.draupnir.policy.service.PolicyKnowledgeService;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import javax.inject.Inject;
import javax.ws.rs.*;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.util.List;

/**
 * REST API for validating Cilium policies and checking zero-trust posture
 */
@Slf4j
@Path("/draupnir/api/policies")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Policy API", description = "Validate Cilium policies, scan posture and generate templates")
public class PolicyResource {

    @Inject
    PolicyKnowledgeService knowledgeService;

    /**
     * YAML files that declare a Cilium policy kind
     */
    @GET
    @Operation(summary = "List policies",
               description = "List YAML files under the glob whose kind is CiliumNetworkPolicy or CiliumClusterwideNetworkPolicy")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Policy files listed"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response listPolicies(@QueryParam("pathGlob") @DefaultValue(PolicyKnowledgeService.DEFAULT_POLICY_GLOB) String pathGlob) {
        try {
            List<String> policies = knowledgeService.listPolicyLikeFiles(pathGlob);
            log.info("Found {} policy files for '{}'", policies.size(), pathGlob);
            return Response.ok(policies).build();
        } catch (Exception e) {
            log.error("Failed to list policies", e);
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/validate")
    @Operation(summary = "Validate policy",
               description = "Validate one Cilium policy file and return its errors, warnings and metadata")
    @APIResponses({
        @APIResponse(responseCode = "200",
                     description = "Validation report",
                     content = @Content(schema = @Schema(implementation = ValidationReport.class))),
        @APIResponse(responseCode = "400", description = "Missing path"),
        @APIResponse(responseCode = "403", description = "Path outside the data directory"),
        @APIResponse(responseCode = "404", description = "File not found"),
        @APIResponse(responseCode = "422", description = "File is not valid YAML"),
        @APIResponse(responseCode = "500", description = "File could not be read")
    })
    public Response validate(@QueryParam("path") String path) {
        if (path == null || path.trim().isEmpty()) {
            return ErrorResponses.badRequest("path query parameter is required");
        }
        try {
            ValidationReport report = knowledgeService.validate(path);
            return Response.ok(report).build();
        } catch (Exception e) {
            log.warn("Failed to validate {}: {}", path, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/checklist")
    @Operation(summary = "Zero-trust checklist",
               description = "Count CNP/CCNP policies, L7 port rules and DNS egress handling across the corpus")
    @APIResponses({
        @APIResponse(responseCode = "200",
                     description = "Posture checklist",
                     content = @Content(schema = @Schema(implementation = PostureChecklist.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response checklist(@QueryParam("pathGlob") @DefaultValue(PolicyKnowledgeService.DEFAULT_POLICY_GLOB) String pathGlob) {
        try {
            return Response.ok(knowledgeService.scanPosture(pathGlob)).build();
        } catch (Exception e) {
            log.error("Posture scan failed for '{}'", pathGlob, e);
            return ErrorResponses.of(e);
        }
    }

    /**
     * Skeleton CiliumNetworkPolicy as YAML
     */
    @POST
    @Path("/template")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces("application/x-yaml")
    @Operation(summary = "Generate policy template",
               description = "Generate a default-deny CiliumNetworkPolicy for an app with ingress ports and egress FQDNs")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Policy YAML"),
        @APIResponse(responseCode = "400", description = "Missing app/namespace or malformed port")
    })
    public Response template(TemplateRequest request) {
        if (request == null) {
            return ErrorResponses.badRequest("Request body is required");
        }
        try {
            String yaml = knowledgeService.renderTemplate(
                    request.getApp(),
                    request.getNamespace(),
                    request.getIngressPorts(),
                    request.getEgressFqdns());
            log.info("Generated policy template for {}/{}", request.getNamespace(), request.getApp());
            return Response.ok(yaml)
                    .header("Content-Disposition", "attachment; filename=\"" + request.getApp() + "-ztp.yaml\"")
                    .build();
        } catch (Exception e) {
            log.warn("Failed to generate template: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }
}
