package com.entity.linking.rest;

import com.entity.linking.api.EntityLinker;
import com.entity.linking.core.model.EntityLink;
import com.entity.linking.core.model.EntityType;
import com.entity.linking.link.LinkRemovalResult;
import com.entity.linking.link.LinkWriteResult;
import com.entity.linking.logging.Redaction;
import com.entity.linking.rest.dto.CreateLinkRequest;
import com.entity.linking.rest.dto.ErrorResponse;
import com.entity.linking.rest.dto.LinkRemovalResponse;
import com.entity.linking.rest.dto.LinkResponse;
import com.entity.linking.rest.dto.LinkWriteResponse;
import com.entity.linking.store.BackendUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST resource for manual entity links.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Creating a link in both directions</li>
 *   <li>Listing the links of an entity</li>
 *   <li>Removing both directions of a link</li>
 * </ul>
 */
@Path("/api/links")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Entity Links", description = "Create, list and remove symmetric links between entities")
@SecurityRequirement(name = "bearer")
public class EntityLinkResource {
    private static final Logger log = LoggerFactory.getLogger(EntityLinkResource.class);
    private static final String PATH = "/api/links";

    private final EntityLinker linker;

    @Inject
    public EntityLinkResource(EntityLinker linker) {
        this.linker = linker;
    }

    /**
     * POST /api/links
     */
    @POST
    @Operation(summary = "Create a link",
            description = "Writes the forward and reverse records of a link. Repeating the call is idempotent.")
    @APIResponse(responseCode = "201", description = "Both directions written")
    @APIResponse(responseCode = "400", description = "Unknown entity type, non-UUID id or label too long")
    @APIResponse(responseCode = "502", description = "The link could not be written; no partial state is left unless outcome is ORPHANED")
    public Response createLink(CreateLinkRequest request) {
        if (request == null) {
            return badRequest("Request body is required");
        }
        try {
            LinkWriteResult result = linker.createLinkDetailed(
                    EntityType.parse(request.sourceType()), request.sourceId(),
                    EntityType.parse(request.targetType()), request.targetRef(),
                    request.label());

            if (result.isCreated()) {
                return Response.status(Response.Status.CREATED)
                        .entity(LinkWriteResponse.from(result))
                        .build();
            }
            return Response.status(Response.Status.BAD_GATEWAY)
                    .entity(LinkWriteResponse.from(result))
                    .build();

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            return internalError("createLink", e);
        }
    }

    /**
     * GET /api/links?entity_type=...&amp;entity_id=...&amp;link_types=todo,url
     */
    @GET
    @Operation(summary = "List links of an entity")
    @APIResponse(responseCode = "200", description = "Links leaving the entity")
    @APIResponse(responseCode = "400", description = "Invalid entity type or id")
    public Response queryLinks(
            @Parameter(description = "Entity type", required = true) @QueryParam("entity_type") String entityType,
            @Parameter(description = "Entity id", required = true) @QueryParam("entity_id") String entityId,
            @Parameter(description = "Comma-separated target types to keep") @QueryParam("link_types") String linkTypes) {
        try {
            EntityType type = EntityType.parse(entityType);
            List<EntityLink> links = linker.queryLinks(type, entityId, parseTypes(linkTypes));
            List<LinkResponse> body = links.stream().map(LinkResponse::from).toList();
            return Response.ok(Map.of("links", body, "count", body.size())).build();

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (BackendUnavailableException e) {
            return badGateway(e);
        } catch (Exception e) {
            return internalError("queryLinks", e);
        }
    }

    /**
     * DELETE /api/links?source_type=...&amp;source_id=...&amp;target_type=...&amp;target_ref=...
     */
    @DELETE
    @Operation(summary = "Remove a link", description = "Deletes both directions of a link.")
    @APIResponse(responseCode = "200", description = "Link removed")
    @APIResponse(responseCode = "404", description = "Neither direction exists")
    @APIResponse(responseCode = "502", description = "A delete failed; the response reports which direction")
    public Response removeLink(
            @QueryParam("source_type") String sourceType,
            @QueryParam("source_id") String sourceId,
            @QueryParam("target_type") String targetType,
            @QueryParam("target_ref") String targetRef) {
        try {
            LinkRemovalResult result = linker.removeLink(
                    EntityType.parse(sourceType), sourceId, EntityType.parse(targetType), targetRef);

            return switch (result.status()) {
                case REMOVED -> Response.ok(LinkRemovalResponse.from(result)).build();
                case NOT_FOUND -> Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("Link not found", PATH))
                        .build();
                case PARTIAL -> Response.status(Response.Status.BAD_GATEWAY)
                        .entity(LinkRemovalResponse.from(result))
                        .build();
            };

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (BackendUnavailableException e) {
            return badGateway(e);
        } catch (Exception e) {
            return internalError("removeLink", e);
        }
    }

    static Set<EntityType> parseTypes(String linkTypes) {
        if (linkTypes == null || linkTypes.isBlank()) {
            return Set.of();
        }
        Set<EntityType> types = EnumSet.noneOf(EntityType.class);
        for (String part : linkTypes.split(",")) {
            if (!part.isBlank()) {
                types.add(EntityType.parse(part));
            }
        }
        return types;
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, PATH))
                .build();
    }

    private static Response badGateway(BackendUnavailableException e) {
        log.warn("links.backendFailed backend={} status={}", e.getBackend(), e.getStatus());
        return Response.status(Response.Status.BAD_GATEWAY)
                .entity(ErrorResponse.badGateway(Redaction.sanitizeError(e), PATH, e.getBackend()))
                .build();
    }

    private static Response internalError(String operation, Exception e) {
        log.error("{}.failed error={}", operation, Redaction.sanitizeError(e), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", PATH))
                .build();
    }
}
