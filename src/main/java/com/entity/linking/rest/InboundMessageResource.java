package com.entity.linking.rest;

import com.entity.linking.api.EntityLinker;
import com.entity.linking.core.model.AutoLinkResult;
import com.entity.linking.core.model.InboundMessage;
import com.entity.linking.rest.dto.AutoLinkRequest;
import com.entity.linking.rest.dto.AutoLinkResponse;
import com.entity.linking.rest.dto.ErrorResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for auto-linking inbound messages.
 */
@Path("/api/messages")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Inbound Messages", description = "Link inbound message threads to senders and work items")
@SecurityRequirement(name = "bearer")
public class InboundMessageResource {
    private static final String PATH = "/api/messages/auto-link";

    private final EntityLinker linker;

    @Inject
    public InboundMessageResource(EntityLinker linker) {
        this.linker = linker;
    }

    /**
     * POST /api/messages/auto-link
     *
     * <p>Always answers 200 for a well-formed request: failures inside the run show up as
     * fewer links, never as an error status.</p>
     */
    @POST
    @Path("/auto-link")
    @Operation(summary = "Auto-link an inbound message",
            description = "Links the thread to contacts matching the sender and, only if the sender is a known "
                    + "contact, to projects and todos matching the content.")
    @APIResponse(responseCode = "200", description = "Links created, possibly none")
    @APIResponse(responseCode = "400", description = "Missing body or thread id")
    public Response autoLink(AutoLinkRequest request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("Request body is required", PATH))
                    .build();
        }
        InboundMessage message = new InboundMessage(request.threadId(), request.senderPhone(),
                request.senderEmail(), request.content());
        AutoLinkResult result = linker.autoLinkInboundMessage(message, request.similarityThreshold());
        return Response.ok(AutoLinkResponse.from(result)).build();
    }
}
