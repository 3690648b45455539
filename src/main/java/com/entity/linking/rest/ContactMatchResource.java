package com.entity.linking.rest;

import com.entity.linking.api.EntityLinker;
import com.entity.linking.core.model.MatchCandidate;
import com.entity.linking.core.model.MatchSignals;
import com.entity.linking.logging.Redaction;
import com.entity.linking.match.InvalidQueryException;
import com.entity.linking.rest.dto.ErrorResponse;
import com.entity.linking.rest.dto.MatchResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
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

import java.util.List;

/**
 * REST resource for contact match suggestions.
 */
@Path("/api/contacts")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Contact Matching", description = "Rank existing contacts against phone, e-mail and name")
@SecurityRequirement(name = "bearer")
public class ContactMatchResource {
    private static final Logger log = LoggerFactory.getLogger(ContactMatchResource.class);
    private static final String PATH = "/api/contacts/suggest-match";

    private final EntityLinker linker;

    @Inject
    public ContactMatchResource(EntityLinker linker) {
        this.linker = linker;
    }

    /**
     * GET /api/contacts/suggest-match?phone=...&amp;email=...&amp;name=...&amp;limit=...
     */
    @GET
    @Path("/suggest-match")
    @Operation(summary = "Suggest matching contacts",
            description = "Returns contacts ranked by confidence. At least one of phone, email or name is required.")
    @APIResponse(responseCode = "200", description = "Ranked matches, possibly empty")
    @APIResponse(responseCode = "400", description = "No usable signal given or invalid limit")
    public Response suggestMatch(
            @Parameter(description = "Phone number in any format") @QueryParam("phone") String phone,
            @Parameter(description = "E-mail address") @QueryParam("email") String email,
            @Parameter(description = "Full or partial display name") @QueryParam("name") String name,
            @Parameter(description = "Maximum matches (default 10, max 50)") @QueryParam("limit") Integer limit) {
        try {
            MatchSignals signals = new MatchSignals(phone, email, name);
            List<MatchCandidate> matches = limit != null
                    ? linker.suggestMatches(signals, limit)
                    : linker.suggestMatches(signals);
            return Response.ok(MatchResponse.from(matches)).build();

        } catch (InvalidQueryException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), PATH))
                    .build();
        } catch (Exception e) {
            log.error("suggestMatch.failed error={}", Redaction.sanitizeError(e), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", PATH))
                    .build();
        }
    }
}
