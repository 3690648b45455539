package com.entity.linking.rest;

import com.entity.linking.api.EntityLinker;
import com.entity.linking.core.model.Contact;
import com.entity.linking.core.model.EndpointType;
import com.entity.linking.core.model.EntityType;
import com.entity.linking.core.model.WorkItemHit;
import com.entity.linking.rest.dto.AutoLinkRequest;
import com.entity.linking.rest.dto.AutoLinkResponse;
import com.entity.linking.rest.dto.CreateLinkRequest;
import com.entity.linking.rest.dto.ErrorResponse;
import com.entity.linking.rest.dto.LinkRemovalResponse;
import com.entity.linking.rest.dto.LinkResponse;
import com.entity.linking.rest.dto.LinkWriteResponse;
import com.entity.linking.rest.dto.MatchResponse;
import com.entity.linking.similarity.EndpointNormalizer;
import com.entity.linking.store.BackendUnavailableException;
import com.entity.linking.store.ChaosItemStore;
import com.entity.linking.store.InMemoryContactDirectory;
import com.entity.linking.store.InMemoryItemStore;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resource-level tests: resources are invoked directly against an in-memory linker.
 */
class LinkingResourcesTest {

    private static final String ALICE_ID = "a11ce000-0000-4000-8000-000000000001";
    private static final String TODO_ID = "7a5c0000-0000-4000-8000-000000000004";
    private static final String PROJECT_ID = "9c0ec700-0000-4000-8000-000000000005";
    private static final String THREAD_ID = "7e7e7e7e-0000-4000-8000-000000000003";

    private InMemoryContactDirectory directory;
    private ChaosItemStore store;
    private List<WorkItemHit> searchHits;
    private boolean searchFails;
    private EntityLinker linker;

    @BeforeEach
    void setUp() {
        directory = new InMemoryContactDirectory(List.of(Contact.builder()
                .id(ALICE_ID)
                .displayName("Alice Smith")
                .endpoints(List.of(
                        EndpointNormalizer.endpoint(EndpointType.PHONE, "+61400123456"),
                        EndpointNormalizer.endpoint(EndpointType.EMAIL, "alice@example.com")))
                .build()));
        store = new ChaosItemStore(new InMemoryItemStore());
        searchHits = new ArrayList<>();
        linker = EntityLinker.builder()
                .contactDirectory(directory)
                .itemStore(store)
                .workItemSearch(query -> {
                    if (searchFails) {
                        throw new BackendUnavailableException("search", 503, "unavailable");
                    }
                    return searchHits;
                })
                .build();
    }

    @AfterEach
    void tearDown() {
        linker.close();
    }

    @Nested
    @DisplayName("GET /api/contacts/suggest-match")
    class SuggestMatch {

        private ContactMatchResource resource;

        @BeforeEach
        void setUp() {
            resource = new ContactMatchResource(linker);
        }

        @Test
        @DisplayName("Returns ranked matches")
        void returnsMatches() {
            Response response = resource.suggestMatch("0400 123 456", "alice@example.com", null, null);

            assertEquals(200, response.getStatus());
            MatchResponse body = (MatchResponse) response.getEntity();
            assertEquals(1, body.matches().size());
            MatchResponse.Match match = body.matches().get(0);
            assertEquals(ALICE_ID, match.contactId());
            assertEquals(1.0, match.confidence(), 1e-9);
            assertEquals(2, match.matchedSignals());
            assertEquals("phone", match.endpoints().get(0).type());
        }

        @Test
        @DisplayName("No signal is a 400")
        void noSignal() {
            Response response = resource.suggestMatch(null, " ", null, null);

            assertEquals(400, response.getStatus());
            assertEquals(400, ((ErrorResponse) response.getEntity()).status());
        }

        @Test
        @DisplayName("Contact directory outage degrades to an empty 200")
        void directoryDownIsEmpty() {
            EntityLinker offline = EntityLinker.builder()
                    .contactDirectory(query -> {
                        throw new BackendUnavailableException("contacts", 503, "unavailable");
                    })
                    .itemStore(store)
                    .workItemSearch(query -> List.of())
                    .build();
            try {
                Response response = new ContactMatchResource(offline)
                        .suggestMatch("+61400123456", "alice@example.com", null, null);

                assertEquals(200, response.getStatus());
                assertTrue(((MatchResponse) response.getEntity()).matches().isEmpty());
            } finally {
                offline.close();
            }
        }

        @Test
        @DisplayName("Signals with no searchable value are a 400")
        void unusableSignal() {
            assertEquals(400, resource.suggestMatch("abc", "foo", null, null).getStatus());
        }

        @Test
        @DisplayName("Non-positive limit is a 400")
        void badLimit() {
            assertEquals(400, resource.suggestMatch("+61400123456", null, null, 0).getStatus());
        }

        @Test
        @DisplayName("No match is an empty 200")
        void noMatch() {
            Response response = resource.suggestMatch(null, "nobody@nowhere.test", null, 5);

            assertEquals(200, response.getStatus());
            assertTrue(((MatchResponse) response.getEntity()).matches().isEmpty());
        }
    }

    @Nested
    @DisplayName("/api/links")
    class Links {

        private EntityLinkResource resource;

        @BeforeEach
        void setUp() {
            resource = new EntityLinkResource(linker);
        }

        @Test
        @DisplayName("POST creates both directions with 201")
        void create() {
            Response response = resource.createLink(
                    new CreateLinkRequest("project", PROJECT_ID, "github_issue", "owner/repo#42", "tracks"));

            assertEquals(201, response.getStatus());
            LinkWriteResponse body = (LinkWriteResponse) response.getEntity();
            assertTrue(body.created());
            assertEquals("CREATED", body.outcome());
            assertEquals("project:" + PROJECT_ID + ":github_issue:owner/repo#42", body.forwardKey());
        }

        @Test
        @DisplayName("POST with an unknown type or a non-UUID id is a 400")
        void createInvalid() {
            assertEquals(400, resource.createLink(
                    new CreateLinkRequest("spaceship", PROJECT_ID, "url", "https://x", null)).getStatus());
            assertEquals(400, resource.createLink(
                    new CreateLinkRequest("project", "not-a-uuid", "url", "https://x", null)).getStatus());
            assertEquals(400, resource.createLink(
                    new CreateLinkRequest("url", "https://x", "project", PROJECT_ID, null)).getStatus());
            assertEquals(400, resource.createLink(null).getStatus());
        }

        @Test
        @DisplayName("POST that cannot be written is a 502 carrying the outcome")
        void createFails() {
            store.failAllPuts();

            Response response = resource.createLink(
                    new CreateLinkRequest("todo", TODO_ID, "project", PROJECT_ID, null));

            assertEquals(502, response.getStatus());
            assertEquals("FORWARD_FAILED", ((LinkWriteResponse) response.getEntity()).outcome());
        }

        @Test
        @DisplayName("GET lists links and filters by link_types")
        @SuppressWarnings("unchecked")
        void list() {
            resource.createLink(new CreateLinkRequest("todo", TODO_ID, "project", PROJECT_ID, "part of"));
            resource.createLink(new CreateLinkRequest("todo", TODO_ID, "url", "https://example.com", null));

            Response all = resource.queryLinks("todo", TODO_ID, null);
            Map<String, Object> allBody = (Map<String, Object>) all.getEntity();
            assertEquals(200, all.getStatus());
            assertEquals(2, allBody.get("count"));

            Response filtered = resource.queryLinks("todo", TODO_ID, "url, github_issue");
            List<LinkResponse> links = (List<LinkResponse>) ((Map<String, Object>) filtered.getEntity()).get("links");
            assertEquals(1, links.size());
            assertEquals("https://example.com", links.get(0).targetRef());
            assertFalse(links.get(0).autoLinked());
        }

        @Test
        @DisplayName("GET with an unknown link type is a 400")
        void listInvalidType() {
            assertEquals(400, resource.queryLinks("todo", TODO_ID, "todo,spaceship").getStatus());
        }

        @Test
        @DisplayName("GET when the store is down is a 502")
        void listBackendDown() {
            store.setFailLookups(true);

            Response response = resource.queryLinks("todo", TODO_ID, null);

            assertEquals(502, response.getStatus());
            assertEquals("chaos", ((ErrorResponse) response.getEntity()).details().get("backend"));
        }

        @Test
        @DisplayName("DELETE removes both directions; a second DELETE is a 404")
        void remove() {
            resource.createLink(new CreateLinkRequest("todo", TODO_ID, "project", PROJECT_ID, null));

            Response removed = resource.removeLink("todo", TODO_ID, "project", PROJECT_ID);
            assertEquals(200, removed.getStatus());
            LinkRemovalResponse body = (LinkRemovalResponse) removed.getEntity();
            assertEquals("REMOVED", body.status());
            assertEquals(2, body.deleted());

            assertEquals(404, resource.removeLink("todo", TODO_ID, "project", PROJECT_ID).getStatus());
        }

        @Test
        @DisplayName("DELETE with a failed direction is a 502 naming it")
        void removePartial() {
            resource.createLink(new CreateLinkRequest("todo", TODO_ID, "project", PROJECT_ID, null));
            store.setThrowOnDeleteAfterFirst(true);

            Response response = resource.removeLink("todo", TODO_ID, "project", PROJECT_ID);

            assertEquals(502, response.getStatus());
            assertEquals(List.of("reverse"), ((LinkRemovalResponse) response.getEntity()).failed());
        }

        @Test
        @DisplayName("Link types parse case-insensitively and skip blanks")
        void parseTypes() {
            assertEquals(java.util.Set.of(EntityType.TODO, EntityType.URL),
                    EntityLinkResource.parseTypes("TODO,, url "));
            assertTrue(EntityLinkResource.parseTypes(null).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> EntityLinkResource.parseTypes("folder"));
        }
    }

    @Nested
    @DisplayName("POST /api/messages/auto-link")
    class AutoLink {

        private InboundMessageResource resource;

        @BeforeEach
        void setUp() {
            resource = new InboundMessageResource(linker);
        }

        @Test
        @DisplayName("Known sender with matching content links contact and work items")
        void knownSender() {
            searchHits.add(new WorkItemHit(PROJECT_ID, "Launch", 0.9, "project"));
            searchHits.add(new WorkItemHit(TODO_ID, "Book venue", 0.8, "task"));

            Response response = resource.autoLink(new AutoLinkRequest(THREAD_ID, "+61 400 123 456", null,
                    "Did you book the venue for the launch?", null));

            assertEquals(200, response.getStatus());
            AutoLinkResponse body = (AutoLinkResponse) response.getEntity();
            assertEquals(3, body.linksCreated());
            assertEquals(List.of(ALICE_ID), body.matches().contacts());
            assertEquals(List.of(PROJECT_ID), body.matches().projects());
            assertEquals(List.of(TODO_ID), body.matches().todos());
        }

        @Test
        @DisplayName("Request threshold is honored")
        void thresholdOverride() {
            searchHits.add(new WorkItemHit(TODO_ID, "Book venue", 0.8, "task"));

            AutoLinkResponse body = (AutoLinkResponse) resource.autoLink(new AutoLinkRequest(THREAD_ID, null,
                    "alice@example.com", "venue", 0.85)).getEntity();

            assertEquals(1, body.linksCreated());
            assertTrue(body.matches().todos().isEmpty());
        }

        @Test
        @DisplayName("Backend failures still answer 200")
        void failuresAre200() {
            searchHits.add(new WorkItemHit(TODO_ID, "Book venue", 0.9, "task"));
            searchFails = true;

            Response response = resource.autoLink(new AutoLinkRequest(THREAD_ID, "+61400123456", null,
                    "venue", null));

            assertEquals(200, response.getStatus());
            assertEquals(1, ((AutoLinkResponse) response.getEntity()).linksCreated());
        }

        @Test
        @DisplayName("Missing body is a 400")
        void missingBody() {
            assertEquals(400, resource.autoLink(null).getStatus());
        }
    }
}
