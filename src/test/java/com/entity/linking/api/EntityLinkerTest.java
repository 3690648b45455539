package com.entity.linking.api;

import com.entity.linking.core.model.AutoLinkResult;
import com.entity.linking.core.model.Contact;
import com.entity.linking.core.model.EndpointType;
import com.entity.linking.core.model.EntityLink;
import com.entity.linking.core.model.EntityType;
import com.entity.linking.core.model.InboundMessage;
import com.entity.linking.core.model.MatchCandidate;
import com.entity.linking.core.model.MatchSignals;
import com.entity.linking.core.model.WorkItemHit;
import com.entity.linking.link.LinkRemovalResult;
import com.entity.linking.link.LinkWriteResult;
import com.entity.linking.match.InvalidQueryException;
import com.entity.linking.similarity.EndpointNormalizer;
import com.entity.linking.store.InMemoryContactDirectory;
import com.entity.linking.store.InMemoryItemStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import com.entity.linking.metrics.MicrometerMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the facade over in-memory stores.
 */
class EntityLinkerTest {

    private static final String ALICE_ID = "a11ce000-0000-4000-8000-000000000001";
    private static final String CAROL_ID = "ca201000-0000-4000-8000-000000000006";
    private static final String THREAD_ID = "7e7e7e7e-0000-4000-8000-000000000003";
    private static final String TODO_ID = "7a5c0000-0000-4000-8000-000000000004";
    private static final String MEMORY_ID = "3e3e3e3e-0000-4000-8000-000000000007";

    private InMemoryItemStore store;
    private SimpleMeterRegistry registry;
    private EntityLinker linker;

    @BeforeEach
    void setUp() {
        store = new InMemoryItemStore();
        registry = new SimpleMeterRegistry();
        InMemoryContactDirectory directory = new InMemoryContactDirectory(List.of(
                contact(ALICE_ID, "Alice Smith", "+61400123456", "alice@example.com"),
                contact(CAROL_ID, "Carol Smith", "+61400999888", "carol@example.com")));
        linker = EntityLinker.builder()
                .contactDirectory(directory)
                .itemStore(store)
                .workItemSearch(query -> List.of(new WorkItemHit(TODO_ID, "Quarterly report", 0.91, "task")))
                .metricsService(new MicrometerMetricsService(registry))
                .clock(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC))
                .build();
    }

    @AfterEach
    void tearDown() {
        linker.close();
    }

    private static Contact contact(String id, String name, String phone, String email) {
        return Contact.builder()
                .id(id)
                .displayName(name)
                .endpoints(List.of(
                        EndpointNormalizer.endpoint(EndpointType.PHONE, phone),
                        EndpointNormalizer.endpoint(EndpointType.EMAIL, email)))
                .build();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Requires every collaborator")
        void requiresCollaborators() {
            assertThrows(IllegalStateException.class, () -> EntityLinker.builder().build());
            assertThrows(IllegalStateException.class, () -> EntityLinker.builder()
                    .contactDirectory(new InMemoryContactDirectory())
                    .itemStore(new InMemoryItemStore())
                    .build());
        }

        @Test
        @DisplayName("backend() wires the HTTP adapters")
        void backendWiring() {
            try (EntityLinker remote = EntityLinker.builder()
                    .options(LinkingOptions.builder().callTimeout(java.time.Duration.ofMillis(200)).build())
                    .backend("http://localhost:3000", "token")
                    .build()) {
                assertEquals(java.time.Duration.ofMillis(200), remote.getOptions().getCallTimeout());
            }
        }

        @Test
        @DisplayName("A caller-supplied executor is not shut down on close")
        void externalExecutor() {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                EntityLinker withExecutor = EntityLinker.builder()
                        .contactDirectory(new InMemoryContactDirectory())
                        .itemStore(new InMemoryItemStore())
                        .workItemSearch(query -> List.of())
                        .executor(executor)
                        .build();
                withExecutor.close();
                assertFalse(executor.isShutdown());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("Shared surname ties break on contact id")
    void suggestMatchesByName() {
        List<MatchCandidate> matches = linker.suggestMatches(MatchSignals.ofName("Smith"));

        assertEquals(2, matches.size());
        assertEquals(ALICE_ID, matches.get(0).contactId());
        assertEquals(CAROL_ID, matches.get(1).contactId());
        assertEquals(matches.get(0).confidence(), matches.get(1).confidence(), 1e-9);
    }

    @Test
    @DisplayName("Full name ranks the exact contact alone")
    void suggestMatchesByFullName() {
        List<MatchCandidate> matches = linker.suggestMatches(MatchSignals.ofName("alice smith"));

        assertEquals(1, matches.size());
        assertEquals(0.8, matches.get(0).confidence(), 1e-9);
    }

    @Test
    @DisplayName("Limit applies to the facade call")
    void suggestMatchesLimit() {
        assertEquals(1, linker.suggestMatches(MatchSignals.ofEmail("someone@example.com"), 1).size());
        assertThrows(InvalidQueryException.class, () -> linker.suggestMatches(MatchSignals.none()));
    }

    @Test
    @DisplayName("Create, query and remove a manual link")
    void linkLifecycle() {
        assertTrue(linker.createLink(EntityType.MEMORY, MEMORY_ID, EntityType.URL, "https://example.com/doc", "source"));

        List<EntityLink> links = linker.queryLinks(EntityType.MEMORY, MEMORY_ID, Set.of());
        assertEquals(1, links.size());
        assertEquals(Instant.parse("2026-03-01T10:15:30Z"), links.get(0).createdAt());
        assertEquals("source", links.get(0).label());

        LinkRemovalResult removed = linker.removeLink(EntityType.MEMORY, MEMORY_ID, EntityType.URL,
                "https://example.com/doc");
        assertEquals(LinkRemovalResult.Status.REMOVED, removed.status());
        assertEquals(0, store.size());
        assertEquals(1.0, registry.find("entity.link.outcome").tag("outcome", "CREATED").counter().count());
    }

    @Test
    @DisplayName("Detailed create reports the keys")
    void createDetailed() {
        LinkWriteResult result = linker.createLinkDetailed(EntityType.TODO, TODO_ID, EntityType.MEMORY, MEMORY_ID, null);

        assertTrue(result.isCreated());
        assertEquals("todo:" + TODO_ID + ":memory:" + MEMORY_ID, result.forwardKey());
        assertEquals("memory:" + MEMORY_ID + ":todo:" + TODO_ID, result.reverseKey());
    }

    @Test
    @DisplayName("Auto-link links sender and todo, both visible from the thread")
    void autoLink() {
        AutoLinkResult result = linker.autoLinkInboundMessage(
                new InboundMessage(THREAD_ID, "+61400123456", null, "Is the quarterly report done?"));

        assertEquals(2, result.linksCreated());
        List<EntityLink> fromThread = linker.queryLinks(EntityType.THREAD, THREAD_ID, null);
        assertEquals(2, fromThread.size());
        assertTrue(fromThread.stream().allMatch(EntityLink::autoLinked));
        assertEquals(Set.of(EntityType.CONTACT, EntityType.TODO),
                Set.of(fromThread.get(0).targetType(), fromThread.get(1).targetType()));
    }
}
