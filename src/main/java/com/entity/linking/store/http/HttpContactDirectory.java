package com.entity.linking.store.http;

import com.entity.linking.core.model.Contact;
import com.entity.linking.core.model.Endpoint;
import com.entity.linking.core.model.EndpointType;
import com.entity.linking.similarity.EndpointNormalizer;
import com.entity.linking.store.ContactDirectory;
import com.entity.linking.store.ContactQuery;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ContactDirectory} backed by the contacts API ({@code GET /api/contacts}).
 *
 * <p>The backend answers with either a {@code contacts} or an {@code items} array, and a contact
 * either carries an {@code endpoints} list or flat {@code phone}/{@code email} fields. Both shapes
 * are folded into {@link Contact} here.</p>
 */
public class HttpContactDirectory implements ContactDirectory {
    private static final Logger log = LoggerFactory.getLogger(HttpContactDirectory.class);

    static final String PATH = "/api/contacts";

    private final BackendClient client;

    public HttpContactDirectory(BackendClient client) {
        this.client = client;
    }

    @Override
    public List<Contact> search(ContactQuery query) {
        ContactsPage page = client.get(PATH, BackendClient.params(
                        "search", query.value(),
                        "signal", query.signal().name().toLowerCase(Locale.ROOT),
                        "limit", String.valueOf(query.limit())),
                ContactsPage.class).orElse(ContactsPage.EMPTY);

        List<ContactPayload> payloads = page.contacts() != null ? page.contacts()
                : page.items() != null ? page.items() : List.of();

        List<Contact> contacts = new ArrayList<>(Math.min(payloads.size(), query.limit()));
        for (ContactPayload payload : payloads) {
            if (contacts.size() >= query.limit()) {
                break;
            }
            if (payload.id() == null || payload.id().isBlank()) {
                log.debug("contacts.skipMalformed reason=missing id");
                continue;
            }
            contacts.add(toContact(payload));
        }
        log.debug("contacts.searched signal={} returned={}", query.signal(), contacts.size());
        return contacts;
    }

    private static Contact toContact(ContactPayload payload) {
        List<Endpoint> endpoints = new ArrayList<>();
        if (payload.endpoints() != null) {
            for (EndpointPayload endpoint : payload.endpoints()) {
                EndpointType type = endpointType(endpoint.type());
                if (type == null || endpoint.value() == null) {
                    continue;
                }
                endpoints.add(endpoint.normalizedValue() != null
                        ? new Endpoint(type, endpoint.value(), endpoint.normalizedValue())
                        : EndpointNormalizer.endpoint(type, endpoint.value()));
            }
        }
        if (payload.phone() != null && !payload.phone().isBlank()) {
            endpoints.add(EndpointNormalizer.endpoint(EndpointType.PHONE, payload.phone()));
        }
        if (payload.email() != null && !payload.email().isBlank()) {
            endpoints.add(EndpointNormalizer.endpoint(EndpointType.EMAIL, payload.email()));
        }
        return Contact.builder()
                .id(payload.id())
                .displayName(payload.displayName())
                .endpoints(endpoints)
                .build();
    }

    private static EndpointType endpointType(String wire) {
        if (wire == null) {
            return null;
        }
        return switch (wire.toLowerCase(Locale.ROOT)) {
            case "phone", "sms", "whatsapp" -> EndpointType.PHONE;
            case "email" -> EndpointType.EMAIL;
            default -> null;
        };
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContactsPage(
            @JsonProperty("contacts") List<ContactPayload> contacts,
            @JsonProperty("items") List<ContactPayload> items
    ) {
        static final ContactsPage EMPTY = new ContactsPage(List.of(), null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContactPayload(
            @JsonProperty("id") String id,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("email") String email,
            @JsonProperty("phone") String phone,
            @JsonProperty("endpoints") List<EndpointPayload> endpoints
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EndpointPayload(
            @JsonProperty("type") String type,
            @JsonProperty("value") String value,
            @JsonProperty("normalized_value") String normalizedValue
    ) {
    }
}
