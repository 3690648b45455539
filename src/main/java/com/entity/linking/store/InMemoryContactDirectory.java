package com.entity.linking.store;

import com.entity.linking.core.model.Contact;
import com.entity.linking.core.model.Endpoint;
import com.entity.linking.similarity.EndpointNormalizer;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link ContactDirectory}.
 * Suitable for testing and local development. Results are ordered by contact id.
 */
public class InMemoryContactDirectory implements ContactDirectory {

    private final Map<String, Contact> contacts = new ConcurrentHashMap<>();

    public InMemoryContactDirectory() {
    }

    public InMemoryContactDirectory(List<Contact> initial) {
        initial.forEach(this::add);
    }

    public void add(Contact contact) {
        contacts.put(contact.getId(), contact);
    }

    @Override
    public List<Contact> search(ContactQuery query) {
        Predicate<Contact> filter = switch (query.signal()) {
            case PHONE -> {
                String prefix = EndpointNormalizer.normalizePhone(query.value());
                yield c -> !prefix.isEmpty() && c.getEndpoints().stream()
                        .filter(Endpoint::isPhone)
                        .anyMatch(e -> EndpointNormalizer.normalizePhone(e.normalizedValue()).startsWith(prefix));
            }
            case EMAIL -> {
                String domain = query.value().startsWith("@")
                        ? EndpointNormalizer.normalizeEmail(query.value().substring(1))
                        : EndpointNormalizer.normalizeEmail(query.value());
                yield c -> !domain.isEmpty() && c.getEndpoints().stream()
                        .filter(Endpoint::isEmail)
                        .anyMatch(e -> EndpointNormalizer.emailDomain(e.normalizedValue()).equals(domain));
            }
            case NAME -> {
                String fragment = EndpointNormalizer.normalizeName(query.value());
                yield c -> !fragment.isEmpty()
                        && EndpointNormalizer.normalizeName(c.getDisplayName()).contains(fragment);
            }
        };

        return contacts.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(Contact::getId))
                .limit(query.limit())
                .toList();
    }
}
