package com.entity.linking.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A contact record as returned by the contact store.
 * Identity is the id; endpoints and display name are read-only snapshots.
 */
public final class Contact {

    private final String id;
    private final String displayName;
    private final List<Endpoint> endpoints;

    private Contact(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.displayName = builder.displayName != null ? builder.displayName : "";
        this.endpoints = builder.endpoints != null ? List.copyOf(builder.endpoints) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public List<Endpoint> getEndpoints(EndpointType type) {
        return endpoints.stream().filter(e -> e.type() == type).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Contact contact = (Contact) o;
        return Objects.equals(id, contact.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Contact{" +
                "id='" + id + '\'' +
                ", endpoints=" + endpoints.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String displayName;
        private List<Endpoint> endpoints;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder endpoints(List<Endpoint> endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Contact build() {
            return new Contact(this);
        }
    }
}
