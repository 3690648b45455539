package com.entity.linking.core.model;

import java.util.Objects;

/**
 * A typed contact identifier with its raw and normalized forms.
 */
public record Endpoint(EndpointType type, String value, String normalizedValue) {

    public Endpoint {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(value, "value is required");
        normalizedValue = normalizedValue != null ? normalizedValue : value;
    }

    public boolean isPhone() {
        return type == EndpointType.PHONE;
    }

    public boolean isEmail() {
        return type == EndpointType.EMAIL;
    }
}
