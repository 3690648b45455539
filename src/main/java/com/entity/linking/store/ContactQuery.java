package com.entity.linking.store;

import com.entity.linking.core.model.SignalType;

import java.util.Objects;

/**
 * A bounded contact search.
 *
 * @param signal which attribute drives the search
 * @param value  phone digit prefix, e-mail domain, or name fragment
 * @param limit  maximum number of contacts to return, always positive
 */
public record ContactQuery(SignalType signal, String value, int limit) {

    public ContactQuery {
        Objects.requireNonNull(signal, "signal is required");
        Objects.requireNonNull(value, "value is required");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
