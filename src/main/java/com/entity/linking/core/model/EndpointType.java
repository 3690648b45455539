package com.entity.linking.core.model;

/**
 * Type of a contact endpoint.
 */
public enum EndpointType {
    PHONE,
    EMAIL
}
