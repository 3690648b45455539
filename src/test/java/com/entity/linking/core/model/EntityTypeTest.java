package com.entity.linking.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class EntityTypeTest {

    @ParameterizedTest
    @CsvSource({
            "memory, MEMORY",
            "TODO, TODO",
            "' Project ', PROJECT",
            "contact, CONTACT",
            "thread, THREAD",
            "github_issue, GITHUB_ISSUE",
            "url, URL"
    })
    @DisplayName("Wire names parse case-insensitively")
    void parses(String wire, EntityType expected) {
        assertEquals(expected, EntityType.parse(wire));
    }

    @Test
    @DisplayName("Unknown or missing names are rejected")
    void rejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> EntityType.parse("folder"));
        assertThrows(IllegalArgumentException.class, () -> EntityType.parse(null));
        assertTrue(EntityType.fromWireName("GitHub-Issue").isEmpty());
    }

    @Test
    @DisplayName("Only external references are non-internal")
    void internalTypes() {
        assertTrue(EntityType.THREAD.isInternal());
        assertTrue(EntityType.CONTACT.isInternal());
        assertFalse(EntityType.GITHUB_ISSUE.isInternal());
        assertFalse(EntityType.URL.isInternal());
    }
}
