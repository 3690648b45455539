package com.entity.linking.store;

import com.entity.linking.core.model.Contact;

import java.util.List;

/**
 * Read access to the contact store.
 *
 * <p>Implementations must honor the query semantics per signal:</p>
 * <ul>
 *   <li>{@code PHONE}: contacts with a phone endpoint whose normalized digits start with the value</li>
 *   <li>{@code EMAIL}: contacts with an e-mail endpoint at the given domain</li>
 *   <li>{@code NAME}: contacts whose display name contains the value, case-insensitively</li>
 * </ul>
 * and must never return more than {@link ContactQuery#limit()} contacts.
 */
public interface ContactDirectory {

    /**
     * @throws BackendUnavailableException if the contact store cannot be reached
     */
    List<Contact> search(ContactQuery query);
}
