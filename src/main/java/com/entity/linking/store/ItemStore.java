package com.entity.linking.store;

import java.util.List;
import java.util.Optional;

/**
 * Generic key/value item store with tags. Only single-key operations exist: there is no
 * multi-key atomicity, so callers that need pairs of records must compensate themselves.
 */
public interface ItemStore {

    /**
     * Creates or replaces the item with the write's collection and key.
     *
     * @return the stored item, carrying its store-assigned id
     * @throws BackendUnavailableException if the write was not accepted
     */
    StoredItem put(ItemWrite write);

    /**
     * Looks an item up by key.
     *
     * @return the item, or empty if no item has that key
     * @throws BackendUnavailableException if the store cannot be reached
     */
    Optional<StoredItem> getByKey(String skillId, String collection, String key);

    /**
     * Deletes an item by id.
     *
     * @return true if the store confirmed the delete
     * @throws BackendUnavailableException if the store cannot be reached
     */
    boolean delete(String itemId);

    /**
     * Lists items of a collection carrying the given tag, at most {@code limit} of them.
     *
     * @throws BackendUnavailableException if the store cannot be reached
     */
    List<StoredItem> findByTag(String skillId, String collection, String tag, int limit);
}
