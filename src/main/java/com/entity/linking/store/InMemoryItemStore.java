package com.entity.linking.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ItemStore}.
 * Suitable for testing and local development; upserts keep the id of the item they replace.
 */
public class InMemoryItemStore implements ItemStore {

    private final Map<String, StoredItem> itemsByKey = new ConcurrentHashMap<>();
    private final Map<String, String> keysById = new ConcurrentHashMap<>();

    @Override
    public StoredItem put(ItemWrite write) {
        String compositeKey = compositeKey(write.skillId(), write.collection(), write.key());
        return itemsByKey.compute(compositeKey, (k, existing) -> {
            String id = existing != null ? existing.id() : UUID.randomUUID().toString();
            keysById.put(id, k);
            return new StoredItem(id, write.collection(), write.key(), write.data(), write.tags());
        });
    }

    @Override
    public Optional<StoredItem> getByKey(String skillId, String collection, String key) {
        return Optional.ofNullable(itemsByKey.get(compositeKey(skillId, collection, key)));
    }

    @Override
    public boolean delete(String itemId) {
        String compositeKey = keysById.remove(itemId);
        return compositeKey != null && itemsByKey.remove(compositeKey) != null;
    }

    @Override
    public List<StoredItem> findByTag(String skillId, String collection, String tag, int limit) {
        String prefix = skillId + "/" + collection + "/";
        List<StoredItem> result = new ArrayList<>();
        for (Map.Entry<String, StoredItem> entry : itemsByKey.entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            if (entry.getKey().startsWith(prefix) && entry.getValue().tags().contains(tag)) {
                result.add(entry.getValue());
            }
        }
        return result;
    }

    /**
     * Returns the number of items stored.
     */
    public int size() {
        return itemsByKey.size();
    }

    /**
     * Clears all items.
     */
    public void clear() {
        itemsByKey.clear();
        keysById.clear();
    }

    private static String compositeKey(String skillId, String collection, String key) {
        return skillId + "/" + collection + "/" + key;
    }
}
