package com.entity.linking.store.http;

import com.entity.linking.store.BackendUnavailableException;
import com.entity.linking.store.ItemStore;
import com.entity.linking.store.ItemWrite;
import com.entity.linking.store.StoredItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ItemStore} backed by the skill-store items API.
 */
public class HttpItemStore implements ItemStore {

    static final String ITEMS_PATH = "/api/skill-store/items";
    static final String BY_KEY_PATH = ITEMS_PATH + "/by-key";

    private final BackendClient client;

    public HttpItemStore(BackendClient client) {
        this.client = client;
    }

    @Override
    public StoredItem put(ItemWrite write) {
        ItemPayload stored = client.post(ITEMS_PATH, new ItemRequest(write.skillId(), write.collection(),
                write.key(), write.data(), write.tags()), ItemPayload.class);
        if (stored == null || stored.id() == null) {
            throw new BackendUnavailableException(client.getName(), "upsert response carried no item id");
        }
        return stored.toStoredItem();
    }

    @Override
    public Optional<StoredItem> getByKey(String skillId, String collection, String key) {
        return client.get(BY_KEY_PATH, BackendClient.params(
                        "skill_id", skillId,
                        "collection", collection,
                        "key", key),
                ItemPayload.class)
                .filter(item -> item.id() != null)
                .map(ItemPayload::toStoredItem);
    }

    @Override
    public boolean delete(String itemId) {
        return client.delete(ITEMS_PATH + "/" + BackendClient.encode(itemId));
    }

    @Override
    public List<StoredItem> findByTag(String skillId, String collection, String tag, int limit) {
        ItemsPage page = client.get(ITEMS_PATH, BackendClient.params(
                        "skill_id", skillId,
                        "collection", collection,
                        "tags", tag,
                        "limit", String.valueOf(limit)),
                ItemsPage.class).orElse(null);
        if (page == null || page.items() == null) {
            return List.of();
        }
        List<StoredItem> items = new ArrayList<>(page.items().size());
        for (ItemPayload payload : page.items()) {
            if (payload.id() != null && items.size() < limit) {
                items.add(payload.toStoredItem());
            }
        }
        return items;
    }

    record ItemRequest(
            @JsonProperty("skill_id") String skillId,
            @JsonProperty("collection") String collection,
            @JsonProperty("key") String key,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("tags") List<String> tags
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemPayload(
            @JsonProperty("id") String id,
            @JsonProperty("collection") String collection,
            @JsonProperty("key") String key,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("tags") List<String> tags
    ) {
        StoredItem toStoredItem() {
            return new StoredItem(id, collection, key, data, tags);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemsPage(
            @JsonProperty("items") List<ItemPayload> items,
            @JsonProperty("has_more") boolean hasMore
    ) {
    }
}
