package com.entity.linking.store;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Decorator around an {@link ItemStore} that injects failures for resilience tests.
 * Writes are failed per key prefix; deletes can be refused or made to throw.
 */
public class ChaosItemStore implements ItemStore {

    private final ItemStore delegate;
    private volatile Predicate<String> failPutForKey = key -> false;
    private volatile boolean refuseDelete;
    private volatile boolean throwOnDelete;
    private volatile boolean throwOnDeleteOfSecond;
    private volatile boolean failLookups;
    private final AtomicInteger deleteCalls = new AtomicInteger();

    public ChaosItemStore(ItemStore delegate) {
        this.delegate = delegate;
    }

    /**
     * Every put whose key starts with the prefix throws {@link BackendUnavailableException}.
     */
    public void failPutsWithKeyPrefix(String prefix) {
        this.failPutForKey = key -> key.startsWith(prefix);
    }

    public void failAllPuts() {
        this.failPutForKey = key -> true;
    }

    /**
     * Deletes answer false without deleting.
     */
    public void setRefuseDelete(boolean refuse) {
        this.refuseDelete = refuse;
    }

    public void setThrowOnDelete(boolean fail) {
        this.throwOnDelete = fail;
    }

    /**
     * The first delete succeeds, every later one throws.
     */
    public void setThrowOnDeleteAfterFirst(boolean fail) {
        this.throwOnDeleteOfSecond = fail;
        deleteCalls.set(0);
    }

    public void setFailLookups(boolean fail) {
        this.failLookups = fail;
    }

    @Override
    public StoredItem put(ItemWrite write) {
        if (failPutForKey.test(write.key())) {
            throw new BackendUnavailableException("chaos", 503, "injected put failure for " + write.key());
        }
        return delegate.put(write);
    }

    @Override
    public Optional<StoredItem> getByKey(String skillId, String collection, String key) {
        if (failLookups) {
            throw new BackendUnavailableException("chaos", 500, "injected lookup failure");
        }
        return delegate.getByKey(skillId, collection, key);
    }

    @Override
    public boolean delete(String itemId) {
        int call = deleteCalls.incrementAndGet();
        if (throwOnDelete || (throwOnDeleteOfSecond && call > 1)) {
            throw new BackendUnavailableException("chaos", BackendUnavailableException.NO_STATUS,
                    "injected delete failure");
        }
        if (refuseDelete) {
            return false;
        }
        return delegate.delete(itemId);
    }

    @Override
    public List<StoredItem> findByTag(String skillId, String collection, String tag, int limit) {
        if (failLookups) {
            throw new BackendUnavailableException("chaos", 500, "injected lookup failure");
        }
        return delegate.findByTag(skillId, collection, tag, limit);
    }
}
