package de.mirkosertic.sitesearch.store;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * The shared key-value store the crawler and the document store depend on.
 * <p>
 * Every operation is atomic on its own; callers never rely on transactions spanning
 * several operations. Implementations report an unreachable or failing backend with
 * {@link StoreUnavailableException}.
 */
public interface KeyValueStore extends AutoCloseable {

    String TYPE_NONE = "none";
    String TYPE_STRING = "string";
    String TYPE_SET = "set";
    String TYPE_HASH = "hash";

    /**
     * Adds members to the set stored at {@code key}.
     *
     * @return the number of members that were not already present
     */
    long sadd(String key, String... members);

    Set<String> smembers(String key);

    void hset(String key, String field, String value);

    @Nullable
    String hget(String key, String field);

    @Nullable
    String get(String key);

    void set(String key, String value);

    /**
     * Returns the Redis type name of the value at {@code key}, {@code none} if absent.
     */
    String type(String key);

    void del(String key);

    @Override
    void close();
}
