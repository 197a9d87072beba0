package de.mirkosertic.sitesearch.store;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local {@link KeyValueStore} for development and tests.
 * <p>
 * Mirrors the Redis semantics the crawler relies on: per-key atomic operations, a type
 * per key, and a {@code WRONGTYPE} error when an operation hits a key of another type.
 * Errors surface as {@link StoreUnavailableException}, like in {@link JedisKeyValueStore}.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, Object> data = new ConcurrentHashMap<>();

    @Override
    public long sadd(final String key, final String... members) {
        final long[] added = new long[1];
        data.compute(key, (k, existing) -> {
            final Set<String> set = existing == null ? ConcurrentHashMap.newKeySet() : asSet(k, existing);
            for (final String member : members) {
                if (set.add(member)) {
                    added[0]++;
                }
            }
            return set;
        });
        return added[0];
    }

    @Override
    public Set<String> smembers(final String key) {
        final Object value = data.get(key);
        return value == null ? Set.of() : Set.copyOf(asSet(key, value));
    }

    @Override
    public void hset(final String key, final String field, final String value) {
        data.compute(key, (k, existing) -> {
            final Map<String, String> hash = existing == null ? new ConcurrentHashMap<>() : asHash(k, existing);
            hash.put(field, value);
            return hash;
        });
    }

    @Override
    @Nullable
    public String hget(final String key, final String field) {
        final Object value = data.get(key);
        return value == null ? null : asHash(key, value).get(field);
    }

    @Override
    @Nullable
    public String get(final String key) {
        final Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw wrongType(key);
    }

    @Override
    public void set(final String key, final String value) {
        data.put(key, value);
    }

    @Override
    public String type(final String key) {
        final Object value = data.get(key);
        if (value == null) {
            return TYPE_NONE;
        }
        if (value instanceof String) {
            return TYPE_STRING;
        }
        if (value instanceof Set) {
            return TYPE_SET;
        }
        return TYPE_HASH;
    }

    @Override
    public void del(final String key) {
        data.remove(key);
    }

    @Override
    public void close() {
        data.clear();
    }

    @SuppressWarnings("unchecked")
    private static Set<String> asSet(final String key, final Object value) {
        if (value instanceof Set) {
            return (Set<String>) value;
        }
        throw wrongType(key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> asHash(final String key, final Object value) {
        if (value instanceof Map) {
            return (Map<String, String>) value;
        }
        throw wrongType(key);
    }

    private static StoreUnavailableException wrongType(final String key) {
        return new StoreUnavailableException("WRONGTYPE Operation against a key holding the wrong kind of value: " + key);
    }
}
