package de.mirkosertic.sitesearch.store;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis backed {@link KeyValueStore} using a pooled Jedis client.
 * Jedis failures are rethrown as {@link StoreUnavailableException}.
 */
public class JedisKeyValueStore implements KeyValueStore {

    private static final Logger logger = LoggerFactory.getLogger(JedisKeyValueStore.class);

    private final JedisPooled jedis;

    public JedisKeyValueStore(final String redisUrl) {
        this(new JedisPooled(URI.create(redisUrl)));
        logger.info("Connected key-value store to {}", URI.create(redisUrl).getHost());
    }

    JedisKeyValueStore(final JedisPooled jedis) {
        this.jedis = jedis;
    }

    @Override
    public long sadd(final String key, final String... members) {
        if (members.length == 0) {
            return 0;
        }
        return call("SADD", key, () -> jedis.sadd(key, members));
    }

    @Override
    public Set<String> smembers(final String key) {
        return call("SMEMBERS", key, () -> jedis.smembers(key));
    }

    @Override
    public void hset(final String key, final String field, final String value) {
        call("HSET", key, () -> jedis.hset(key, field, value));
    }

    @Override
    @Nullable
    public String hget(final String key, final String field) {
        return call("HGET", key, () -> jedis.hget(key, field));
    }

    @Override
    @Nullable
    public String get(final String key) {
        return call("GET", key, () -> jedis.get(key));
    }

    @Override
    public void set(final String key, final String value) {
        call("SET", key, () -> jedis.set(key, value));
    }

    @Override
    public String type(final String key) {
        return call("TYPE", key, () -> jedis.type(key));
    }

    @Override
    public void del(final String key) {
        call("DEL", key, () -> jedis.del(key));
    }

    @Override
    public void close() {
        jedis.close();
    }

    private <T> T call(final String command, final String key, final Supplier<T> operation) {
        try {
            return operation.get();
        } catch (final JedisException e) {
            throw new StoreUnavailableException(command + " " + key + " failed: " + e.getMessage(), e);
        }
    }
}
