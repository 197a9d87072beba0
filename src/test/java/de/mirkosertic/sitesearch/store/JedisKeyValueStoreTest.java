package de.mirkosertic.sitesearch.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JedisKeyValueStore Tests")
class JedisKeyValueStoreTest {

    private JedisPooled jedis;
    private JedisKeyValueStore store;

    @BeforeEach
    void setUp() {
        jedis = mock(JedisPooled.class);
        store = new JedisKeyValueStore(jedis);
    }

    @Test
    @DisplayName("Should delegate set commands to Redis")
    void shouldDelegateSetCommands() {
        when(jedis.sadd("urls:to_crawl", "https://example.com/")).thenReturn(1L);
        when(jedis.smembers("urls:to_crawl")).thenReturn(Set.of("https://example.com/"));

        assertThat(store.sadd("urls:to_crawl", "https://example.com/")).isEqualTo(1L);
        assertThat(store.smembers("urls:to_crawl")).containsExactly("https://example.com/");
    }

    @Test
    @DisplayName("SADD without members should not reach Redis")
    void shouldSkipEmptySadd() {
        assertThat(store.sadd("urls:to_crawl")).isZero();

        verify(jedis, never()).sadd(anyString(), any(String[].class));
    }

    @Test
    @DisplayName("Connection failures should surface as StoreUnavailableException")
    void shouldMapConnectionFailures() {
        when(jedis.hget("urls:visited", "https://example.com/"))
                .thenThrow(new JedisConnectionException("Connection refused"));

        assertThatThrownBy(() -> store.hget("urls:visited", "https://example.com/"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("HGET urls:visited")
                .hasCauseInstanceOf(JedisConnectionException.class);
    }
}
