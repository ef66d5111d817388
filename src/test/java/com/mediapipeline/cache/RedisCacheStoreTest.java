package com.mediapipeline.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private RedisTemplate<String, byte[]> redisTemplate;

    @Mock
    private RedisConnectionFactory connectionFactory;

    @Mock
    private ValueOperations<String, byte[]> valueOperations;

    @Test
    void failedPingLeavesCacheUnavailable() {
        when(redisTemplate.getRequiredConnectionFactory()).thenReturn(connectionFactory);
        when(connectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("refused"));
        RedisCacheStore store = new RedisCacheStore(redisTemplate, true, Duration.ofMinutes(30));

        store.init();

        assertThat(store.isAvailable()).isFalse();
    }

    @Test
    void disabledCacheNeverConnects() {
        RedisCacheStore store = new RedisCacheStore(redisTemplate, false, Duration.ofMinutes(30));

        store.init();

        assertThat(store.isAvailable()).isFalse();
        verifyNoInteractions(redisTemplate);
    }

    @Test
    void setUsesConfiguredTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        RedisCacheStore store = new RedisCacheStore(redisTemplate, true, Duration.ofMinutes(30));

        store.set("media:segment:abc123:x.ts", new byte[]{1});

        verify(valueOperations).set("media:segment:abc123:x.ts", new byte[]{1}, Duration.ofMinutes(30));
    }
}
