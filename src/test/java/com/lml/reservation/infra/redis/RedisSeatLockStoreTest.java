package com.lml.reservation.infra.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RedisSeatLockStoreTest {

    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);

    @SuppressWarnings({"unchecked", "rawtypes"})
    private final DefaultRedisScript<List<Long>> lockScript = new DefaultRedisScript(
            "return {}", List.class);
    private final DefaultRedisScript<Long> releaseScript = new DefaultRedisScript<>("return 0", Long.class);
    private final DefaultRedisScript<Long> extendScript = new DefaultRedisScript<>("return 0", Long.class);

    private RedisSeatLockStore store;

    @BeforeEach
    void setUp() {
        store = new RedisSeatLockStore(redisTemplate, lockScript, releaseScript, extendScript);
    }

    @Test
    void seatLockKey_groupsShowInHashTag() {
        assertThat(RedisSeatLockStore.seatLockKey(7L, 42L)).isEqualTo("seat:lock:{7}:42");
    }

    @Test
    @DisplayName("Lua 가 돌려준 1-based 인덱스를 정렬된 seatId 로 되돌린다")
    void lockSeats_mapsConflictIndexesToSortedSeatIds() {
        List<String> keys = List.of("seat:lock:{1}:10", "seat:lock:{1}:20", "seat:lock:{1}:30");
        given(redisTemplate.execute(eq(lockScript), eq(keys), eq("sess-1"), eq("900")))
                .willReturn(List.of(2L));

        Set<Long> conflicts = store.lockSeats(1L, Set.of(30L, 10L, 20L), "sess-1", 900);

        assertThat(conflicts).containsExactly(20L);
    }

    @Test
    @DisplayName("전부 잠기면 빈 집합")
    void lockSeats_allAcquired() {
        given(redisTemplate.execute(eq(lockScript), anyList(), any(), any())).willReturn(List.of());

        assertThat(store.lockSeats(1L, Set.of(1L, 2L), "sess-1", 900)).isEmpty();
    }

    @Test
    @DisplayName("Redis 장애는 충돌이 아니라 DB 로 넘긴다")
    void lockSeats_redisDown_fallsThrough() {
        given(redisTemplate.execute(eq(lockScript), anyList(), any(), any()))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(store.lockSeats(1L, Set.of(1L, 2L), "sess-1", 900)).isEmpty();
    }

    @Test
    void releaseAndExtend_passOwnerAndSortedKeys() {
        List<String> keys = List.of("seat:lock:{1}:1", "seat:lock:{1}:2");

        store.releaseSeats(1L, Set.of(2L, 1L), "sess-1");
        store.extendSeats(1L, Set.of(2L, 1L), "sess-1", 60);

        verify(redisTemplate).execute(releaseScript, keys, "sess-1");
        verify(redisTemplate).execute(extendScript, keys, "sess-1", "60");
    }

    @Test
    @DisplayName("release 실패는 삼킨다 (키는 TTL 로 사라진다)")
    void release_redisDown_doesNotThrow() {
        given(redisTemplate.execute(eq(releaseScript), anyList(), any()))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        store.releaseSeats(1L, Set.of(1L), "sess-1");
    }
}
