package com.lml.reservation.infra.redis;

import com.lml.reservation.domain.hold.SeatLockStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Redis 좌석 선점. 여러 좌석을 Lua 한 번으로 all-or-nothing 처리한다.
 *
 * 키: seat:lock:{showId}:seatId (hash tag 로 같은 공연 좌석을 한 슬롯에 모은다)
 * 값: 홀드 요청 세션 토큰
 *
 * Redis 장애는 선점 실패로 보지 않는다. 판정은 DB 가 하므로 캐시 없이 진행한다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ticketing.hold.cache.enabled", havingValue = "true")
public class RedisSeatLockStore implements SeatLockStore {

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List<Long>> seatLockScript;
    private final DefaultRedisScript<Long> seatReleaseScript;
    private final DefaultRedisScript<Long> seatExtendScript;

    public RedisSeatLockStore(StringRedisTemplate redisTemplate,
                              @Qualifier("seatLockScript") DefaultRedisScript<List<Long>> seatLockScript,
                              @Qualifier("seatReleaseScript") DefaultRedisScript<Long> seatReleaseScript,
                              @Qualifier("seatExtendScript") DefaultRedisScript<Long> seatExtendScript) {
        this.redisTemplate = redisTemplate;
        this.seatLockScript = seatLockScript;
        this.seatReleaseScript = seatReleaseScript;
        this.seatExtendScript = seatExtendScript;
    }

    static String seatLockKey(long showId, long seatId) {
        return "seat:lock:{" + showId + "}:" + seatId;
    }

    @Override
    public Set<Long> lockSeats(long showId, Collection<Long> seatIds, String owner, long ttlSeconds) {
        List<Long> ordered = new ArrayList<>(new TreeSet<>(seatIds));
        List<String> keys = keys(showId, ordered);

        List<Long> conflictIndexes;
        try {
            conflictIndexes = redisTemplate.execute(seatLockScript, keys, owner, String.valueOf(ttlSeconds));
        } catch (DataAccessException e) {
            log.warn("seat lock cache unavailable, falling through to db. showId={}, err={}", showId, e.toString());
            return Set.of();
        }

        Set<Long> conflicts = new TreeSet<>();
        if (conflictIndexes != null) {
            for (Long idx : conflictIndexes) {
                // Lua 배열은 1부터
                conflicts.add(ordered.get(idx.intValue() - 1));
            }
        }
        return conflicts;
    }

    @Override
    public void releaseSeats(long showId, Collection<Long> seatIds, String owner) {
        try {
            redisTemplate.execute(seatReleaseScript, keys(showId, seatIds), owner);
        } catch (DataAccessException e) {
            // 키는 TTL 로 사라진다
            log.warn("seat lock release failed. showId={}, seatIds={}, err={}", showId, seatIds, e.toString());
        }
    }

    @Override
    public void extendSeats(long showId, Collection<Long> seatIds, String owner, long ttlSeconds) {
        try {
            redisTemplate.execute(seatExtendScript, keys(showId, seatIds), owner, String.valueOf(ttlSeconds));
        } catch (DataAccessException e) {
            log.warn("seat lock extend failed. showId={}, seatIds={}, err={}", showId, seatIds, e.toString());
        }
    }

    private static List<String> keys(long showId, Collection<Long> seatIds) {
        return seatIds.stream().sorted().map(id -> seatLockKey(showId, id)).toList();
    }
}
