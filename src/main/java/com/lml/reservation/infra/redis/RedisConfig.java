package com.lml.reservation.infra.redis;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;

/**
 * 좌석 선점 Lua 스크립트. 캐시를 켰을 때만 올라온다.
 * StringRedisTemplate 은 Boot 자동 설정을 그대로 쓴다.
 */
@Configuration
@ConditionalOnProperty(name = "ticketing.hold.cache.enabled", havingValue = "true")
public class RedisConfig {

    @Bean
    @SuppressWarnings({"unchecked", "rawtypes"})
    public DefaultRedisScript<List<Long>> seatLockScript() {
        DefaultRedisScript script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("redis/seat_lock.lua"));
        script.setResultType(List.class);
        return script;
    }

    @Bean
    public DefaultRedisScript<Long> seatReleaseScript() {
        return longScript("redis/seat_release.lua");
    }

    @Bean
    public DefaultRedisScript<Long> seatExtendScript() {
        return longScript("redis/seat_extend.lua");
    }

    private static DefaultRedisScript<Long> longScript(String location) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(location));
        script.setResultType(Long.class);
        return script;
    }
}
