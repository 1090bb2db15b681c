package com.study.webflux.funnel.infrastructure.ratelimit.adapter;

import java.time.Duration;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.generation.port.RateLimitPort;
import reactor.core.publisher.Mono;

/**
 * Redis 고정 윈도우 카운터로 요청 빈도를 제한합니다.
 *
 * <p>
 * 증가와 만료 설정은 하나의 Lua 스크립트로 원자적으로 실행합니다. 만료 시간이 없는 키를 만나면 그 자리에서 다시 설정하므로 카운터가 영구히 남지 않습니다.
 * Redis 장애 시에는 생성 요청을 막지 않도록 허용으로 처리합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisRateLimitAdapter implements RateLimitPort {

	private static final String KEY_PREFIX = "ratelimit:";

	static final RedisScript<Long> INCREMENT_WITH_EXPIRY = RedisScript.of("""
		local count = redis.call('INCR', KEYS[1])
		if redis.call('PTTL', KEYS[1]) < 0 then
			redis.call('PEXPIRE', KEYS[1], ARGV[1])
		end
		return count
		""", Long.class);

	private final ReactiveRedisTemplate<String, Long> redisTemplate;

	private String keyFor(String identifier) {
		return KEY_PREFIX + identifier;
	}

	@Override
	public Mono<Boolean> tryAcquire(String identifier, int limit, Duration window) {
		String key = keyFor(identifier);
		return redisTemplate.execute(INCREMENT_WITH_EXPIRY, List.of(key), List.of(window.toMillis()))
			.next()
			.map(count -> count <= limit)
			.defaultIfEmpty(true)
			.onErrorResume(error -> {
				log.warn("요청 빈도 제한 확인 실패, 요청 허용 - identifier={}: {}", identifier,
					error.toString());
				return Mono.just(true);
			});
	}
}
