package com.fabric.shared.saga;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis leases for horizontally scaled runtimes ({@code runtime.lock.mode=redis}).
 *
 * Acquire is SET NX PX with a random owner token; renew and release only touch the key
 * while it still carries that token. The coordinator renews before every WAL append and
 * every {@link #renewInterval()} while it waits on a handler, so a drive longer than one
 * lease keeps the lock for as long as it runs.
 *
 * Key format: lease:execution:{tenantId}:{executionId}
 */
@Slf4j
public class RedisExecutionLocks implements ExecutionLocks {

    private static final String KEY_PREFIX = "lease:execution:";

    private static final RedisScript<Long> RENEW = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end", Long.class);

    private static final RedisScript<Long> RELEASE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) else return 0 end", Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration leaseTtl;

    public RedisExecutionLocks(StringRedisTemplate redisTemplate, Duration leaseTtl) {
        this.redisTemplate = redisTemplate;
        this.leaseTtl = leaseTtl;
    }

    @Override
    public Optional<ExecutionLease> tryAcquire(String tenantId, String executionId) {
        String key = buildKey(tenantId, executionId);
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, token, leaseTtl);
        if (!Boolean.TRUE.equals(acquired)) {
            log.debug("Execution lease held elsewhere: executionId={}", executionId);
            return Optional.empty();
        }
        return Optional.of(new ExecutionLease() {
            @Override
            public boolean renew() {
                Long renewed = redisTemplate.execute(RENEW, List.of(key), token,
                        String.valueOf(leaseTtl.toMillis()));
                if (renewed == null || renewed == 0L) {
                    log.warn("Execution lease lost: executionId={}", executionId);
                    return false;
                }
                return true;
            }

            @Override
            public void close() {
                redisTemplate.execute(RELEASE, List.of(key), token);
            }
        });
    }

    @Override
    public Duration renewInterval() {
        return leaseTtl.dividedBy(3);
    }

    @Override
    public boolean isLeased(String tenantId, String executionId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(tenantId, executionId)));
    }

    private String buildKey(String tenantId, String executionId) {
        return KEY_PREFIX + tenantId + ":" + executionId;
    }
}
