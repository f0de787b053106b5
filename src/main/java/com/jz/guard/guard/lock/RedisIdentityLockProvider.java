package com.jz.guard.guard.lock;

import com.jz.guard.config.LockProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * 多实例部署：SET NX PX 抢锁 + Lua 比对 token 解锁/续期 + 看门狗续期。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "guard.lock", name = "provider", havingValue = "redis")
public class RedisIdentityLockProvider implements IdentityLockProvider {

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> unlockScript;
    private final DefaultRedisScript<Long> renewScript;
    private final ScheduledExecutorService scheduler;
    private final LockProperties props;

    public RedisIdentityLockProvider(
            StringRedisTemplate redis,
            @Qualifier("unlockScript") DefaultRedisScript<Long> unlockScript,
            @Qualifier("renewScript") DefaultRedisScript<Long> renewScript,
            @Qualifier("lockRenewScheduler") ScheduledExecutorService lockRenewScheduler,
            LockProperties props
    ) {
        this.redis = redis;
        this.unlockScript = unlockScript;
        this.renewScript = renewScript;
        this.scheduler = lockRenewScheduler;
        this.props = props;
    }

    @Override
    public IdentityLock acquire(String identity) {
        String key = props.getKeyPrefix() + identity;
        long deadline = System.currentTimeMillis() + props.getAcquireTimeoutMs();
        while (true) {
            LockSession session = tryAcquire(identity, key, props.getTtlMs());
            if (session != null) {
                session.startWatchdog();
                return session;
            }
            if (System.currentTimeMillis() >= deadline) {
                log.warn("redis identity lock timeout, key={}", key);
                throw new IdentityLockException("identity lock timeout: " + identity);
            }
            try {
                Thread.sleep(props.getRetryIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IdentityLockException("interrupted while waiting for identity lock", e);
            }
        }
    }

    /** 尝试加锁（SET NX PX）成功则返回会话；失败返回 null */
    LockSession tryAcquire(String identity, String key, long ttlMs) {
        String token = UUID.randomUUID().toString();
        Boolean ok = redis.opsForValue().setIfAbsent(key, token, ttlMs, TimeUnit.MILLISECONDS);
        if (!Boolean.TRUE.equals(ok)) return null;
        return new LockSession(identity, key, token, ttlMs);
    }

    @Getter
    public class LockSession implements IdentityLock {
        private final String identity;
        private final String key;
        private final String token;
        private final long ttlMs;
        private volatile ScheduledFuture<?> renewTask;
        private volatile boolean closed = false;

        private LockSession(String identity, String key, String token, long ttlMs) {
            this.identity = identity;
            this.key = key;
            this.token = token;
            this.ttlMs = ttlMs;
        }

        @Override
        public String identity() {
            return identity;
        }

        /** 启动看门狗（每 ttl/3 续期一次） */
        void startWatchdog() {
            long period = Math.max(props.getMinRenewIntervalMs(), ttlMs / 3);
            long initial = Math.max(0, props.getRenewInitialDelayMs());
            // 轻微抖动，避免羊群效应
            long jitter = ThreadLocalRandom.current().nextLong(Math.max(1, period / 10));
            long firstDelay = Math.max(initial + jitter, period);

            this.renewTask = scheduler.scheduleAtFixedRate(() -> {
                try {
                    Long res = redis.execute(renewScript,
                            Collections.singletonList(key),
                            token,
                            String.valueOf(ttlMs));
                    if (res == null || res == 0L) {
                        // 锁不再属于当前持有者或已过期
                        cancelRenewal();
                        log.warn("identity lock renew failed (lost ownership), key={}", key);
                    }
                } catch (Exception e) {
                    // 出错不立刻退出，等待下个周期再试
                    log.debug("identity lock renew exception key={}, err={}", key, e.toString());
                }
            }, firstDelay, period, TimeUnit.MILLISECONDS);
        }

        /** 取消续期任务（仅停止调度，不释放锁） */
        void cancelRenewal() {
            ScheduledFuture<?> t = this.renewTask;
            if (t != null) t.cancel(false);
            this.renewTask = null;
        }

        /** 关闭会话：取消续期并原子解锁（compare token + DEL） */
        @Override
        public void close() {
            if (closed) return;
            closed = true;
            cancelRenewal();
            try {
                Long res = redis.execute(unlockScript, Collections.singletonList(key), token);
                if (res == null || res < 0L) {
                    log.warn("identity lock already expired before release, key={}", key);
                } else if (res == 0L) {
                    log.warn("identity lock taken over by another holder before release, key={}", key);
                }
            } catch (Exception e) {
                // 释放失败只会让锁等到 TTL 自然过期
                log.warn("identity lock release failed, key={}, err={}", key, e.toString());
            }
        }
    }
}
