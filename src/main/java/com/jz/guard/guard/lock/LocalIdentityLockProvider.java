package com.jz.guard.guard.lock;

import com.jz.guard.config.LockProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单实例部署：固定数量的分段可重入锁，identity 按 hash 落到某一段。
 * 哈希碰撞的两个 identity 只是偶尔串行，不影响正确性。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "guard.lock", name = "provider", havingValue = "local", matchIfMissing = true)
public class LocalIdentityLockProvider implements IdentityLockProvider {

    private final ReentrantLock[] stripes;
    private final long acquireTimeoutMs;

    public LocalIdentityLockProvider(LockProperties props) {
        int n = Math.max(1, props.getStripes());
        this.stripes = new ReentrantLock[n];
        for (int i = 0; i < n; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.acquireTimeoutMs = props.getAcquireTimeoutMs();
    }

    @Override
    public IdentityLock acquire(String identity) {
        ReentrantLock lock = stripes[Math.floorMod(identity.hashCode(), stripes.length)];
        boolean ok;
        try {
            ok = lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityLockException("interrupted while waiting for identity lock", e);
        }
        if (!ok) {
            log.warn("identity lock timeout after {}ms, identity={}", acquireTimeoutMs, identity);
            throw new IdentityLockException("identity lock timeout: " + identity);
        }
        return new StripeLock(identity, lock);
    }

    private record StripeLock(String identity, ReentrantLock lock) implements IdentityLock {
        @Override
        public void close() {
            lock.unlock();
        }
    }
}
