package com.jz.guard.guard.lock;

/**
 * 按 identity 加锁。不同 identity 之间互不阻塞，不存在全局锁。
 */
public interface IdentityLockProvider {

    /**
     * 阻塞直到拿到锁或超时。
     *
     * @throws IdentityLockException 超时或等待时被中断
     */
    IdentityLock acquire(String identity);
}
