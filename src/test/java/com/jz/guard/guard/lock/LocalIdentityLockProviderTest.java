package com.jz.guard.guard.lock;

import com.jz.guard.config.LockProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalIdentityLockProviderTest {

    private static LocalIdentityLockProvider provider(int stripes, long timeoutMs) {
        LockProperties props = new LockProperties();
        props.setStripes(stripes);
        props.setAcquireTimeoutMs(timeoutMs);
        return new LocalIdentityLockProvider(props);
    }

    @Test
    void secondHolderOfSameIdentityTimesOut() throws Exception {
        LocalIdentityLockProvider provider = provider(16, 50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> owner = CompletableFuture.runAsync(() -> {
            try (IdentityLock ignored = provider.acquire("10.0.0.1")) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> provider.acquire("10.0.0.1"))
                .isInstanceOf(IdentityLockException.class)
                .hasMessageContaining("10.0.0.1");

        release.countDown();
        owner.get(5, TimeUnit.SECONDS);
        try (IdentityLock lock = provider.acquire("10.0.0.1")) {
            assertThat(lock.identity()).isEqualTo("10.0.0.1");
        }
    }

    @Test
    void differentIdentitiesDoNotWaitOnEachOther() throws Exception {
        // "a" 和 "b" 的 hashCode 相邻，256 段下落在不同段
        LocalIdentityLockProvider provider = provider(256, 50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> owner = CompletableFuture.runAsync(() -> {
            try (IdentityLock ignored = provider.acquire("a")) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try (IdentityLock lock = provider.acquire("b")) {
            assertThat(lock.identity()).isEqualTo("b");
        } finally {
            release.countDown();
        }
        owner.get(5, TimeUnit.SECONDS);
    }
}
