package com.jz.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "guard.lock")
public class LockProperties {

    /** local = 单实例进程内分段锁；redis = 多实例共享同一存储时使用 */
    private String provider = "local";

    /** 本地分段锁数量 */
    private int stripes = 256;

    /** 拿锁最长等待时间，超时按 internal_error 拒绝 */
    private long acquireTimeoutMs = 3000;

    /** Redis 锁 TTL，看门狗每 ttl/3 续期 */
    private long ttlMs = 10_000;

    private long renewInitialDelayMs = 0;

    private long minRenewIntervalMs = 1000;

    private long retryIntervalMs = 25;

    private String keyPrefix = "guard:lock:identity:";
}
