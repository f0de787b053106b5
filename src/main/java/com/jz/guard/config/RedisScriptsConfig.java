package com.jz.guard.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@ConditionalOnProperty(prefix = "guard.lock", name = "provider", havingValue = "redis")
public class RedisScriptsConfig {

    /**
     * 解锁：1 = 已释放，0 = 锁已被别的持有者拿走，-1 = 锁已过期不存在。
     */
    @Bean
    public DefaultRedisScript<Long> unlockScript() {
        return longScript("""
                local holder = redis.call('GET', KEYS[1])
                if not holder then
                  return -1
                end
                if holder ~= ARGV[1] then
                  return 0
                end
                return redis.call('DEL', KEYS[1])
                """);
    }

    /** 续期：只有 token 仍是自己时才把 TTL 重置为 ARGV[2] 毫秒，否则返回 0 */
    @Bean
    public DefaultRedisScript<Long> renewScript() {
        return longScript("""
                if redis.call('GET', KEYS[1]) ~= ARGV[1] then
                  return 0
                end
                return redis.call('PEXPIRE', KEYS[1], tonumber(ARGV[2]))
                """);
    }

    private static DefaultRedisScript<Long> longScript(String lua) {
        return new DefaultRedisScript<>(lua, Long.class);
    }

    /** 专用续期线程池（单线程守护），关闭时随容器 shutdown */
    @Bean(name = "lockRenewScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService lockRenewScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lock-renewer");
            t.setDaemon(true);
            return t;
        });
    }
}
