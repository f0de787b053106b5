package com.jz.guard.guard;

import com.jz.guard.service.MessageLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 滑动窗口限流：每次调用按当前时间统计最近 window_minutes 内的日志条数。
 * 在本条消息入库之前调用，所以本条不计入自身。
 */
@Component
@RequiredArgsConstructor
public class RateLimiter {

    private final MessageLogService messageLogService;
    private final ModerationConfigStore configStore;
    private final Clock clock;

    public RateLimitResult check(String identity) {
        return check(identity, configStore.current());
    }

    public RateLimitResult check(String identity, ModerationConfig config) {
        LocalDateTime since = LocalDateTime.now(clock).minusMinutes(config.getWindowMinutes());
        long count = messageLogService.countSince(identity, since);
        if (count >= config.getMaxMessagesPerWindow()) {
            return new RateLimitResult(true, count,
                    "Rate limit exceeded: " + count + " messages in last " + config.getWindowMinutes() + " minutes");
        }
        return new RateLimitResult(false, count,
                count + " of " + config.getMaxMessagesPerWindow() + " messages used in last "
                        + config.getWindowMinutes() + " minutes");
    }
}
