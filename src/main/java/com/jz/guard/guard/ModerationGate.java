package com.jz.guard.guard;

import com.jz.guard.config.IdentityProperties;
import com.jz.guard.domain.entity.GuardSession;
import com.jz.guard.domain.entity.ModerationAction;
import com.jz.guard.domain.vo.SessionSnapshotVO;
import com.jz.guard.guard.lock.IdentityLock;
import com.jz.guard.guard.lock.IdentityLockProvider;
import com.jz.guard.service.BlockLedger;
import com.jz.guard.service.MessageLogService;
import com.jz.guard.service.SessionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * 每条入站消息的准入判定，请求处理层只调用这一个入口。
 *
 * <p>严格线性、遇拒即停：
 * <ol>
 *   <li>是否被封禁（过期的封禁在这里惰性解除）</li>
 *   <li>是否超出滑动窗口配额（只数本条之前的消息）</li>
 *   <li>内容打标</li>
 *   <li>无论是否命中，计数 + 写日志（同一事务）</li>
 *   <li>命中则违规计数 + 1，达到阈值自动封禁</li>
 * </ol>
 *
 * <p>整个流程在 identity 锁内执行，同一 identity 的并发请求串行，不同 identity 互不阻塞。
 * 任何存储/加锁异常都按 internal_error 拒绝，不会默认放行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationGate {

    private final BlockLedger blockLedger;
    private final RateLimiter rateLimiter;
    private final ContentClassifier classifier;
    private final SessionStore sessionStore;
    private final MessageLogService messageLogService;
    private final ModerationConfigStore configStore;
    private final IdentityLockProvider lockProvider;
    private final TransactionTemplate transactionTemplate;
    private final IdentityProperties identityProps;
    private final MeterRegistry meterRegistry;

    private Timer latencyTimer;
    private Counter failClosedCounter;

    @PostConstruct
    void initMetrics() {
        this.latencyTimer = Timer.builder("guard.moderation.latency")
                .description("Latency of one moderation decision, lock wait included")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(meterRegistry);
        this.failClosedCounter = Counter.builder("guard.moderation.fail_closed.count")
                .description("Requests denied because storage or locking failed")
                .register(meterRegistry);
    }

    public Decision moderate(IdentityContext ctx, String text) {
        Decision decision = decide(ctx, text);
        // 按 reason 计数，Counter 由 registry 缓存
        meterRegistry.counter("guard.moderation.decision", "reason", decision.getReason().code()).increment();
        return decision;
    }

    private Decision decide(IdentityContext ctx, String text) {
        if (ctx == null || ctx.identity() == null || ctx.identity().isBlank()) {
            return Decision.invalidInput("Client identity is required");
        }
        if (ctx.identity().length() > identityProps.getMaxLength()) {
            return Decision.invalidInput("Client identity is too long");
        }
        if (text == null || text.isBlank()) {
            return Decision.invalidInput("No message provided");
        }

        String identity = ctx.identity();
        long started = System.nanoTime();
        Timer.Sample sample = Timer.start(meterRegistry);
        try (IdentityLock ignored = lockProvider.acquire(identity)) {
            return evaluate(identity, ctx.userAgent() == null ? "" : ctx.userAgent(), text, started);
        } catch (RuntimeException e) {
            failClosedCounter.increment();
            log.error("moderation failed closed, identity={}, err={}", identity, e.toString(), e);
            return Decision.internalError();
        } finally {
            sample.stop(latencyTimer);
        }
    }

    private Decision evaluate(String identity, String userAgent, String text, long started) {
        // 一次判定内使用同一份配置快照
        ModerationConfig config = configStore.current();

        BlockStatus block = blockLedger.isBlocked(identity);
        if (block.blocked()) {
            log.debug("denied user_blocked, identity={}", identity);
            return Decision.userBlocked(block.reason());
        }

        RateLimitResult rate = rateLimiter.check(identity, config);
        if (rate.limited()) {
            log.info("denied rate_limited, identity={}, count={}", identity, rate.count());
            return Decision.rateLimited(rate.detail(), retryAfterSeconds(config));
        }

        ContentVerdict verdict = classifier.classify(text);

        int elapsedMs = (int) TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        GuardSession session = transactionTemplate.execute(status -> {
            GuardSession s = sessionStore.recordMessage(identity, userAgent);
            messageLogService.append(identity, text, verdict.flagged(),
                    new ArrayList<>(verdict.reasons()), userAgent, elapsedMs);
            return s;
        });

        if (verdict.flagged()) {
            long flagged = sessionStore.recordFlag(identity);
            log.info("message flagged, identity={}, flaggedTotal={}, reasons={}", identity, flagged, verdict.reasons());
            if (flagged >= config.getAutoBlockThreshold()) {
                blockLedger.block(identity, "Auto-blocked after " + flagged + " flagged messages",
                        config.getBlockDurationHours(), ModerationAction.ACTOR_SYSTEM);
            }
            return Decision.contentFlagged(verdict.publicTags());
        }
        return Decision.approved(SessionSnapshotVO.of(session));
    }

    /** 与配置的窗口长度一致；默认 60 分钟即 3600 秒 */
    static long retryAfterSeconds(ModerationConfig config) {
        return config.getWindowMinutes() * 60L;
    }
}
