package com.jz.guard.guard;

import com.jz.guard.domain.dto.ConfigPatchDTO;
import com.jz.guard.domain.entity.GuardSession;
import com.jz.guard.domain.entity.ModerationAction;
import com.jz.guard.service.BlockLedger;
import com.jz.guard.service.SessionStore;
import com.jz.guard.support.GuardIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class ModerationGateIntegrationTest extends GuardIntegrationTest {

    @Autowired
    ModerationGate gate;

    @Autowired
    SessionStore sessionStore;

    @Autowired
    BlockLedger blockLedger;

    private Decision send(String identity, String text) {
        return gate.moderate(new IdentityContext(identity, "junit-agent"), text);
    }

    @Test
    void repeatedDenylistHitsAutoBlockAtThreshold() {
        configStore.update(ConfigPatchDTO.builder().autoBlockThreshold(2).build());

        Decision first = send("Z", "let me hack this");
        assertThat(first.getReason()).isEqualTo(DecisionReason.CONTENT_FLAGGED);
        assertThat(first.getFlags()).containsExactly("inappropriate_language");
        assertThat(sessionStore.find("Z").getFlaggedMessages()).isEqualTo(1L);
        assertThat(blockLedger.isBlocked("Z").blocked()).isFalse();

        Decision second = send("Z", "hack again");
        assertThat(second.getReason()).isEqualTo(DecisionReason.CONTENT_FLAGGED);
        GuardSession session = sessionStore.find("Z");
        assertThat(session.getFlaggedMessages()).isEqualTo(2L);
        assertThat(session.getIsBlocked()).isTrue();
        assertThat(session.getBlockReason()).isEqualTo("Auto-blocked after 2 flagged messages");

        Decision third = send("Z", "hello there");
        assertThat(third.getReason()).isEqualTo(DecisionReason.USER_BLOCKED);
        assertThat(third.getMessage()).endsWith("Auto-blocked after 2 flagged messages");

        List<ModerationAction> history = blockLedger.history("Z");
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getActor()).isEqualTo(ModerationAction.ACTOR_SYSTEM);
        assertThat(history.get(0).getExpiresAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 8, 0));
    }

    @Test
    void fourthMessageInWindowIsRateLimited() {
        configStore.update(ConfigPatchDTO.builder().maxMessagesPerWindow(3).windowMinutes(60).build());

        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofMinutes(5));
            assertThat(send("10.1.1.1", "hello " + i).isAllowed()).isTrue();
        }
        Decision fourth = send("10.1.1.1", "one more");

        assertThat(fourth.isAllowed()).isFalse();
        assertThat(fourth.getReason()).isEqualTo(DecisionReason.RATE_LIMITED);
        assertThat(fourth.getRetryAfter()).isEqualTo(3600L);
        assertThat(fourth.getMessage()).isEqualTo("Rate limit exceeded: 3 messages in last 60 minutes");
        // 被限流的消息不入日志
        assertThat(countRows("guard_message_log", "10.1.1.1")).isEqualTo(3);
    }

    @Test
    void windowSlidesWithTheClock() {
        configStore.update(ConfigPatchDTO.builder().maxMessagesPerWindow(2).windowMinutes(10).build());

        assertThat(send("10.1.1.2", "a").isAllowed()).isTrue();
        clock.advance(Duration.ofMinutes(6));
        assertThat(send("10.1.1.2", "b").isAllowed()).isTrue();
        assertThat(send("10.1.1.2", "c").getRetryAfter()).isEqualTo(600L);

        clock.advance(Duration.ofMinutes(5));
        assertThat(send("10.1.1.2", "d").isAllowed()).isTrue();
    }

    @Test
    void sessionCounterMatchesLoggedRows() {
        configStore.update(ConfigPatchDTO.builder().maxMessagesPerWindow(4).autoBlockThreshold(100).build());

        send("10.2.0.1", "hello");
        send("10.2.0.1", "buy now, limited offer");
        send("10.2.0.1", "hello again");
        send("10.2.0.1", "fine");
        send("10.2.0.1", "rate limited, never logged");

        assertThat(sessionStore.find("10.2.0.1").getMessagesSent()).isEqualTo(4L);
        assertThat(countRows("guard_message_log", "10.2.0.1")).isEqualTo(4);
        Long flaggedRows = jdbc.queryForObject(
                "SELECT COUNT(*) FROM guard_message_log WHERE identity_key = ? AND is_flagged = TRUE",
                Long.class, "10.2.0.1");
        assertThat(flaggedRows).isEqualTo(1L);
    }

    @Test
    void approvedDecisionCarriesSessionSnapshot() {
        Decision d = send("10.3.0.1", "hello world");

        assertThat(d.isAllowed()).isTrue();
        assertThat(d.getSessionInfo().getMessagesSent()).isEqualTo(1L);
        assertThat(d.getSessionInfo().getUserAgent()).isEqualTo("junit-agent");
        assertThat(d.getSessionInfo().getIsBlocked()).isFalse();
    }

    @Test
    void oversizedUserAgentIsTruncatedNotRejected() {
        Decision d = gate.moderate(new IdentityContext("10.3.0.2", "x".repeat(600)), "hello world");

        assertThat(d.getReason()).isEqualTo(DecisionReason.APPROVED);
        assertThat(d.getSessionInfo().getUserAgent()).hasSize(500);
        assertThat(sessionStore.find("10.3.0.2").getLastUserAgent()).hasSize(500);
        String logged = jdbc.queryForObject(
                "SELECT user_agent FROM guard_message_log WHERE identity_key = ?", String.class, "10.3.0.2");
        assertThat(logged).hasSize(500);
    }

    @Test
    void concurrentSendsFromOneIdentityAreAllCounted() throws Exception {
        int n = 20;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Decision>> tasks = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                String text = i % 2 == 0 ? "hello " + i : "hack " + i;
                tasks.add(() -> send("10.9.9.9", text));
            }
            List<Future<Decision>> results = pool.invokeAll(tasks);
            for (Future<Decision> f : results) {
                assertThat(f.get().getReason()).isNotEqualTo(DecisionReason.INTERNAL_ERROR);
            }
        } finally {
            pool.shutdownNow();
        }

        GuardSession s = sessionStore.find("10.9.9.9");
        long logged = countRows("guard_message_log", "10.9.9.9");
        assertThat(s.getMessagesSent()).isEqualTo(logged);
        // 阈值 5：第 5 次命中即封禁，之后的请求在第一步就被拒绝
        assertThat(s.getFlaggedMessages()).isEqualTo(5L);
        assertThat(countRows("guard_moderation_action", "10.9.9.9")).isEqualTo(1);
    }
}
