package com.jz.guard.service.impl;

import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import com.jz.guard.domain.entity.GuardSession;
import com.jz.guard.domain.entity.ModerationAction;
import com.jz.guard.guard.BlockStatus;
import com.jz.guard.mapper.GuardSessionMapper;
import com.jz.guard.mapper.ModerationActionMapper;
import com.jz.guard.service.BlockLedger;
import com.jz.guard.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BlockLedgerImpl implements BlockLedger {

    static final String REASON_EXPIRED = "Block expired";
    static final String REASON_MANUAL_UNBLOCK = "Manual unblock";

    private final GuardSessionMapper sessionMapper;
    private final ModerationActionMapper actionMapper;
    private final SessionStore sessionStore;
    private final Clock clock;

    @Transactional(rollbackFor = Exception.class)
    @Override
    public BlockStatus isBlocked(String identity) {
        GuardSession s = sessionMapper.selectById(identity);
        if (s == null || !Boolean.TRUE.equals(s.getIsBlocked())) {
            return BlockStatus.notBlocked();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (isExpired(s, now)) {
            // 条件更新：只有仍然"已封且过期"时才生效，并发读者只有一个拿到 1
            if (sessionMapper.expireBlock(identity, now) == 1) {
                appendAction(identity, ModerationAction.UNBLOCK, REASON_EXPIRED, ModerationAction.ACTOR_AUTO_EXPIRE, null);
                log.info("block expired, auto unblocked identity={}", identity);
                return BlockStatus.notBlocked();
            }
            // 别人已经解封，或者刚好又被重新封禁：重读一次
            s = sessionMapper.selectById(identity);
            if (s == null || !Boolean.TRUE.equals(s.getIsBlocked()) || isExpired(s, now)) {
                return BlockStatus.notBlocked();
            }
        }
        return BlockStatus.blocked(s.getBlockReason(), s.getBlockExpires());
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public ModerationAction block(String identity, String reason, int durationHours, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("block reason must not be empty");
        }
        LocalDateTime expires = durationHours > 0 ? LocalDateTime.now(clock).plusHours(durationHours) : null;
        // 允许预先封禁从未出现过的 identity
        sessionStore.getOrCreate(identity);
        sessionMapper.applyBlock(identity, reason, expires);
        log.info("identity blocked, identity={}, actor={}, expires={}, reason={}",
                identity, actor, expires == null ? "never" : expires, reason);
        return appendAction(identity, ModerationAction.BLOCK, reason, actor, expires);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public ModerationAction unblock(String identity, String actor) {
        int rows = sessionMapper.clearBlock(identity);
        log.info("identity unblocked, identity={}, actor={}, sessionFound={}", identity, actor, rows > 0);
        return appendAction(identity, ModerationAction.UNBLOCK, REASON_MANUAL_UNBLOCK, actor, null);
    }

    @Override
    public List<ModerationAction> history(String identity) {
        return actionMapper.selectList(Wrappers.<ModerationAction>lambdaQuery()
                .eq(ModerationAction::getIdentityKey, identity)
                .orderByAsc(ModerationAction::getId));
    }

    private static boolean isExpired(GuardSession s, LocalDateTime now) {
        return s.getBlockExpires() != null && now.isAfter(s.getBlockExpires());
    }

    private ModerationAction appendAction(String identity, String type, String reason, String actor,
                                          LocalDateTime expiresAt) {
        ModerationAction action = ModerationAction.builder()
                .identityKey(identity)
                .actionType(type)
                .reason(reason)
                .actor(actor)
                .expiresAt(expiresAt)
                .build();
        actionMapper.insert(action);
        return action;
    }
}
