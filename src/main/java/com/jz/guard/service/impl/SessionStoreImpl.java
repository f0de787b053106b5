package com.jz.guard.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.guard.config.ModerationProperties;
import com.jz.guard.domain.entity.GuardSession;
import com.jz.guard.mapper.GuardSessionMapper;
import com.jz.guard.service.SessionStore;
import com.jz.guard.utils.TextUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionStoreImpl extends ServiceImpl<GuardSessionMapper, GuardSession>
        implements SessionStore {

    private final Clock clock;
    private final ModerationProperties props;

    @Override
    public GuardSession getOrCreate(String identity) {
        GuardSession existing = baseMapper.selectById(identity);
        if (existing != null) return existing;

        LocalDateTime now = LocalDateTime.now(clock);
        GuardSession fresh = GuardSession.builder()
                .identityKey(identity)
                .sessionStart(now)
                .messagesSent(0L)
                .flaggedMessages(0L)
                .warningsIssued(0)
                .lastActivity(now)
                .lastUserAgent("")
                .isBlocked(false)
                .blockReason("")
                .build();
        try {
            baseMapper.insert(fresh);
            log.debug("session created, identity={}", identity);
            return fresh;
        } catch (DuplicateKeyException e) {
            // 并发首条消息：另一个请求先插入了，直接读它的
            return baseMapper.selectById(identity);
        }
    }

    @Override
    public GuardSession find(String identity) {
        return baseMapper.selectById(identity);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public GuardSession recordMessage(String identity, String userAgent) {
        LocalDateTime now = LocalDateTime.now(clock);
        // last_user_agent 列有长度上限，直接调用 gate 的调用方未必截断过
        String ua = TextUtil.truncate(userAgent, props.getMaxUserAgentLength());
        if (baseMapper.incrementMessages(identity, now, ua) == 0) {
            getOrCreate(identity);
            baseMapper.incrementMessages(identity, now, ua);
        }
        return baseMapper.selectById(identity);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public long recordFlag(String identity) {
        // UPDATE 拿到行锁直到提交，随后的 SELECT 读到的就是本次自增后的值
        if (baseMapper.incrementFlagged(identity) == 0) {
            getOrCreate(identity);
            baseMapper.incrementFlagged(identity);
        }
        Long count = baseMapper.selectFlaggedCount(identity);
        return count == null ? 0 : count;
    }
}
