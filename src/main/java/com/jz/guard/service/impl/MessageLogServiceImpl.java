package com.jz.guard.service.impl;


import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.guard.config.ModerationProperties;
import com.jz.guard.domain.entity.MessageLog;
import com.jz.guard.mapper.MessageLogMapper;
import com.jz.guard.service.MessageLogService;
import com.jz.guard.utils.TextUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageLogServiceImpl extends ServiceImpl<MessageLogMapper, MessageLog>
        implements MessageLogService {

    private final ModerationProperties props;

    @Override
    public MessageLog append(String identity, String content, boolean flagged, List<String> flagReasons,
                             String userAgent, int responseTimeMs) {
        MessageLog entry = MessageLog.builder()
                .identityKey(identity)
                .messageContent(TextUtil.truncate(content, props.getMaxStoredContentLength()))
                .isFlagged(flagged)
                .flagReasons(List.copyOf(flagReasons))
                .userAgent(TextUtil.truncate(userAgent, props.getMaxUserAgentLength()))
                .responseTimeMs(responseTimeMs)
                .build();
        try {
            this.save(entry);
        } catch (Exception e) {
            log.error("append message log failed, identity={}, err={}", identity, e.getMessage(), e);
            throw e;
        }
        return entry;
    }

    @Override
    public long countSince(String identity, LocalDateTime since) {
        return baseMapper.countSince(identity, since);
    }

    @Override
    public long countFor(String identity, boolean flaggedOnly) {
        return lambdaQuery()
                .eq(MessageLog::getIdentityKey, identity)
                .eq(flaggedOnly, MessageLog::getIsFlagged, true)
                .count();
    }

    @Override
    public long countAll(boolean flaggedOnly) {
        return lambdaQuery()
                .eq(flaggedOnly, MessageLog::getIsFlagged, true)
                .count();
    }

    @Override
    public List<MessageLog> recent(LocalDateTime since, int limit) {
        return lambdaQuery()
                .gt(MessageLog::getCreatedAt, since)
                .orderByDesc(MessageLog::getCreatedAt)
                .orderByDesc(MessageLog::getId)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }
}
