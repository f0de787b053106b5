package com.jz.guard.service.impl;

import com.jz.guard.config.IdentityProperties;
import com.jz.guard.domain.dto.BadWordsDTO;
import com.jz.guard.domain.dto.BlockRequestDTO;
import com.jz.guard.domain.dto.ConfigPatchDTO;
import com.jz.guard.domain.entity.GuardSession;
import com.jz.guard.domain.vo.ActivityVO;
import com.jz.guard.domain.vo.IdentityStatsVO;
import com.jz.guard.domain.vo.ModerationActionVO;
import com.jz.guard.domain.vo.OverallStatsVO;
import com.jz.guard.guard.ContentRuleStore;
import com.jz.guard.guard.ContentRules;
import com.jz.guard.guard.ModerationConfig;
import com.jz.guard.guard.ModerationConfigStore;
import com.jz.guard.mapper.GuardSessionMapper;
import com.jz.guard.service.BlockLedger;
import com.jz.guard.service.MessageLogService;
import com.jz.guard.service.ModerationAdminService;
import com.jz.guard.service.SessionStore;
import com.jz.guard.utils.IdentityResolver;
import com.jz.guard.utils.TextUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationAdminServiceImpl implements ModerationAdminService {

    static final String DEFAULT_REASON = "Manual block by admin";
    static final int DEFAULT_DURATION_HOURS = 24;
    static final String DEFAULT_ADMIN = "admin";
    static final int PREVIEW_LENGTH = 100;
    static final int MAX_RECENT_LIMIT = 1000;
    /** 与表结构一致：block_reason / reason VARCHAR(255)，actor VARCHAR(64) */
    static final int MAX_REASON_LENGTH = 255;
    static final int MAX_ADMIN_ID_LENGTH = 64;

    private final BlockLedger blockLedger;
    private final SessionStore sessionStore;
    private final GuardSessionMapper sessionMapper;
    private final MessageLogService messageLogService;
    private final ModerationConfigStore configStore;
    private final ContentRuleStore ruleStore;
    private final Clock clock;
    private final IdentityResolver identityResolver;
    private final IdentityProperties identityProps;

    @Override
    public ModerationActionVO block(BlockRequestDTO req) {
        String identity = requireIdentity(req.getIdentity());
        String reason = isBlank(req.getReason()) ? DEFAULT_REASON : req.getReason().trim();
        int hours = req.getDurationHours() == null ? DEFAULT_DURATION_HOURS : req.getDurationHours();
        if (hours < 0) {
            throw new IllegalArgumentException("duration_hours must be >= 0");
        }
        requireMaxLength("reason", reason, MAX_REASON_LENGTH);
        String admin = adminOrDefault(req.getAdminId());
        return ModerationActionVO.of(blockLedger.block(identity, reason, hours, admin));
    }

    @Override
    public ModerationActionVO unblock(String identity, String adminId) {
        String key = requireIdentity(identity);
        return ModerationActionVO.of(blockLedger.unblock(key, adminOrDefault(adminId)));
    }

    @Override
    public OverallStatsVO overallStats() {
        long totalMessages = messageLogService.countAll(false);
        long flagged = messageLogService.countAll(true);
        return OverallStatsVO.builder()
                .totalUsers(sessionMapper.selectCount(null))
                .totalMessages(totalMessages)
                .flaggedMessages(flagged)
                .blockedUsers(sessionMapper.countEffectiveBlocks(LocalDateTime.now(clock)))
                .flaggedPercentage(totalMessages > 0 ? flagged * 100.0 / totalMessages : 0)
                .build();
    }

    @Override
    public IdentityStatsVO identityStats(String identity) {
        String key = requireIdentity(identity);
        GuardSession s = sessionStore.find(key);
        if (s == null) return null;
        return IdentityStatsVO.builder()
                .identity(s.getIdentityKey())
                .sessionStart(s.getSessionStart())
                .totalMessages(messageLogService.countFor(key, false))
                .flaggedMessages(messageLogService.countFor(key, true))
                .warningsIssued(s.getWarningsIssued() == null ? 0 : s.getWarningsIssued())
                .isBlocked(Boolean.TRUE.equals(s.getIsBlocked()))
                .blockReason(s.getBlockReason())
                .blockExpires(s.getBlockExpires())
                .lastActivity(s.getLastActivity())
                .lastUserAgent(s.getLastUserAgent())
                .build();
    }

    @Override
    public List<ActivityVO> recentActivity(int hours, int limit) {
        if (hours <= 0 || limit <= 0) {
            throw new IllegalArgumentException("hours and limit must be positive");
        }
        LocalDateTime since = LocalDateTime.now(clock).minusHours(hours);
        return messageLogService.recent(since, Math.min(limit, MAX_RECENT_LIMIT)).stream()
                .map(m -> ActivityVO.builder()
                        .identity(m.getIdentityKey())
                        .timestamp(m.getCreatedAt())
                        .message(TextUtil.preview(m.getMessageContent(), PREVIEW_LENGTH))
                        .isFlagged(Boolean.TRUE.equals(m.getIsFlagged()))
                        .flagReasons(m.getFlagReasons() == null ? List.of() : m.getFlagReasons())
                        .build())
                .toList();
    }

    @Override
    public List<ModerationActionVO> actions(String identity) {
        return blockLedger.history(requireIdentity(identity)).stream()
                .map(ModerationActionVO::of)
                .toList();
    }

    @Override
    public ModerationConfig config() {
        return configStore.current();
    }

    @Override
    public ModerationConfig updateConfig(ConfigPatchDTO patch) {
        if (patch == null) {
            throw new IllegalArgumentException("config patch is required");
        }
        return configStore.update(patch);
    }

    @Override
    public BadWordsDTO rules() {
        ContentRules r = ruleStore.current();
        return new BadWordsDTO(r.words(), r.patterns());
    }

    @Override
    public BadWordsDTO updateRules(BadWordsDTO req) {
        if (req == null) {
            throw new IllegalArgumentException("words or patterns required");
        }
        ContentRules r = ruleStore.update(req.getWords(), req.getPatterns());
        return new BadWordsDTO(r.words(), r.patterns());
    }

    /** 校验长度后换成会话主键（开启摘要时与请求侧同一规则） */
    private String requireIdentity(String identity) {
        if (isBlank(identity)) {
            throw new IllegalArgumentException("identity required");
        }
        String trimmed = identity.trim();
        requireMaxLength("identity", trimmed, identityProps.getMaxLength());
        return identityResolver.storageKey(trimmed);
    }

    private static String adminOrDefault(String adminId) {
        if (isBlank(adminId)) return DEFAULT_ADMIN;
        String admin = adminId.trim();
        requireMaxLength("admin_id", admin, MAX_ADMIN_ID_LENGTH);
        return admin;
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value.length() > max) {
            throw new IllegalArgumentException(field + " must be at most " + max + " characters");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
