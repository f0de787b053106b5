package com.jz.guard.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.jz.guard.domain.entity.GuardSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionSnapshotVO {
    private String identity;
    private LocalDateTime sessionStart;
    private long messagesSent;
    private long flaggedMessages;
    private int warningsIssued;
    private LocalDateTime lastActivity;
    private String userAgent;
    private Boolean isBlocked;
    private String blockReason;
    private LocalDateTime blockExpires;

    public static SessionSnapshotVO of(GuardSession s) {
        return SessionSnapshotVO.builder()
                .identity(s.getIdentityKey())
                .sessionStart(s.getSessionStart())
                .messagesSent(s.getMessagesSent() == null ? 0 : s.getMessagesSent())
                .flaggedMessages(s.getFlaggedMessages() == null ? 0 : s.getFlaggedMessages())
                .warningsIssued(s.getWarningsIssued() == null ? 0 : s.getWarningsIssued())
                .lastActivity(s.getLastActivity())
                .userAgent(s.getLastUserAgent())
                .isBlocked(Boolean.TRUE.equals(s.getIsBlocked()))
                .blockReason(s.getBlockReason() == null ? "" : s.getBlockReason())
                .blockExpires(s.getBlockExpires())
                .build();
    }
}
