package com.jz.guard.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** 单个 identity 的统计；消息数以日志表为准 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IdentityStatsVO {
    private String identity;
    private LocalDateTime sessionStart;
    private long totalMessages;
    private long flaggedMessages;
    private int warningsIssued;
    private Boolean isBlocked;
    private String blockReason;
    private LocalDateTime blockExpires;
    private LocalDateTime lastActivity;
    private String lastUserAgent;
}
