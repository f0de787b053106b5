package com.jz.guard.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OverallStatsVO {
    private long totalUsers;
    private long totalMessages;
    private long flaggedMessages;
    /** 当前仍生效的封禁 */
    private long blockedUsers;
    private double flaggedPercentage;
}
