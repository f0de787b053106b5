package com.jz.guard.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.jz.guard.guard.ModerationConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 部分更新：为 null 的字段保持原值 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConfigPatchDTO {
    private Integer maxMessagesPerWindow;
    private Integer windowMinutes;
    private Integer autoBlockThreshold;
    private Integer blockDurationHours;
    private Integer warningThreshold;

    public ModerationConfig applyTo(ModerationConfig base) {
        var b = base.toBuilder();
        if (maxMessagesPerWindow != null) b.maxMessagesPerWindow(maxMessagesPerWindow);
        if (windowMinutes != null) b.windowMinutes(windowMinutes);
        if (autoBlockThreshold != null) b.autoBlockThreshold(autoBlockThreshold);
        if (blockDurationHours != null) b.blockDurationHours(blockDurationHours);
        if (warningThreshold != null) b.warningThreshold(warningThreshold);
        return b.build();
    }
}
