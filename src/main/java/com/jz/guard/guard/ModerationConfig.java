package com.jz.guard.guard;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.jz.guard.config.ModerationProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 运行期阈值。ModerationConfigStore 持有的实例不会被原地修改，每次变更都换一个新对象。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModerationConfig {

    private int maxMessagesPerWindow;
    private int windowMinutes;
    private int autoBlockThreshold;
    /** 0 表示自动封禁为无限期 */
    private int blockDurationHours;
    private int warningThreshold;

    public static ModerationConfig from(ModerationProperties.Defaults d) {
        return ModerationConfig.builder()
                .maxMessagesPerWindow(d.getMaxMessagesPerWindow())
                .windowMinutes(d.getWindowMinutes())
                .autoBlockThreshold(d.getAutoBlockThreshold())
                .blockDurationHours(d.getBlockDurationHours())
                .warningThreshold(d.getWarningThreshold())
                .build();
    }

    /** @throws IllegalArgumentException 任一阈值越界 */
    public ModerationConfig validate() {
        requireAtLeast("max_messages_per_window", maxMessagesPerWindow, 1);
        requireAtLeast("window_minutes", windowMinutes, 1);
        requireAtLeast("auto_block_threshold", autoBlockThreshold, 1);
        requireAtLeast("block_duration_hours", blockDurationHours, 0);
        requireAtLeast("warning_threshold", warningThreshold, 0);
        return this;
    }

    private static void requireAtLeast(String name, int value, int min) {
        if (value < min) {
            throw new IllegalArgumentException(name + " must be >= " + min + ", got " + value);
        }
    }
}
