package com.jz.guard.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.jz.guard.domain.entity.ModerationAction;
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
public class ModerationActionVO {
    private Long id;
    private String identity;
    private String actionType;
    private String reason;
    private String actor;
    private LocalDateTime timestamp;
    private LocalDateTime expiresAt;

    public static ModerationActionVO of(ModerationAction a) {
        return ModerationActionVO.builder()
                .id(a.getId())
                .identity(a.getIdentityKey())
                .actionType(a.getActionType())
                .reason(a.getReason())
                .actor(a.getActor())
                .timestamp(a.getCreatedAt())
                .expiresAt(a.getExpiresAt())
                .build();
    }
}
