package com.jz.guard.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("guard_moderation_action")
public class ModerationAction {

    public static final String BLOCK = "block";
    public static final String UNBLOCK = "unblock";

    public static final String ACTOR_SYSTEM = "system";
    public static final String ACTOR_AUTO_EXPIRE = "auto_expire";

    @TableId(type = IdType.AUTO)
    private Long id;

    private String identityKey;

    /** block / unblock */
    private String actionType;

    private String reason;

    /** 管理员 id，或 system / auto_expire */
    private String actor;

    /** 仅 block 有值；为空表示无限期 */
    private LocalDateTime expiresAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
