package com.jz.guard.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 每个 identity 一行，首次发消息时创建，之后只改字段不删除。
 * 不变式：isBlocked == true 时 blockReason 非空；blockExpires 为空表示需要人工解封。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("guard_session")
public class GuardSession {

    @TableId(type = IdType.INPUT)
    private String identityKey;              // 客户端地址（或其摘要）

    private LocalDateTime sessionStart;

    private Long messagesSent;
    private Long flaggedMessages;
    private Integer warningsIssued;          // 预留，目前没有递增路径

    private LocalDateTime lastActivity;
    private String lastUserAgent;

    private Boolean isBlocked;
    private String blockReason;
    private LocalDateTime blockExpires;
}
