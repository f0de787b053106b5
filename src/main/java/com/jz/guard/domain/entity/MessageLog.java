package com.jz.guard.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/** 只追加的消息日志；限流窗口计数以它为准 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "guard_message_log", autoResultMap = true)
public class MessageLog {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String identityKey;

    /** 截断后的原文（默认前 1000 字） */
    private String messageContent;

    private Boolean isFlagged;

    /** 完整命中标签（含具体敏感词），只留在服务端审计 */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> flagReasons;

    private String userAgent;

    private Integer responseTimeMs;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
