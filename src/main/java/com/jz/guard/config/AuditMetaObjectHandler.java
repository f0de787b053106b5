package com.jz.guard.config;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import lombok.RequiredArgsConstructor;
import org.apache.ibatis.reflection.MetaObject;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
public class AuditMetaObjectHandler implements MetaObjectHandler {

    private final Clock clock;

    @Override
    public void insertFill(MetaObject metaObject) {
        // 仅填充 @TableField(fill = INSERT) 且为空的字段
        this.strictInsertFill(metaObject, "createdAt", LocalDateTime.class, LocalDateTime.now(clock));
    }

    @Override
    public void updateFill(MetaObject metaObject) {
    }
}
