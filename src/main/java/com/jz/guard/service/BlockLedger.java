package com.jz.guard.service;

import com.jz.guard.domain.entity.ModerationAction;
import com.jz.guard.guard.BlockStatus;

import java.util.List;

/**
 * 封禁/解封与审计记录。封禁状态存在会话行上，每次动作都追加一条 ModerationAction。
 */
public interface BlockLedger {

    /**
     * 读取封禁状态；已过期的封禁在这里惰性解除，并由唯一一个读者写入 auto_expire 审计。
     */
    BlockStatus isBlocked(String identity);

    /**
     * 无条件覆盖已有封禁。durationHours <= 0 表示无限期。
     */
    ModerationAction block(String identity, String reason, int durationHours, String actor);

    /** 即使本来没封也会留一条审计 */
    ModerationAction unblock(String identity, String actor);

    /** 旧到新 */
    List<ModerationAction> history(String identity);
}
