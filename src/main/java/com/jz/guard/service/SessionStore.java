package com.jz.guard.service;

import com.jz.guard.domain.entity.GuardSession;

/**
 * 每个 identity 的计数与封禁状态，唯一可信来源。
 * 同一 identity 的自增在 SQL 层原子执行，不会丢更新；不同 identity 互不影响。
 */
public interface SessionStore {

    /** 不存在则以零计数创建 */
    GuardSession getOrCreate(String identity);

    /** 不存在返回 null */
    GuardSession find(String identity);

    /** messages_sent + 1，刷新最近活跃时间与 UA；首条消息隐式创建会话 */
    GuardSession recordMessage(String identity, String userAgent);

    /** flagged_messages + 1，返回自增后的总数 */
    long recordFlag(String identity);
}
