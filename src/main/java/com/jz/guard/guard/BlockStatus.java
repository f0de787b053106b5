package com.jz.guard.guard;

import java.time.LocalDateTime;

/**
 * @param expiresAt 为 null 表示无限期（或未封禁）
 */
public record BlockStatus(boolean blocked, String reason, LocalDateTime expiresAt) {

    private static final BlockStatus NOT_BLOCKED = new BlockStatus(false, "", null);

    public static BlockStatus notBlocked() {
        return NOT_BLOCKED;
    }

    public static BlockStatus blocked(String reason, LocalDateTime expiresAt) {
        return new BlockStatus(true, reason, expiresAt);
    }
}
