package com.jz.guard.guard;

/**
 * @param count  窗口内（不含本次）的消息数
 * @param detail 可读说明，带上计数
 */
public record RateLimitResult(boolean limited, long count, String detail) {
}
