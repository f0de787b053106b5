package com.jz.guard.guard;

/**
 * 调用方（请求处理层）解析好的客户端身份。
 *
 * @param identity  客户端地址，或其摘要
 * @param userAgent 客户端描述，可为空串
 */
public record IdentityContext(String identity, String userAgent) {
}
