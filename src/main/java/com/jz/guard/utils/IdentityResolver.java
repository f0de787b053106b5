package com.jz.guard.utils;

import com.jz.guard.config.IdentityProperties;
import com.jz.guard.config.ModerationProperties;
import com.jz.guard.guard.IdentityContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * 从请求中解析问责主体：
 * - 有 X-Forwarded-For 时取第一个逗号分隔值（经过代理的真实客户端）
 * - 否则取直连地址
 * - 可选只保存 SHA-256 摘要的前 16 位
 */
@Component
@RequiredArgsConstructor
public class IdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String USER_AGENT = "User-Agent";
    private static final Pattern DIGEST = Pattern.compile("[0-9a-f]{16}");

    private final IdentityProperties identityProps;
    private final ModerationProperties moderationProps;

    public IdentityContext resolve(HttpServletRequest req) {
        String address = clientAddress(req.getHeader(FORWARDED_FOR), req.getRemoteAddr());
        String ua = TextUtil.truncate(req.getHeader(USER_AGENT), moderationProps.getMaxUserAgentLength());
        return new IdentityContext(storageKey(address), ua);
    }

    /**
     * 管理端传入的 identity 换成会话主键：开启摘要时，原始地址按同样规则取摘要；
     * 已经是 16 位摘要的（从统计/活动列表里复制来的）原样使用。地址里总有 '.' 或 ':'，不会被误认成摘要。
     */
    public String storageKey(String identity) {
        if (!identityProps.isHashIdentities() || identity.isEmpty() || DIGEST.matcher(identity).matches()) {
            return identity;
        }
        return hash(identity);
    }

    String clientAddress(String forwardedFor, String remoteAddr) {
        if (identityProps.isTrustForwardedFor() && forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",", 2)[0].trim();
            if (!first.isEmpty()) return first;
        }
        return remoteAddr == null ? "" : remoteAddr.trim();
    }

    static String hash(String address) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(address.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            // 每个 JRE 都必须提供 SHA-256
            throw new IllegalStateException(e);
        }
    }
}
