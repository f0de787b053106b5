package com.jz.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "guard.identity")
public class IdentityProperties {
    /** 前面有反向代理时才打开，否则客户端可伪造 X-Forwarded-For */
    private boolean trustForwardedFor = true;
    /** 是否只保存地址的 SHA-256 摘要（前 16 位） */
    private boolean hashIdentities = false;
    private int maxLength = 128;
}
