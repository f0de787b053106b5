package com.jz.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "guard.web")
public class WebProperties {
    /** 管理后台前端地址（不能用 *，要写具体域名） */
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("http://localhost:*"));
}
