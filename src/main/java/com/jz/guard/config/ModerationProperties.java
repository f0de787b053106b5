package com.jz.guard.config;


import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "guard.moderation")
public class ModerationProperties {

    /** 阈值配置文件（管理员修改后落盘，重启后仍生效） */
    private String configFile = "data/moderation_config.json";

    /** 敏感词/正则文件：{"words": [...], "patterns": [...]} */
    private String rulesFile = "data/bad_words.json";

    /** 规则文件轮询间隔，文件 mtime 变化即热加载 */
    private long rulesReloadIntervalMs = 5000;

    /** 消息入库时截断的最大长度 */
    private int maxStoredContentLength = 1000;

    private int maxUserAgentLength = 500;

    /** 配置文件缺失或损坏时使用的默认阈值 */
    private Defaults defaults = new Defaults();

    @Data
    public static class Defaults {
        private int maxMessagesPerWindow = 60;
        private int windowMinutes = 60;
        /** 累计违规条数达到该值自动封禁 */
        private int autoBlockThreshold = 5;
        private int blockDurationHours = 24;
        /** 预留：目前没有自动发放警告的路径 */
        private int warningThreshold = 2;
    }
}
