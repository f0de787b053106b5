package com.jz.guard.guard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.guard.config.ModerationProperties;
import com.jz.guard.domain.dto.BadWordsDTO;
import com.jz.guard.utils.WatchedJsonFile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 敏感词/正则来源：bad_words.json。
 * - 启动时文件不存在就写入默认规则
 * - 定时轮询 mtime，文件变化即热加载，无需重启
 * - 文件损坏时保留上一份可用规则，只打日志
 */
@Slf4j
@Component
public class ContentRuleStore {

    public static final List<String> DEFAULT_WORDS = List.of(
            // 脏话
            "fuck", "shit", "damn", "bitch", "asshole", "bastard",
            // 仇恨/攻击
            "hate", "stupid", "idiot", "retard", "kill yourself",
            // 垃圾广告
            "buy now", "click here", "free money", "viagra",
            // 恶意请求
            "hack", "break", "destroy", "damage", "illegal"
    );

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "\\b(fuck|shit|damn)\\w*\\b",
            "\\b(kill\\s+yourself)\\b",
            "\\b(hack\\s+into)\\b",
            "(.)\\1{4,}"
    );

    private final WatchedJsonFile<BadWordsDTO> file;
    private volatile ContentRules current = ContentRules.lenient(DEFAULT_WORDS, DEFAULT_PATTERNS);

    public ContentRuleStore(ModerationProperties props, ObjectMapper objectMapper) {
        this.file = new WatchedJsonFile<>(Path.of(props.getRulesFile()), BadWordsDTO.class, objectMapper);
    }

    @PostConstruct
    public void init() {
        if (file.exists()) {
            reloadIfChanged();
            return;
        }
        try {
            file.write(toDto(current));
            log.info("moderation rules file not found, defaults written to {}", file.getPath());
        } catch (IOException e) {
            log.warn("failed to write default moderation rules to {}: {}", file.getPath(), e.toString());
        }
    }

    @Scheduled(fixedDelayString = "${guard.moderation.rules-reload-interval-ms:5000}")
    public void reloadIfChanged() {
        try {
            Optional<BadWordsDTO> changed = file.readIfChanged();
            if (changed.isEmpty()) return;
            BadWordsDTO dto = changed.get();
            ContentRules base = current;
            ContentRules next = ContentRules.lenient(
                    dto.getWords() != null ? dto.getWords() : base.words(),
                    dto.getPatterns() != null ? dto.getPatterns() : base.patterns());
            current = next;
            log.info("moderation rules reloaded: {} words, {} patterns", next.words().size(), next.patterns().size());
        } catch (IOException e) {
            log.warn("moderation rules file {} unreadable, keeping last-known-good rules: {}",
                    file.getPath(), e.getMessage());
        }
    }

    public ContentRules current() {
        return current;
    }

    /**
     * 管理员修改：先校验、再落盘、最后替换内存快照。
     *
     * @throws IllegalArgumentException 存在非法正则
     */
    public synchronized ContentRules update(List<String> words, List<String> patterns) {
        ContentRules base = current;
        ContentRules next = ContentRules.strict(
                words != null ? words : base.words(),
                patterns != null ? patterns : base.patterns());
        try {
            file.write(toDto(next));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to persist moderation rules to " + file.getPath(), e);
        }
        current = next;
        log.info("moderation rules updated: {} words, {} patterns", next.words().size(), next.patterns().size());
        return next;
    }

    private static BadWordsDTO toDto(ContentRules rules) {
        return new BadWordsDTO(rules.words(), rules.patterns());
    }
}
