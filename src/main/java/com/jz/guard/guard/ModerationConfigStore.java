package com.jz.guard.guard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.guard.config.ModerationProperties;
import com.jz.guard.domain.dto.ConfigPatchDTO;
import com.jz.guard.utils.WatchedJsonFile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 进程级阈值配置：启动时从 moderation_config.json 读取，管理员每次修改都落盘。
 * 读不到或内容非法时退回到上一份可用配置（首次即 application.yml 中的默认值）。
 */
@Slf4j
@Component
public class ModerationConfigStore {

    private final WatchedJsonFile<ModerationConfig> file;
    private volatile ModerationConfig current;

    public ModerationConfigStore(ModerationProperties props, ObjectMapper objectMapper) {
        this.file = new WatchedJsonFile<>(Path.of(props.getConfigFile()), ModerationConfig.class, objectMapper);
        this.current = ModerationConfig.from(props.getDefaults()).validate();
    }

    @PostConstruct
    public void init() {
        if (file.exists()) {
            reloadIfChanged();
            return;
        }
        try {
            file.write(current);
            log.info("moderation config not found, defaults written to {}", file.getPath());
        } catch (IOException e) {
            log.warn("failed to write default moderation config to {}: {}", file.getPath(), e.toString());
        }
    }

    @Scheduled(fixedDelayString = "${guard.moderation.rules-reload-interval-ms:5000}")
    public void reloadIfChanged() {
        try {
            Optional<ModerationConfig> changed = file.readIfChanged();
            if (changed.isEmpty()) return;
            current = changed.get().validate();
            log.info("moderation config reloaded: {}", current);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("moderation config {} rejected, keeping last-known-good: {}", file.getPath(), e.getMessage());
        }
    }

    /** 返回副本，调用方改了也不影响共享配置 */
    public ModerationConfig current() {
        return current.toBuilder().build();
    }

    /**
     * @throws IllegalArgumentException 合并后的阈值越界
     */
    public synchronized ModerationConfig update(ConfigPatchDTO patch) {
        ModerationConfig next = patch.applyTo(current).validate();
        try {
            file.write(next);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to persist moderation config to " + file.getPath(), e);
        }
        current = next;
        log.info("moderation config updated: {}", next);
        return next.toBuilder().build();
    }
}
