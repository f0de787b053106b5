package com.jz.guard.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.Optional;

/**
 * 本地 JSON 文件 + mtime 跟踪：轮询时只有文件变化才重新解析。
 * 写入走临时文件 + rename，读者不会看到写了一半的文件。
 */
@Slf4j
public class WatchedJsonFile<T> {

    @Getter
    private final Path path;
    private final Class<T> type;
    private final ObjectMapper om;
    private volatile FileTime lastSeen;

    public WatchedJsonFile(Path path, Class<T> type, ObjectMapper om) {
        this.path = path;
        this.type = type;
        this.om = om;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * 文件缺失或 mtime 未变时返回 empty。
     * 解析失败同样记下 mtime，同一份坏文件不会每轮都报错。
     */
    public Optional<T> readIfChanged() throws IOException {
        if (!exists()) return Optional.empty();
        FileTime mtime = Files.getLastModifiedTime(path);
        if (Objects.equals(mtime, lastSeen)) return Optional.empty();
        lastSeen = mtime;
        return Optional.ofNullable(om.readValue(path.toFile(), type));
    }

    public void write(T value) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        lastSeen = Files.getLastModifiedTime(path);
    }
}
