package com.jz.guard.service;

import com.jz.guard.domain.entity.MessageLog;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageLogService {

    /** 追加一条日志，内容与 UA 按配置截断 */
    MessageLog append(String identity, String content, boolean flagged, List<String> flagReasons,
                      String userAgent, int responseTimeMs);

    /** created_at 严格大于 since 的条数 */
    long countSince(String identity, LocalDateTime since);

    long countFor(String identity, boolean flaggedOnly);

    long countAll(boolean flaggedOnly);

    /** 新到旧 */
    List<MessageLog> recent(LocalDateTime since, int limit);
}
