package com.jz.guard.guard;

import java.util.List;
import java.util.Set;

/**
 * @param reasons 有序、去重的命中标签，如 inappropriate_language:hack、excessive_caps
 */
public record ContentVerdict(boolean flagged, Set<String> reasons) {

    /** 去掉冒号后的具体词/正则，只保留类别，避免把过滤规则泄露给用户 */
    public List<String> publicTags() {
        return reasons.stream()
                .map(r -> {
                    int i = r.indexOf(':');
                    return i < 0 ? r : r.substring(0, i);
                })
                .distinct()
                .toList();
    }
}
