package com.jz.guard.guard;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 一份不可变的规则快照：敏感词 + 预编译正则。热加载时整体替换。
 */
@Slf4j
public final class ContentRules {

    public record CompiledPattern(String source, Pattern regex) {}

    private final List<String> words;
    private final List<String> patterns;
    private final List<CompiledPattern> compiled;

    private ContentRules(List<String> words, List<String> patterns, List<CompiledPattern> compiled) {
        this.words = words;
        this.patterns = patterns;
        this.compiled = compiled;
    }

    /** 管理员提交：任一正则非法则整体拒绝 */
    public static ContentRules strict(List<String> words, List<String> patterns) {
        return build(words, patterns, true);
    }

    /** 读文件：非法正则跳过并记录日志，其余照常生效 */
    public static ContentRules lenient(List<String> words, List<String> patterns) {
        return build(words, patterns, false);
    }

    private static ContentRules build(List<String> words, List<String> patterns, boolean strict) {
        List<String> ws = new ArrayList<>();
        if (words != null) {
            for (String w : words) {
                if (w != null && !w.isBlank()) ws.add(w);
            }
        }
        List<String> ps = new ArrayList<>();
        List<CompiledPattern> cs = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                if (p == null || p.isEmpty()) continue;
                try {
                    cs.add(new CompiledPattern(p, Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
                    ps.add(p);
                } catch (PatternSyntaxException e) {
                    if (strict) {
                        throw new IllegalArgumentException("invalid pattern: " + p, e);
                    }
                    log.warn("skip invalid moderation pattern {}: {}", p, e.getDescription());
                }
            }
        }
        return new ContentRules(List.copyOf(ws), List.copyOf(ps), List.copyOf(cs));
    }

    public List<String> words() {
        return words;
    }

    public List<String> patterns() {
        return patterns;
    }

    public List<CompiledPattern> compiled() {
        return compiled;
    }
}
