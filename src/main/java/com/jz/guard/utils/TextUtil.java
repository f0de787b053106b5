package com.jz.guard.utils;

public final class TextUtil {

    private TextUtil() {
    }

    /** null 视为空串；按 UTF-16 长度截断，不会切开代理对 */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        int end = max;
        if (end > 0 && Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    /** 管理后台列表预览：超长截断并加省略号 */
    public static String preview(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? truncate(s, max) + "..." : s;
    }
}
