package com.semantic.common.util;

/**
 * 文本处理工具：截断与 Key 脱敏。
 */
public final class TextUtils {

    private TextUtils() {
    }

    /**
     * 超过 maxLength 时截断并追加 "..."。
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    /**
     * Key 脱敏，只保留前 8 位。
     */
    public static String maskKey(String key) {
        if (key == null || key.length() <= 8) return "***";
        return key.substring(0, 8) + "***";
    }
}
