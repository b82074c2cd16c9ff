package com.semantic.ai.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 去除 Markdown 代码块围栏（```json ... ```）。
 */
public final class CodeFenceStripper {

    private static final Pattern FENCE = Pattern.compile(
            "```[a-zA-Z]*\\s*\\n?(.*?)\\n?\\s*```", Pattern.DOTALL);

    private CodeFenceStripper() {
    }

    /**
     * 文本中存在完整围栏时返回第一个围栏内的内容，否则返回去首尾空白后的原文。
     * 对已去除围栏的文本再次调用结果不变。
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        Matcher m = FENCE.matcher(trimmed);
        if (m.find()) {
            return m.group(1).trim();
        }
        return trimmed;
    }
}
