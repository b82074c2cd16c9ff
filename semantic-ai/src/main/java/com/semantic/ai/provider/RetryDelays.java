package com.semantic.ai.provider;

import okhttp3.Response;

import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从响应头或错误文本中提取供应商建议的重试延迟。
 */
final class RetryDelays {

    private static final List<Pattern> TEXT_PATTERNS = List.of(
            // Gemini: "retryDelay": "37s" 或 'retryDelay': '37s'
            Pattern.compile("[\"']retryDelay[\"']\\s*:\\s*[\"'](\\d+(?:\\.\\d+)?)s[\"']"),
            // OpenAI: "Please try again in 20s" / "try again in 1.5s"
            Pattern.compile("try again in (\\d+(?:\\.\\d+)?)\\s*s", Pattern.CASE_INSENSITIVE),
            Pattern.compile("retry after (\\d+(?:\\.\\d+)?)\\s*(?:s|seconds)", Pattern.CASE_INSENSITIVE));

    private RetryDelays() {
    }

    /** Retry-After 头（秒数形式），无法解析返回 null */
    static Duration fromHeader(Response response) {
        String value = response.header("retry-after");
        if (value == null || value.isBlank()) {
            return null;
        }
        return parseSeconds(value.trim());
    }

    /** 错误文本中的延迟，无法解析返回 null */
    static Duration fromText(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (Pattern pattern : TEXT_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return parseSeconds(m.group(1));
            }
        }
        return null;
    }

    /** 先看响应头，再看响应体 */
    static Duration from(Response response, String body) {
        Duration fromHeader = fromHeader(response);
        return fromHeader != null ? fromHeader : fromText(body);
    }

    static Duration parseSeconds(String seconds) {
        try {
            double value = Double.parseDouble(seconds.endsWith("s") ? seconds.substring(0, seconds.length() - 1) : seconds);
            if (value < 0) {
                return null;
            }
            return Duration.ofMillis((long) Math.ceil(value * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
