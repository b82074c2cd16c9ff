package com.semantic.ai.parse;

import com.semantic.common.dto.Verdict;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 将模型给出的结论词映射为 {@link Verdict}。
 * <p>
 * 先做精确匹配，再按 不确定 → 否定 → 肯定 的顺序做包含匹配，
 * 否定词先于肯定词检查，避免"不是"被识别为"是"。
 * {@link Verdict#ERROR} 只接受单独的"错误"/"error"；结论中出现的"错误"表示回答有误，按否定处理。
 */
public final class VerdictMapper {

    private static final Pattern DECORATION = Pattern.compile("[【】\\[\\]「」\"'“”*`。．.!！,，\\s]");

    private static final Map<String, Verdict> EXACT = Map.ofEntries(
            Map.entry("是", Verdict.CONSISTENT),
            Map.entry("相符", Verdict.CONSISTENT),
            Map.entry("一致", Verdict.CONSISTENT),
            Map.entry("yes", Verdict.CONSISTENT),
            Map.entry("true", Verdict.CONSISTENT),
            Map.entry("consistent", Verdict.CONSISTENT),
            Map.entry("否", Verdict.INCONSISTENT),
            Map.entry("不相符", Verdict.INCONSISTENT),
            Map.entry("不一致", Verdict.INCONSISTENT),
            Map.entry("no", Verdict.INCONSISTENT),
            Map.entry("false", Verdict.INCONSISTENT),
            Map.entry("inconsistent", Verdict.INCONSISTENT),
            Map.entry("不确定", Verdict.UNCERTAIN),
            Map.entry("无法判断", Verdict.UNCERTAIN),
            Map.entry("无法确定", Verdict.UNCERTAIN),
            Map.entry("uncertain", Verdict.UNCERTAIN),
            Map.entry("unknown", Verdict.UNCERTAIN),
            Map.entry("错误", Verdict.ERROR),
            Map.entry("error", Verdict.ERROR));

    private static final List<Map.Entry<Pattern, Verdict>> CONTAINS = List.of(
            Map.entry(Pattern.compile("不确定|无法判断|无法确定|uncertain|unknown|unsure"), Verdict.UNCERTAIN),
            Map.entry(Pattern.compile("否|不是|错误|不相符|不符|不一致|inconsistent|\\bno\\b|\\bnot\\b|\\bfalse\\b"), Verdict.INCONSISTENT),
            Map.entry(Pattern.compile("是|相符|一致|consistent|\\byes\\b|\\btrue\\b"), Verdict.CONSISTENT));

    private VerdictMapper() {
    }

    public static Optional<Verdict> map(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = DECORATION.matcher(token).replaceAll("").toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Verdict exact = EXACT.get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        String spaced = token.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, Verdict> entry : CONTAINS) {
            if (entry.getKey().matcher(spaced).find()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
