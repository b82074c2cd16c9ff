package com.semantic.ai.parse;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.util.TextUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 第三层：统计正负指示词出现次数猜测结论，两者持平时放弃。
 * 否定词先计数并从文本中移除，再统计肯定词，避免"不符合"同时命中"符合"。
 */
public class KeywordScoringParser implements ResponseParser {

    private static final List<String> NEGATIVE = List.of(
            "不相符", "不符合", "不一致", "不正确", "错误", "无法推断", "不能推断", "相悖", "矛盾",
            "inconsistent", "contradict", "not consistent");

    private static final List<String> POSITIVE = List.of(
            "相符", "符合", "一致", "正确", "能够推断", "可以推断", "consistent");

    private final int maxJustificationLength;

    public KeywordScoringParser(int maxJustificationLength) {
        this.maxJustificationLength = maxJustificationLength;
    }

    @Override
    public Optional<EvaluationOutcome> parse(String text) {
        String remaining = text.toLowerCase(Locale.ROOT);
        int negative = 0;
        for (String word : NEGATIVE) {
            negative += count(remaining, word);
            remaining = remaining.replace(word, " ");
        }
        int positive = 0;
        for (String word : POSITIVE) {
            positive += count(remaining, word);
        }

        if (positive == negative) {
            return Optional.empty();
        }
        String justification = TextUtils.truncate(text.trim(), maxJustificationLength);
        return Optional.of(positive > negative
                ? EvaluationOutcome.consistent(justification)
                : EvaluationOutcome.inconsistent(justification));
    }

    private static int count(String text, String word) {
        int n = 0;
        int from = 0;
        while ((from = text.indexOf(word, from)) >= 0) {
            n++;
            from += word.length();
        }
        return n;
    }

    @Override
    public String name() {
        return "keyword";
    }
}
