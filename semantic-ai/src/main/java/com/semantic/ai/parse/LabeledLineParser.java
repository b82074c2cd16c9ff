package com.semantic.ai.parse;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.Verdict;
import com.semantic.common.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 第二层：解析"判断结果：是 / 判断依据：..."形式的标签行。
 */
public class LabeledLineParser implements ResponseParser {

    private static final Pattern P_VERDICT = Pattern.compile(
            "^\\s*[*#\\s]*(?:判断结果|结果|结论|verdict|result)[*\\s]*[：:]\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern P_REASON = Pattern.compile(
            "^\\s*[*#\\s]*(?:判断依据|依据|理由|原因|reason|justification)[*\\s]*[：:]\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);

    private final int maxJustificationLength;

    public LabeledLineParser(int maxJustificationLength) {
        this.maxJustificationLength = maxJustificationLength;
    }

    @Override
    public Optional<EvaluationOutcome> parse(String text) {
        String[] lines = text.split("\\R");

        int verdictLine = -1;
        Verdict verdict = null;
        for (int i = 0; i < lines.length; i++) {
            Matcher m = P_VERDICT.matcher(lines[i]);
            if (m.matches()) {
                Optional<Verdict> mapped = VerdictMapper.map(m.group(1));
                if (mapped.isPresent()) {
                    verdict = mapped.get();
                    verdictLine = i;
                    break;
                }
            }
        }
        if (verdict == null) {
            return Optional.empty();
        }

        return Optional.of(EvaluationOutcome.of(verdict, justification(lines, verdictLine, text)));
    }

    private String justification(String[] lines, int verdictLine, String text) {
        List<String> parts = new ArrayList<>();
        boolean inReason = false;
        for (int i = 0; i < lines.length; i++) {
            if (i == verdictLine) {
                continue;
            }
            Matcher m = P_REASON.matcher(lines[i]);
            if (m.matches()) {
                inReason = true;
                if (!m.group(1).isBlank()) {
                    parts.add(m.group(1).trim());
                }
            } else if (inReason && !lines[i].isBlank()) {
                parts.add(lines[i].trim());
            }
        }
        if (parts.isEmpty()) {
            // 没有依据标签，取结论行之后的非空行
            for (int i = verdictLine + 1; i < lines.length; i++) {
                if (!lines[i].isBlank()) {
                    parts.add(lines[i].trim());
                }
            }
        }
        String joined = parts.isEmpty() ? text.trim() : String.join("\n", parts);
        return TextUtils.truncate(joined, maxJustificationLength);
    }

    @Override
    public String name() {
        return "labeled-line";
    }
}
