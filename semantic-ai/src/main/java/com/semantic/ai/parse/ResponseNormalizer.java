package com.semantic.ai.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 将模型的原始回复归一化为 {@link EvaluationOutcome}。
 * <p>
 * 解析顺序：去除代码块围栏 → JSON 结构 → 标签行 → 关键词打分 → 不确定。
 * 永不抛出异常，也不会在无法判断时给出"是"。
 */
@Slf4j
@Component
public class ResponseNormalizer {

    public static final int MAX_JUSTIFICATION_LENGTH = 500;

    private final List<ResponseParser> tiers;

    public ResponseNormalizer() {
        this(new ObjectMapper());
    }

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.tiers = List.of(
                new StructuredResultParser(objectMapper),
                new LabeledLineParser(MAX_JUSTIFICATION_LENGTH),
                new KeywordScoringParser(MAX_JUSTIFICATION_LENGTH));
    }

    public EvaluationOutcome normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("模型返回空响应，标记为不确定");
            return EvaluationOutcome.uncertain(raw != null ? raw.trim() : "");
        }

        String stripped = CodeFenceStripper.strip(raw);
        for (ResponseParser tier : tiers) {
            try {
                Optional<EvaluationOutcome> outcome = tier.parse(stripped);
                if (outcome.isPresent()) {
                    log.debug("响应由 {} 层解析: {}", tier.name(), outcome.get().getVerdict());
                    return outcome.get();
                }
            } catch (RuntimeException e) {
                log.warn("{} 层解析异常，继续尝试下一层: {}", tier.name(), e.getMessage());
            }
        }

        log.warn("无法从响应中识别结论，标记为不确定 (长度 {})", raw.length());
        return EvaluationOutcome.uncertain(TextUtils.truncate(raw.trim(), MAX_JUSTIFICATION_LENGTH));
    }
}
