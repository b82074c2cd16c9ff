package com.semantic.ai.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 第一层：解析 {"result": "...", "reason": "..."} 结构。
 * 整段文本不是 JSON 时，尝试截取第一个 '{' 到最后一个 '}' 之间的内容再解析。
 */
@Slf4j
public class StructuredResultParser implements ResponseParser {

    private final ObjectMapper objectMapper;

    public StructuredResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<EvaluationOutcome> parse(String text) {
        JsonNode root = readObject(text);
        if (root == null) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                root = readObject(text.substring(start, end + 1));
            }
        }
        if (root == null || !root.hasNonNull("result")) {
            return Optional.empty();
        }

        String result = root.get("result").asText("");
        String reason = root.path("reason").asText("");
        if (reason.isBlank()) {
            reason = "无";
        }
        Verdict verdict = VerdictMapper.map(result).orElse(Verdict.UNCERTAIN);
        return Optional.of(EvaluationOutcome.of(verdict, reason));
    }

    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.trace("不是合法 JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    @Override
    public String name() {
        return "structured";
    }
}
