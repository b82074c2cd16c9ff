package com.semantic.ai.parse;

import com.semantic.common.dto.EvaluationOutcome;

import java.util.Optional;

/**
 * 归一化流水线中的一层解析器。无法识别时返回 {@link Optional#empty()}，交给下一层处理。
 */
public interface ResponseParser {

    Optional<EvaluationOutcome> parse(String text);

    /** 日志中显示的层名 */
    String name();
}
