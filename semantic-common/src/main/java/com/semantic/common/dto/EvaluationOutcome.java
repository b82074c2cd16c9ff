package com.semantic.common.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 一次语义比对的最终结果：结论 + 判断依据。
 * <p>
 * 这是供应商注册表对外返回的唯一类型，调用方将四种结论都视为终态，不再自行重试。
 */
@Getter
@EqualsAndHashCode
public final class EvaluationOutcome {

    private final Verdict verdict;
    private final String justification;

    private EvaluationOutcome(Verdict verdict, String justification) {
        this.verdict = Objects.requireNonNull(verdict, "verdict");
        this.justification = justification != null ? justification : "";
    }

    public static EvaluationOutcome of(Verdict verdict, String justification) {
        return new EvaluationOutcome(verdict, justification);
    }

    public static EvaluationOutcome consistent(String justification) {
        return new EvaluationOutcome(Verdict.CONSISTENT, justification);
    }

    public static EvaluationOutcome inconsistent(String justification) {
        return new EvaluationOutcome(Verdict.INCONSISTENT, justification);
    }

    public static EvaluationOutcome uncertain(String justification) {
        return new EvaluationOutcome(Verdict.UNCERTAIN, justification);
    }

    public static EvaluationOutcome error(String reason) {
        return new EvaluationOutcome(Verdict.ERROR, reason);
    }

    public boolean isError() {
        return verdict == Verdict.ERROR;
    }

    @Override
    public String toString() {
        return verdict.getLabel() + ": " + justification;
    }
}
