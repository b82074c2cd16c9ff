package com.semantic.ai.parse;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    @Test
    void fencedJsonIsParsedLikeBareJson() {
        String bare = "{\"result\": \"否\", \"reason\": \"缺少字段X\"}";
        String fenced = "```json\n" + bare + "\n```";

        EvaluationOutcome fromFenced = normalizer.normalize(fenced);

        assertThat(fromFenced).isEqualTo(EvaluationOutcome.inconsistent("缺少字段X"));
        assertThat(normalizer.normalize(bare)).isEqualTo(fromFenced);
    }

    @Test
    void strippingFenceTwiceChangesNothing() {
        String fenced = "```json\n{\"result\": \"是\", \"reason\": \"一致\"}\n```";

        String once = CodeFenceStripper.strip(fenced);

        assertThat(CodeFenceStripper.strip(once)).isEqualTo(once);
    }

    @Test
    void labeledLinesAreParsedWhenJsonIsAbsent() {
        EvaluationOutcome outcome = normalizer.normalize("判断结果：是\n判断依据：一致");

        assertThat(outcome).isEqualTo(EvaluationOutcome.consistent("一致"));
    }

    @Test
    void bracketedVerdictIsRecognised() {
        EvaluationOutcome outcome = normalizer.normalize("分析如下。\n判断结果：【否】\n判断依据：源文档未提及退款期限");

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.INCONSISTENT);
        assertThat(outcome.getJustification()).isEqualTo("源文档未提及退款期限");
    }

    @Test
    void jsonEmbeddedInProseIsExtracted() {
        EvaluationOutcome outcome = normalizer.normalize("结果如下：{\"result\": \"不确定\", \"reason\": \"信息不足\"} 以上。");

        assertThat(outcome).isEqualTo(EvaluationOutcome.uncertain("信息不足"));
    }

    @Test
    void verdictMentioningWrongDetailIsInconsistentNotError() {
        EvaluationOutcome labeled = normalizer.normalize("判断结果：否（回答中的日期是错误的）\n判断依据：源文档写的是 2023 年");
        EvaluationOutcome json = normalizer.normalize("{\"result\":\"否，回答存在错误\",\"reason\":\"日期不符\"}");

        assertThat(labeled).isEqualTo(EvaluationOutcome.inconsistent("源文档写的是 2023 年"));
        assertThat(json).isEqualTo(EvaluationOutcome.inconsistent("日期不符"));
    }

    @Test
    void bareErrorVerdictStaysError() {
        EvaluationOutcome outcome = normalizer.normalize("{\"result\":\"错误\",\"reason\":\"无法处理\"}");

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.ERROR);
    }

    @Test
    void keywordScoringIsLastResort() {
        EvaluationOutcome outcome = normalizer.normalize("AI回答与源文档的描述不一致，存在矛盾。");

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.INCONSISTENT);
    }

    @Test
    void emptyBodyIsUncertain() {
        assertThat(normalizer.normalize("").getVerdict()).isEqualTo(Verdict.UNCERTAIN);
        assertThat(normalizer.normalize(null).getVerdict()).isEqualTo(Verdict.UNCERTAIN);
        assertThat(normalizer.normalize("   ").getJustification()).isEmpty();
    }

    @Test
    void unparseableBodyIsUncertainWithTruncatedRawText() {
        String raw = "今天天气很好。".repeat(100);

        EvaluationOutcome outcome = normalizer.normalize(raw);

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.UNCERTAIN);
        assertThat(outcome.getJustification())
                .hasSize(ResponseNormalizer.MAX_JUSTIFICATION_LENGTH + 3)
                .endsWith("...");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"result\": 42}",
            "{\"reason\": \"没有结论\"}",
            "```\n```",
            "判断结果：\n判断依据：",
            "[1, 2, 3]",
            "\u0000\u0001",
            "{{{{"
    })
    void alwaysReturnsOneOfTheFourVerdicts(String raw) {
        EvaluationOutcome outcome = normalizer.normalize(raw);

        assertThat(outcome).isNotNull();
        assertThat(outcome.getVerdict()).isIn((Object[]) Verdict.values());
        assertThat(outcome.getJustification()).isNotNull();
    }

    @Test
    void neverGuessesConsistentWithoutEvidence() {
        assertThat(normalizer.normalize("我不知道。").getVerdict()).isNotEqualTo(Verdict.CONSISTENT);
    }
}
