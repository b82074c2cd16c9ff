package com.semantic.ai.parse;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.Verdict;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LabeledLineParserTest {

    private final LabeledLineParser parser = new LabeledLineParser(500);

    @Test
    void collectsMultiLineJustification() {
        Optional<EvaluationOutcome> outcome = parser.parse(
                "**判断结果**：否\n**判断依据**：第一点\n第二点\n\n第三点");

        assertThat(outcome).isPresent();
        assertThat(outcome.get().getVerdict()).isEqualTo(Verdict.INCONSISTENT);
        assertThat(outcome.get().getJustification()).isEqualTo("第一点\n第二点\n第三点");
    }

    @Test
    void usesFollowingLinesWhenReasonLabelMissing() {
        Optional<EvaluationOutcome> outcome = parser.parse("Result: yes\nThe answer matches the policy.");

        assertThat(outcome).contains(EvaluationOutcome.consistent("The answer matches the policy."));
    }

    @Test
    void textWithoutVerdictLabelIsSkipped() {
        assertThat(parser.parse("这段话没有任何标签。")).isEmpty();
    }
}
