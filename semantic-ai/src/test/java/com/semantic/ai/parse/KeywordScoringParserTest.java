package com.semantic.ai.parse;

import com.semantic.common.dto.Verdict;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordScoringParserTest {

    private final KeywordScoringParser parser = new KeywordScoringParser(500);

    @Test
    void negatedPhraseDoesNotCountAsPositive() {
        assertThat(parser.parse("回答不符合文档").map(o -> o.getVerdict())).contains(Verdict.INCONSISTENT);
    }

    @Test
    void wrongDetailCountsAsNegative() {
        assertThat(parser.parse("回答中的日期是错误的").map(o -> o.getVerdict())).contains(Verdict.INCONSISTENT);
    }

    @Test
    void positiveWordsWin() {
        assertThat(parser.parse("回答与文档一致，内容正确").map(o -> o.getVerdict())).contains(Verdict.CONSISTENT);
    }

    @Test
    void tieIsUndecided() {
        assertThat(parser.parse("部分一致，部分矛盾")).isEmpty();
        assertThat(parser.parse("无关内容")).isEmpty();
    }
}
