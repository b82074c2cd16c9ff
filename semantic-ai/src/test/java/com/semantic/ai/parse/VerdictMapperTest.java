package com.semantic.ai.parse;

import com.semantic.common.dto.Verdict;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictMapperTest {

    @ParameterizedTest
    @CsvSource({
            "是, CONSISTENT",
            "【是】, CONSISTENT",
            "Yes, CONSISTENT",
            "相符, CONSISTENT",
            "否, INCONSISTENT",
            "不相符, INCONSISTENT",
            "不是, INCONSISTENT",
            "No, INCONSISTENT",
            "不确定, UNCERTAIN",
            "无法判断, UNCERTAIN",
            "错误, ERROR",
            "【Error】, ERROR",
            "否，回答存在错误, INCONSISTENT",
            "回答中的日期是错误的, INCONSISTENT",
            "否（回答中的日期是错误的）, INCONSISTENT",
            "是的，回答与文档一致, CONSISTENT",
            "not consistent, INCONSISTENT"
    })
    void mapsTokens(String token, Verdict expected) {
        assertThat(VerdictMapper.map(token)).contains(expected);
    }

    @ParameterizedTest
    @CsvSource({"''", "'  '", "'42'", "maybe"})
    void unknownTokensMapToNothing(String token) {
        assertThat(VerdictMapper.map(token)).isEmpty();
    }
}
