package com.semantic.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.dto.ProviderType;
import com.semantic.common.dto.Verdict;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.semantic.ai.provider.ProviderTestSupport.openAiResponse;
import static org.assertj.core.api.Assertions.assertThat;

class IflowProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private AiProvider provider() {
        return ProviderTestSupport.create(ProviderConfig.builder()
                .id("iflow").type(ProviderType.IFLOW)
                .apiKey("iflow-key")
                .baseUrl(server.url("/v1").toString())
                .build());
    }

    @Test
    void labeledPromptAndAnswer() throws Exception {
        server.enqueue(new MockResponse().setBody(openAiResponse("判断结果：是\n判断依据：一致")));

        EvaluationOutcome outcome = provider().evaluate("q", "a", "文".repeat(5000), null);

        assertThat(outcome).isEqualTo(EvaluationOutcome.consistent("一致"));
        JsonNode body = new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("qwen3-max");
        String prompt = body.path("messages").path(1).path("content").asText();
        assertThat(prompt).contains("判断结果：是/否/不确定");
        assertThat(prompt).doesNotContain("文".repeat(IflowProvider.DEFAULT_DOCUMENT_LIMIT + 1));
    }

    @Test
    void invalidKeyBusinessCodeIsAuthenticationError() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"434\",\"msg\":\"Invalid apiKey\",\"body\":null}"));

        EvaluationOutcome outcome = provider().evaluate("q", "a", "doc", null);

        assertThat(outcome.isError()).isTrue();
        assertThat(outcome.getJustification()).contains("434");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void rateLimitBusinessCodeIsRetried() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"449\",\"msg\":\"You exceeded your current rate limit\"}"));
        server.enqueue(new MockResponse().setBody(openAiResponse("{\"result\":\"否\",\"reason\":\"不符\"}")));

        EvaluationOutcome outcome = provider().evaluate("q", "a", "doc", null);

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.INCONSISTENT);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void missingChoicesIsTransient() {
        server.enqueue(new MockResponse().setBody("{\"id\":\"x\",\"choices\":[]}"));
        server.enqueue(new MockResponse().setBody("{\"status\":\"500\",\"msg\":\"model error\"}"));
        server.enqueue(new MockResponse().setBody(openAiResponse("判断结果：不确定")));

        EvaluationOutcome outcome = provider().evaluate("q", "a", "doc", null);

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.UNCERTAIN);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }
}
