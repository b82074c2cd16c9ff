package com.semantic.ai.provider;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.dto.ProviderType;
import com.semantic.common.dto.Verdict;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.semantic.ai.provider.ProviderTestSupport.quote;
import static org.assertj.core.api.Assertions.assertThat;

class AnthropicProviderTest {

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

    private AiProvider provider(boolean stream) {
        return ProviderTestSupport.create(ProviderConfig.builder()
                .id("anthropic").type(ProviderType.ANTHROPIC)
                .apiKey("sk-ant-test")
                .baseUrl(server.url("/").toString())
                .stream(stream)
                .build());
    }

    private static String message(String text) {
        return "{\"id\":\"msg_1\",\"type\":\"message\",\"content\":[{\"type\":\"text\",\"text\":" + quote(text) + "}]}";
    }

    @Test
    void bracketedVerdictIsParsed() throws Exception {
        server.enqueue(new MockResponse().setBody(message("判断结果：【是】\n判断依据：一致")));

        EvaluationOutcome outcome = provider(false).evaluate("q", "a", "doc", null);

        assertThat(outcome).isEqualTo(EvaluationOutcome.consistent("一致"));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant-test");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
    }

    @Test
    void overloadedIsTreatedAsRateLimit() {
        server.enqueue(new MockResponse().setResponseCode(529).setHeader("retry-after", "3")
                .setBody("{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}"));
        server.enqueue(new MockResponse().setBody(message("```json\n{\"result\":\"否\",\"reason\":\"不符\"}\n```")));

        AiProvider anthropic = provider(false);
        EvaluationOutcome outcome = anthropic.evaluate("q", "a", "doc", null);

        assertThat(outcome).isEqualTo(EvaluationOutcome.inconsistent("不符"));
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void streamingDeltasAreCollectedUntilMessageStop() {
        String sse = "event: message_start\ndata: {\"type\":\"message_start\"}\n\n"
                + "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":"
                + quote("{\"result\":\"不确定\",") + "}}\n\n"
                + "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":"
                + quote("\"reason\":\"信息不足\"}") + "}}\n\n"
                + "event: message_stop\ndata: {\"type\":\"message_stop\"}\n\n";
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(sse));

        EvaluationOutcome outcome = provider(true).evaluate("q", "a", "doc", null);

        assertThat(outcome).isEqualTo(EvaluationOutcome.uncertain("信息不足"));
    }

    @Test
    void streamErrorEventIsRetried() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(
                "event: error\ndata: {\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}\n\n"));
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(
                "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"delta\":{\"text\":"
                        + quote("判断结果：是") + "}}\n\nevent: message_stop\ndata: {\"type\":\"message_stop\"}\n\n"));

        EvaluationOutcome outcome = provider(true).evaluate("q", "a", "doc", null);

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.CONSISTENT);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void baseUrlEndingWithV1IsNotDoubled() throws Exception {
        AiProvider anthropic = ProviderTestSupport.create(ProviderConfig.builder()
                .id("relay").type(ProviderType.ANTHROPIC)
                .apiKey("sk-ant-test")
                .baseUrl(server.url("/v1").toString())
                .build());
        server.enqueue(new MockResponse().setBody("{\"content\":[]}"));

        assertThat(anthropic.validateKey("sk-ant-test")).isTrue();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/messages");
    }
}
