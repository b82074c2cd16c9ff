package com.semantic.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.exception.RateLimitException;
import com.semantic.common.exception.TransientException;
import com.semantic.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Dify 应用（chat-messages）实现。
 * <p>
 * Dify 应用在平台侧绑定模型，请求里不带模型参数；整段 Prompt 作为 query 发送。
 * Base URL 统一补齐到 {@code /v1}。HTTP 地址被重定向到 HTTPS 后 POST 会变成 GET 并返回 405，
 * 此时改用 HTTPS 重发一次，之后一直使用 HTTPS。
 */
@Slf4j
public class DifyProvider extends AbstractAiProvider {

    static final int DEFAULT_DOCUMENT_LIMIT = 8000;
    private static final String USER = "semantic_tester";

    private volatile boolean upgradedToHttps;

    public DifyProvider(ProviderConfig config, ProviderContext context) {
        super(config, context);
    }

    @Override
    protected String baseUrl() {
        String url = super.baseUrl();
        if (!url.endsWith("/v1")) {
            url = url + "/v1";
        }
        if (upgradedToHttps && url.startsWith("http://")) {
            url = "https://" + url.substring("http://".length());
        }
        return url;
    }

    @Override
    protected int defaultDocumentLimit() {
        return DEFAULT_DOCUMENT_LIMIT;
    }

    @Override
    protected String callBackend(String apiKey, String model, String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("inputs");
        root.put("query", prompt);
        root.put("response_mode", config.isStream() ? "streaming" : "blocking");
        root.put("user", USER);
        if (config.getAppId() != null && !config.getAppId().isBlank()) {
            root.put("app_id", config.getAppId());
        }

        Response response = send(chatRequest(apiKey, root));
        if (response.code() == 405 && baseUrl().startsWith("http://")) {
            response.close();
            log.warn("Dify 地址 {} 返回 405，改用 HTTPS 重试", baseUrl());
            upgradedToHttps = true;
            response = send(chatRequest(apiKey, root));
        }

        try (Response r = response) {
            if (!r.isSuccessful()) {
                String body = readBody(r);
                log.error("Dify API 调用失败: {} - {}", r.code(), TextUtils.truncate(body, 300));
                throw classifyHttpError(r, body);
            }
            return config.isStream() ? readStream(r) : readBlocking(r);
        }
    }

    private String readBlocking(Response response) {
        JsonNode json = readJson(readBody(response));
        String answer = json.path("answer").asText("");
        if (answer.isEmpty()) {
            answer = json.path("message").asText("");
        }
        if (answer.isEmpty()) {
            answer = json.path("data").path("answer").asText("");
        }
        return answer;
    }

    private String readStream(Response response) {
        StringBuilder full = new StringBuilder();
        readEvents(response, (event, data) -> {
            JsonNode chunk = readJson(data);
            String type = chunk.path("event").asText(event != null ? event : "");
            switch (type) {
                case "message", "agent_message" -> {
                    String delta = chunk.path("answer").asText("");
                    full.append(delta);
                    emitToken(delta);
                }
                case "message_end" -> {
                    return false;
                }
                case "error" -> throw streamError(chunk);
                default -> {
                    // ping / workflow_started / node_finished 等
                }
            }
            return true;
        });
        return full.toString();
    }

    private RuntimeException streamError(JsonNode chunk) {
        String message = chunk.path("message").asText("未知错误");
        if (chunk.path("status").asInt(0) == 429) {
            return new RateLimitException("Dify 速率限制: " + message, RetryDelays.fromText(message));
        }
        return new TransientException("Dify 流式错误: " + message);
    }

    @Override
    protected boolean checkKey(String apiKey) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("inputs");
        root.put("query", "test");
        root.put("response_mode", "blocking");
        root.put("user", USER);
        try (Response response = send(chatRequest(apiKey, root))) {
            return response.isSuccessful();
        }
    }

    private Request chatRequest(String apiKey, ObjectNode root) {
        return new Request.Builder()
                .url(baseUrl() + "/chat-messages")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(jsonBody(root))
                .build();
    }
}
