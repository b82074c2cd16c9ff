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
 * Anthropic Messages API 实现。
 * <p>
 * 529（overloaded）与 429 一样按限流处理，建议延迟取自 retry-after 响应头。
 */
@Slf4j
public class AnthropicProvider extends AbstractAiProvider {

    private static final String API_VERSION = "2023-06-01";

    public AnthropicProvider(ProviderConfig config, ProviderContext context) {
        super(config, context);
    }

    @Override
    protected String callBackend(String apiKey, String model, String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("max_tokens", context.getProperties().getMaxTokens());
        root.put("system", context.getProperties().getSystemPrompt());
        if (config.isStream()) {
            root.put("stream", true);
        }
        ObjectNode userMsg = root.putArray("messages").addObject();
        userMsg.put("role", "user");
        userMsg.put("content", prompt);

        try (Response response = send(messagesRequest(apiKey, root))) {
            if (!response.isSuccessful()) {
                String body = readBody(response);
                log.error("Anthropic API 调用失败: {} - {}", response.code(), TextUtils.truncate(body, 300));
                throw classifyHttpError(response, body);
            }
            return config.isStream() ? readStream(response) : readBlocking(response);
        }
    }

    private String readBlocking(Response response) {
        JsonNode json = readJson(readBody(response));
        JsonNode content = json.path("content");
        if (!content.isArray()) {
            throw new TransientException("Anthropic 响应格式异常: 缺少 content");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        return text.toString();
    }

    private String readStream(Response response) {
        StringBuilder full = new StringBuilder();
        readEvents(response, (event, data) -> {
            JsonNode chunk = readJson(data);
            String type = event != null ? event : chunk.path("type").asText("");
            switch (type) {
                case "content_block_delta" -> {
                    String delta = chunk.path("delta").path("text").asText("");
                    full.append(delta);
                    emitToken(delta);
                }
                case "message_stop" -> {
                    return false;
                }
                case "error" -> throw streamError(chunk.path("error"));
                default -> {
                    // message_start / ping / content_block_start 等无需处理
                }
            }
            return true;
        });
        return full.toString();
    }

    private RuntimeException streamError(JsonNode error) {
        String type = error.path("type").asText("");
        String message = error.path("message").asText("未知错误");
        if ("overloaded_error".equals(type) || "rate_limit_error".equals(type)) {
            return new RateLimitException("Anthropic " + type + ": " + message);
        }
        return new TransientException("Anthropic 流式错误 " + type + ": " + message);
    }

    @Override
    protected RuntimeException classifyHttpError(Response response, String body) {
        if (response.code() == 529) {
            return new RateLimitException("Anthropic 服务过载 (HTTP 529)", RetryDelays.fromHeader(response));
        }
        return super.classifyHttpError(response, body);
    }

    @Override
    protected boolean checkKey(String apiKey) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", getDefaultModel());
        root.put("max_tokens", 5);
        ObjectNode userMsg = root.putArray("messages").addObject();
        userMsg.put("role", "user");
        userMsg.put("content", "Hi");
        try (Response response = send(messagesRequest(apiKey, root))) {
            return response.isSuccessful();
        }
    }

    private Request messagesRequest(String apiKey, ObjectNode root) {
        String base = baseUrl();
        String url = base.endsWith("/v1") ? base + "/messages" : base + "/v1/messages";
        return new Request.Builder()
                .url(url)
                .addHeader("x-api-key", apiKey)
                .addHeader("anthropic-version", API_VERSION)
                .post(jsonBody(root))
                .build();
    }
}
