package com.semantic.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.exception.AuthenticationException;
import com.semantic.common.exception.RateLimitException;
import com.semantic.common.exception.TransientException;
import com.semantic.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.Response;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Google Gemini（generateContent）实现。
 * <p>
 * 限流时优先读取错误详情中的 {@code google.rpc.RetryInfo.retryDelay}，其次从错误文本中匹配。
 */
@Slf4j
public class GeminiProvider extends AbstractAiProvider {

    private static final Pattern KEY_FORMAT = Pattern.compile("^[A-Za-z0-9_-]{20,}$");
    private static final String RETRY_INFO_TYPE = "type.googleapis.com/google.rpc.RetryInfo";

    public GeminiProvider(ProviderConfig config, ProviderContext context) {
        super(config, context);
    }

    @Override
    protected String callBackend(String apiKey, String model, String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode content = root.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);
        root.putObject("generationConfig").put("temperature", 0);

        String url = config.isStream()
                ? baseUrl() + "/models/" + model + ":streamGenerateContent?alt=sse"
                : baseUrl() + "/models/" + model + ":generateContent";
        Request request = new Request.Builder()
                .url(url)
                .addHeader("x-goog-api-key", apiKey)
                .post(jsonBody(root))
                .build();

        try (Response response = send(request)) {
            if (!response.isSuccessful()) {
                String body = readBody(response);
                log.error("Gemini API 调用失败: {} - {}", response.code(), TextUtils.truncate(body, 300));
                throw classifyHttpError(response, body);
            }
            if (config.isStream()) {
                StringBuilder full = new StringBuilder();
                readEvents(response, (event, data) -> {
                    String text = extractText(readJson(data));
                    full.append(text);
                    emitToken(text);
                    return true;
                });
                return full.toString();
            }
            JsonNode json = readJson(readBody(response));
            checkBlocked(json);
            return extractText(json);
        }
    }

    @Override
    protected RuntimeException classifyHttpError(Response response, String body) {
        JsonNode error = parseError(body);
        String status = error.path("status").asText("");
        String message = error.path("message").asText(TextUtils.truncate(body, 200));

        if (response.code() == 429 || "RESOURCE_EXHAUSTED".equals(status)) {
            return new RateLimitException("Gemini 速率限制: " + message, retryDelay(error, response, body));
        }
        if (body.contains("API_KEY_INVALID") || "PERMISSION_DENIED".equals(status) || "UNAUTHENTICATED".equals(status)) {
            return new AuthenticationException("Gemini API Key 无效: " + message);
        }
        return super.classifyHttpError(response, body);
    }

    @Override
    protected boolean checkKey(String apiKey) {
        if (!KEY_FORMAT.matcher(apiKey).matches()) {
            return false;
        }
        Request request = new Request.Builder()
                .url(baseUrl() + "/models/" + getDefaultModel())
                .addHeader("x-goog-api-key", apiKey)
                .get()
                .build();
        try (Response response = send(request)) {
            return response.isSuccessful();
        }
    }

    private String extractText(JsonNode json) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : json.path("candidates").path(0).path("content").path("parts")) {
            // thinking 模型的思考片段不计入回答
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private void checkBlocked(JsonNode json) {
        String blockReason = json.path("promptFeedback").path("blockReason").asText("");
        if (!blockReason.isEmpty() && !json.path("candidates").has(0)) {
            throw new TransientException("Gemini 拒绝生成: " + blockReason);
        }
    }

    private JsonNode parseError(String body) {
        try {
            return objectMapper.readTree(body).path("error");
        } catch (JsonProcessingException e) {
            log.trace("Gemini 错误响应不是 JSON: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private Duration retryDelay(JsonNode error, Response response, String body) {
        for (JsonNode detail : error.path("details")) {
            if (RETRY_INFO_TYPE.equals(detail.path("@type").asText())) {
                Duration delay = RetryDelays.parseSeconds(detail.path("retryDelay").asText(""));
                if (delay != null) {
                    return delay;
                }
            }
        }
        return RetryDelays.from(response, body);
    }
}
