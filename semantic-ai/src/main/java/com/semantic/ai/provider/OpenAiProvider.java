package com.semantic.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.exception.TransientException;
import com.semantic.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.Response;

/**
 * OpenAI 兼容 API 实现，支持阻塞式和 SSE 流式两种调用方式。
 */
@Slf4j
public class OpenAiProvider extends AbstractAiProvider {

    public OpenAiProvider(ProviderConfig config, ProviderContext context) {
        super(config, context);
    }

    // ======================== 调用 ========================

    @Override
    protected String callBackend(String apiKey, String model, String prompt) {
        Request request = new Request.Builder()
                .url(baseUrl() + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Accept", config.isStream() ? "text/event-stream" : "application/json")
                .post(jsonBody(buildRequestBody(model, prompt)))
                .build();

        try (Response response = send(request)) {
            if (!response.isSuccessful()) {
                String body = readBody(response);
                log.error("OpenAI API 调用失败: {} - {}", response.code(), TextUtils.truncate(body, 300));
                throw classifyHttpError(response, body);
            }
            return config.isStream() ? readStream(response) : readBlocking(response);
        }
    }

    private String readBlocking(Response response) {
        JsonNode json = readJson(readBody(response));
        JsonNode message = json.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new TransientException("OpenAI 响应格式异常: 缺少 choices");
        }
        String result = message.path("content").asText("");
        log.debug("OpenAI 响应长度: {} 字符", result.length());
        return result;
    }

    private String readStream(Response response) {
        StringBuilder fullContent = new StringBuilder();
        readEvents(response, (event, data) -> {
            // 流结束标记
            if ("[DONE]".equals(data)) {
                return false;
            }
            JsonNode chunk = readJson(data);
            String delta = chunk.path("choices").path(0).path("delta").path("content").asText("");
            fullContent.append(delta);
            emitToken(delta);
            return true;
        });
        log.debug("OpenAI SSE 流结束，总长度: {} 字符", fullContent.length());
        return fullContent.toString();
    }

    /**
     * 构建 Chat Completions 请求体。
     */
    private ObjectNode buildRequestBody(String model, String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("max_tokens", context.getProperties().getMaxTokens());
        root.put("temperature", 0);
        if (config.isStream()) {
            root.put("stream", true);
        }

        ArrayNode messages = root.putArray("messages");
        ObjectNode systemMsg = messages.addObject();
        systemMsg.put("role", "system");
        systemMsg.put("content", context.getProperties().getSystemPrompt());

        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", prompt);
        return root;
    }

    // ======================== Key 验证 ========================

    @Override
    protected boolean checkKey(String apiKey) {
        if (!apiKey.startsWith("sk-")) {
            return false;
        }
        Request request = new Request.Builder()
                .url(baseUrl() + "/models")
                .addHeader("Authorization", "Bearer " + apiKey)
                .get()
                .build();
        try (Response response = send(request)) {
            return response.isSuccessful();
        }
    }
}
