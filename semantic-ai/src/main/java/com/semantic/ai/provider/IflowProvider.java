package com.semantic.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.exception.AuthenticationException;
import com.semantic.common.exception.RateLimitException;
import com.semantic.common.exception.TransientException;
import com.semantic.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.Response;

import java.util.Set;

/**
 * iFlow（心流）OpenAI 兼容接口实现。
 * <p>
 * iFlow 的业务错误以 HTTP 200 + {"status": "...", "msg": "..."} 返回，需要先检查业务码：
 * 434/439/401 为 Key 无效，429/449/8211 为限流，其余非零码按暂时性错误处理。
 * Prompt 使用"判断结果/判断依据"标签行格式。
 */
@Slf4j
public class IflowProvider extends AbstractAiProvider {

    static final int DEFAULT_DOCUMENT_LIMIT = 3000;

    private static final String SYSTEM_PROMPT =
            "你是一个专业的语义分析专家。请根据提供的源文档内容，判断AI客服的回答在语义上是否与源文档相符。";

    private static final Set<String> AUTH_CODES = Set.of("434", "439", "401");
    private static final Set<String> RATE_LIMIT_CODES = Set.of("429", "449", "8211");
    private static final Set<String> OK_CODES = Set.of("", "0", "200");

    public IflowProvider(ProviderConfig config, ProviderContext context) {
        super(config, context);
    }

    @Override
    protected int defaultDocumentLimit() {
        return DEFAULT_DOCUMENT_LIMIT;
    }

    @Override
    protected String buildPrompt(String question, String aiAnswer, String reference) {
        return context.getPromptTemplates().labeledCheck(question, aiAnswer,
                TextUtils.truncate(reference, documentLimit()));
    }

    @Override
    protected String callBackend(String apiKey, String model, String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("stream", false);
        root.put("temperature", 0.3);
        root.put("max_tokens", context.getProperties().getMaxTokens());
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", prompt);

        Request request = new Request.Builder()
                .url(baseUrl() + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(jsonBody(root))
                .build();

        try (Response response = send(request)) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                log.error("iFlow API 调用失败: {} - {}", response.code(), TextUtils.truncate(body, 300));
                throw classifyHttpError(response, body);
            }

            JsonNode json = readJson(body);
            checkBusinessStatus(json);

            JsonNode choices = json.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new TransientException("iFlow 响应格式异常: 缺少 choices");
            }
            return choices.path(0).path("message").path("content").asText("");
        }
    }

    private void checkBusinessStatus(JsonNode json) {
        String status = json.path("status").asText("").trim();
        if (OK_CODES.contains(status)) {
            return;
        }
        String msg = json.path("msg").asText("");
        log.warn("iFlow 业务错误: status={}, msg={}", status, msg);
        if (AUTH_CODES.contains(status)) {
            throw new AuthenticationException("iFlow API Key 无效 (" + status + "): " + msg);
        }
        if (RATE_LIMIT_CODES.contains(status)) {
            throw new RateLimitException("iFlow 速率限制 (" + status + "): " + msg, RetryDelays.fromText(msg));
        }
        throw new TransientException("iFlow 业务错误 (" + status + "): " + msg);
    }

    @Override
    protected boolean checkKey(String apiKey) {
        Request request = new Request.Builder()
                .url(baseUrl() + "/models")
                .addHeader("Authorization", "Bearer " + apiKey)
                .get()
                .build();
        try (Response response = send(request)) {
            if (!response.isSuccessful()) {
                return false;
            }
            JsonNode json = readJson(readBody(response));
            return OK_CODES.contains(json.path("status").asText("").trim());
        }
    }
}
