package com.semantic.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.dto.ProviderInfo;
import com.semantic.common.dto.ProviderType;
import com.semantic.common.exception.AuthenticationException;
import com.semantic.common.exception.ConfigurationException;
import com.semantic.common.exception.RateLimitException;
import com.semantic.common.exception.TransientException;
import com.semantic.common.util.IdGenerator;
import com.semantic.common.util.TextUtils;
import com.semantic.dispatcher.pool.ApiKeyPool;
import com.semantic.dispatcher.retry.RetryPolicy;
import com.semantic.dispatcher.wait.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 供应商公共骨架：Key 池构建、重试编排、响应归一化与 HTTP 错误分类。
 * <p>
 * 子类只需实现三件事：发起一次调用并返回模型原始文本（{@link #callBackend}），
 * 在线验证 Key（{@link #checkKey}），以及必要时覆盖错误分类与 Prompt 构建。
 * 构造完成后须调用 {@link #initialize()}，由 {@link AiProviderFactory} 负责。
 */
@Slf4j
public abstract class AbstractAiProvider implements AiProvider {

    protected static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    protected final ProviderConfig config;
    protected final ProviderContext context;
    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    private final CancellationSignal cancellationSignal = new CancellationSignal();
    private volatile Consumer<String> tokenListener = token -> { };
    private volatile ApiKeyPool keyPool;
    private volatile boolean clientReady;

    protected AbstractAiProvider(ProviderConfig config, ProviderContext context) {
        this.config = config;
        this.context = context;
        this.httpClient = context.getHttpClient();
        this.objectMapper = context.getObjectMapper();
    }

    /**
     * 检查 Base URL，按需在线验证 Key，然后建立 Key 池。
     */
    public final void initialize() {
        clientReady = HttpUrl.parse(baseUrl()) != null;
        if (!clientReady) {
            log.warn("{} 的 Base URL 无效: {}", getName(), baseUrl());
        }

        List<String> keys = config.getUsableKeys();
        if (config.isValidateKeysOnStartup() && clientReady && !keys.isEmpty()) {
            List<String> valid = new ArrayList<>();
            for (String key : keys) {
                if (validateKey(key)) {
                    valid.add(key);
                } else {
                    log.warn("{} Key {} 验证失败，已从池中移除", getName(), TextUtils.maskKey(key));
                }
            }
            keys = valid;
        }

        keyPool = context.getKeyPoolFactory().create(getName(), keys, config.isEffectiveAutoRotate());
        log.info("{} 初始化完成: {} 个 Key，{}轮转，默认模型 {}",
                getName(), keys.size(), config.isEffectiveAutoRotate() ? "自动" : "手动", getDefaultModel());
    }

    // ======================== 契约实现 ========================

    @Override
    public String getId() {
        return config.getId();
    }

    @Override
    public String getName() {
        return config.getDisplayName();
    }

    @Override
    public ProviderType getType() {
        return config.getType();
    }

    @Override
    public List<String> getModels() {
        return config.getModelList();
    }

    @Override
    public boolean isConfigured() {
        ApiKeyPool pool = keyPool;
        return clientReady && pool != null && !pool.isEmpty();
    }

    @Override
    public ApiKeyPool getKeyPool() {
        return keyPool;
    }

    @Override
    public void setTokenListener(Consumer<String> tokenListener) {
        this.tokenListener = tokenListener != null ? tokenListener : token -> { };
    }

    @Override
    public void cancel() {
        cancellationSignal.cancel();
    }

    @Override
    public ProviderInfo getProviderInfo() {
        ApiKeyPool pool = keyPool;
        return ProviderInfo.builder()
                .id(getId())
                .name(getName())
                .type(getType())
                .configured(isConfigured())
                .defaultModel(getDefaultModel())
                .models(getModels())
                .baseUrl(baseUrl())
                .keyCount(pool != null ? pool.size() : 0)
                .autoRotate(config.isEffectiveAutoRotate())
                .build();
    }

    @Override
    public final boolean validateKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return false;
        }
        try {
            boolean valid = checkKey(apiKey.trim());
            log.debug("{} Key {} 验证{}", getName(), TextUtils.maskKey(apiKey), valid ? "通过" : "失败");
            return valid;
        } catch (IOException | RuntimeException e) {
            log.warn("{} Key {} 验证出错: {}", getName(), TextUtils.maskKey(apiKey), e.getMessage());
            return false;
        }
    }

    @Override
    public EvaluationOutcome evaluate(String question, String aiAnswer, String reference, String model) {
        if (!isConfigured()) {
            return EvaluationOutcome.error("供应商 " + getName() + " 未正确配置");
        }
        String modelToUse = model != null && !model.isBlank() ? model.trim() : getDefaultModel();
        String evalId = IdGenerator.withPrefix("eval");

        try {
            String prompt = buildPrompt(question, aiAnswer, reference);
            RetryPolicy policy = context.getRetryOrchestrator().policyFor(config.getEffectiveMaxAttempts());
            long start = System.currentTimeMillis();

            EvaluationOutcome outcome = context.getRetryOrchestrator().execute(getName(), keyPool, policy,
                    (apiKey, attempt) -> context.getNormalizer().normalize(callBackend(apiKey, modelToUse, prompt)));

            log.info("[{}] {} ({}) 比对结果: {}，耗时 {}ms",
                    evalId, getName(), modelToUse, outcome.getVerdict().getLabel(), System.currentTimeMillis() - start);
            return outcome;
        } catch (RuntimeException e) {
            log.error("[{}] {} 语义比对异常", evalId, getName(), e);
            return EvaluationOutcome.error(getName() + " 调用异常: " + e.getMessage());
        }
    }

    // ======================== 子类扩展点 ========================

    /**
     * 使用指定 Key 发起一次调用，返回模型的原始文本。
     * 失败时抛出 {@link AuthenticationException}、{@link RateLimitException}、
     * {@link ConfigurationException} 或 {@link TransientException}。
     */
    protected abstract String callBackend(String apiKey, String model, String prompt);

    /** 在线检查 Key，返回是否可用 */
    protected abstract boolean checkKey(String apiKey) throws IOException;

    protected String buildPrompt(String question, String aiAnswer, String reference) {
        return context.getPromptTemplates().semanticCheck(question, aiAnswer,
                TextUtils.truncate(reference, documentLimit()));
    }

    /** 源文档截断长度，配置优先，0 表示不截断 */
    protected int documentLimit() {
        return config.getMaxDocumentLength() > 0 ? config.getMaxDocumentLength() : defaultDocumentLimit();
    }

    protected int defaultDocumentLimit() {
        return 0;
    }

    protected String baseUrl() {
        return config.getEffectiveBaseUrl();
    }

    /**
     * 非 2xx 响应的默认分类：401/403 认证失败，429 限流，408/5xx 暂时性错误，其余 4xx 视为请求错误不再重试。
     */
    protected RuntimeException classifyHttpError(Response response, String body) {
        int code = response.code();
        String detail = TextUtils.truncate(body, 200);
        if (code == 401 || code == 403) {
            return new AuthenticationException(getName() + " API Key 无效或无权限 (HTTP " + code + ")");
        }
        if (code == 429) {
            return new RateLimitException(getName() + " 速率限制 (HTTP 429): " + detail, RetryDelays.from(response, body));
        }
        if (code == 408 || code >= 500) {
            return new TransientException(getName() + " 服务暂时不可用 (HTTP " + code + "): " + detail);
        }
        return new ConfigurationException(getName() + " 请求被拒绝 (HTTP " + code + "): " + detail);
    }

    // ======================== HTTP 工具 ========================

    protected Response send(Request request) {
        try {
            return httpClient.newCall(request).execute();
        } catch (InterruptedIOException e) {
            throw new TransientException(getName() + " 请求超时", e);
        } catch (IOException e) {
            throw new TransientException(getName() + " 网络错误: " + e.getMessage(), e);
        }
    }

    protected String readBody(Response response) {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        try {
            return body.string();
        } catch (IOException e) {
            throw new TransientException(getName() + " 读取响应失败: " + e.getMessage(), e);
        }
    }

    protected JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientException(getName() + " 响应不是合法 JSON: " + TextUtils.truncate(body, 200), e);
        }
    }

    protected RequestBody jsonBody(ObjectNode root) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("构建请求体失败", e);
        }
    }

    /**
     * 读取 SSE 流直到终止标记或流结束。调用 {@link #cancel()} 后下一行读取前抛出停止异常。
     */
    protected void readEvents(Response response, SseEventReader.EventHandler handler) {
        ResponseBody body = response.body();
        if (body == null) {
            throw new TransientException(getName() + " SSE 响应体为空");
        }
        CancellationSignal.Token token = cancellationSignal.newToken();
        try {
            boolean terminated = SseEventReader.read(body.source(), token, handler);
            log.debug("{} SSE 流结束 (终止标记: {})", getName(), terminated);
        } catch (InterruptedIOException e) {
            throw new TransientException(getName() + " 流式读取超时", e);
        } catch (IOException e) {
            throw new TransientException(getName() + " 流式读取中断: " + e.getMessage(), e);
        }
    }

    /** 推送一段增量文本给监听者 */
    protected void emitToken(String token) {
        if (token != null && !token.isEmpty()) {
            tokenListener.accept(token);
        }
    }

}
