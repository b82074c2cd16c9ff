package com.semantic.ai.provider;

import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.ProviderInfo;
import com.semantic.common.dto.ProviderType;
import com.semantic.dispatcher.pool.ApiKeyPool;

import java.util.List;
import java.util.function.Consumer;

/**
 * AI 供应商统一契约。
 * 通过适配器模式屏蔽不同后端（Gemini、OpenAI、Anthropic、Dify、iFlow）的协议差异，
 * 对外只暴露"问题 + 回答 + 源文档 → 结论"这一种调用。
 */
public interface AiProvider {

    /** 注册表中的唯一 ID */
    String getId();

    /** 显示名称 */
    String getName();

    ProviderType getType();

    /** 可选模型列表，第一个为默认模型 */
    List<String> getModels();

    default String getDefaultModel() {
        List<String> models = getModels();
        return models.isEmpty() ? "" : models.get(0);
    }

    /**
     * 在线验证单个 Key 是否可用，网络异常与鉴权失败都返回 false。
     */
    boolean validateKey(String apiKey);

    /** 至少有一个可用 Key 且客户端可构建 */
    boolean isConfigured();

    /**
     * 执行一次语义比对，内部完成 Key 轮转与重试。
     * <p>
     * 永不抛出异常：认证失败、重试耗尽、被取消等情况都以 {@link com.semantic.common.dto.Verdict#ERROR} 返回。
     *
     * @param question  用户问题
     * @param aiAnswer  待检查的 AI 客服回答
     * @param reference 源知识库文档内容
     * @param model     指定模型，为空时使用默认模型
     */
    EvaluationOutcome evaluate(String question, String aiAnswer, String reference, String model);

    ProviderInfo getProviderInfo();

    ApiKeyPool getKeyPool();

    /**
     * 流式调用时每收到一段增量文本的回调，默认不处理。
     */
    void setTokenListener(Consumer<String> tokenListener);

    /** 停止正在进行的流式读取 */
    void cancel();
}
