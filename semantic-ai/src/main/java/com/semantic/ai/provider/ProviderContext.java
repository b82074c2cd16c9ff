package com.semantic.ai.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semantic.ai.config.AiProperties;
import com.semantic.ai.parse.ResponseNormalizer;
import com.semantic.ai.prompt.PromptTemplates;
import com.semantic.dispatcher.pool.KeyPoolFactory;
import com.semantic.dispatcher.retry.RetryOrchestrator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;

/**
 * 所有供应商共享的基础设施，由 {@link AiProviderFactory} 注入到每个供应商实例。
 */
@Getter
@RequiredArgsConstructor
public class ProviderContext {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AiProperties properties;
    private final PromptTemplates promptTemplates;
    private final ResponseNormalizer normalizer;
    private final RetryOrchestrator retryOrchestrator;
    private final KeyPoolFactory keyPoolFactory;
}
