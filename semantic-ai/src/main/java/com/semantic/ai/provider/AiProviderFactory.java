package com.semantic.ai.provider;

import com.semantic.common.dto.ProviderConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * AI 供应商工厂，根据配置类型创建对应的 Provider 并完成初始化。
 */
@Slf4j
@RequiredArgsConstructor
public class AiProviderFactory {

    private final ProviderContext context;

    public AiProvider create(ProviderConfig config) {
        AbstractAiProvider provider = switch (config.getType()) {
            case GEMINI -> new GeminiProvider(config, context);
            case OPENAI -> new OpenAiProvider(config, context);
            case ANTHROPIC -> new AnthropicProvider(config, context);
            case DIFY -> new DifyProvider(config, context);
            case IFLOW -> new IflowProvider(config, context);
        };
        provider.initialize();
        log.debug("已创建供应商 {} ({})", config.getId(), config.getType());
        return provider;
    }
}
