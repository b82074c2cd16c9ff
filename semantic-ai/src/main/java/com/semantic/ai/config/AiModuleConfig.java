package com.semantic.ai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semantic.ai.parse.ResponseNormalizer;
import com.semantic.ai.prompt.PromptTemplates;
import com.semantic.ai.provider.AiProviderFactory;
import com.semantic.ai.provider.ProviderContext;
import com.semantic.ai.registry.ProviderRegistry;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.dispatcher.config.DispatcherModuleConfig;
import com.semantic.dispatcher.pool.KeyPoolFactory;
import com.semantic.dispatcher.retry.RetryOrchestrator;
import com.semantic.dispatcher.wait.Waiter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;

/**
 * AI 模块自动配置。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.semantic.ai")
@Import(DispatcherModuleConfig.class)
@EnableConfigurationProperties(AiProperties.class)
public class AiModuleConfig {

    @Bean
    public OkHttpClient aiHttpClient(AiProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
    }

    @Bean
    public AiProviderFactory aiProviderFactory(OkHttpClient aiHttpClient, AiProperties properties,
                                               PromptTemplates promptTemplates, ResponseNormalizer normalizer,
                                               RetryOrchestrator retryOrchestrator, KeyPoolFactory keyPoolFactory) {
        return new AiProviderFactory(new ProviderContext(aiHttpClient, new ObjectMapper(), properties,
                promptTemplates, normalizer, retryOrchestrator, keyPoolFactory));
    }

    /**
     * 按配置顺序注册供应商。类型无法识别的条目记录错误后跳过。
     */
    @Bean
    public ProviderRegistry providerRegistry(AiProperties properties, AiProviderFactory factory, Waiter waiter) {
        ProviderRegistry registry = new ProviderRegistry(factory, waiter);
        for (AiProperties.ProviderProperties entry : properties.getProviders()) {
            if (!entry.isEnabled()) {
                log.info("供应商 {} 已禁用，跳过", entry.getId());
                continue;
            }
            ProviderConfig config;
            try {
                config = entry.toConfig();
            } catch (IllegalArgumentException e) {
                log.error("供应商配置无效，跳过: {}", e.getMessage());
                continue;
            }
            registry.register(config);
        }

        registry.autoSelect();
        String preferred = properties.getCurrentProvider();
        if (preferred != null && !preferred.isBlank()) {
            if (!registry.switchTo(preferred)) {
                log.warn("配置的当前供应商 {} 未注册，保持自动选择结果", preferred);
            }
        }
        return registry;
    }
}
