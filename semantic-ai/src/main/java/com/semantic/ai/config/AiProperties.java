package com.semantic.ai.config;

import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.dto.ProviderType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * AI 模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "semantic.ai")
public class AiProperties {

    /** 启动时优先选用的供应商 ID，为空时自动选择第一个已配置的供应商 */
    private String currentProvider;

    /** 单次 API 调用的读超时（秒） */
    private int requestTimeoutSeconds = 60;

    /** 建立连接的超时（秒） */
    private int connectTimeoutSeconds = 10;

    /** Chat 类接口使用的系统提示词 */
    private String systemPrompt = "你是一个专业的语义分析助手。";

    /** 自定义语义比对提示词文件路径（文件系统），为空时使用 classpath:prompts/semantic-check.md */
    private String promptFile;

    /** 单次回复的最大 Token 数 */
    private int maxTokens = 1000;

    /** 供应商列表，注册顺序即配置顺序 */
    private List<ProviderProperties> providers = new ArrayList<>();

    @Data
    public static class ProviderProperties {

        private String id;

        private String name;

        /** 供应商类型: gemini / openai / anthropic / dify / iflow，为空时按 id 推断 */
        private String type;

        private boolean enabled = true;

        private List<String> apiKeys = new ArrayList<>();

        private String model;

        private List<String> models = new ArrayList<>();

        private String baseUrl;

        /** 为空时使用类型默认策略 */
        private Boolean autoRotate;

        private String appId;

        private boolean stream = false;

        private Integer maxAttempts;

        /** 源文档截断长度，0 表示使用供应商默认值 */
        private int maxDocumentLength = 0;

        private boolean validateKeysOnStartup = false;

        public ProviderConfig toConfig() {
            ProviderType providerType = ProviderType.fromName(type != null && !type.isBlank() ? type : id);
            String providerId = id != null && !id.isBlank() ? id : providerType.name().toLowerCase();
            return ProviderConfig.builder()
                    .id(providerId)
                    .name(name)
                    .type(providerType)
                    .apiKeys(apiKeys != null ? apiKeys : List.of())
                    .model(model)
                    .models(models != null ? models : List.of())
                    .baseUrl(baseUrl)
                    .autoRotate(autoRotate)
                    .appId(appId)
                    .stream(stream)
                    .maxAttempts(maxAttempts)
                    .maxDocumentLength(maxDocumentLength)
                    .validateKeysOnStartup(validateKeysOnStartup)
                    .build();
        }
    }
}
