package com.semantic.common.dto;

import java.util.List;
import java.util.Locale;

/**
 * 支持的 AI 供应商类型，以及各自的默认端点、模型列表、轮转策略和重试次数。
 */
public enum ProviderType {

    GEMINI("Gemini", "https://generativelanguage.googleapis.com/v1beta",
            List.of("gemini-2.5-flash", "gemini-2.5-pro", "gemini-2.0-flash-thinking-exp-1219",
                    "gemini-1.5-flash", "gemini-1.5-pro"),
            true, 5),

    OPENAI("OpenAI", "https://api.openai.com/v1",
            List.of("gpt-4o", "gpt-4o-mini", "gpt-4-turbo", "gpt-3.5-turbo", "gpt-4"),
            true, 3),

    ANTHROPIC("Anthropic", "https://api.anthropic.com",
            List.of("claude-sonnet-4-20250514", "claude-3-7-sonnet-20250314",
                    "claude-3-5-sonnet-20241022", "claude-3-5-haiku-20241022", "claude-3-opus-20240229"),
            false, 3),

    DIFY("Dify", "https://api.dify.ai/v1",
            List.of("Dify App"),
            false, 3),

    IFLOW("iFlow", "https://apis.iflow.cn/v1",
            List.of("qwen3-max", "kimi-k2-0905", "glm-4.6", "deepseek-v3.2"),
            false, 3);

    private final String displayName;
    private final String defaultBaseUrl;
    private final List<String> defaultModels;
    private final boolean defaultAutoRotate;
    private final int defaultMaxAttempts;

    ProviderType(String displayName, String defaultBaseUrl, List<String> defaultModels,
                 boolean defaultAutoRotate, int defaultMaxAttempts) {
        this.displayName = displayName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModels = defaultModels;
        this.defaultAutoRotate = defaultAutoRotate;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public List<String> getDefaultModels() {
        return defaultModels;
    }

    public boolean isDefaultAutoRotate() {
        return defaultAutoRotate;
    }

    public int getDefaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    /**
     * 按名称解析供应商类型，忽略大小写与连字符，如 "openai"、"Open-AI"。
     *
     * @throws IllegalArgumentException 未知类型
     */
    public static ProviderType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("供应商类型为空");
        }
        String normalized = name.trim().replace("-", "").replace("_", "").toUpperCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的供应商类型: " + name + "，可选: gemini, openai, anthropic, dify, iflow");
    }
}
