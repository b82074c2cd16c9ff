package com.semantic.common.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单个供应商的不可变配置快照，在注册表构建时一次性读取。
 * <p>
 * 未显式配置的项回落到 {@link ProviderType} 的默认值。
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "apiKeys")
public class ProviderConfig {

    /** 供应商 ID，注册表中的唯一键 */
    private final String id;

    /** 显示名称 */
    private final String name;

    private final ProviderType type;

    /** 按配置顺序排列的 API Key */
    @Singular
    private final List<String> apiKeys;

    /** 默认模型，为空时取模型列表第一个 */
    private final String model;

    /** 自定义模型列表，为空时使用类型默认列表 */
    private final List<String> models;

    /** 自定义 Base URL（用于反代中转），为空时使用类型默认值 */
    private final String baseUrl;

    /** true: 每次调用前主动轮转；false: 仅在限流/失败时强制轮转；null: 使用类型默认策略 */
    private final Boolean autoRotate;

    /** Dify 应用 ID（可选） */
    private final String appId;

    /** 是否使用流式（SSE）调用 */
    private final boolean stream;

    /** 最大尝试次数，null 使用类型默认值 */
    private final Integer maxAttempts;

    /** 源文档截断长度，0 表示不截断 */
    private final int maxDocumentLength;

    /** 启动时是否逐个验证 Key 并剔除无效 Key */
    private final boolean validateKeysOnStartup;

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : type.getDisplayName();
    }

    public String getEffectiveBaseUrl() {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : type.getDefaultBaseUrl();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public boolean isEffectiveAutoRotate() {
        return autoRotate != null ? autoRotate : type.isDefaultAutoRotate();
    }

    public int getEffectiveMaxAttempts() {
        return maxAttempts != null && maxAttempts > 0 ? maxAttempts : type.getDefaultMaxAttempts();
    }

    /**
     * 有效模型列表：配置的默认模型排在第一位，去重，永不为空。
     */
    public List<String> getModelList() {
        Set<String> ordered = new LinkedHashSet<>();
        if (model != null && !model.isBlank()) {
            ordered.add(model.trim());
        }
        List<String> source = models != null && !models.isEmpty() ? models : type.getDefaultModels();
        for (String m : source) {
            if (m != null && !m.isBlank()) {
                ordered.add(m.trim());
            }
        }
        return List.copyOf(new ArrayList<>(ordered));
    }

    /**
     * 去除空白与重复后的 Key 列表，保持配置顺序。
     */
    public List<String> getUsableKeys() {
        Set<String> keys = new LinkedHashSet<>();
        if (apiKeys != null) {
            for (String key : apiKeys) {
                if (key != null && !key.isBlank()) {
                    keys.add(key.trim());
                }
            }
        }
        return List.copyOf(keys);
    }
}
