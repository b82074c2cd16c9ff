package com.semantic.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 注册表配置概况：总数、已配置数与当前供应商。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationSummary {

    private int total;

    private int configured;

    /** 当前供应商 ID，无任何供应商时为 null */
    private String currentId;

    private String currentName;

    private List<ProviderInfo> providers;
}
