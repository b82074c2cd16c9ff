package com.semantic.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 供应商概要信息，用于菜单与状态展示。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderInfo {

    private String id;

    private String name;

    private ProviderType type;

    private boolean configured;

    private boolean current;

    private String defaultModel;

    private List<String> models;

    private String baseUrl;

    private int keyCount;

    private boolean autoRotate;
}
