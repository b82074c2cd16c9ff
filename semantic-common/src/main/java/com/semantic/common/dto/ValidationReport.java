package com.semantic.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 供应商 API Key 在线验证报告。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    /** 供应商 ID -> 验证结果，保持注册顺序 */
    private Map<String, Entry> results;

    private int validCount;

    private int invalidCount;

    private int unconfiguredCount;

    public enum Status {
        UNCONFIGURED("未配置"),
        VALID("验证通过"),
        INVALID("验证失败");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        private String name;

        private Status status;

        private String message;
    }
}
