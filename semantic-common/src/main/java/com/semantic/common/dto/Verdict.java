package com.semantic.common.dto;

/**
 * 语义比对结论。
 * <p>
 * {@link #getLabel()} 为写回结果表格的文字。
 */
public enum Verdict {

    /** 回答与源文档语义相符 */
    CONSISTENT("是"),

    /** 回答与源文档语义不符 */
    INCONSISTENT("否"),

    /** 信息不足，无法明确判断 */
    UNCERTAIN("不确定"),

    /** 技术性错误（供应商不可用、重试耗尽等） */
    ERROR("错误");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
