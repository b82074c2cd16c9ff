package com.semantic.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * API Key 状态快照，用于状态展示，不包含 Key 明文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyInfo {

    /** 在池中的位置（配置顺序） */
    private int index;

    /** 脱敏后的 Key，如 sk-abcde*** */
    private String maskedKey;

    /** 最近一次被选中的时间 */
    private Instant lastUsedAt;

    /** 冷却截止时间，EPOCH 表示从未冷却 */
    private Instant cooldownUntil;

    /** 剩余冷却秒数 */
    private long cooldownRemainingSeconds;

    private Status status;

    /** 是否为池的当前 Key */
    private boolean current;

    public enum Status {
        ACTIVE, COOLDOWN
    }
}
