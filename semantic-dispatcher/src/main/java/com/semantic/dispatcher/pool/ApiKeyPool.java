package com.semantic.dispatcher.pool;

import com.semantic.common.dto.ApiKeyInfo;

import java.time.Duration;
import java.util.List;

/**
 * 单个供应商独占的 API Key 轮转池。
 * <p>
 * Key 按配置顺序排列，池在启动校验之后不再增减；
 * 轮转与冷却状态由池自身加锁维护，可被多个工作线程同时使用。
 */
public interface ApiKeyPool {

    /**
     * 按轮转策略选出下一次调用使用的 Key。
     * <ul>
     *   <li>{@code force = true}：无条件前进一位，忽略冷却与间隔</li>
     *   <li>{@code force = false} 且为手动策略：不轮转，返回当前 Key</li>
     *   <li>{@code force = false} 且为自动策略：跳过冷却中的 Key，必要时等待使用间隔或最短冷却</li>
     * </ul>
     *
     * @return 选中的 Key
     * @throws com.semantic.common.exception.KeyPoolExhaustedException 池为空
     */
    String rotate(boolean force);

    /** 当前 Key，不触发轮转 */
    String currentKey();

    /** 配置中的第一个 Key，不读取也不改变轮转状态，用于按需验证 */
    String firstKey();

    /** 将指定 Key 冷却到 now + delay */
    void coolDown(String key, Duration delay);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /** 是否每次调用前自动轮转 */
    boolean isAutoRotate();

    /** 各 Key 状态快照（已脱敏） */
    List<ApiKeyInfo> snapshot();
}
