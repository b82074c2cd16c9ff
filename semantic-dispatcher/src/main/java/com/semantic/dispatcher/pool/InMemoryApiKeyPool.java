package com.semantic.dispatcher.pool;

import com.semantic.common.dto.ApiKeyInfo;
import com.semantic.common.exception.KeyPoolExhaustedException;
import com.semantic.common.util.TextUtils;
import com.semantic.dispatcher.wait.Waiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的 API Key 轮转池。
 * <p>
 * 选 Key 的扫描过程在 {@link ReentrantLock} 内完成，保证多线程下 {@code currentIndex}、
 * 使用时间与冷却时间的一致；需要等待的部分（使用间隔、全部冷却）在锁外通过 {@link Waiter} 完成，
 * 不阻塞其他线程的轮转请求。
 */
@Slf4j
public class InMemoryApiKeyPool implements ApiKeyPool {

    private final String poolName;
    private final List<KeyState> keys;
    private final boolean autoRotate;
    private final Duration minKeySpacing;
    private final Clock clock;
    private final Waiter waiter;
    private final ReentrantLock lock = new ReentrantLock();

    private int currentIndex = 0;
    private boolean firstActualUse = true;

    public InMemoryApiKeyPool(String poolName, List<String> apiKeys, boolean autoRotate,
                              Duration minKeySpacing, Clock clock, Waiter waiter) {
        this.poolName = poolName;
        this.autoRotate = autoRotate;
        this.minKeySpacing = minKeySpacing;
        this.clock = clock;
        this.waiter = waiter;
        List<KeyState> states = new ArrayList<>(apiKeys.size());
        for (String key : apiKeys) {
            states.add(new KeyState(key));
        }
        this.keys = List.copyOf(states);
        log.debug("[{}] 已初始化 {} 个 API Key, 自动轮转: {}", poolName, keys.size(), autoRotate);
    }

    @Override
    public String rotate(boolean force) {
        return rotate(force, false, 1);
    }

    private String rotate(boolean force, boolean afterCooldownWait, int retriesLeft) {
        ensureNotEmpty();

        Selection selection;
        lock.lock();
        try {
            selection = select(force, afterCooldownWait);
        } finally {
            lock.unlock();
        }

        if (selection.key != null) {
            waiter.await(selection.wait, poolName + " 密钥 " + selection.index + " 使用间隔未满");
            return selection.key;
        }

        // 所有 Key 都在冷却中：等最短的剩余冷却时间后重选一次
        waiter.await(selection.wait, poolName + " 所有密钥冷却中");
        if (retriesLeft > 0) {
            return rotate(false, true, retriesLeft - 1);
        }
        log.warn("[{}] 等待冷却后仍无可用密钥，强制轮转", poolName);
        return rotate(true, false, 0);
    }

    /**
     * 扫描并选定 Key，调用方必须持有锁。
     */
    private Selection select(boolean force, boolean afterCooldownWait) {
        Instant now = clock.instant();
        int size = keys.size();

        if (force) {
            currentIndex = (currentIndex + 1) % size;
            KeyState forced = keys.get(currentIndex);
            forced.lastUsedAt = now;
            log.info("[{}] 强制轮转: 新密钥索引 {}", poolName, currentIndex);
            return new Selection(forced.key, currentIndex, Duration.ZERO);
        }

        if (!autoRotate) {
            return new Selection(keys.get(currentIndex).key, currentIndex, Duration.ZERO);
        }

        Duration shortestCooldown = null;
        for (int step = 1; step <= size; step++) {
            int index = (currentIndex + step) % size;
            KeyState candidate = keys.get(index);

            Duration cooldownRemaining = positiveBetween(now, candidate.cooldownUntil);
            if (!cooldownRemaining.isZero()) {
                log.info("[{}] 密钥 {} 冷却中: 剩余 {}s", poolName, index, seconds(cooldownRemaining));
                if (shortestCooldown == null || cooldownRemaining.compareTo(shortestCooldown) < 0) {
                    shortestCooldown = cooldownRemaining;
                }
                continue;
            }

            Duration spacingWait = Duration.ZERO;
            if (firstActualUse) {
                log.info("[{}] 首次实际调用，密钥 {} 可用", poolName, index);
                firstActualUse = false;
            } else if (size > 1 && !afterCooldownWait) {
                Duration sinceLastUse = Duration.between(candidate.lastUsedAt, now);
                if (sinceLastUse.compareTo(minKeySpacing) < 0) {
                    spacingWait = minKeySpacing.minus(sinceLastUse);
                    log.info("[{}] 密钥 {} 需要等待: {}s", poolName, index, seconds(spacingWait));
                }
            }

            currentIndex = index;
            // 预占到等待结束的时刻，避免其他线程在等待期间再次选中它
            candidate.lastUsedAt = now.plus(spacingWait);
            log.info("[{}] 密钥 {} 可用", poolName, index);
            return new Selection(candidate.key, index, spacingWait);
        }

        log.warn("[{}] 所有密钥不可用，等待最短冷却时间: {}s", poolName, seconds(shortestCooldown));
        return new Selection(null, -1, shortestCooldown);
    }

    @Override
    public String currentKey() {
        ensureNotEmpty();
        lock.lock();
        try {
            return keys.get(currentIndex).key;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String firstKey() {
        ensureNotEmpty();
        return keys.get(0).key;
    }

    @Override
    public void coolDown(String key, Duration delay) {
        lock.lock();
        try {
            for (int i = 0; i < keys.size(); i++) {
                KeyState state = keys.get(i);
                if (state.key.equals(key)) {
                    state.cooldownUntil = clock.instant().plus(delay);
                    log.warn("[{}] 密钥 {} ({}) 进入冷却 {}s", poolName, i, TextUtils.maskKey(key), seconds(delay));
                    return;
                }
            }
            log.debug("[{}] 冷却请求的 Key 不在池中: {}", poolName, TextUtils.maskKey(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return keys.size();
    }

    @Override
    public boolean isAutoRotate() {
        return autoRotate;
    }

    @Override
    public List<ApiKeyInfo> snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ApiKeyInfo> infos = new ArrayList<>(keys.size());
            for (int i = 0; i < keys.size(); i++) {
                KeyState state = keys.get(i);
                Duration remaining = positiveBetween(now, state.cooldownUntil);
                infos.add(ApiKeyInfo.builder()
                        .index(i)
                        .maskedKey(TextUtils.maskKey(state.key))
                        .lastUsedAt(state.lastUsedAt)
                        .cooldownUntil(state.cooldownUntil)
                        .cooldownRemainingSeconds(remaining.toSeconds())
                        .status(remaining.isZero() ? ApiKeyInfo.Status.ACTIVE : ApiKeyInfo.Status.COOLDOWN)
                        .current(i == currentIndex)
                        .build());
            }
            return infos;
        } finally {
            lock.unlock();
        }
    }

    private void ensureNotEmpty() {
        if (keys.isEmpty()) {
            throw new KeyPoolExhaustedException(poolName + " 未配置任何 API Key");
        }
    }

    private static Duration positiveBetween(Instant now, Instant until) {
        Duration remaining = Duration.between(now, until);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private static String seconds(Duration duration) {
        return String.format("%.1f", duration.toMillis() / 1000.0);
    }

    private static final class KeyState {

        private final String key;

        /** 从未使用过时为 EPOCH */
        private Instant lastUsedAt = Instant.EPOCH;

        private Instant cooldownUntil = Instant.EPOCH;

        private KeyState(String key) {
            this.key = key;
        }
    }

    private static final class Selection {

        private final String key;
        private final int index;
        private final Duration wait;

        private Selection(String key, int index, Duration wait) {
            this.key = key;
            this.index = index;
            this.wait = wait;
        }
    }
}
