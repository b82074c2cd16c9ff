package com.semantic.config;

import com.semantic.ai.provider.AiProvider;
import com.semantic.ai.registry.ProviderRegistry;
import com.semantic.common.dto.ApiKeyInfo;
import com.semantic.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 定时任务：输出各供应商冷却中的 Key。
 * <p>
 * 冷却到期由 Key 池在下次轮转时自动判断，这里只负责观测。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyStatusReporter {

    private final ProviderRegistry registry;

    @Scheduled(fixedDelayString = "PT${semantic.dispatcher.status-report-interval-seconds:60}S")
    public void reportCoolingKeys() {
        for (AiProvider provider : registry.getProviders()) {
            ApiKeyPool pool = provider.getKeyPool();
            if (pool == null || pool.isEmpty()) {
                continue;
            }
            List<ApiKeyInfo> cooling = pool.snapshot().stream()
                    .filter(info -> info.getStatus() == ApiKeyInfo.Status.COOLDOWN)
                    .toList();
            if (cooling.isEmpty()) {
                continue;
            }
            log.info("{} 有 {}/{} 个 Key 处于冷却中", provider.getName(), cooling.size(), pool.size());
            for (ApiKeyInfo info : cooling) {
                log.info("  #{} {} 剩余 {} 秒", info.getIndex(), info.getMaskedKey(), info.getCooldownRemainingSeconds());
            }
        }
    }
}
