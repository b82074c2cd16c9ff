package com.semantic.dispatcher.pool;

import com.semantic.dispatcher.config.DispatcherProperties;
import com.semantic.dispatcher.wait.Waiter;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.util.List;

/**
 * 为每个供应商创建独立的 Key 池，同一类型的供应商配置多次也互不共享。
 */
@RequiredArgsConstructor
public class KeyPoolFactory {

    private final DispatcherProperties properties;
    private final Clock clock;
    private final Waiter waiter;

    public ApiKeyPool create(String poolName, List<String> apiKeys, boolean autoRotate) {
        return new InMemoryApiKeyPool(poolName, apiKeys, autoRotate,
                properties.getMinKeySpacing(), clock, waiter);
    }
}
