package com.semantic.dispatcher.config;

import com.semantic.dispatcher.pool.KeyPoolFactory;
import com.semantic.dispatcher.retry.RetryOrchestrator;
import com.semantic.dispatcher.wait.LoggingWaitObserver;
import com.semantic.dispatcher.wait.ScheduledWaiter;
import com.semantic.dispatcher.wait.WaitObserver;
import com.semantic.dispatcher.wait.Waiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 调度模块自动配置。
 * <p>
 * 所有等待（Key 间隔、冷却、重试延迟）都通过同一个 {@link ScheduledExecutorService} 定时唤醒，
 * 可由 {@link Waiter#cancelAll()} 从任意线程提前结束。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock semanticClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService semanticWaitScheduler(DispatcherProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("semantic-wait-");
        threadFactory.setDaemon(true);
        return Executors.newScheduledThreadPool(Math.max(1, properties.getWaiterThreads()), threadFactory);
    }

    @Bean
    public WaitObserver loggingWaitObserver() {
        return new LoggingWaitObserver();
    }

    @Bean
    @ConditionalOnMissingBean
    public Waiter semanticWaiter(ScheduledExecutorService semanticWaitScheduler, List<WaitObserver> observers) {
        log.info("等待调度器已就绪，观察者数量: {}", observers.size());
        return new ScheduledWaiter(semanticWaitScheduler, observers);
    }

    @Bean
    public KeyPoolFactory keyPoolFactory(DispatcherProperties properties, Clock clock, Waiter waiter) {
        return new KeyPoolFactory(properties, clock, waiter);
    }

    @Bean
    public RetryOrchestrator retryOrchestrator(DispatcherProperties properties, Waiter waiter) {
        return new RetryOrchestrator(properties, waiter);
    }
}
