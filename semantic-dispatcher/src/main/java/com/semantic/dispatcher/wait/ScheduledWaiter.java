package com.semantic.dispatcher.wait;

import com.semantic.common.exception.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于 {@link ScheduledExecutorService} 的等待实现：定时唤醒 + 取消令牌。
 * <p>
 * 每次等待对应一个 {@link CompletableFuture}，由定时任务在到期时完成；
 * {@link #cancelAll()} 直接取消这些 Future，等待方随即收到 {@link OperationCancelledException}。
 */
@Slf4j
public class ScheduledWaiter implements Waiter {

    private final ScheduledExecutorService scheduler;
    private final List<WaitObserver> observers;
    private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

    public ScheduledWaiter(ScheduledExecutorService scheduler, List<WaitObserver> observers) {
        this.scheduler = scheduler;
        this.observers = List.copyOf(observers);
    }

    @Override
    public void await(Duration delay, String reason) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }

        CompletableFuture<Void> wakeUp = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> wakeUp.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
        pending.add(wakeUp);
        notifyStarted(reason, delay);

        boolean cancelled = true;
        try {
            wakeUp.get();
            cancelled = false;
        } catch (CancellationException e) {
            throw new OperationCancelledException("等待已取消: " + reason, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("等待被中断: " + reason, e);
        } catch (ExecutionException e) {
            throw new OperationCancelledException("等待异常结束: " + reason, e.getCause());
        } finally {
            timer.cancel(false);
            pending.remove(wakeUp);
            notifyFinished(reason, cancelled);
        }
    }

    @Override
    public int cancelAll() {
        int cancelled = 0;
        for (CompletableFuture<Void> future : pending) {
            if (future.cancel(false)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("已取消 {} 个正在进行的等待", cancelled);
        }
        return cancelled;
    }

    private void notifyStarted(String reason, Duration delay) {
        for (WaitObserver observer : observers) {
            try {
                observer.onWaitStarted(reason, delay);
            } catch (RuntimeException e) {
                log.debug("等待观察者回调失败: {}", e.getMessage());
            }
        }
    }

    private void notifyFinished(String reason, boolean cancelled) {
        for (WaitObserver observer : observers) {
            try {
                observer.onWaitFinished(reason, cancelled);
            } catch (RuntimeException e) {
                log.debug("等待观察者回调失败: {}", e.getMessage());
            }
        }
    }
}
