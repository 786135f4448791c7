package io.hookforge;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 延迟任务调度器。
 *
 * <p>为回调上下文的 start/stop 截止时间计时：到期时触发上下文取消。
 * 在多个 runner 之间共享时是线程安全的。
 */
public final class DelayScheduler {

    private static final DelayScheduler SHARED = new DelayScheduler(createSharedExecutor());

    private final ScheduledExecutorService executor;

    /**
     * 私有构造函数，封装底层定时执行器。
     */
    private DelayScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 获取进程级共享调度器实例。
     *
     * <p>由框架托管，线程为守护线程，不会阻止 JVM 退出。
     */
    public static DelayScheduler shared() {
        return SHARED;
    }

    /**
     * 基于外部 {@link ScheduledExecutorService} 构造包装。
     *
     * <p>外部执行器生命周期由调用方负责。
     */
    public static DelayScheduler from(ScheduledExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new DelayScheduler(executor);
    }

    /**
     * 提交一次性延迟任务。
     *
     * <p>示例：
     * <pre>{@code
     * ScheduledTask expiry = scheduler.schedule(Duration.ofSeconds(30), () -> ctx.expire());
     * }</pre>
     */
    public ScheduledTask schedule(Duration delay, Runnable runnable) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(runnable, "runnable");
        ScheduledFuture<?> future = executor.schedule(runnable, delay.toNanos(), TimeUnit.NANOSECONDS);
        return new DefaultScheduledTask(future);
    }

    /**
     * 创建框架默认共享的单线程调度执行器。
     */
    private static ScheduledExecutorService createSharedExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
            1,
            new NamedThreadFactory("hookforge-deadline")
        );
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    /**
     * 默认计划任务句柄实现。
     */
    private static final class DefaultScheduledTask implements ScheduledTask {

        private final ScheduledFuture<?> future;

        private DefaultScheduledTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }

    /**
     * 定时线程命名工厂，便于定位线程来源。
     */
    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger id;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
            this.id = new AtomicInteger(1);
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + id.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
