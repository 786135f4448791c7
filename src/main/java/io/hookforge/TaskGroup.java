package io.hookforge;

import io.hookforge.internal.CancellableContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次 run 的结构化并发单元。
 *
 * <p>{@code TaskGroup} 把“任务提交、首个失败记录、失败即取消、全部汇合”收敛在同一边界内：
 * 任意任务失败时立即取消共享的根上下文（即使其他任务仍在运行），
 * {@link #awaitAll()} 等待全部任务结束后返回首个失败。
 *
 * <p>失败聚合：首个失败胜出；之后的失败作为 suppressed 附加到首个失败上，
 * 但根上下文自身的取消原因（信号任务回传的那个实例）不会重复附加。
 *
 * <p>线程安全约束：
 * {@code submit} 只由 runner 线程调用；任务完成回调可在任意工作线程并发发生。
 */
final class TaskGroup {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private final long runId;
    private final AtomicLong taskIdGen;
    private final Queue<Task> tasks;
    private final AtomicReference<Throwable> firstFailure;
    private final Scheduler scheduler;
    private final TaskObserver observer;
    private final CancellableContext root;

    TaskGroup(long runId, Scheduler scheduler, TaskObserver observer, CancellableContext root) {
        this.runId = runId;
        this.taskIdGen = new AtomicLong(1L);
        this.tasks = new ConcurrentLinkedQueue<Task>();
        this.firstFailure = new AtomicReference<Throwable>();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.root = Objects.requireNonNull(root, "root");
    }

    /**
     * 提交一个任务。
     *
     * <p>任务体抛出的任何异常都视为失败：记录并触发根上下文取消。
     * 执行器拒绝提交同样按失败处理。
     */
    Task submit(String name, TaskKind kind, int hookIndex, final Callable<Void> body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(body, "body");

        long id = taskIdGen.getAndIncrement();
        final Task task = new Task(new TaskInfo(runId, id, name, kind, hookIndex, Instant.now(), scheduler.name()));
        tasks.add(task);

        try {
            scheduler.executor().execute(new Runnable() {
                @Override
                public void run() {
                    runTask(task, body);
                }
            });
        } catch (RejectedExecutionException rejectedExecutionException) {
            completeFailure(task, rejectedExecutionException, System.nanoTime());
        }
        return task;
    }

    /**
     * 等待全部任务结束，返回首个失败（全部成功时为 {@code null}）。
     *
     * <p>等待期间线程被中断时，取消根上下文并继续等待，让 stop 任务完成优雅关闭；
     * 返回前恢复中断标记。
     */
    Throwable awaitAll() {
        boolean interrupted = false;
        for (Task task : tasks) {
            while (true) {
                try {
                    task.await();
                    break;
                } catch (InterruptedException interruptedException) {
                    interrupted = true;
                    root.cancel(new CancelledException("context canceled: runner interrupted", interruptedException));
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return firstFailure.get();
    }

    /**
     * 当前已记录的首个失败。
     */
    Throwable firstFailure() {
        return firstFailure.get();
    }

    int size() {
        return tasks.size();
    }

    /**
     * 在工作线程内执行任务主体，并统一处理状态迁移、异常归集、观测打点。
     */
    private void runTask(Task task, Callable<Void> body) {
        long started = System.nanoTime();
        if (!task.markRunning()) {
            return;
        }

        TaskInfo info = task.info();
        if (log.isDebugEnabled()) {
            log.debug("Task {} started {} ms after submit", info,
                Math.max(0L, Duration.between(info.createdAt(), Instant.now()).toMillis()));
        }
        TaskObservers.safeStart(observer, info);

        try {
            body.call();
            if (task.complete()) {
                Duration duration = Duration.ofNanos(elapsedNanos(started));
                log.debug("Task {} finished in {} ms", info, duration.toMillis());
                TaskObservers.safeSuccess(observer, info, duration);
            }
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            completeFailure(task, new CancelledException("Task interrupted", interruptedException), started);
        } catch (Throwable throwable) {
            completeFailure(task, throwable, started);
        }
    }

    /**
     * 失败必须先记录、再完成任务句柄：{@link #awaitAll()} 在最后一个句柄完成后立即读取首个失败。
     */
    private void completeFailure(Task task, Throwable failure, long started) {
        if (task.isDone()) {
            return;
        }
        Duration duration = Duration.ofNanos(elapsedNanos(started));
        log.debug("Task {} failed after {} ms: {}", task.info(), duration.toMillis(), failure.toString());
        TaskObservers.safeFailure(observer, task.info(), failure, duration);
        record(task.info(), failure);
        task.fail(failure);
    }

    /**
     * 首个失败胜出并取消根上下文；后续失败附加为 suppressed。
     */
    private void record(TaskInfo info, Throwable failure) {
        if (firstFailure.compareAndSet(null, failure)) {
            root.cancel(new CancelledException("context canceled: task '" + info.name() + "' failed", failure));
            return;
        }
        Throwable primary = firstFailure.get();
        if (failure != primary && failure != root.cause()) {
            primary.addSuppressed(failure);
        }
    }

    /**
     * 计算运行耗时纳秒值，并确保非负。
     */
    private long elapsedNanos(long startedAtNanos) {
        return Math.max(0L, System.nanoTime() - startedAtNanos);
    }
}
