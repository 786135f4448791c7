package io.hookforge;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 任务组内单个任务的句柄。
 *
 * <p>{@code Task} 对 {@link CompletableFuture} 做了语义封装：
 * 补充了任务状态与元数据，结果只有“成功”或“失败（附带异常）”两种。
 */
final class Task {

    /**
     * 任务生命周期状态。
     */
    enum State {
        /** 已创建但尚未运行。 */
        PENDING,
        /** 正在运行。 */
        RUNNING,
        /** 成功完成。 */
        SUCCESS,
        /** 失败完成。 */
        FAILED
    }

    private final TaskInfo info;
    private final CompletableFuture<Void> future;
    private final AtomicReference<State> state;

    /**
     * 包级构造函数，仅供 {@link TaskGroup} 创建任务句柄。
     */
    Task(TaskInfo info) {
        this.info = info;
        this.future = new CompletableFuture<Void>();
        this.state = new AtomicReference<State>(State.PENDING);
    }

    TaskInfo info() {
        return info;
    }

    /**
     * 获取当前任务状态快照。
     */
    State state() {
        return state.get();
    }

    /**
     * 任务是否已经结束（成功/失败任一状态）。
     */
    boolean isDone() {
        State current = state.get();
        return current == State.SUCCESS || current == State.FAILED;
    }

    /**
     * 等待任务结束。
     *
     * <p>成功返回 {@code null}，失败返回任务抛出的异常；不会抛出任务自身的异常。
     */
    Throwable await() throws InterruptedException {
        try {
            future.get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    /**
     * 标记任务进入运行状态。
     */
    boolean markRunning() {
        return state.compareAndSet(State.PENDING, State.RUNNING);
    }

    /**
     * 标记任务成功完成。
     */
    boolean complete() {
        if (!finish(State.SUCCESS)) {
            return false;
        }
        future.complete(null);
        return true;
    }

    /**
     * 标记任务失败完成。
     */
    boolean fail(Throwable failure) {
        if (!finish(State.FAILED)) {
            return false;
        }
        future.completeExceptionally(failure);
        return true;
    }

    /**
     * 先迁移到终态再完成 future，保证等待方醒来时状态已可见。
     */
    private boolean finish(State terminal) {
        while (true) {
            State current = state.get();
            if (current == State.SUCCESS || current == State.FAILED) {
                return false;
            }
            if (state.compareAndSet(current, terminal)) {
                return true;
            }
        }
    }
}
