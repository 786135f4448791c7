package io.hookforge;

import io.hookforge.internal.CancellableContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程生命周期协调器。
 *
 * <p>{@code LifecycleRunner} 并发启动 {@link HookRegistry} 中的全部 hook，等待关闭触发
 * （任意任务失败、{@link #stop()}、或配置的终止信号），然后并发、优雅地停止全部 hook，
 * 每个回调都有自己独立的截止时间。
 *
 * <p>一次 {@link #run()} 的任务构成：
 * 每个带 stop 回调的 hook 一个 stop 任务（阻塞到根上下文取消后，才在 {@code stopTimeout}
 * 约束下调用回调）；每个带 start 回调的 hook 一个 start 任务（立即在 {@code startTimeout}
 * 约束下调用回调）；配置了信号时再加一个信号监听任务。任意任务失败都会取消根上下文，
 * 从而放行所有 stop 任务。
 *
 * <p>状态机：{@code IDLE → RUNNING → SHUTTING_DOWN → TERMINATED}；
 * 结束后的 runner 可以再次 run，但同一时刻最多只有一个 run 持有根上下文。
 *
 * <p>推荐用法示例：
 * <pre>{@code
 * HookRegistry registry = new HookRegistry()
 *     .register(httpServer)
 *     .register(Hook.onStop(ctx -> pool.close()));
 * LifecycleRunner runner = new LifecycleRunner(registry, RunnerOptions.fromEnvironment());
 * runner.run(); // blocks until SIGINT/SIGTERM or runner.stop()
 * }</pre>
 */
public final class LifecycleRunner {

    private static final Logger log = LoggerFactory.getLogger(LifecycleRunner.class);
    private static final AtomicLong RUN_IDS = new AtomicLong(1L);
    private static final Object WAKE_UP = new Object();

    private final HookRegistry registry;
    private final RunnerOptions options;
    private final AtomicReference<CancellableContext> active;
    private final AtomicReference<RunnerState> state;

    public LifecycleRunner(HookRegistry registry) {
        this(registry, RunnerOptions.defaults());
    }

    public LifecycleRunner(HookRegistry registry, RunnerOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
        this.active = new AtomicReference<CancellableContext>();
        this.state = new AtomicReference<RunnerState>(RunnerState.IDLE);
    }

    public HookRegistry registry() {
        return registry;
    }

    public RunnerOptions options() {
        return options;
    }

    /**
     * 获取当前状态快照。
     */
    public RunnerState state() {
        return state.get();
    }

    /**
     * 运行全部 hook，阻塞直到关闭完成。
     *
     * <p>即使没有任何任务会阻塞，run 也只会在关闭触发之后返回。
     * 阻塞在 run 中的线程被中断等同于一次关闭触发，返回前会恢复中断标记。
     *
     * <p>异常语义：
     * 全部任务成功时正常返回；否则抛出首个失败（之后的失败附加为 suppressed）。
     * 回调抛出的运行时异常/错误原样传播；checked exception 包装为 {@link LifecycleException}；
     * 配置了信号监听时，由 {@link #stop()} 或信号触发的关闭会以 {@link CancelledException} 结束。
     *
     * @throws IllegalStateException 另一个 run 正在进行中
     */
    public void run() {
        final long runId = RUN_IDS.getAndIncrement();
        final ServiceInfo serviceInfo = options.serviceInfo();
        final CancellableContext root = CancellableContext.root(serviceInfo);
        if (!active.compareAndSet(null, root)) {
            throw new IllegalStateException("LifecycleRunner is already running");
        }
        state.set(RunnerState.RUNNING);
        root.onCancel(new Runnable() {
            @Override
            public void run() {
                state.compareAndSet(RunnerState.RUNNING, RunnerState.SHUTTING_DOWN);
                log.info("Shutdown of {} triggered (run {}): {}", serviceInfo, runId, root.cause().getMessage());
            }
        });

        List<Hook> hooks = registry.hooks();
        TaskGroup group = new TaskGroup(runId, options.scheduler(), options.observer(), root);
        Throwable failure;
        try {
            log.info("Starting {} hooks of {} (run {}, scheduler {})", hooks.size(), serviceInfo, runId, options.scheduler().name());
            for (PlannedTask planned : plan(hooks, root)) {
                group.submit(planned.name, planned.kind, planned.hookIndex, planned.body);
            }
            if (options.signals().isEmpty()) {
                log.debug("No signals configured for run {}", runId);
            } else {
                group.submit("signals", TaskKind.SIGNAL, -1, signalLoop(root, new RunHandle(root)));
            }
            awaitTrigger(root);
            failure = group.awaitAll();
        } catch (RuntimeException e) {
            root.cancel(new CancelledException("context canceled: run aborted", e));
            throw e;
        } finally {
            state.set(RunnerState.TERMINATED);
            active.compareAndSet(root, null);
        }

        if (failure == null) {
            log.info("Run {} of {} terminated", runId, serviceInfo);
            return;
        }
        log.info("Run {} of {} terminated: {}", runId, serviceInfo, failure.toString());
        rethrow(failure);
    }

    /**
     * 请求关闭当前 run。
     *
     * <p>幂等且不会失败：没有进行中的 run 时（尚未调用或已经返回）什么也不做。
     */
    public void stop() {
        CancellableContext root = active.get();
        if (root != null) {
            root.cancel(stopRequested());
        }
    }

    /**
     * 按 hook 顺序构建显式的任务列表：每个 hook 先 stop 后 start，缺失的回调不产生任务。
     */
    private List<PlannedTask> plan(List<Hook> hooks, CancellableContext root) {
        List<PlannedTask> planned = new ArrayList<PlannedTask>(hooks.size() * 2);
        for (int index = 0; index < hooks.size(); index++) {
            Hook hook = hooks.get(index);
            String label = hook.name() != null ? hook.name() : "hook-" + index;
            if (hook.hasStop()) {
                planned.add(new PlannedTask(label + "/stop", TaskKind.STOP, index,
                    stopTask(label, hook.onStop(), root)));
            }
            if (hook.hasStart()) {
                planned.add(new PlannedTask(label + "/start", TaskKind.START, index,
                    startTask(label, hook.onStart())));
            }
        }
        return planned;
    }

    private Callable<Void> startTask(final String label, final HookCallback callback) {
        return new Callable<Void>() {
            @Override
            public Void call() throws Exception {
                invoke(label, "start", callback, options.startTimeout());
                return null;
            }
        };
    }

    private Callable<Void> stopTask(final String label, final HookCallback callback, final CancellableContext root) {
        return new Callable<Void>() {
            @Override
            public Void call() throws Exception {
                root.awaitCancellation();
                invoke(label, "stop", callback, options.stopTimeout());
                return null;
            }
        };
    }

    /**
     * 在独立的限时上下文中调用回调；回调返回后立即释放该上下文。
     */
    private void invoke(String label, String phase, HookCallback callback, Duration timeout) throws InterruptedException {
        CancellableContext ctx = CancellableContext.withTimeout(options.serviceInfo(), timeout, DelayScheduler.shared());
        try {
            callback.call(ctx);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new LifecycleException("Hook '" + label + "' failed to " + phase, e);
        } finally {
            ctx.release();
        }
    }

    /**
     * 信号监听循环：阻塞等待信号或根上下文取消；每收到一个信号交给 {@link SignalHandler}，取消后以其取消原因结束。
     */
    private Callable<Void> signalLoop(final CancellableContext root, final RunnerHandle handle) {
        return new Callable<Void>() {
            @Override
            public Void call() throws Exception {
                final BlockingQueue<Object> received = new ArrayBlockingQueue<Object>(options.signals().size() + 1);
                SignalSource.Subscription subscription = options.signalSource().subscribe(options.signals(), new SignalSource.Listener() {
                    @Override
                    public void onSignal(SignalKind signal) {
                        received.offer(signal);
                    }
                });
                // offer fails only while the queue still holds entries to wake the loop
                root.onCancel(new Runnable() {
                    @Override
                    public void run() {
                        received.offer(WAKE_UP);
                    }
                });
                try {
                    if (subscription.kinds().isEmpty()) {
                        log.warn("None of the signals {} can be observed", options.signals());
                    }
                    while (true) {
                        CancelledException cause = root.cause();
                        if (cause != null) {
                            throw cause;
                        }
                        Object next = received.take();
                        if (next instanceof SignalKind) {
                            SignalKind signal = (SignalKind) next;
                            log.info("Received SIG{}", signal.signalName());
                            options.signalHandler().onSignal(handle, signal);
                        }
                    }
                } finally {
                    subscription.close();
                }
            }
        };
    }

    /**
     * 等待关闭触发；被中断时把中断当作触发，并在返回前恢复中断标记。
     */
    private void awaitTrigger(CancellableContext root) {
        boolean interrupted = false;
        while (true) {
            try {
                root.awaitCancellation();
                break;
            } catch (InterruptedException interruptedException) {
                interrupted = true;
                root.cancel(new CancelledException("context canceled: runner interrupted", interruptedException));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 统一异常转换并重新抛出。
     */
    private static void rethrow(Throwable failure) {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new LifecycleException("Run failed", failure);
    }

    private static CancelledException stopRequested() {
        return new CancelledException("context canceled: stop requested");
    }

    /**
     * 绑定单次 run 根上下文的句柄。
     */
    private final class RunHandle implements RunnerHandle {

        private final CancellableContext root;

        private RunHandle(CancellableContext root) {
            this.root = root;
        }

        @Override
        public void requestStop() {
            root.cancel(stopRequested());
        }

        @Override
        public ServiceInfo serviceInfo() {
            return root.serviceInfo();
        }

        @Override
        public RunnerState state() {
            return active.get() == root ? state.get() : RunnerState.TERMINATED;
        }
    }

    private static final class PlannedTask {

        private final String name;
        private final TaskKind kind;
        private final int hookIndex;
        private final Callable<Void> body;

        private PlannedTask(String name, TaskKind kind, int hookIndex, Callable<Void> body) {
            this.name = name;
            this.kind = kind;
            this.hookIndex = hookIndex;
            this.body = body;
        }
    }
}
