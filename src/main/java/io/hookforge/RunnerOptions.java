package io.hookforge;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 不可变的 runner 配置。
 *
 * <p>每个 {@code with*} 方法都返回新实例，参数在调用时立即校验。
 *
 * <p>默认值：
 * {@code startTimeout=30s}，{@code stopTimeout=30s}，
 * {@code signals=INT/QUIT/TERM}，{@code signalHandler=SignalHandler.stopOnTermination()}，
 * {@code signalSource=SignalSources.jvm()}，{@code scheduler=Scheduler.detect()}。
 *
 * <p>示例：
 * <pre>{@code
 * RunnerOptions options = RunnerOptions.fromEnvironment()
 *     .withStopTimeout(Duration.ofSeconds(10))
 *     .withSignals(SignalKind.INT, SignalKind.TERM);
 * }</pre>
 */
public final class RunnerOptions {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration startTimeout;
    private final Duration stopTimeout;
    private final Set<SignalKind> signals;
    private final SignalHandler signalHandler;
    private final SignalSource signalSource;
    private final Scheduler scheduler;
    private final TaskObserver observer;
    private final ServiceInfo serviceInfo;

    private RunnerOptions(
        Duration startTimeout,
        Duration stopTimeout,
        Set<SignalKind> signals,
        SignalHandler signalHandler,
        SignalSource signalSource,
        Scheduler scheduler,
        TaskObserver observer,
        ServiceInfo serviceInfo
    ) {
        this.startTimeout = startTimeout;
        this.stopTimeout = stopTimeout;
        this.signals = signals;
        this.signalHandler = signalHandler;
        this.signalSource = signalSource;
        this.scheduler = scheduler;
        this.observer = observer;
        this.serviceInfo = serviceInfo;
    }

    /**
     * 默认配置。
     */
    public static RunnerOptions defaults() {
        return new RunnerOptions(
            DEFAULT_TIMEOUT,
            DEFAULT_TIMEOUT,
            SignalKind.termination(),
            SignalHandler.stopOnTermination(),
            SignalSources.jvm(),
            Scheduler.detect(),
            TaskObserver.NOOP,
            ServiceInfo.empty()
        );
    }

    /**
     * 默认配置，服务身份取自进程环境变量（见 {@link ServiceInfo#fromEnvironment(Map)}）。
     */
    public static RunnerOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * 默认配置，服务身份取自给定的变量表。
     */
    public static RunnerOptions fromEnvironment(Map<String, String> env) {
        return defaults().withServiceInfo(ServiceInfo.fromEnvironment(env));
    }

    /**
     * 每个 start 回调上下文的截止时间。
     */
    public RunnerOptions withStartTimeout(Duration startTimeout) {
        return new RunnerOptions(requirePositive(startTimeout, "startTimeout"), stopTimeout, signals,
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    /**
     * 每个 stop 回调上下文的截止时间（从关闭触发后各自开始计时）。
     */
    public RunnerOptions withStopTimeout(Duration stopTimeout) {
        return new RunnerOptions(startTimeout, requirePositive(stopTimeout, "stopTimeout"), signals,
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    /**
     * 需要监听的信号集合；空集合表示不启动信号监听任务。
     */
    public RunnerOptions withSignals(Collection<SignalKind> signals) {
        Objects.requireNonNull(signals, "signals");
        Set<SignalKind> copy = EnumSet.noneOf(SignalKind.class);
        for (SignalKind signal : signals) {
            copy.add(Objects.requireNonNull(signal, "signal"));
        }
        return new RunnerOptions(startTimeout, stopTimeout, Collections.unmodifiableSet(copy),
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    /**
     * {@link #withSignals(Collection)} 的可变参数重载；无参数等价于关闭信号监听。
     */
    public RunnerOptions withSignals(SignalKind... signals) {
        Objects.requireNonNull(signals, "signals");
        Set<SignalKind> copy = EnumSet.noneOf(SignalKind.class);
        for (SignalKind signal : signals) {
            copy.add(Objects.requireNonNull(signal, "signal"));
        }
        return withSignals(copy);
    }

    public RunnerOptions withSignalHandler(SignalHandler signalHandler) {
        Objects.requireNonNull(signalHandler, "signalHandler");
        return new RunnerOptions(startTimeout, stopTimeout, signals,
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    public RunnerOptions withSignalSource(SignalSource signalSource) {
        Objects.requireNonNull(signalSource, "signalSource");
        return new RunnerOptions(startTimeout, stopTimeout, signals,
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    /**
     * 指定任务调度器。调度器必须能同时运行一次 run 的全部任务。
     */
    public RunnerOptions withScheduler(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        return new RunnerOptions(startTimeout, stopTimeout, signals,
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    /**
     * 追加任务观测回调；多次调用会按顺序组合，而不是替换。
     */
    public RunnerOptions withObserver(TaskObserver observer) {
        Objects.requireNonNull(observer, "observer");
        return new RunnerOptions(startTimeout, stopTimeout, signals,
            signalHandler, signalSource, scheduler, TaskObservers.compose(this.observer, observer), serviceInfo);
    }

    public RunnerOptions withServiceInfo(ServiceInfo serviceInfo) {
        Objects.requireNonNull(serviceInfo, "serviceInfo");
        return new RunnerOptions(startTimeout, stopTimeout, signals,
            signalHandler, signalSource, scheduler, observer, serviceInfo);
    }

    public Duration startTimeout() {
        return startTimeout;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    /**
     * @return an unmodifiable view, possibly empty.
     */
    public Set<SignalKind> signals() {
        return signals;
    }

    public SignalHandler signalHandler() {
        return signalHandler;
    }

    public SignalSource signalSource() {
        return signalSource;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public TaskObserver observer() {
        return observer;
    }

    public ServiceInfo serviceInfo() {
        return serviceInfo;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }
}
