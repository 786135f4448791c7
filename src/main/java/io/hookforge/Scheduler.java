package io.hookforge;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 任务执行策略抽象。
 *
 * <p>{@code Scheduler} 决定一次 run 中 start/stop/signal 任务运行在哪些线程上。
 * stop 任务会一直阻塞到关闭触发，因此调度器不能把线程数限制在任务数之下：
 * 默认优先使用虚拟线程，不支持时回退到共享的守护线程缓存池。
 *
 * <p>该类型为线程安全且不可变对象。
 */
public final class Scheduler {

    private static final Scheduler SHARED_CACHED = new Scheduler(createCachedExecutor(), "cached", false);
    private static volatile Scheduler SHARED_VIRTUAL_THREADS;

    private final ExecutorService executor;
    private final String name;
    private final boolean virtualThreadMode;

    /**
     * 私有构造函数，按“执行器 + 标识”构建调度器实例。
     */
    private Scheduler(ExecutorService executor, String name, boolean virtualThreadMode) {
        this.executor = executor;
        this.name = name;
        this.virtualThreadMode = virtualThreadMode;
    }

    /**
     * 返回共享的无界缓存线程池调度器。
     *
     * <p>线程为守护线程，空闲 60 秒后回收。
     */
    public static Scheduler cached() {
        return SHARED_CACHED;
    }

    /**
     * 基于外部执行器创建调度器包装。
     *
     * <p>生命周期由调用方管理，runner 不会关闭该执行器。
     * 执行器必须能同时运行一次 run 的全部任务，否则 stop 任务会占满线程导致 start 任务无法执行。
     */
    public static Scheduler from(ExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new Scheduler(executor, "external", false);
    }

    /**
     * 获取共享虚拟线程调度器。
     *
     * <p>若当前 JDK 不支持虚拟线程，则自动回退到 {@link #cached()}。
     */
    public static Scheduler virtualThreads() {
        Scheduler scheduler = SHARED_VIRTUAL_THREADS;
        if (scheduler != null) {
            return scheduler;
        }

        synchronized (Scheduler.class) {
            scheduler = SHARED_VIRTUAL_THREADS;
            if (scheduler != null) {
                return scheduler;
            }

            ExecutorService executor = tryCreateVirtualThreadExecutor();
            if (executor == null) {
                return cached();
            }

            scheduler = new Scheduler(executor, "virtualThreads", true);
            SHARED_VIRTUAL_THREADS = scheduler;
            return scheduler;
        }
    }

    /**
     * 自动检测并返回当前环境推荐调度器。
     *
     * <p>优先虚拟线程，不支持时回退缓存线程池。
     */
    public static Scheduler detect() {
        if (isVirtualThreadSupported()) {
            return virtualThreads();
        }
        return cached();
    }

    /**
     * 判断当前 JDK 是否支持虚拟线程执行器。
     *
     * <p>通过反射探测 {@code Executors.newVirtualThreadPerTaskExecutor()}。
     */
    public static boolean isVirtualThreadSupported() {
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return method != null;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    /**
     * 调度器名称（用于日志/观测）。
     */
    public String name() {
        return name;
    }

    /**
     * 是否运行在虚拟线程模式。
     */
    public boolean isVirtualThreadMode() {
        return virtualThreadMode;
    }

    /**
     * 返回底层执行器（包级，供任务组内部调度使用）。
     */
    ExecutorService executor() {
        return executor;
    }

    private static ExecutorService createCachedExecutor() {
        return new ThreadPoolExecutor(
            0,
            Integer.MAX_VALUE,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<Runnable>(),
            new NamedThreadFactory("hookforge-task")
        );
    }

    /**
     * 尝试通过反射创建虚拟线程执行器。
     */
    private static ExecutorService tryCreateVirtualThreadExecutor() {
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            Object result = method.invoke(null);
            if (result instanceof ExecutorService) {
                return (ExecutorService) result;
            }
        } catch (NoSuchMethodException e) {
            return null;
        } catch (IllegalAccessException e) {
            return null;
        } catch (InvocationTargetException e) {
            return null;
        }
        return null;
    }

    /**
     * 线程命名工厂，便于排查线程来源。
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
