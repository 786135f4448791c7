package io.hookforge;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookForgeCoreTest {

    private static RunnerOptions quietOptions() {
        return RunnerOptions.defaults().withSignals();
    }

    @Test
    void cleanRunStartsAndStopsEveryHookAndReturnsNormally() throws Exception {
        final AtomicInteger started = new AtomicInteger();
        final AtomicInteger stopped = new AtomicInteger();
        final CountDownLatch allStarted = new CountDownLatch(3);
        HookRegistry registry = new HookRegistry();
        for (int i = 0; i < 3; i++) {
            registry.register(Hook.of(new HookCallback() {
                @Override
                public void call(HookContext ctx) {
                    started.incrementAndGet();
                    allStarted.countDown();
                }
            }, new HookCallback() {
                @Override
                public void call(HookContext ctx) {
                    stopped.incrementAndGet();
                }
            }));
        }

        LifecycleRunner runner = new LifecycleRunner(registry, quietOptions());
        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(allStarted.await(2, TimeUnit.SECONDS));
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        assertEquals(0, stopped.get());

        runner.stop();

        assertTrue(run.awaitDone(2000));
        assertNull(run.failure());
        assertEquals(3, started.get());
        assertEquals(3, stopped.get());
        assertEquals(RunnerState.TERMINATED, runner.state());
    }

    @Test
    void startFailureStopsEveryHookAndSurfacesTheSameError() {
        final IllegalStateException boom = new IllegalStateException("boom");
        final List<String> stopped = Collections.synchronizedList(new ArrayList<String>());
        HookRegistry registry = new HookRegistry()
            .register(Hook.of(ctx -> {
                throw boom;
            }, ctx -> stopped.add("a")).named("a"))
            .register(Hook.of(ctx -> {
            }, ctx -> stopped.add("b")).named("b"))
            .register(Hook.onStop(ctx -> stopped.add("c")).named("c"));

        final LifecycleRunner runner = new LifecycleRunner(registry, quietOptions());
        IllegalStateException thrown = assertThrows(IllegalStateException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                runner.run();
            }
        });

        assertSame(boom, thrown);
        assertEquals(3, stopped.size());
        assertTrue(stopped.containsAll(java.util.Arrays.asList("a", "b", "c")));
    }

    @Test
    void stopCallbacksGetFreshContextsAfterTrigger() throws Exception {
        final AtomicReference<HookContext> stopContext = new AtomicReference<HookContext>();
        final AtomicBoolean cancelledOnEntry = new AtomicBoolean(true);
        final AtomicReference<Duration> remainingOnEntry = new AtomicReference<Duration>();
        HookRegistry registry = new HookRegistry().register(Hook.onStop(new HookCallback() {
            @Override
            public void call(HookContext ctx) {
                cancelledOnEntry.set(ctx.isCancelled());
                remainingOnEntry.set(ctx.remaining());
                stopContext.set(ctx);
            }
        }));

        LifecycleRunner runner = new LifecycleRunner(registry, quietOptions().withStopTimeout(Duration.ofSeconds(5)));
        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        runner.stop();
        assertTrue(run.awaitDone(2000));

        assertNull(run.failure());
        assertFalse(cancelledOnEntry.get());
        assertTrue(remainingOnEntry.get().compareTo(Duration.ofSeconds(4)) > 0);
        assertTrue(stopContext.get().isCancelled(), "context is released once the callback returns");
    }

    @Test
    void stopIsIdempotentConcurrentAndSafeOutsideRun() throws Exception {
        final AtomicInteger stopped = new AtomicInteger();
        HookRegistry registry = new HookRegistry().register(Hook.onStop(ctx -> stopped.incrementAndGet()));
        final LifecycleRunner runner = new LifecycleRunner(registry, quietOptions());

        runner.stop();
        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        assertFalse(run.awaitDone(100), "stop before run must not pre-arm the next run");

        final CountDownLatch go = new CountDownLatch(1);
        List<Thread> callers = new ArrayList<Thread>();
        for (int i = 0; i < 8; i++) {
            Thread caller = new Thread(new Runnable() {
                @Override
                public void run() {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    runner.stop();
                }
            });
            caller.start();
            callers.add(caller);
        }
        go.countDown();
        for (Thread caller : callers) {
            caller.join(2000);
        }

        assertTrue(run.awaitDone(2000));
        assertNull(run.failure());
        assertEquals(1, stopped.get());

        runner.stop();
        runner.stop();
        assertEquals(RunnerState.TERMINATED, runner.state());
    }

    @Test
    void overrunningStopCallbackDoesNotConsumeSiblingBudget() throws Exception {
        final AtomicReference<CancelledException> slowCause = new AtomicReference<CancelledException>();
        final AtomicBoolean fastCancelled = new AtomicBoolean(true);
        final AtomicReference<Duration> fastRemaining = new AtomicReference<Duration>();
        final CountDownLatch slowEntered = new CountDownLatch(1);
        HookRegistry registry = new HookRegistry()
            .register(Hook.onStop(new HookCallback() {
                @Override
                public void call(HookContext ctx) throws Exception {
                    slowEntered.countDown();
                    Thread.sleep(300L);
                    slowCause.set(ctx.cause());
                }
            }).named("slow"))
            .register(Hook.onStop(new HookCallback() {
                @Override
                public void call(HookContext ctx) throws Exception {
                    assertTrue(slowEntered.await(2, TimeUnit.SECONDS));
                    fastCancelled.set(ctx.isCancelled());
                    fastRemaining.set(ctx.remaining());
                }
            }).named("fast"));

        LifecycleRunner runner = new LifecycleRunner(registry, quietOptions().withStopTimeout(Duration.ofMillis(100)));
        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        runner.stop();

        assertTrue(run.awaitDone(3000));
        assertNull(run.failure());
        assertInstanceOf(DeadlineExceededException.class, slowCause.get());
        assertFalse(fastCancelled.get());
        assertTrue(fastRemaining.get().compareTo(Duration.ZERO) > 0);
    }

    @Test
    void terminationSignalEndsRunWithCancellation() throws Exception {
        ManualSignalSource signals = new ManualSignalSource();
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry(),
            RunnerOptions.defaults().withSignalSource(signals));

        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(signals.awaitSubscribed(2000));
        signals.emit(SignalKind.TERM);

        assertTrue(run.awaitDone(2000));
        assertInstanceOf(CancelledException.class, run.failure());
        assertEquals(1, signals.closeCount());
        assertFalse(signals.isSubscribed());
    }

    @RepeatedTest(20)
    void terminationSignalIsReportedOnEveryRun() throws Exception {
        ManualSignalSource signals = new ManualSignalSource();
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry(),
            RunnerOptions.defaults().withSignalSource(signals));

        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(signals.awaitSubscribed(2000));
        signals.emit(SignalKind.TERM);

        assertTrue(run.awaitDone(2000));
        assertInstanceOf(CancelledException.class, run.failure());
    }

    @RepeatedTest(20)
    void failingStopCallbackIsReportedOnEveryRun() throws Exception {
        final IllegalStateException boom = new IllegalStateException("stop failed");
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry().register(Hook.onStop(ctx -> {
            throw boom;
        })), quietOptions());

        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        runner.stop();

        assertTrue(run.awaitDone(2000));
        assertSame(boom, run.failure());
        assertEquals(0, boom.getSuppressed().length);
    }

    @Test
    void stopWithSignalsConfiguredReportsCancellation() throws Exception {
        ManualSignalSource signals = new ManualSignalSource();
        final AtomicInteger stopped = new AtomicInteger();
        LifecycleRunner runner = new LifecycleRunner(
            new HookRegistry().register(Hook.onStop(ctx -> stopped.incrementAndGet())),
            RunnerOptions.defaults().withSignalSource(signals));

        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(signals.awaitSubscribed(2000));
        runner.stop();

        assertTrue(run.awaitDone(2000));
        CancelledException cancelled = assertInstanceOf(CancelledException.class, run.failure());
        assertTrue(cancelled.getMessage().contains("stop requested"));
        assertEquals(1, stopped.get());
    }

    @Test
    void runWithoutTasksWaitsForExplicitStop() throws Exception {
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry(), quietOptions());

        BackgroundRun run = BackgroundRun.start(runner);
        assertFalse(run.awaitDone(200));
        assertEquals(RunnerState.RUNNING, runner.state());

        runner.stop();
        assertTrue(run.awaitDone(2000));
        assertNull(run.failure());
    }

    @Test
    void checkedExceptionIsWrappedWithHookName() {
        final IOException ioFailure = new IOException("disk gone");
        HookRegistry registry = new HookRegistry().register(Hook.onStart(new HookCallback() {
            @Override
            public void call(HookContext ctx) throws Exception {
                throw ioFailure;
            }
        }).named("storage"));

        final LifecycleRunner runner = new LifecycleRunner(registry, quietOptions());
        LifecycleException thrown = assertThrows(LifecycleException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                runner.run();
            }
        });

        assertSame(ioFailure, thrown.getCause());
        assertTrue(thrown.getMessage().contains("storage"));
        assertTrue(thrown.getMessage().contains("start"));
    }

    @Test
    void laterFailuresAreAttachedAsSuppressed() {
        final IllegalStateException first = new IllegalStateException("first");
        final IllegalArgumentException second = new IllegalArgumentException("second");
        HookRegistry registry = new HookRegistry()
            .register(Hook.onStart(ctx -> {
                throw first;
            }))
            .register(Hook.onStop(ctx -> {
                throw second;
            }));

        final LifecycleRunner runner = new LifecycleRunner(registry, quietOptions());
        IllegalStateException thrown = assertThrows(IllegalStateException.class, runner::run);

        assertSame(first, thrown);
        assertEquals(1, thrown.getSuppressed().length);
        assertSame(second, thrown.getSuppressed()[0]);
    }

    @Test
    void defaultHandlerIgnoresNonTerminationSignals() throws Exception {
        ManualSignalSource signals = new ManualSignalSource();
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry(),
            RunnerOptions.defaults().withSignalSource(signals).withSignals(SignalKind.HUP, SignalKind.TERM));

        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(signals.awaitSubscribed(2000));
        signals.emit(SignalKind.HUP);
        assertFalse(run.awaitDone(200));
        assertEquals(RunnerState.RUNNING, runner.state());

        signals.emit(SignalKind.TERM);
        assertTrue(run.awaitDone(2000));
        assertInstanceOf(CancelledException.class, run.failure());
    }

    @Test
    void customHandlerSeesEverySignal() throws Exception {
        ManualSignalSource signals = new ManualSignalSource();
        final List<SignalKind> seen = Collections.synchronizedList(new ArrayList<SignalKind>());
        final AtomicReference<ServiceInfo> handleInfo = new AtomicReference<ServiceInfo>();
        ServiceInfo info = new ServiceInfo("id-1", "orders", "1.2.0", Collections.<String>emptyList());
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry(), RunnerOptions.defaults()
            .withSignalSource(signals)
            .withServiceInfo(info)
            .withSignals(SignalKind.HUP, SignalKind.USR1, SignalKind.USR2)
            .withSignalHandler(new SignalHandler() {
                @Override
                public void onSignal(RunnerHandle handle, SignalKind signal) {
                    seen.add(signal);
                    handleInfo.set(handle.serviceInfo());
                    if (signal == SignalKind.USR2) {
                        handle.requestStop();
                    }
                }
            }));

        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(signals.awaitSubscribed(2000));
        signals.emit(SignalKind.HUP);
        signals.emit(SignalKind.USR1);
        signals.emit(SignalKind.TERM);
        signals.emit(SignalKind.USR2);

        assertTrue(run.awaitDone(2000));
        assertInstanceOf(CancelledException.class, run.failure());
        assertEquals(java.util.Arrays.asList(SignalKind.HUP, SignalKind.USR1, SignalKind.USR2), seen);
        assertSame(info, handleInfo.get());
    }

    @Test
    void failingSignalHandlerTriggersShutdown() throws Exception {
        ManualSignalSource signals = new ManualSignalSource();
        final UnsupportedOperationException rejected = new UnsupportedOperationException("reload");
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry(), RunnerOptions.defaults()
            .withSignalSource(signals)
            .withSignals(SignalKind.HUP)
            .withSignalHandler(new SignalHandler() {
                @Override
                public void onSignal(RunnerHandle handle, SignalKind signal) {
                    throw rejected;
                }
            }));

        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(signals.awaitSubscribed(2000));
        signals.emit(SignalKind.HUP);

        assertTrue(run.awaitDone(2000));
        assertSame(rejected, run.failure());
    }

    @Test
    void interruptingRunThreadTriggersGracefulShutdown() throws Exception {
        final AtomicInteger stopped = new AtomicInteger();
        LifecycleRunner runner = new LifecycleRunner(
            new HookRegistry().register(Hook.onStop(ctx -> stopped.incrementAndGet())), quietOptions());

        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        run.interrupt();

        assertTrue(run.awaitDone(2000));
        assertNull(run.failure());
        assertEquals(1, stopped.get());
        assertTrue(run.interruptedAfterRun());
    }

    @Test
    void concurrentRunIsRejectedAndTerminatedRunnerCanRunAgain() throws Exception {
        final AtomicInteger started = new AtomicInteger();
        final LifecycleRunner runner = new LifecycleRunner(
            new HookRegistry().register(Hook.onStart(ctx -> started.incrementAndGet())), quietOptions());

        BackgroundRun first = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        assertThrows(IllegalStateException.class, runner::run);
        runner.stop();
        assertTrue(first.awaitDone(2000));
        assertNull(first.failure());

        BackgroundRun second = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        runner.stop();
        assertTrue(second.awaitDone(2000));
        assertNull(second.failure());
        assertEquals(2, started.get());
    }

    @Test
    void stateMovesThroughShuttingDownWhileStopCallbacksDrain() throws Exception {
        final CountDownLatch inStop = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry().register(Hook.onStop(new HookCallback() {
            @Override
            public void call(HookContext ctx) throws Exception {
                inStop.countDown();
                release.await();
            }
        })), quietOptions());
        assertEquals(RunnerState.IDLE, runner.state());

        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        runner.stop();
        assertTrue(inStop.await(2, TimeUnit.SECONDS));
        assertEquals(RunnerState.SHUTTING_DOWN, runner.state());
        assertTrue(runner.state().isActive());

        release.countDown();
        assertTrue(run.awaitDone(2000));
        assertEquals(RunnerState.TERMINATED, runner.state());
        assertFalse(runner.state().isActive());
    }

    @Test
    void startCallbackSeesDeadlineAndServiceInfo() throws Exception {
        final AtomicReference<HookContext> seen = new AtomicReference<HookContext>();
        final AtomicReference<Duration> remaining = new AtomicReference<Duration>();
        ServiceInfo info = ServiceInfo.fromEnvironment(Collections.singletonMap(ServiceInfo.ENV_NAME, "billing"));
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry().register(Hook.onStart(new HookCallback() {
            @Override
            public void call(HookContext ctx) {
                remaining.set(ctx.remaining());
                seen.set(ctx);
            }
        })), quietOptions().withStartTimeout(Duration.ofSeconds(10)).withServiceInfo(info));

        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        runner.stop();
        assertTrue(run.awaitDone(2000));

        assertNotNull(seen.get());
        assertTrue(seen.get().hasDeadline());
        assertTrue(remaining.get().compareTo(Duration.ofSeconds(9)) > 0);
        assertTrue(remaining.get().compareTo(Duration.ofSeconds(10)) <= 0);
        assertEquals("billing", seen.get().serviceInfo().name());
    }

    @Test
    void startCallbackCanObserveStartDeadline() throws Exception {
        final AtomicReference<CancelledException> cause = new AtomicReference<CancelledException>();
        LifecycleRunner runner = new LifecycleRunner(new HookRegistry().register(Hook.onStart(new HookCallback() {
            @Override
            public void call(HookContext ctx) throws Exception {
                ctx.awaitCancellation();
                cause.set(ctx.cause());
            }
        })), quietOptions().withStartTimeout(Duration.ofMillis(50)));

        BackgroundRun run = BackgroundRun.start(runner);
        BackgroundRun.awaitState(runner, RunnerState.RUNNING, 2000);
        long limit = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (cause.get() == null && System.nanoTime() < limit) {
            Thread.sleep(5L);
        }
        assertInstanceOf(DeadlineExceededException.class, cause.get());
        assertFalse(run.isDone(), "start returning normally after its deadline is not a trigger");

        runner.stop();
        assertTrue(run.awaitDone(2000));
        assertNull(run.failure());
    }

    @Test
    void lifecycleComponentsAreRegisteredInOrder() throws Exception {
        final List<String> events = Collections.synchronizedList(new ArrayList<String>());
        final CountDownLatch started = new CountDownLatch(1);
        HookRegistry registry = new HookRegistry().register(new Lifecycle() {
            @Override
            public void start(HookContext ctx) {
                events.add("start");
                started.countDown();
            }

            @Override
            public void stop(HookContext ctx) {
                events.add("stop");
            }
        });

        LifecycleRunner runner = new LifecycleRunner(registry, quietOptions());
        BackgroundRun run = BackgroundRun.start(runner);
        assertTrue(started.await(2, TimeUnit.SECONDS));
        runner.stop();
        assertTrue(run.awaitDone(2000));

        assertEquals(java.util.Arrays.asList("start", "stop"), events);
    }

    @Test
    void observerSeesEveryTaskOfTheRun() throws Exception {
        final List<String> events = Collections.synchronizedList(new ArrayList<String>());
        final IllegalStateException boom = new IllegalStateException("boom");
        TaskObserver observer = new TaskObserver() {
            @Override
            public void onStart(TaskInfo info) {
                events.add("start:" + info.name());
            }

            @Override
            public void onSuccess(TaskInfo info, Duration duration) {
                events.add("success:" + info.name());
            }

            @Override
            public void onFailure(TaskInfo info, Throwable error, Duration duration) {
                events.add("failure:" + info.name() + ":" + error.getMessage());
            }
        };
        HookRegistry registry = new HookRegistry()
            .register(Hook.of(ctx -> {
                throw boom;
            }, ctx -> {
            }).named("db"))
            .register(Hook.onStop(ctx -> {
            }));

        final LifecycleRunner runner = new LifecycleRunner(registry, quietOptions().withObserver(observer));
        assertThrows(IllegalStateException.class, runner::run);

        assertTrue(events.contains("start:db/start"));
        assertTrue(events.contains("failure:db/start:boom"));
        assertTrue(events.contains("success:db/stop"));
        assertTrue(events.contains("success:hook-1/stop"));
        assertEquals(6, events.size());
    }
}
