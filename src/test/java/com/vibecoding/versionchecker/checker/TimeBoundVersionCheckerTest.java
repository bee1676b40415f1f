package com.vibecoding.versionchecker.checker;

import com.vibecoding.versionchecker.TestPods;
import com.vibecoding.versionchecker.exception.NoVersionFoundException;
import com.vibecoding.versionchecker.exception.ReconcileCancelledException;
import com.vibecoding.versionchecker.model.CheckOutcome;
import com.vibecoding.versionchecker.model.CheckOutcomeType;
import com.vibecoding.versionchecker.model.ImageCheckResult;
import com.vibecoding.versionchecker.model.ImageOptions;
import com.vibecoding.versionchecker.reconciler.ReconcileContext;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TimeBoundVersionCheckerTest {

    private ExecutorService executor;
    private final Pod pod = TestPods.pod("app");
    private final Container container = pod.getSpec().getContainers().get(0);
    private final ImageOptions options = new ImageOptions();

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void check_DelegateReturnsResult_ShouldPassThrough() {
        ImageCheckResult result = ImageCheckResult.builder().imageUrl("repo/app").latest(true).build();
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> CheckOutcome.result(result), executor, Duration.ofSeconds(5));

        CheckOutcome outcome = checker.check(ReconcileContext.of(false), pod, container, options);

        assertEquals(CheckOutcomeType.RESULT, outcome.getType());
        assertSame(result, outcome.getResult());
    }

    @Test
    void check_DelegateReturnsNull_ShouldBePending() {
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> null, executor, Duration.ofSeconds(5));

        CheckOutcome outcome = checker.check(ReconcileContext.of(false), pod, container, options);

        assertEquals(CheckOutcomeType.PENDING, outcome.getType());
    }

    @Test
    void check_DelegateThrowsNoVersionFound_ShouldClassify() {
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> {
                throw new NoVersionFoundException("no tags match ^v1");
            }, executor, Duration.ofSeconds(5));

        CheckOutcome outcome = checker.check(ReconcileContext.of(false), pod, container, options);

        assertTrue(outcome.isNoVersionFound());
    }

    @Test
    void check_DelegateThrowsOther_ShouldBeFailed() {
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> {
                throw new IllegalStateException("registry unreachable");
            }, executor, Duration.ofSeconds(5));

        CheckOutcome outcome = checker.check(ReconcileContext.of(false), pod, container, options);

        assertTrue(outcome.isFailed());
        assertEquals("registry unreachable", outcome.getError().getMessage());
    }

    @Test
    void check_SlowDelegate_ShouldFailAfterTimeoutAndInterrupt() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> {
                try {
                    new CountDownLatch(1).await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                }
                return CheckOutcome.pending();
            }, executor, Duration.ofMillis(100));

        CheckOutcome outcome = checker.check(ReconcileContext.of(false), pod, container, options);

        assertTrue(outcome.isFailed());
        assertInstanceOf(ReconcileCancelledException.class, outcome.getError());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void check_ContextDeadlineShorterThanTimeout_ShouldFailWithDeadline() {
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> {
                try {
                    new CountDownLatch(1).await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return CheckOutcome.pending();
            }, executor, Duration.ofSeconds(30));

        long start = System.nanoTime();
        CheckOutcome outcome = checker.check(
            ReconcileContext.withTimeout(false, Duration.ofMillis(150)), pod, container, options);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(outcome.isFailed());
        assertInstanceOf(ReconcileCancelledException.class, outcome.getError());
        assertTrue(elapsedMillis < 5000, "should stop waiting at the context deadline");
    }

    @Test
    void check_ContextAlreadyCancelled_ShouldNotCallDelegate() {
        AtomicInteger calls = new AtomicInteger();
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> {
                calls.incrementAndGet();
                return CheckOutcome.pending();
            }, executor, Duration.ofSeconds(5));
        ReconcileContext context = ReconcileContext.of(false);
        context.cancel();

        CheckOutcome outcome = checker.check(context, pod, container, options);

        assertTrue(outcome.isFailed());
        assertEquals("reconcile canceled", outcome.getError().getMessage());
        assertEquals(0, calls.get());
    }

    @Test
    void check_ExecutorShutDown_ShouldFail() {
        executor.shutdownNow();
        AtomicBoolean called = new AtomicBoolean();
        TimeBoundVersionChecker checker = new TimeBoundVersionChecker(
            (ctx, p, c, o) -> {
                called.set(true);
                return CheckOutcome.pending();
            }, executor, Duration.ofSeconds(5));

        CheckOutcome outcome = checker.check(ReconcileContext.of(false), pod, container, options);

        assertTrue(outcome.isFailed());
        assertFalse(called.get());
    }
}
