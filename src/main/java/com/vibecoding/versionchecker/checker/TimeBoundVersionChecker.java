package com.vibecoding.versionchecker.checker;

import com.vibecoding.versionchecker.exception.ReconcileCancelledException;
import com.vibecoding.versionchecker.model.CheckOutcome;
import com.vibecoding.versionchecker.model.ImageOptions;
import com.vibecoding.versionchecker.reconciler.ReconcileContext;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 검사 시간을 제한하는 검사기 데코레이터
 * 컨텍스트의 남은 시간과 검사 타임아웃 중 짧은 쪽까지만 기다린다.
 */
public class TimeBoundVersionChecker implements ImageVersionChecker {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundVersionChecker.class);

    private final ImageVersionChecker delegate;
    private final ExecutorService executor;
    private final Duration checkTimeout;

    public TimeBoundVersionChecker(ImageVersionChecker delegate, ExecutorService executor, Duration checkTimeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.checkTimeout = checkTimeout;
    }

    @Override
    public CheckOutcome check(ReconcileContext context, Pod pod, Container container, ImageOptions options) {
        if (context.isDone()) {
            return CheckOutcome.failed(new ReconcileCancelledException(context.doneReason()));
        }

        Duration wait = context.remaining()
            .filter(remaining -> remaining.compareTo(checkTimeout) < 0)
            .orElse(checkTimeout);

        Future<CheckOutcome> future;
        try {
            future = executor.submit(() -> delegate.check(context, pod, container, options));
        } catch (RejectedExecutionException e) {
            return CheckOutcome.failed(new ReconcileCancelledException("check executor is shut down", e));
        }

        try {
            CheckOutcome outcome = future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : CheckOutcome.pending();
        } catch (TimeoutException e) {
            future.cancel(true);
            String reason = context.isDone() ? context.doneReason() : "check timed out after " + wait.toMillis() + "ms";
            log.warn("Check of image {} aborted: {}", container.getImage(), reason);
            return CheckOutcome.failed(new ReconcileCancelledException(reason, e));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return CheckOutcome.failed(new ReconcileCancelledException("check interrupted", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                return CheckOutcome.fromException(runtime);
            }
            return CheckOutcome.failed(new IllegalStateException(cause.getMessage(), cause));
        }
    }
}
