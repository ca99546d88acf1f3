package com.gemflush.orchestrator.pipeline;

import com.gemflush.orchestrator.config.CfpProperties.CallPolicy;
import com.gemflush.orchestrator.config.PipelineConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external capabilities under a hard timeout, optionally with
 * bounded exponential-backoff retry.
 *
 * Only {@link RetryableIoException} is retried. A timeout is converted into
 * one, so it is retried for crawl/scoring and reported for publish.
 */
@Component
public class StageCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageCallExecutor.class);

    private final ExecutorService callPool;

    public StageCallExecutor(@Qualifier(PipelineConfig.CALL_EXECUTOR) ExecutorService callPool) {
        this.callPool = callPool;
    }

    /**
     * Call with retry. Each attempt gets the full policy timeout.
     *
     * @throws StageException the last failure once the attempt budget is spent,
     *                        or the first non-retryable one
     */
    public <T> T callWithRetry(String operation, CallPolicy policy, Supplier<T> call) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, policy.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.getInitialBackoff().toMillis(),
                        policy.getMultiplier(),
                        policy.getMaxBackoff().toMillis()))
                .retryOnException(e -> e instanceof RetryableIoException)
                .build();
        Retry retry = Retry.of(operation, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("{} attempt {} failed, retrying in {} ms: {}",
                        operation, event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));

        Supplier<T> guarded = () -> callOnce(operation, policy.getTimeout(), call);
        return Retry.decorateSupplier(retry, guarded).get();
    }

    /**
     * Single attempt under a timeout. Used directly for publisher calls,
     * which are reported rather than retried.
     */
    public <T> T callOnce(String operation, Duration timeout, Supplier<T> call) {
        TimeLimiter limiter = TimeLimiter.of(operation, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        try {
            return limiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, callPool));
        } catch (TimeoutException e) {
            throw new RetryableIoException(operation + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(operation + " interrupted", false, e);
        } catch (Exception e) {
            throw translate(operation, unwrap(e));
        }
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static RuntimeException translate(String operation, Throwable t) {
        if (t instanceof RuntimeException re) {
            return re;
        }
        if (t instanceof Error err) {
            throw err;
        }
        return new StageException(operation + " failed: " + t.getMessage(), false, t);
    }
}
