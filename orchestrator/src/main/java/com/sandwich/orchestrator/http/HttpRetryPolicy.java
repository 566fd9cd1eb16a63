package com.sandwich.orchestrator.http;

import com.sandwich.orchestrator.error.PipelineException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry policy shared by the outbound API clients.
 *
 * HTTP 429, any 5xx and transport errors are retried up to {@code maxRetries}
 * times, waiting {@code backoff}, then 2x{@code backoff}, then 3x... between
 * attempts. Once the budget is spent the last response is handed back so the
 * caller can map its status; a transport error that survives the budget
 * becomes a RETRYABLE {@link PipelineException}.
 */
public class HttpRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(HttpRetryPolicy.class);

    /** One blocking HTTP exchange. */
    @FunctionalInterface
    public interface HttpCall {
        HttpResponse<String> send() throws IOException, InterruptedException;
    }

    /** The final response and how many attempts it took to get it. */
    public record Result(HttpResponse<String> response, int attempts) {
        public int status() { return response.statusCode(); }
        public String body() { return response.body(); }
    }

    private final String label;
    private final Retry  retry;

    /**
     * @param label      service name used in log lines and failure messages, e.g. "Claude API"
     * @param maxRetries retries after the first attempt; 0 disables retrying
     * @param backoff    pause before the first retry; later pauses grow linearly
     */
    public HttpRetryPolicy(String label, int maxRetries, Duration backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
        long stepMillis = Math.max(1, backoff.toMillis());
        this.label = label;
        RetryConfig config = RetryConfig.<HttpResponse<String>>custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(IntervalFunction.of(Duration.ofMillis(stepMillis), previous -> previous + stepMillis))
                .retryOnResult(response -> isRetryable(response.statusCode()))
                .retryExceptions(IOException.class)
                .ignoreExceptions(InterruptedException.class)
                .build();
        this.retry = Retry.of(label, config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("{} attempt {} failed ({}), retrying in {} ms", label,
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "retryable status",
                        event.getWaitInterval().toMillis()));
    }

    /** 429 and every 5xx are worth another attempt; other statuses are final. */
    public static boolean isRetryable(int status) {
        return status == 429 || status >= 500;
    }

    /**
     * Run {@code call} under this policy.
     *
     * @return the first non-retryable response, or the last response once the budget is spent
     * @throws PipelineException RETRYABLE {@code network_error} when every attempt failed in
     *                           transport, RETRYABLE {@code interrupted} when the thread was interrupted
     */
    public Result execute(HttpCall call) {
        AtomicInteger attempts = new AtomicInteger();
        CheckedSupplier<HttpResponse<String>> guarded = Retry.decorateCheckedSupplier(retry, () -> {
            attempts.incrementAndGet();
            return call.send();
        });
        try {
            return new Result(guarded.get(), attempts.get());
        } catch (IOException e) {
            throw PipelineException.retriesExhausted("network_error",
                    label + " unreachable: " + e.getMessage(), attempts.get(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PipelineException.retriesExhausted("interrupted",
                    "Interrupted during " + label + " call", attempts.get(), e);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException(label + " call failed", t);
        }
    }
}
