package quest.gekko.rankboard.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Caps concurrent outbound calls and retries transient failures. A missing resource is not retried.
 */
@Component
public class RateLimiter {
    private final Semaphore sem = new Semaphore(5);
    private final RetryTemplate retry = RetryTemplate.builder()
            .maxAttempts(3)
            .fixedBackoff(800)
            .notRetryOn(WebClientResponseException.NotFound.class)
            .build();

    public <T> T call(Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for an outbound slot", e);
        }
        try {
            return retry.execute(ctx -> c.call());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        } finally {
            sem.release();
        }
    }
}
