package com.barcache.service.fetch;

import com.barcache.core.exception.CircuitOpenException;
import com.barcache.core.exception.FetchExhaustedException;
import com.barcache.core.exception.InvalidSymbolException;
import com.barcache.core.exception.MarketDataException;
import com.barcache.core.exception.RateLimitException;
import com.barcache.service.config.BarCacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs remote calls with a per-attempt timeout, exponential backoff with jitter,
 * a shared rate limiter and a circuit breaker.
 * <p>
 * The breaker is consulted before every attempt. When it rejects the first attempt the call
 * fails with {@link CircuitOpenException} and the provider is never contacted; when it opens
 * part way through the retries the remaining retries are abandoned and the call fails with
 * {@link FetchExhaustedException}. {@link InvalidSymbolException} is passed through untouched.
 */
public class ResilientFetchExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientFetchExecutor.class);

    private final RetryPolicy policy;
    private final CircuitBreaker breaker;
    private final RateLimiter rateLimiter;
    private final Duration callTimeout;
    private final Sleeper sleeper;
    private final Random random;
    private final ExecutorService workers;

    public ResilientFetchExecutor(RetryPolicy policy, CircuitBreaker breaker, RateLimiter rateLimiter,
                                  Duration callTimeout, Sleeper sleeper, Random random) {
        this.policy = policy;
        this.breaker = breaker;
        this.rateLimiter = rateLimiter;
        this.callTimeout = callTimeout;
        this.sleeper = sleeper;
        this.random = random;
        this.workers = Executors.newCachedThreadPool(newWorkerFactory());
    }

    public static ResilientFetchExecutor fromConfig(BarCacheConfig config, Clock clock) {
        RetryPolicy policy = new RetryPolicy(config.getMaxRetries(), config.getRetryBaseDelay(),
            config.getRetryMaxDelay(), config.getMaxJitter());
        CircuitBreaker breaker = new CircuitBreaker(config.getBreakerThreshold(), config.getBreakerCooldown(), clock);
        Sleeper sleeper = Sleeper.system();
        RateLimiter limiter = new RateLimiter(config.getMinRequestSpacing(), sleeper, clock);
        return new ResilientFetchExecutor(policy, breaker, limiter, config.getCallTimeout(), sleeper, new Random());
    }

    private static ThreadFactory newWorkerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "remote-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Execute {@code call} until it succeeds, the retry budget is spent or the breaker refuses.
     *
     * @param name label used in logs and error messages
     */
    public <T> T execute(String name, RemoteCall<T> call) throws MarketDataException {
        Exception lastError = null;
        int attempts = 0;

        for (int retry = 0; retry <= policy.maxRetries(); retry++) {
            if (!breaker.tryAcquire()) {
                if (attempts == 0) {
                    throw new CircuitOpenException(
                        "Circuit breaker open, not calling " + name, breaker.getRetryAt());
                }
                throw new FetchExhaustedException(
                    name + " abandoned after " + attempts + " attempts: circuit breaker opened",
                    attempts, lastError);
            }

            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                breaker.release();
                Thread.currentThread().interrupt();
                throw new MarketDataException("Interrupted waiting for rate limit before " + name, e);
            }

            attempts++;
            try {
                T result = runWithTimeout(name, call);
                breaker.recordSuccess();
                if (attempts > 1) {
                    log.info("{} succeeded on attempt {}", name, attempts);
                }
                return result;
            } catch (InvalidSymbolException e) {
                breaker.release();
                throw e;
            } catch (InterruptedException e) {
                breaker.release();
                Thread.currentThread().interrupt();
                throw new MarketDataException("Interrupted during " + name, e);
            } catch (MarketDataException | RuntimeException e) {
                lastError = e;
                breaker.recordFailure();
            } catch (Error e) {
                breaker.release();
                throw e;
            }

            if (retry == policy.maxRetries()) {
                break;
            }

            Duration delay = nextDelay(retry, lastError);
            log.warn("{} failed (attempt {}/{}): {} - retrying in {}ms",
                name, attempts, policy.maxAttempts(), lastError.getMessage(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MarketDataException("Interrupted while waiting to retry " + name, e);
            }
        }

        log.error("{} failed after {} attempts: {}", name, attempts,
            lastError != null ? lastError.getMessage() : "unknown error");
        throw new FetchExhaustedException(name + " failed after " + attempts + " attempts", attempts, lastError);
    }

    private Duration nextDelay(int retry, Exception lastError) {
        long jitter = policy.maxJitter().isZero() ? 0 : random.nextInt((int) policy.maxJitter().toMillis() + 1);
        if (lastError instanceof RateLimitException) {
            return policy.delayForRateLimit(retry, jitter, ((RateLimitException) lastError).getRetryAfterMs());
        }
        return policy.delayFor(retry, jitter);
    }

    private <T> T runWithTimeout(String name, RemoteCall<T> call) throws MarketDataException, InterruptedException {
        Callable<T> task = call::call;
        Future<T> future = workers.submit(task);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MarketDataException(name + " timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MarketDataException) {
                throw (MarketDataException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new MarketDataException(name + " failed: " + cause, cause);
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return breaker;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
