package io.ratelimits;

/**
 * Contract for a rate limiter guarding a single key.  The caller is expected to call tryAcquire() once per
 * request and proceed only when it returns true.  There is nothing to release: a permit is consumed on
 * admission and replenished by the limiter over time.
 */
public interface Limiter {
    /**
     * Try to take one permit without waiting.
     *
     * @return true if the request is admitted, false if no permit is available right now
     */
    boolean tryAcquire();

    /**
     * @return Sustained rate at which permits are replenished, per second
     */
    int getRequestsPerSecond();

    /**
     * @return Maximum number of permits that may accumulate while idle
     */
    int getBurstSize();
}
