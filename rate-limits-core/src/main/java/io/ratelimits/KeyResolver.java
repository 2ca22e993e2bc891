package io.ratelimits;

/**
 * Partitions inbound requests into independent rate limit budgets.  Requests resolving to the same key share
 * one {@link Limiter}.  Implementations must be pure and thread safe since they are invoked for every request
 * from arbitrary threads.
 *
 * @param <ContextT> Request context the key is derived from
 */
@FunctionalInterface
public interface KeyResolver<ContextT> {
    String GLOBAL_KEY = "global";

    /**
     * Key used when a resolver cannot determine a key for a request
     */
    String UNKNOWN_KEY = "unknown";

    /**
     * @param context Context for the request
     * @return Rate limit key, or null if none could be determined
     */
    String resolve(ContextT context);

    /**
     * All requests share a single budget
     */
    static <ContextT> KeyResolver<ContextT> global() {
        return context -> GLOBAL_KEY;
    }
}
