package com.wifi.emitter.positioning.emitter;

/**
 * Lifecycle of an emitter record with respect to persisted coverage.
 *
 * <pre>
 * UNKNOWN -> NEW | CACHED | BLACKLISTED
 * NEW     -> CACHED | BLACKLISTED
 * CACHED  -> CHANGED | BLACKLISTED
 * CHANGED -> CACHED | BLACKLISTED
 * BLACKLISTED is terminal
 * </pre>
 */
public enum EmitterStatus {
    /** Seen, but nothing known: not persisted and no coverage. */
    UNKNOWN,
    /** Not persisted yet, but coverage has been learned. */
    NEW,
    /** Persisted with pending coverage changes. */
    CHANGED,
    /** Persisted, nothing pending. */
    CACHED,
    /** Moving or otherwise unusable emitter. */
    BLACKLISTED;

    /**
     * Total transition function. Requests that the table does not allow leave the status unchanged.
     *
     * @param requested status asked for
     * @return the resulting status
     */
    public EmitterStatus transitionTo(EmitterStatus requested) {
        if (requested == this) {
            return this;
        }
        boolean allowed =
                switch (this) {
                    case UNKNOWN -> requested == NEW || requested == CACHED || requested == BLACKLISTED;
                    case NEW -> requested == CACHED || requested == BLACKLISTED;
                    case CACHED, CHANGED ->
                            requested == CACHED || requested == CHANGED || requested == BLACKLISTED;
                    case BLACKLISTED -> false;
                };
        return allowed ? requested : this;
    }
}
