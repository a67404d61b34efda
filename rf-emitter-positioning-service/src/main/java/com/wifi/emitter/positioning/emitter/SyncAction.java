package com.wifi.emitter.positioning.emitter;

/** The single persistence write an emitter record needs during a cache flush. */
public enum SyncAction {
    NONE,
    INSERT,
    UPDATE,
    /** Keep the row but mark its radius invalid, so the emitter stays blacklisted. */
    INVALIDATE,
    DROP
}
