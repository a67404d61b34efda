package com.wifi.emitter.positioning.dto;

import java.util.Objects;

/**
 * Canonical identity of a radio emitter: a type-scoped id plus its {@link EmitterType}.
 *
 * <p>The unique key is type prefixed for WLAN bands, because the same hardware address is
 * broadcast on several bands and every band has its own coverage. Cell ids are already unique
 * within their technology, so cellular keys are the raw id. Two identities are equal iff their
 * keys are equal.
 */
public final class RfIdentification implements Comparable<RfIdentification> {

    private static final String WLAN_KEY_SEPARATOR = "/";

    private final String typeScopedId;
    private final EmitterType type;
    private final String uniqueKey;

    public RfIdentification(String typeScopedId, EmitterType type) {
        this.typeScopedId = Objects.requireNonNull(typeScopedId, "typeScopedId");
        this.type = Objects.requireNonNull(type, "type");
        this.uniqueKey = type.isWlan() ? type.name() + WLAN_KEY_SEPARATOR + typeScopedId : typeScopedId;
    }

    public static RfIdentification of(String typeScopedId, EmitterType type) {
        return new RfIdentification(typeScopedId, type);
    }

    public String typeScopedId() {
        return typeScopedId;
    }

    public EmitterType type() {
        return type;
    }

    public String uniqueKey() {
        return uniqueKey;
    }

    @Override
    public int compareTo(RfIdentification other) {
        return uniqueKey.compareTo(other.uniqueKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RfIdentification)) {
            return false;
        }
        return uniqueKey.equals(((RfIdentification) o).uniqueKey);
    }

    @Override
    public int hashCode() {
        return uniqueKey.hashCode();
    }

    @Override
    public String toString() {
        return uniqueKey;
    }
}
