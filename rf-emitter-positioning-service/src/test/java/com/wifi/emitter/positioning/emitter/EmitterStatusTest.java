package com.wifi.emitter.positioning.emitter;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("EmitterStatus Transition Tests")
class EmitterStatusTest {

    @ParameterizedTest(name = "{0} + {1} -> {2}")
    @CsvSource({
        "UNKNOWN, NEW, NEW",
        "UNKNOWN, CACHED, CACHED",
        "UNKNOWN, BLACKLISTED, BLACKLISTED",
        "UNKNOWN, CHANGED, UNKNOWN",
        "NEW, CACHED, CACHED",
        "NEW, BLACKLISTED, BLACKLISTED",
        "NEW, CHANGED, NEW",
        "NEW, UNKNOWN, NEW",
        "CACHED, CHANGED, CHANGED",
        "CACHED, BLACKLISTED, BLACKLISTED",
        "CACHED, NEW, CACHED",
        "CHANGED, CACHED, CACHED",
        "CHANGED, BLACKLISTED, BLACKLISTED",
        "CHANGED, UNKNOWN, CHANGED"
    })
    @DisplayName("Transition table")
    void transitionTable(EmitterStatus current, EmitterStatus requested, EmitterStatus expected) {
        assertEquals(expected, current.transitionTo(requested));
    }

    @ParameterizedTest
    @EnumSource(EmitterStatus.class)
    @DisplayName("BLACKLISTED is terminal")
    void blacklistedIsTerminal(EmitterStatus requested) {
        assertEquals(EmitterStatus.BLACKLISTED, EmitterStatus.BLACKLISTED.transitionTo(requested));
    }

    @Test
    @DisplayName("Requesting the current status keeps it")
    void sameStatusIsNoOp() {
        for (EmitterStatus status : EmitterStatus.values()) {
            assertEquals(status, status.transitionTo(status));
        }
    }
}
