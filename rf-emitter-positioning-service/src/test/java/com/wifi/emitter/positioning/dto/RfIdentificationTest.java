package com.wifi.emitter.positioning.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RfIdentification Tests")
class RfIdentificationTest {

    private static final String BSSID = "aa:bb:cc:dd:ee:ff";

    @Test
    @DisplayName("WLAN keys are prefixed with the band")
    void wlanKeysArePrefixed() {
        assertThat(RfIdentification.of(BSSID, EmitterType.WLAN5).uniqueKey()).isEqualTo("WLAN5/" + BSSID);
        assertThat(RfIdentification.of(BSSID, EmitterType.WLAN2).uniqueKey()).isEqualTo("WLAN2/" + BSSID);
    }

    @Test
    @DisplayName("Cell keys are the raw id")
    void cellKeysAreRaw() {
        RfIdentification lte = RfIdentification.of("LTE/262/2/1234/56789", EmitterType.LTE);

        assertThat(lte.uniqueKey()).isEqualTo("LTE/262/2/1234/56789");
        assertThat(lte.toString()).isEqualTo(lte.uniqueKey());
    }

    @Test
    @DisplayName("Same address on two bands is two emitters")
    void sameAddressDifferentBandsAreDistinct() {
        RfIdentification band2 = RfIdentification.of(BSSID, EmitterType.WLAN2);
        RfIdentification band5 = RfIdentification.of(BSSID, EmitterType.WLAN5);

        assertThat(band2).isNotEqualTo(band5);
        assertThat(band2).isEqualTo(RfIdentification.of(BSSID, EmitterType.WLAN2));
        assertThat(band2.hashCode()).isEqualTo(RfIdentification.of(BSSID, EmitterType.WLAN2).hashCode());
    }

    @Test
    @DisplayName("Identities order by unique key")
    void comparesByKey() {
        RfIdentification a = RfIdentification.of("a", EmitterType.GSM);
        RfIdentification b = RfIdentification.of("b", EmitterType.GSM);

        assertThat(a.compareTo(b)).isNegative();
        assertThat(b.compareTo(a)).isPositive();
    }

    @Test
    @DisplayName("Null id is rejected")
    void nullIdRejected() {
        assertThatThrownBy(() -> RfIdentification.of(null, EmitterType.GSM))
                .isInstanceOf(NullPointerException.class);
    }
}
