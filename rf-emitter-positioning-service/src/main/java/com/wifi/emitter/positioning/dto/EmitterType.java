package com.wifi.emitter.positioning.dto;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of radio technologies we learn coverage for. Each constant carries its static
 * {@link RfCharacteristics}.
 *
 * <p>WLAN has tight fix-accuracy requirements and short range; wide-area cellular accepts loose
 * fixes and spans kilometers. INVALID is configured so that it practically never contributes: it
 * demands a 2 m fix and a group of 99 emitters.
 */
public enum EmitterType {
    // 2.4 GHz indoor range is ~46 m, outdoor ~90 m, but very long detections happen in rural areas
    WLAN2(new RfCharacteristics(15.0, 35.0, 300.0, 2)),
    WLAN5(Shared.WLAN5),
    WLAN6(Shared.WLAN5),
    BT(new RfCharacteristics(5.0, 2.0, 100.0, 2)),
    // usual maximum is ~35 km, extended range cells reach ~200 km
    GSM(new RfCharacteristics(100.0, 500.0, 200_000.0, 1)),
    CDMA(Shared.LTE),
    WCDMA(Shared.LTE),
    TDSCDMA(Shared.LTE),
    LTE(Shared.LTE),
    NR(Shared.LTE),
    INVALID(new RfCharacteristics(2.0, 50.0, 100.0, 99));

    private static final Set<EmitterType> WLAN_TYPES = EnumSet.of(WLAN2, WLAN5, WLAN6);

    private static final Set<EmitterType> SHORT_RANGE_TYPES = EnumSet.of(WLAN2, WLAN5, WLAN6, BT);

    private final RfCharacteristics characteristics;

    EmitterType(RfCharacteristics characteristics) {
        this.characteristics = characteristics;
    }

    /** Characteristics shared by several constants; a holder class avoids forward references. */
    private static final class Shared {
        // the frequency difference between 5 and 6 GHz does not change range significantly
        static final RfCharacteristics WLAN5 = new RfCharacteristics(10.0, 15.0, 100.0, 2);

        // LTE cells are usually smaller than GSM cells but can span the same huge areas
        static final RfCharacteristics LTE = new RfCharacteristics(50.0, 250.0, 100_000.0, 1);
    }

    public RfCharacteristics characteristics() {
        return characteristics;
    }

    /** WiFi bands; the same hardware address on two bands is two distinct emitters. */
    public boolean isWlan() {
        return WLAN_TYPES.contains(this);
    }

    /** WiFi-class emitters whose coverage is small enough to trust a tight radius. */
    public boolean isShortRange() {
        return SHORT_RANGE_TYPES.contains(this);
    }
}
