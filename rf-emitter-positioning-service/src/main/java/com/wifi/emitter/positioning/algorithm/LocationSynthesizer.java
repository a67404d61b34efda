package com.wifi.emitter.positioning.algorithm;

import com.wifi.emitter.positioning.dto.FusedLocation;
import com.wifi.emitter.positioning.dto.RfLocation;
import java.util.Collection;
import java.util.Optional;

/**
 * Fuses the coverage projections of the emitters seen during one reporting interval into a single
 * location.
 */
public interface LocationSynthesizer {

    /**
     * Fuses the given projections.
     *
     * @param locations projections gathered during one interval
     * @return the fused location, or empty when no sufficiently consistent subset exists
     */
    Optional<FusedLocation> synthesize(Collection<RfLocation> locations);
}
