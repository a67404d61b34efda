package com.wifi.emitter.positioning.repository;

import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.SignalCorrection;
import java.util.Optional;

/**
 * Key-value store for the per-type signal correction learned on this device.
 */
public interface SignalCorrectionRepository {

    Optional<SignalCorrection> findByType(EmitterType type);

    void save(SignalCorrection correction);
}
