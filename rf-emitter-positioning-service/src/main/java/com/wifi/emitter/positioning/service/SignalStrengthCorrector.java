package com.wifi.emitter.positioning.service;

import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.SignalCorrection;
import com.wifi.emitter.positioning.repository.SignalCorrectionRepository;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Detects devices that report a fixed default signal strength for a whole emitter type.
 *
 * <p>The first signal value seen for a type is remembered and trusted. While every later value
 * equals it, the type is assumed to report a constant placeholder and observations are corrected
 * to the minimum signal. Once a different value shows up, the type is marked as varying and
 * values pass through from then on. The learned state survives restarts through the
 * {@link SignalCorrectionRepository}.
 */
@Slf4j
@Service
public class SignalStrengthCorrector {

    private final SignalCorrectionRepository repository;
    private final Map<EmitterType, Integer> constantSignals = new EnumMap<>(EmitterType.class);

    public SignalStrengthCorrector(SignalCorrectionRepository repository) {
        this.repository = repository;
    }

    /**
     * Applies the learned correction for the observation's type.
     *
     * @param observation observation with the device-reported signal
     * @return the observation with its corrected signal
     */
    public Observation correct(Observation observation) {
        int corrected = correctedSignal(observation.identification().type(), observation.signalStrength());
        return corrected == observation.signalStrength() ? observation : observation.withSignalStrength(corrected);
    }

    /**
     * @param type emitter type
     * @param signal clamped device signal
     * @return the signal to use for positioning
     */
    public synchronized int correctedSignal(EmitterType type, int signal) {
        Integer known = constantSignals.get(type);
        if (known == null) {
            known = repository.findByType(type).map(SignalCorrection::getConstantSignal).orElse(null);
            if (known == null) {
                remember(type, signal);
                return signal;
            }
            constantSignals.put(type, known);
        }

        if (known == SignalCorrection.VARYING) {
            return signal;
        }
        if (known == signal) {
            return Observation.MINIMUM_SIGNAL;
        }
        log.info("{} reports varying signal strength ({} and {}), trusting it from now on", type, known, signal);
        remember(type, SignalCorrection.VARYING);
        return signal;
    }

    private void remember(EmitterType type, int value) {
        constantSignals.put(type, value);
        repository.save(new SignalCorrection(type.name(), value));
    }
}
