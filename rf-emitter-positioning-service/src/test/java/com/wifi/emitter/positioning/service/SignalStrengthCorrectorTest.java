package com.wifi.emitter.positioning.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.dto.SignalCorrection;
import com.wifi.emitter.positioning.repository.impl.InMemorySignalCorrectionRepository;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SignalStrengthCorrector Tests")
class SignalStrengthCorrectorTest {

    private InMemorySignalCorrectionRepository repository;
    private SignalStrengthCorrector corrector;

    @BeforeEach
    void setUp() {
        repository = new InMemorySignalCorrectionRepository();
        corrector = new SignalStrengthCorrector(repository);
    }

    @Test
    @DisplayName("Should trust and remember the first value of a type")
    void shouldTrustFirstValue() {
        assertThat(corrector.correctedSignal(EmitterType.WLAN2, 20)).isEqualTo(20);
        assertThat(repository.storedValue(EmitterType.WLAN2)).contains(20);
    }

    @Test
    @DisplayName("Should correct a repeated constant value to the minimum")
    void shouldCorrectRepeatedValue() {
        corrector.correctedSignal(EmitterType.WLAN2, 20);

        assertThat(corrector.correctedSignal(EmitterType.WLAN2, 20)).isEqualTo(Observation.MINIMUM_SIGNAL);
        assertThat(corrector.correctedSignal(EmitterType.WLAN2, 20)).isEqualTo(Observation.MINIMUM_SIGNAL);
    }

    @Test
    @DisplayName("Should pass values through once the type varies")
    void shouldPassThroughOnceVarying() {
        corrector.correctedSignal(EmitterType.WLAN2, 20);

        assertThat(corrector.correctedSignal(EmitterType.WLAN2, 25)).isEqualTo(25);
        assertThat(corrector.correctedSignal(EmitterType.WLAN2, 20)).isEqualTo(20);
        assertThat(repository.storedValue(EmitterType.WLAN2)).contains(SignalCorrection.VARYING);
    }

    @Test
    @DisplayName("Should learn each type independently")
    void shouldLearnTypesIndependently() {
        corrector.correctedSignal(EmitterType.WLAN2, 20);
        corrector.correctedSignal(EmitterType.WLAN2, 25);

        assertThat(corrector.correctedSignal(EmitterType.LTE, 20)).isEqualTo(20);
        assertThat(corrector.correctedSignal(EmitterType.LTE, 20)).isEqualTo(Observation.MINIMUM_SIGNAL);
    }

    @Test
    @DisplayName("Should continue from the persisted state")
    void shouldUsePersistedState() {
        repository.save(new SignalCorrection(EmitterType.GSM.name(), 17));
        repository.save(new SignalCorrection(EmitterType.WLAN5.name(), SignalCorrection.VARYING));

        assertThat(corrector.correctedSignal(EmitterType.GSM, 17)).isEqualTo(Observation.MINIMUM_SIGNAL);
        assertThat(corrector.correctedSignal(EmitterType.WLAN5, 9)).isEqualTo(9);
    }

    @Test
    @DisplayName("Should return the same observation when nothing changes")
    void shouldKeepUnchangedObservation() {
        Observation observation = new Observation(
                RfIdentification.of("aa:bb:cc:dd:ee:ff", EmitterType.WLAN2), 20, Instant.now());

        assertThat(corrector.correct(observation)).isSameAs(observation);

        Observation corrected = corrector.correct(observation);
        assertThat(corrected.signalStrength()).isEqualTo(Observation.MINIMUM_SIGNAL);
        assertThat(corrected.identification()).isEqualTo(observation.identification());
    }
}
