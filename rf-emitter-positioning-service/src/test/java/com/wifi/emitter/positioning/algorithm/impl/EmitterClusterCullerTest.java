package com.wifi.emitter.positioning.algorithm.impl;

import static com.wifi.emitter.positioning.algorithm.impl.RfLocations.at;
import static com.wifi.emitter.positioning.algorithm.impl.RfLocations.wifi;
import static org.assertj.core.api.Assertions.assertThat;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.RfLocation;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EmitterClusterCuller Tests")
class EmitterClusterCullerTest {

    private EmitterClusterCuller culler;

    @BeforeEach
    void setUp() {
        culler = new EmitterClusterCuller(new PositioningProperties());
    }

    @Test
    @DisplayName("Should keep a tight cluster intact")
    void shouldKeepTightCluster() {
        List<RfLocation> cluster = List.of(
                wifi(50.0, 8.0), wifi(50.0001, 8.0), wifi(50.0, 8.0001));

        Optional<List<RfLocation>> result = culler.cull(cluster);

        assertThat(result).isPresent();
        assertThat(result.get()).containsExactlyInAnyOrderElementsOf(cluster);
    }

    @Test
    @DisplayName("Should exclude an emitter one kilometer away")
    void shouldExcludeOutlier() {
        RfLocation outlier = wifi(50.009, 8.0);
        List<RfLocation> locations = List.of(
                wifi(50.0, 8.0), wifi(50.0001, 8.0), outlier, wifi(50.0, 8.0001));

        Optional<List<RfLocation>> result = culler.cull(locations);

        assertThat(result).isPresent();
        assertThat(result.get()).hasSize(3).doesNotContain(outlier);
    }

    @Test
    @DisplayName("Should accept a single cell tower")
    void shouldAcceptSingleCell() {
        RfLocation cell = at(EmitterType.GSM, 50.0, 8.0, 0.0, 10);

        assertThat(culler.cull(List.of(cell))).contains(List.of(cell));
    }

    @Test
    @DisplayName("Should accept a single WiFi network")
    void shouldAcceptSingleWifi() {
        assertThat(culler.cull(List.of(wifi(50.0, 8.0)))).isPresent();
    }

    @Test
    @DisplayName("Should reject a single invalid emitter")
    void shouldRejectSingleInvalid() {
        assertThat(culler.cull(List.of(at(EmitterType.INVALID, 50.0, 8.0, 0.0, 10)))).isEmpty();
    }

    @Test
    @DisplayName("Should reject two WiFi networks that disagree")
    void shouldRejectDisagreeingPair() {
        assertThat(culler.cull(List.of(wifi(50.0, 8.0), wifi(50.009, 8.0)))).isEmpty();
    }

    @Test
    @DisplayName("Should accept a lone cell when WiFi disagrees with it")
    void shouldAcceptCellAgainstScatteredWifi() {
        RfLocation cell = at(EmitterType.LTE, 50.0, 8.0, 2_000.0, 10);
        RfLocation farWifi = wifi(51.0, 8.0);

        Optional<List<RfLocation>> result = culler.cull(List.of(cell, farWifi));

        assertThat(result).contains(List.of(cell));
    }

    @Test
    @DisplayName("Should return empty for no input")
    void shouldReturnEmptyForNoInput() {
        assertThat(culler.cull(List.of())).isEmpty();
        assertThat(culler.cull(null)).isEmpty();
    }
}
