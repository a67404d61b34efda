package com.wifi.emitter.positioning.algorithm.impl;

import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.DEG_TO_METER;
import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.METER_TO_DEG;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.FusedLocation;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.RfCharacteristics;
import com.wifi.emitter.positioning.dto.RfLocation;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Signal- and coverage-weighted average of emitter coverage centers.
 *
 * <p>WEIGHTS:
 * Each member is weighted by signal strength divided by its accuracy estimate, so strong signals
 * from small cells dominate. Two adjustments apply:
 * <ul>
 *   <li>An emitter seen only from a few nearby spots has a tiny learned radius, but that only means
 *       we do not know where it really is. When the radius is below half the type's minimum range,
 *       the accuracy used for weighting is inflated towards {@code minRange + 0.5 * maxRange}.</li>
 *   <li>Suspicious observations count with half their signal, never below the minimum signal.</li>
 * </ul>
 *
 * <p>ACCURACY:
 * The coverage edge is treated as a two-sigma bound, so one standard deviation is half the
 * accuracy. A strong signal suggests we are close to the emitter, so the accuracy estimate is
 * pulled linearly towards the type's minimum range as the signal rises:
 * <pre>
 *   adjusted = minRange + (1 - scaling * (signal - 1) / 30) * (accuracyEstimate - minRange)
 * </pre>
 *
 * <p>VARIANCE per axis, in degrees:
 * <pre>
 *   variance = Σ w²·(σ² + d²) / (n · Σ w²)
 * </pre>
 * where {@code d} is the member's deviation from the weighted mean. When a short-range emitter is
 * part of the set, {@code max(σ, d)²} replaces {@code σ² + d²}; WiFi coverage is tight enough that
 * the additive form overstates the error. Longitude is not scaled by cos(latitude) in either
 * direction, the factors nearly cancel over the short distances involved.
 *
 * <p>The final accuracy is floored at the minimum believable accuracy and then inflated when the
 * result rests entirely on suspicious WiFi data, or on a single emitter whose radius is below its
 * minimum range.
 */
@Component
public class WeightedAverageLocationCalculator {

    private static final Logger logger = LoggerFactory.getLogger(WeightedAverageLocationCalculator.class);

    private static final double SIGNAL_SPAN = Observation.MAXIMUM_SIGNAL - Observation.MINIMUM_SIGNAL;

    /** Coverage edge is assumed to be two standard deviations out. */
    private static final double SIGMA_PER_ACCURACY = 0.5;

    private final double minimumBelievableAccuracy;
    private final double accuracySignalScaling;
    private final double accuracyInflation;

    public WeightedAverageLocationCalculator(PositioningProperties properties) {
        PositioningProperties.Synthesis synthesis = properties.getSynthesis();
        this.minimumBelievableAccuracy = synthesis.getMinimumBelievableAccuracy();
        this.accuracySignalScaling = synthesis.getAccuracySignalScaling();
        this.accuracyInflation = synthesis.getAccuracyInflation();
    }

    /**
     * Computes the weighted average of the given projections.
     *
     * @param locations projections to average
     * @return fused location, empty for an empty input
     */
    public Optional<FusedLocation> average(Collection<RfLocation> locations) {
        if (locations == null || locations.isEmpty()) {
            return Optional.empty();
        }
        List<RfLocation> members = List.copyOf(locations);
        int n = members.size();

        double[] latitudes = new double[n];
        double[] longitudes = new double[n];
        double[] sigmas = new double[n];
        double[] weights = new double[n];
        boolean shortRangePresent = false;
        boolean allShortRangeSuspicious = true;
        Instant newest = Instant.MIN;

        for (int i = 0; i < n; i++) {
            RfLocation member = members.get(i);
            latitudes[i] = member.latitude();
            longitudes[i] = member.longitude();
            weights[i] = weight(member);
            sigmas[i] = signalAdjustedAccuracy(member) * METER_TO_DEG * SIGMA_PER_ACCURACY;

            if (member.type().isShortRange()) {
                shortRangePresent = true;
                allShortRangeSuspicious &= member.suspicious();
            }
            if (member.time() != null && member.time().isAfter(newest)) {
                newest = member.time();
            }
        }

        double latMean = weightedMean(latitudes, weights);
        double lonMean = weightedMean(longitudes, weights);
        double latVariance = weightedVariance(latMean, latitudes, sigmas, weights, shortRangePresent);
        double lonVariance = weightedVariance(lonMean, longitudes, sigmas, weights, shortRangePresent);

        double accuracy = Math.max(
                Math.sqrt(latVariance + lonVariance) * DEG_TO_METER, minimumBelievableAccuracy);

        boolean suspiciousWifiOnly = shortRangePresent && allShortRangeSuspicious;
        boolean singleUnderRanged = n == 1
                && members.get(0).radius() < members.get(0).characteristics().minimumRange();
        if (suspiciousWifiOnly || singleUnderRanged) {
            accuracy *= accuracyInflation;
        }

        logger.debug("Averaged {} emitters to ({}, {}) accuracy {}m", n, latMean, lonMean, accuracy);
        return Optional.of(new FusedLocation(
                latMean, lonMean, accuracy, newest == Instant.MIN ? null : newest, n));
    }

    /**
     * Signal divided by the accuracy used for weighting.
     */
    double weight(RfLocation member) {
        RfCharacteristics characteristics = member.characteristics();
        double minRange = characteristics.minimumRange();
        double accuracyPartOfWeight = member.radius() > minRange / 2
                ? member.accuracyEstimate()
                : minRange + (0.5 - member.radius() / minRange) * characteristics.maximumRange();

        int signal = member.signalStrength();
        if (member.suspicious()) {
            signal = Math.max(Observation.MINIMUM_SIGNAL, signal / 2);
        }
        return signal / accuracyPartOfWeight;
    }

    /**
     * Accuracy estimate pulled towards the minimum range as the signal gets stronger.
     */
    double signalAdjustedAccuracy(RfLocation member) {
        double minRange = member.characteristics().minimumRange();
        double signalFraction = (member.signalStrength() - Observation.MINIMUM_SIGNAL) / SIGNAL_SPAN;
        double adjusted = minRange
                + (1 - accuracySignalScaling * signalFraction) * (member.accuracyEstimate() - minRange);
        return Math.max(adjusted, minRange);
    }

    private static double weightedMean(double[] positions, double[] weights) {
        double weightedSum = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < positions.length; i++) {
            weightedSum += positions[i] * weights[i];
            weightSum += weights[i];
        }
        return weightedSum / weightSum;
    }

    private static double weightedVariance(
            double mean, double[] positions, double[] sigmas, double[] weights, boolean shortRangePresent) {
        double weightedVarianceSum = 0.0;
        double squaredWeightSum = 0.0;
        for (int i = 0; i < positions.length; i++) {
            double deviation = positions[i] - mean;
            double squaredWeight = weights[i] * weights[i];
            double term = shortRangePresent
                    ? Math.pow(Math.max(sigmas[i], Math.abs(deviation)), 2)
                    : sigmas[i] * sigmas[i] + deviation * deviation;
            weightedVarianceSum += squaredWeight * term;
            squaredWeightSum += squaredWeight;
        }
        return weightedVarianceSum / (positions.length * squaredWeightSum);
    }
}
