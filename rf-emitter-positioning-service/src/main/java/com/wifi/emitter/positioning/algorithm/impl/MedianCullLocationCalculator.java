package com.wifi.emitter.positioning.algorithm.impl;

import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.approximateDistance;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.FusedLocation;
import com.wifi.emitter.positioning.dto.RfLocation;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Median-robust refinement of the weighted average.
 *
 * <p>Members far from the per-axis median are trimmed before averaging. Per-axis medians are not
 * geometrically robust: with two tight clusters far apart, the median point can land between them
 * and trimming would discard good data. The trimmed result is therefore only trusted when it agrees
 * with the untrimmed average and the trim was modest. Otherwise the candidate closest to the
 * centroid of all candidates wins.
 */
@Component
public class MedianCullLocationCalculator {

    private static final Logger logger = LoggerFactory.getLogger(MedianCullLocationCalculator.class);

    /** Minimum subset size for which a median is meaningful. */
    private static final int MIN_MEDIAN_SUBSET = 3;

    private final WeightedAverageLocationCalculator weightedAverage;
    private final EmitterClusterCuller culler;
    private final double trimFactor;
    private final double maxTrimmedFraction;
    private final double disagreementFactor;

    public MedianCullLocationCalculator(
            WeightedAverageLocationCalculator weightedAverage,
            EmitterClusterCuller culler,
            PositioningProperties properties) {
        this.weightedAverage = weightedAverage;
        this.culler = culler;
        PositioningProperties.Synthesis synthesis = properties.getSynthesis();
        this.trimFactor = synthesis.getMedianTrimFactor();
        this.maxTrimmedFraction = synthesis.getMaxTrimmedFraction();
        this.disagreementFactor = synthesis.getDisagreementFactor();
    }

    /**
     * Computes the median-trimmed weighted average, falling back to the most central candidate when
     * the trimmed result cannot be trusted. Nothing is reported unless {@link EmitterClusterCuller}
     * finds a believable group.
     *
     * @param locations projections of one interval
     * @return fused location, empty for an empty input or when no group is believable
     */
    public Optional<FusedLocation> medianCullSafe(Collection<RfLocation> locations) {
        if (locations == null || locations.isEmpty()) {
            return Optional.empty();
        }
        List<RfLocation> all = List.copyOf(locations);
        Optional<List<RfLocation>> consistentGroup = culler.cull(all);
        if (consistentGroup.isEmpty()) {
            logger.debug("medianCullSafe() - no consistent group among {} emitters", all.size());
            return Optional.empty();
        }

        List<RfLocation> trimmed = medianCull(all);
        if (trimmed.size() == all.size()) {
            return weightedAverage.average(all);
        }

        Optional<FusedLocation> median = weightedAverage.average(trimmed);
        FusedLocation untrimmed = weightedAverage.average(all).orElseThrow();
        Optional<FusedLocation> culled = weightedAverage.average(consistentGroup.get());

        if (median.isPresent() && isTrimTrustworthy(all, trimmed, median.get(), untrimmed)) {
            return median;
        }

        List<FusedLocation> candidates = new ArrayList<>();
        median.ifPresent(candidates::add);
        candidates.add(untrimmed);
        culled.ifPresent(candidates::add);

        FusedLocation chosen = closestToCentroid(candidates);
        if (chosen == untrimmed && median.isPresent()) {
            FusedLocation medianLocation = median.get();
            if (untrimmed.accuracy() > disagreementFactor * medianLocation.accuracy()
                    && distance(untrimmed, medianLocation) <= untrimmed.accuracy()) {
                chosen = medianLocation;
            }
        }
        logger.debug("medianCullSafe() - trimmed {} of {}, falling back to {} of {} candidates",
                all.size() - trimmed.size(), all.size(), chosen, candidates.size());
        return Optional.of(chosen);
    }

    /**
     * Keeps the members within {@code trimFactor} times their own accuracy of the per-axis median
     * of the preferred subset.
     */
    List<RfLocation> medianCull(List<RfLocation> locations) {
        List<RfLocation> subset = medianSubset(locations);
        double medianLat = median(subset, RfLocation::latitude);
        double medianLon = median(subset, RfLocation::longitude);

        List<RfLocation> kept = new ArrayList<>();
        for (RfLocation location : locations) {
            double distance = approximateDistance(location.latitude(), location.longitude(), medianLat, medianLon);
            if (distance <= trimFactor * location.accuracyEstimate()) {
                kept.add(location);
            }
        }
        return kept;
    }

    /**
     * Trusted non-suspicious WiFi first, then any WiFi, then everything, as long as at least three
     * members remain.
     */
    private List<RfLocation> medianSubset(List<RfLocation> locations) {
        List<RfLocation> shortRange = locations.stream().filter(l -> l.type().isShortRange()).toList();
        List<RfLocation> trustedShortRange = shortRange.stream().filter(l -> !l.suspicious()).toList();
        if (trustedShortRange.size() >= MIN_MEDIAN_SUBSET) {
            return trustedShortRange;
        }
        if (shortRange.size() >= MIN_MEDIAN_SUBSET) {
            return shortRange;
        }
        return locations;
    }

    private boolean isTrimTrustworthy(
            List<RfLocation> all, List<RfLocation> trimmed, FusedLocation median, FusedLocation untrimmed) {
        double distance = distance(median, untrimmed);
        if (distance > median.accuracy() || distance > untrimmed.accuracy()) {
            return false;
        }
        int removed = all.size() - trimmed.size();
        if (removed > maxTrimmedFraction * all.size()) {
            return false;
        }
        boolean hadShortRange = all.stream().anyMatch(l -> l.type().isShortRange());
        boolean keptShortRange = trimmed.stream().anyMatch(l -> l.type().isShortRange());
        return !hadShortRange || keptShortRange;
    }

    private static FusedLocation closestToCentroid(List<FusedLocation> candidates) {
        double centroidLat = candidates.stream().mapToDouble(FusedLocation::latitude).average().orElseThrow();
        double centroidLon = candidates.stream().mapToDouble(FusedLocation::longitude).average().orElseThrow();
        return candidates.stream()
                .min(Comparator.comparingDouble(c ->
                        approximateDistance(c.latitude(), c.longitude(), centroidLat, centroidLon)))
                .orElseThrow();
    }

    private static double distance(FusedLocation a, FusedLocation b) {
        return approximateDistance(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    private static double median(List<RfLocation> locations, ToDoubleFunction<RfLocation> axis) {
        double[] values = locations.stream().mapToDouble(axis).sorted().toArray();
        int middle = values.length / 2;
        return values.length % 2 == 0
                ? (values[middle - 1] + values[middle]) / 2.0
                : values[middle];
    }
}
