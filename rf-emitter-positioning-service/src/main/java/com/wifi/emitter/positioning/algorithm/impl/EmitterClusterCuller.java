package com.wifi.emitter.positioning.algorithm.impl;

import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.approximateDistance;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.RfLocation;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Discards emitters whose coverage is inconsistent with the rest of what we see, typically because
 * they moved.
 *
 * <p>Every projection seeds a group. Every projection is then added to each group whose members it
 * is all close enough to, where two coverages are compatible when their centers are at most
 * {@code cullTolerance} times the sum of their accuracy estimates apart. The largest group wins.
 * A single projection can end up in several groups.
 */
@Slf4j
@Component
public class EmitterClusterCuller {

    private final double tolerance;

    public EmitterClusterCuller(PositioningProperties properties) {
        this.tolerance = properties.getSynthesis().getCullTolerance();
    }

    /**
     * Selects the largest mutually compatible group.
     *
     * <p>A lone projection is accepted unless its type is INVALID. Otherwise the group must be at
     * least as large as the minimum group size of one of its members.
     *
     * @param locations projections of one interval
     * @return the winning group, or empty if there is no believable group
     */
    public Optional<List<RfLocation>> cull(Collection<RfLocation> locations) {
        if (locations == null || locations.isEmpty()) {
            return Optional.empty();
        }
        List<RfLocation> result = divideInGroups(locations).stream()
                .max(Comparator.comparingInt(List::size))
                .orElseThrow();

        if (locations.size() == 1) {
            return result.get(0).type() == EmitterType.INVALID ? Optional.empty() : Optional.of(result);
        }
        for (RfLocation member : result) {
            if (result.size() >= member.minimumGroupSize()) {
                return Optional.of(result);
            }
        }
        log.debug("cull() - largest group has only {} of {} emitters, not enough", result.size(), locations.size());
        return Optional.empty();
    }

    private List<List<RfLocation>> divideInGroups(Collection<RfLocation> locations) {
        List<List<RfLocation>> groups = new ArrayList<>();
        for (RfLocation seed : locations) {
            List<RfLocation> group = new ArrayList<>();
            group.add(seed);
            groups.add(group);
        }
        for (RfLocation location : locations) {
            for (List<RfLocation> group : groups) {
                if (!group.contains(location) && isCompatibleWithGroup(location, group)) {
                    group.add(location);
                }
            }
        }
        return groups;
    }

    private boolean isCompatibleWithGroup(RfLocation location, List<RfLocation> group) {
        for (RfLocation other : group) {
            double distance = approximateDistance(
                    location.latitude(), location.longitude(), other.latitude(), other.longitude());
            if (distance > tolerance * (location.accuracyEstimate() + other.accuracyEstimate())) {
                return false;
            }
        }
        return true;
    }
}
