package com.wifi.emitter.positioning.emitter;

import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.approximateDistance;
import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.notNullIsland;

import com.wifi.emitter.positioning.dto.EmitterRow;
import com.wifi.emitter.positioning.dto.RfCharacteristics;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.dto.RfLocation;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.TrustedFix;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything known about one emitter: identity, learned coverage, status, label and the most
 * recent observation.
 *
 * <p>Records are owned by the {@link com.wifi.emitter.positioning.cache.EmitterCache}. Fields are
 * not synchronized; a single processing thread mutates records between cache calls.
 *
 * <p>Persistence is two-phase. {@link #planSync()} reports the one write the record needs without
 * touching it, and {@link #completeSync(SyncAction)} applies the resulting state once the write
 * has been committed. A failed flush therefore leaves the record exactly as it was.
 */
@Slf4j
public class EmitterRecord {

    /** Fix and observation must be this close in time for the fix to describe where we saw it. */
    public static final Duration MAX_FIX_OBSERVATION_SKEW = Duration.ofSeconds(10);

    /**
     * An inaccurate fix is still accepted when it is this many times (maximum range + fix accuracy)
     * away from the coverage, so that the moved emitter gets blacklisted.
     */
    public static final double MOVED_EMITTER_DISTANCE_FACTOR = 2.0;

    private final RfIdentification identification;
    private final RfCharacteristics characteristics;

    private CoverageBox coverage;
    private EmitterStatus status = EmitterStatus.UNKNOWN;
    private String label = "";
    private Observation lastObservation;
    private boolean persisted;
    private int idleAge;

    public EmitterRecord(RfIdentification identification) {
        this.identification = Objects.requireNonNull(identification, "identification");
        this.characteristics = identification.type().characteristics();
    }

    /**
     * Restores a record from its persisted row. Rows carrying the invalid-radius marker, and rows
     * whose radii exceed what the type allows, come back blacklisted.
     *
     * @param row persisted emitter row
     * @return the restored record
     */
    public static EmitterRecord fromRow(EmitterRow row) {
        EmitterRecord emitterRecord = new EmitterRecord(row.toIdentification());
        emitterRecord.persisted = true;
        if (row.isInvalidated()) {
            emitterRecord.changeStatus(EmitterStatus.BLACKLISTED, "loaded with invalid radius");
        } else {
            emitterRecord.coverage =
                    CoverageBox.ofCenter(
                            valueOrZero(row.getLatitude()),
                            valueOrZero(row.getLongitude()),
                            valueOrZero(row.getRadiusNs()),
                            valueOrZero(row.getRadiusEw()));
            emitterRecord.changeStatus(EmitterStatus.CACHED, "loaded");
        }
        emitterRecord.setLabel(row.getLabel());

        double maximumRange = emitterRecord.characteristics.maximumRange();
        if (valueOrZero(row.getRadiusEw()) > maximumRange
                || valueOrZero(row.getRadiusNs()) > maximumRange) {
            emitterRecord.changeStatus(EmitterStatus.BLACKLISTED, "loaded with radius too large");
        }
        return emitterRecord;
    }

    // === OBSERVATION AND LABEL ===

    /**
     * Attaches the newest sighting. The sighting's label replaces the stored one.
     *
     * @param observation newest observation of this emitter
     */
    public void setLastObservation(Observation observation) {
        this.lastObservation = observation;
        setLabel(observation == null ? "" : observation.label());
    }

    /**
     * Changes the label and re-runs the moving-network check when it actually changed.
     *
     * @param newLabel network name, null is treated as empty
     */
    public void setLabel(String newLabel) {
        String value = newLabel == null ? "" : newLabel;
        if (value.equals(label)) {
            return;
        }
        label = value;
        if (isBlacklistedByLabel()) {
            blacklist("label '" + label + "' looks mobile");
        }
    }

    boolean isBlacklistedByLabel() {
        return MobileEmitterLabelFilter.isMobile(identification, label);
    }

    // === COVERAGE LEARNING ===

    /**
     * Learns coverage from a trusted fix taken while this emitter was visible.
     *
     * @param fix smoothed satellite position
     * @return the status after the update
     */
    public EmitterStatus updateLocation(TrustedFix fix) {
        if (status == EmitterStatus.BLACKLISTED) {
            return status;
        }
        if (lastObservation == null) {
            log.debug("updateLocation({}) - no update, emitter not observed", identification);
            return status;
        }
        if (lastObservation.suspicious()) {
            log.debug("updateLocation({}) - no update, last observation is suspicious", identification);
            return status;
        }

        Duration skew = Duration.between(lastObservation.captureTime(), fix.captureTime()).abs();
        if (skew.compareTo(MAX_FIX_OBSERVATION_SKEW) > 0) {
            log.debug(
                    "updateLocation({}) - no update, fix and observation differ by {}ms",
                    identification,
                    skew.toMillis());
            return status;
        }

        if (fix.accuracy() > characteristics.requiredFixAccuracy() && !isFarOutsideCoverage(fix)) {
            log.debug(
                    "updateLocation({}) - no update, fix accuracy {} worse than required {}",
                    identification,
                    fix.accuracy(),
                    characteristics.requiredFixAccuracy());
            return status;
        }

        if (coverage == null) {
            coverage = CoverageBox.ofPoint(fix.latitude(), fix.longitude());
            return changeStatus(EmitterStatus.NEW, "first coverage");
        }

        if (coverage.update(fix.latitude(), fix.longitude())) {
            if (coverage.radius() > characteristics.maximumRange()) {
                blacklist("radius " + coverage.radius() + " too large");
            } else {
                changeStatus(EmitterStatus.CHANGED, "coverage grew");
            }
        }
        return status;
    }

    private boolean isFarOutsideCoverage(TrustedFix fix) {
        if (coverage == null) {
            return false;
        }
        double distance =
                approximateDistance(
                        fix.latitude(), fix.longitude(), coverage.centerLat(), coverage.centerLon());
        return distance
                >= (characteristics.maximumRange() + fix.accuracy()) * MOVED_EMITTER_DISTANCE_FACTOR;
    }

    // === PERSISTENCE ===

    /** True for NEW, CHANGED, and BLACKLISTED records whose persisted coverage is still present. */
    public boolean syncNeeded() {
        return status == EmitterStatus.NEW
                || status == EmitterStatus.CHANGED
                || (status == EmitterStatus.BLACKLISTED && coverage != null);
    }

    /**
     * Determines the single persistence write this record needs. Does not modify the record.
     *
     * @return the action and the row to write
     */
    public SyncPlan planSync() {
        SyncAction action =
                switch (status) {
                    case UNKNOWN, CACHED -> SyncAction.NONE;
                    case NEW -> SyncAction.INSERT;
                    case CHANGED -> SyncAction.UPDATE;
                    case BLACKLISTED -> {
                        if (coverage == null) {
                            yield SyncAction.NONE;
                        }
                        // a mobile network is removed entirely, an oversized one keeps a marker row
                        yield isBlacklistedByLabel() ? SyncAction.DROP : SyncAction.INVALIDATE;
                    }
                };
        return new SyncPlan(action, toRow());
    }

    /**
     * Applies the outcome of a committed write.
     *
     * @param action the action that was written, as returned by {@link #planSync()}
     * @return the status after the sync
     */
    public EmitterStatus completeSync(SyncAction action) {
        switch (action) {
            case INSERT, UPDATE -> {
                persisted = true;
                changeStatus(EmitterStatus.CACHED, "synced " + action);
            }
            case DROP, INVALIDATE -> {
                coverage = null;
                log.debug("completeSync({}) - blacklisted emitter {}", identification, action);
            }
            case NONE -> {}
        }
        return status;
    }

    /**
     * Builds the persisted form of this record.
     *
     * @return row with current coverage, zero radii when there is none
     */
    public EmitterRow toRow() {
        return EmitterRow.builder()
                .uniqueKey(identification.uniqueKey())
                .type(identification.type().name())
                .typeScopedId(identification.typeScopedId())
                .latitude(coverage == null ? 0.0 : coverage.centerLat())
                .longitude(coverage == null ? 0.0 : coverage.centerLon())
                .radiusNs(coverage == null ? 0.0 : coverage.radiusNs())
                .radiusEw(coverage == null ? 0.0 : coverage.radiusEw())
                .label(label)
                .build();
    }

    // === PROJECTION ===

    /**
     * Projects the coverage for position synthesis. Nothing is reported for emitters we have not
     * observed, blacklisted emitters, emitters without coverage, and coverage at null island.
     *
     * @return coverage center with the latest observation's signal and time
     */
    public Optional<RfLocation> location() {
        if (lastObservation == null || status == EmitterStatus.BLACKLISTED || coverage == null) {
            return Optional.empty();
        }
        if (!notNullIsland(coverage.centerLat(), coverage.centerLon())) {
            return Optional.empty();
        }
        return Optional.of(
                new RfLocation(
                        identification,
                        coverage.centerLat(),
                        coverage.centerLon(),
                        coverage.radius(),
                        lastObservation.signalStrength(),
                        lastObservation.suspicious(),
                        lastObservation.captureTime()));
    }

    // === STATUS ===

    private EmitterStatus changeStatus(EmitterStatus requested, String reason) {
        EmitterStatus previous = status;
        status = status.transitionTo(requested);
        if (log.isDebugEnabled() && requested != previous) {
            log.debug(
                    "{}: {} requested {} from {}, now {}", identification, reason, requested, previous, status);
        }
        return status;
    }

    /** Coverage that was never persisted has nothing to invalidate and is dropped right away. */
    private void blacklist(String reason) {
        changeStatus(EmitterStatus.BLACKLISTED, reason);
        if (!persisted) {
            coverage = null;
        }
    }

    // === CACHE AGE ===

    public void resetAge() {
        idleAge = 0;
    }

    public void incrementAge() {
        idleAge++;
    }

    public int getAge() {
        return idleAge;
    }

    // === ACCESSORS ===

    public RfIdentification getIdentification() {
        return identification;
    }

    public EmitterStatus getStatus() {
        return status;
    }

    public Optional<CoverageBox> getCoverage() {
        return Optional.ofNullable(coverage);
    }

    public String getLabel() {
        return label;
    }

    public Optional<Observation> getLastObservation() {
        return Optional.ofNullable(lastObservation);
    }

    /** Records are equal when they model the same physical emitter, whatever their coverage. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmitterRecord)) {
            return false;
        }
        return identification.equals(((EmitterRecord) o).identification);
    }

    @Override
    public int hashCode() {
        return identification.hashCode();
    }

    @Override
    public String toString() {
        return "EmitterRecord[" + identification + ", " + status + ", label='" + label + "']";
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0.0 : value;
    }

    /**
     * Persistence write planned for one record.
     *
     * @param action what to do with the row
     * @param row the record's current persisted form
     */
    public record SyncPlan(SyncAction action, EmitterRow row) {}
}
