package com.wifi.emitter.positioning.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Persisted coverage of one emitter, mapped to the emitter table.
 *
 * <p>A negative radius marks an emitter that was blacklisted for exceeding its maximum
 * range; the row is kept so the emitter is not relearned from scratch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@DynamoDbBean
public class EmitterRow {

    /** Radius marker written by an invalidate operation. */
    public static final double INVALID_RADIUS = -1.0;

    private String uniqueKey;
    private String type;
    private String typeScopedId;
    private Double latitude;
    private Double longitude;
    private Double radiusNs;
    private Double radiusEw;
    private String label;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("unique_key")
    public String getUniqueKey() {
        return uniqueKey;
    }

    public void setUniqueKey(String uniqueKey) {
        this.uniqueKey = uniqueKey;
    }

    @DynamoDbAttribute("rf_type")
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    @DynamoDbAttribute("rf_id")
    public String getTypeScopedId() {
        return typeScopedId;
    }

    public void setTypeScopedId(String typeScopedId) {
        this.typeScopedId = typeScopedId;
    }

    @DynamoDbAttribute("latitude")
    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    @DynamoDbAttribute("longitude")
    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    @DynamoDbAttribute("radius_ns")
    public Double getRadiusNs() {
        return radiusNs;
    }

    public void setRadiusNs(Double radiusNs) {
        this.radiusNs = radiusNs;
    }

    @DynamoDbAttribute("radius_ew")
    public Double getRadiusEw() {
        return radiusEw;
    }

    public void setRadiusEw(Double radiusEw) {
        this.radiusEw = radiusEw;
    }

    @DynamoDbAttribute("label")
    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    /**
     * Checks whether this row carries the invalid-radius marker.
     *
     * @return true if the emitter was blacklisted for its coverage size
     */
    @DynamoDbIgnore
    public boolean isInvalidated() {
        return (radiusEw != null && radiusEw < 0) || (radiusNs != null && radiusNs < 0);
    }

    /**
     * Resolves the identity stored in this row.
     *
     * @return identity, with INVALID type for unknown type names
     */
    public RfIdentification toIdentification() {
        EmitterType emitterType;
        try {
            emitterType = EmitterType.valueOf(type);
        } catch (IllegalArgumentException | NullPointerException e) {
            emitterType = EmitterType.INVALID;
        }
        return new RfIdentification(typeScopedId, emitterType);
    }
}
