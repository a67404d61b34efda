package com.wifi.emitter.positioning.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Learned signal-strength quirk of one emitter type on this device. {@code constantSignal} is the
 * only value seen so far, or {@link #VARYING} once two different values were observed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class SignalCorrection {

    public static final int VARYING = 0;

    private String emitterType;
    private Integer constantSignal;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("emitter_type")
    public String getEmitterType() {
        return emitterType;
    }

    public void setEmitterType(String emitterType) {
        this.emitterType = emitterType;
    }

    @DynamoDbAttribute("constant_signal")
    public Integer getConstantSignal() {
        return constantSignal;
    }

    public void setConstantSignal(Integer constantSignal) {
        this.constantSignal = constantSignal;
    }
}
