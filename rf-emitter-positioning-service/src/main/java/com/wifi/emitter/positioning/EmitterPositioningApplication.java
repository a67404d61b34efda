package com.wifi.emitter.positioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Offline positioning service.
 *
 * <p>Learns where radio emitters (WiFi access points, cell towers) can be received from trusted
 * satellite fixes, persists that coverage in DynamoDB, and fuses the emitters visible during each
 * reporting interval into a location without any network lookup.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EmitterPositioningApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmitterPositioningApplication.class, args);
    }
}
