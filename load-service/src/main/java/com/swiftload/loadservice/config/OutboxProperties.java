package com.swiftload.loadservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "swiftload.outbox")
public class OutboxProperties {

    // Relay switch; rows are still written when false
    private boolean enabled = true;

    private String exchange = AmqpConfig.LOAD_EXCHANGE;

    // Read by @Scheduled through its placeholder
    private long publishDelayMs = 2000;

    private int retentionDays = 1;

    private String cleanupCron = "0 0 3 * * *";
}
