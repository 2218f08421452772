package com.auditchain.api.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Append engine limits and the backoff used when another writer wins a sequence.
 */
@Configuration
@ConfigurationProperties(prefix = "auditchain.append")
@Validated
public class AppendProperties {

    @Positive
    private int maxAttempts = 5;
    @NotNull
    private Duration initialBackoff = Duration.ofMillis(10);
    private double backoffMultiplier = 2.0;
    @NotNull
    private Duration maxBackoff = Duration.ofMillis(500);
    @Positive
    private int maxFieldLength = 256;
    @Positive
    private int maxChainIdLength = 128;
    @Positive
    private int maxPayloadBytes = 1_048_576;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    public int getMaxFieldLength() { return maxFieldLength; }
    public void setMaxFieldLength(int maxFieldLength) { this.maxFieldLength = maxFieldLength; }
    public int getMaxChainIdLength() { return maxChainIdLength; }
    public void setMaxChainIdLength(int maxChainIdLength) { this.maxChainIdLength = maxChainIdLength; }
    public int getMaxPayloadBytes() { return maxPayloadBytes; }
    public void setMaxPayloadBytes(int maxPayloadBytes) { this.maxPayloadBytes = maxPayloadBytes; }
}
