package com.auditchain.api.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * When checkpoints are taken, where they are exported, and when a missing export
 * becomes an alert.
 */
@Configuration
@ConfigurationProperties(prefix = "auditchain.checkpoint")
@Validated
public class CheckpointProperties {

    /** Checkpoint a chain once its head is this many entries past the latest checkpoint. */
    @Positive
    private long everyEntries = 1000;
    /** Checkpoint a chain with new entries once its latest checkpoint is this old. */
    @NotNull
    private Duration interval = Duration.ofHours(1);
    /** Unexported checkpoints older than this are reported as export failures. */
    @NotNull
    private Duration staleAfter = Duration.ofHours(6);
    /** file or blockchain. */
    @NotBlank
    private String exporter = "file";
    private String fileDirectory = "./checkpoints";

    public long getEveryEntries() { return everyEntries; }
    public void setEveryEntries(long everyEntries) { this.everyEntries = everyEntries; }
    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }
    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
    public String getExporter() { return exporter; }
    public void setExporter(String exporter) { this.exporter = exporter; }
    public String getFileDirectory() { return fileDirectory; }
    public void setFileDirectory(String fileDirectory) { this.fileDirectory = fileDirectory; }
}
