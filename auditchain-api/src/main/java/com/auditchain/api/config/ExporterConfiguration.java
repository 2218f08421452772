package com.auditchain.api.config;

import com.auditchain.api.checkpoint.FileCheckpointExporter;
import com.auditchain.blockchain.service.BlockchainCheckpointExporter;
import com.auditchain.blockchain.service.BlockchainConfig;
import com.auditchain.core.export.CheckpointExporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Builds the checkpoint exporter named by {@code auditchain.checkpoint.exporter}.
 */
@Configuration
public class ExporterConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExporterConfiguration.class);

    @Bean
    public CheckpointExporter checkpointExporter(CheckpointProperties properties,
                                                 BlockchainConfig blockchainConfig,
                                                 ObjectMapper objectMapper) {
        CheckpointExporter exporter = switch (properties.getExporter()) {
            case "file" -> new FileCheckpointExporter(Path.of(properties.getFileDirectory()), objectMapper);
            case "blockchain" -> new BlockchainCheckpointExporter(blockchainConfig);
            default -> throw new IllegalStateException(
                    "Unknown checkpoint exporter: " + properties.getExporter());
        };
        log.info("Checkpoint exporter: {}", exporter.name());
        return exporter;
    }
}
