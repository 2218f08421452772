package com.auditchain.api.checkpoint;

import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.export.CheckpointExporter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends one JSON line per checkpoint to {@code checkpoints.ndjson} in a directory
 * kept apart from the database, forcing each line to disk before returning.
 */
public class FileCheckpointExporter implements CheckpointExporter {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointExporter.class);
    public static final String FILE_NAME = "checkpoints.ndjson";

    private final Path file;
    private final ObjectMapper mapper;

    public FileCheckpointExporter(Path directory, ObjectMapper objectMapper) {
        this.file = directory.resolve(FILE_NAME);
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized String export(CheckpointArtifact artifact) {
        byte[] line;
        try {
            line = (mapper.writeValueAsString(artifact) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Checkpoint artifact could not be serialized", e);
        }
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write checkpoint to " + file, e);
        }
        log.debug("Wrote checkpoint {}@{} to {}", artifact.chainId(), artifact.sequence(), file);
        return file.toUri().toString();
    }

    /**
     * Every artifact written so far, in write order.
     */
    public synchronized List<CheckpointArtifact> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<CheckpointArtifact> artifacts = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    artifacts.add(mapper.readValue(line, CheckpointArtifact.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read checkpoints from " + file, e);
        }
        return artifacts;
    }

    @Override
    public String name() {
        return "file";
    }

    public Path file() {
        return file;
    }
}
