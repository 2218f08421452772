package com.auditchain.core.export;

import com.auditchain.core.domain.CheckpointArtifact;

/**
 * Writes checkpoints to a destination outside the primary store, so that rewriting
 * the database cannot also rewrite the witness.
 */
public interface CheckpointExporter {

    /**
     * Durably exports one checkpoint.
     *
     * @return a description of where the artifact was written
     * @throws RuntimeException if the destination did not accept it
     */
    String export(CheckpointArtifact artifact);

    /**
     * Short identifier used in logs and status output.
     */
    String name();
}
