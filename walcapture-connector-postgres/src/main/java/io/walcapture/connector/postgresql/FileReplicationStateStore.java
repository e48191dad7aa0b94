/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walcapture.WalCaptureException;

/**
 * Stores the state as a JSON document in a file. Writes go to a sibling temporary file that then replaces the
 * previous document, so a crash leaves either the old or the new state behind.
 */
public class FileReplicationStateStore implements ReplicationStateStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileReplicationStateStore.class);

    private final Path file;

    public FileReplicationStateStore(Path file) {
        this.file = file.toAbsolutePath();
    }

    @Override
    public ReplicationState load() {
        if (!Files.exists(file)) {
            LOGGER.info("No replication state found in '{}', starting without prior state", file);
            return ReplicationState.empty();
        }
        try {
            final ReplicationState state = ReplicationState.fromJson(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            LOGGER.info("Loaded replication state {} from '{}'", state, file);
            return state;
        }
        catch (IOException | IllegalArgumentException e) {
            throw new WalCaptureException("Unable to read replication state from '" + file + "'", e);
        }
    }

    @Override
    public void store(ReplicationState state) {
        final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.write(temp, state.toJson().getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e) {
                LOGGER.debug("Atomic move not supported for '{}', replacing the file", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.debug("Stored replication state {}", state);
        }
        catch (IOException e) {
            throw new WalCaptureException("Unable to write replication state to '" + file + "'", e);
        }
    }

    public Path file() {
        return file;
    }
}
