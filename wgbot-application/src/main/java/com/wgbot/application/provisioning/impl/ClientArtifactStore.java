package com.wgbot.application.provisioning.impl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Local directory of client configs, one {@code <name>.conf} per peer, readable by the owner only.
 */
public class ClientArtifactStore {

    private final Path directory;

    public ClientArtifactStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path pathFor(String clientName) {
        return directory.resolve(clientName + ".conf");
    }

    public Path write(String clientName, String content) {
        Path target = pathFor(clientName);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, clientName + "-", ".tmp");
            try {
                Files.writeString(tmp, content, StandardCharsets.UTF_8);
                restrictToOwner(tmp);
                try {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write client config " + target, e);
        }
    }

    /**
     * @return true if a file was deleted; a missing artifact is not an error
     */
    public boolean delete(String clientName) {
        try {
            return Files.deleteIfExists(pathFor(clientName));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete client config " + pathFor(clientName), e);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
