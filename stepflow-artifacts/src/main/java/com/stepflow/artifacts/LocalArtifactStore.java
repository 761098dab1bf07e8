package com.stepflow.artifacts;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Artifact store on the local filesystem.
 */
public final class LocalArtifactStore implements ArtifactStore {

    private final UUID id;
    private final Path root;

    public LocalArtifactStore(UUID id, Path root) {
        this.id = Objects.requireNonNull(id, "id");
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath();
    }

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public String getPath() {
        return root.toString();
    }

    @Override
    public String allocateLocation(String scope, String name) {
        return root.resolve(scope).resolve(name).toString();
    }

    @Override
    public boolean exists(String uri) {
        return Files.exists(Path.of(uri));
    }

    @Override
    public void makeDirectory(String uri) {
        try {
            Files.createDirectories(Path.of(uri));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create artifact directory " + uri, e);
        }
    }
}
