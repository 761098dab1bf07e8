package com.stepflow.artifacts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metadata store kept in memory; for local runs and tests.
 */
public final class InMemoryArtifactMetadataStore implements ArtifactMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryArtifactMetadataStore.class);

    private final Map<UUID, ArtifactRecord> records = new ConcurrentHashMap<>();

    @Override
    public UUID createArtifactRecord(ArtifactRecordRequest request) {
        Objects.requireNonNull(request, "request");
        UUID id = UUID.randomUUID();
        records.put(id, ArtifactRecord.of(id, request));
        log.debug("Artifact record created (in-memory) | id={} | name={} | uri={}", id, request.name(), request.uri());
        return id;
    }

    @Override
    public ArtifactRecord getArtifactRecord(UUID id) {
        ArtifactRecord record = records.get(id);
        if (record == null) {
            throw new IllegalArgumentException("No artifact with id " + id);
        }
        return record;
    }

    /** Adds an existing record, e.g. an artifact produced by an earlier run. */
    public void put(ArtifactRecord record) {
        records.put(record.id(), record);
    }

    public Collection<ArtifactRecord> getAll() {
        return Collections.unmodifiableCollection(records.values());
    }
}
