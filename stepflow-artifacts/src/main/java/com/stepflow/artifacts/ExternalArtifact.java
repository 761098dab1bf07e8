package com.stepflow.artifacts;

import com.stepflow.config.StepflowConfig;
import com.stepflow.materializer.BaseMaterializer;
import com.stepflow.materializer.MaterializerNotFoundException;
import com.stepflow.materializer.MaterializerResolver;
import com.stepflow.stepconfig.Source;
import com.stepflow.stepinterface.DeclaredType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.UUID;

/**
 * Step input supplied from outside the pipeline graph: either a value, uploaded to the artifact
 * store when the invocation is finalized, or the id of an artifact stored earlier.
 * <p>
 * States: {@code PENDING} (value, not yet uploaded), {@code REFERENCED} (id given by the caller,
 * store scope not yet checked) and {@code RESOLVED}. {@link #resolve(ArtifactUploadContext)}
 * moves to {@code RESOLVED} at most once; afterwards it returns the same id without touching
 * the stores.
 */
public final class ExternalArtifact implements ArtifactReference {

    private static final Logger log = LoggerFactory.getLogger(ExternalArtifact.class);

    /** Prefix of generated artifact names. */
    static final String NAME_PREFIX = "external_";

    public enum State {
        PENDING,
        REFERENCED,
        RESOLVED
    }

    private final Object value;
    private final Class<?> valueType;
    private final Source materializer;
    private final boolean skipTypeChecking;
    private UUID id;
    private State state;

    private ExternalArtifact(Object value, UUID id, Source materializer, boolean skipTypeChecking) {
        if (value != null && id != null) {
            throw new IllegalArgumentException("Only value or id allowed for an external artifact");
        }
        if (value == null && id == null) {
            throw new IllegalArgumentException("Either value or id required for an external artifact");
        }
        this.value = value;
        this.valueType = value != null ? value.getClass() : null;
        this.id = id;
        this.materializer = materializer;
        this.skipTypeChecking = skipTypeChecking;
        this.state = value != null ? State.PENDING : State.REFERENCED;
    }

    public static ExternalArtifact ofValue(Object value) {
        return new ExternalArtifact(Objects.requireNonNull(value, "value"), null, null, false);
    }

    /** Value persisted with the given materializer instead of the registered default. */
    public static ExternalArtifact ofValue(Object value, Class<? extends BaseMaterializer> materializer) {
        return new ExternalArtifact(Objects.requireNonNull(value, "value"), null, Source.fromClass(materializer), false);
    }

    public static ExternalArtifact ofId(UUID id) {
        return new ExternalArtifact(null, Objects.requireNonNull(id, "id"), null, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public synchronized State getState() {
        return state;
    }

    /** Id of the stored artifact; null until a value has been uploaded. */
    public synchronized UUID getId() {
        return id;
    }

    /** Whether the caller supplied a value (as opposed to an id). */
    public boolean isValue() {
        return valueType != null;
    }

    public Source getMaterializer() {
        return materializer;
    }

    public boolean isSkipTypeChecking() {
        return skipTypeChecking;
    }

    @Override
    public DeclaredType type(ArtifactMetadataStore metadataStore) {
        if (skipTypeChecking) return DeclaredType.ANY;
        if (valueType != null) return DeclaredType.ofClass(valueType);
        return DeclaredType.ofClass(metadataStore.getArtifactRecord(getId()).dataType().load());
    }

    /**
     * Uploads a pending value or verifies a referenced id, then returns the artifact id.
     * Repeated calls return the same id without store or registry calls.
     *
     * @throws ArtifactStoreMismatchException if a referenced artifact lives in another artifact store
     * @throws MaterializerNotFoundException  if no materializer is configured or registered for the value
     * @throws IllegalStateException          if the allocated location already exists
     */
    public synchronized UUID resolve(ArtifactUploadContext context) {
        Objects.requireNonNull(context, "context");
        switch (state) {
            case RESOLVED:
                return id;
            case REFERENCED:
                ArtifactRecord record = context.getMetadataStore().getArtifactRecord(id);
                if (!Objects.equals(record.artifactStoreId(), context.getArtifactStoreId())) {
                    throw new ArtifactStoreMismatchException(id, context.getArtifactStoreId(), record.artifactStoreId());
                }
                state = State.RESOLVED;
                return id;
            default:
                id = upload(context);
                state = State.RESOLVED;
                return id;
        }
    }

    private UUID upload(ArtifactUploadContext context) {
        log.info("Uploading external artifact.");
        Class<? extends BaseMaterializer> materializerClass = materializerClass(context);
        StepflowConfig config = context.getConfig();
        ArtifactStore store = context.getArtifactStore();
        String name = NAME_PREFIX + UUID.randomUUID();
        String uri = store.allocateLocation(config.getExternalArtifactsDir(), name);
        if (store.exists(uri)) {
            throw new IllegalStateException("Artifact URI already exists: " + uri);
        }
        store.makeDirectory(uri);
        try {
            BaseMaterializer.create(materializerClass, uri).save(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save external artifact to " + uri, e);
        }
        ArtifactRecordRequest request = new ArtifactRecordRequest(
                name,
                BaseMaterializer.artifactType(materializerClass),
                uri,
                Source.fromClass(materializerClass),
                Source.fromClass(valueType),
                context.getRunContext().userId(),
                context.getRunContext().workspaceId(),
                context.getArtifactStoreId());
        UUID created = context.getMetadataStore().createArtifactRecord(request);
        log.debug("External artifact stored | id={} | uri={} | materializer={}", created, uri, materializerClass.getName());
        return created;
    }

    private Class<? extends BaseMaterializer> materializerClass(ArtifactUploadContext context) {
        if (materializer != null) {
            return MaterializerResolver.loadMaterializerClass(materializer, "external artifact");
        }
        return context.getMaterializerRegistry().find(valueType)
                .orElseThrow(() -> new MaterializerNotFoundException(null, null, valueType.getName()));
    }

    @Override
    public synchronized String toString() {
        return "ExternalArtifact{state=" + state
                + (id != null ? ", id=" + id : ", type=" + valueType.getName())
                + "}";
    }

    public static final class Builder {
        private Object value;
        private UUID id;
        private Source materializer;
        private boolean skipTypeChecking;

        private Builder() {
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder materializer(Class<? extends BaseMaterializer> materializer) {
            this.materializer = Source.fromClass(materializer);
            return this;
        }

        public Builder materializerSource(Source materializer) {
            this.materializer = materializer;
            return this;
        }

        /** The artifact is then typed as Any and accepted by every input. */
        public Builder skipTypeChecking(boolean skipTypeChecking) {
            this.skipTypeChecking = skipTypeChecking;
            return this;
        }

        /**
         * @throws IllegalArgumentException unless exactly one of value and id is set
         */
        public ExternalArtifact build() {
            return new ExternalArtifact(value, id, materializer, skipTypeChecking);
        }
    }
}
