package com.stepflow.artifacts;

import com.stepflow.config.StepflowConfig;
import com.stepflow.materializer.MaterializerRegistry;

import java.util.Objects;
import java.util.UUID;

/**
 * Collaborators needed to resolve external artifacts: the active artifact store, the metadata
 * store, the active user/workspace, the materializer registry and library settings.
 */
public final class ArtifactUploadContext {

    private final ArtifactStore artifactStore;
    private final ArtifactMetadataStore metadataStore;
    private final RunContext runContext;
    private final MaterializerRegistry materializerRegistry;
    private final StepflowConfig config;

    private ArtifactUploadContext(Builder b) {
        this.artifactStore = Objects.requireNonNull(b.artifactStore, "artifactStore");
        this.metadataStore = Objects.requireNonNull(b.metadataStore, "metadataStore");
        this.runContext = Objects.requireNonNull(b.runContext, "runContext");
        this.materializerRegistry = b.materializerRegistry != null ? b.materializerRegistry : MaterializerRegistry.getInstance();
        this.config = b.config != null ? b.config : StepflowConfig.get();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    /** Scope that referenced artifacts must belong to. */
    public UUID getArtifactStoreId() {
        return artifactStore.getId();
    }

    public ArtifactMetadataStore getMetadataStore() {
        return metadataStore;
    }

    public RunContext getRunContext() {
        return runContext;
    }

    public MaterializerRegistry getMaterializerRegistry() {
        return materializerRegistry;
    }

    public StepflowConfig getConfig() {
        return config;
    }

    public static final class Builder {
        private ArtifactStore artifactStore;
        private ArtifactMetadataStore metadataStore;
        private RunContext runContext;
        private MaterializerRegistry materializerRegistry;
        private StepflowConfig config;

        private Builder() {
        }

        public Builder artifactStore(ArtifactStore artifactStore) {
            this.artifactStore = artifactStore;
            return this;
        }

        public Builder metadataStore(ArtifactMetadataStore metadataStore) {
            this.metadataStore = metadataStore;
            return this;
        }

        public Builder runContext(RunContext runContext) {
            this.runContext = runContext;
            return this;
        }

        /** Default: {@link MaterializerRegistry#getInstance()}. */
        public Builder materializerRegistry(MaterializerRegistry materializerRegistry) {
            this.materializerRegistry = materializerRegistry;
            return this;
        }

        /** Default: {@link StepflowConfig#get()}. */
        public Builder config(StepflowConfig config) {
            this.config = config;
            return this;
        }

        public ArtifactUploadContext build() {
            return new ArtifactUploadContext(this);
        }
    }
}
