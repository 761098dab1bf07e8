/**
 * Artifact references passed between steps and the external artifact upload.
 * <ul>
 *   <li>{@link com.stepflow.artifacts.StepArtifact} – output of another invocation in the graph</li>
 *   <li>{@link com.stepflow.artifacts.ExternalArtifact} – value or stored artifact from outside; resolved once</li>
 *   <li>{@link com.stepflow.artifacts.ArtifactStore} / {@link com.stepflow.artifacts.ArtifactMetadataStore} – collaborator ports</li>
 * </ul>
 */
package com.stepflow.artifacts;
