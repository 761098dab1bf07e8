/**
 * Stepflow annotations: declaration metadata read once when a step template or materializer is registered.
 * <ul>
 *   <li>{@link com.stepflow.annotations.Step} – step class (name, initial cache and metadata flags)</li>
 *   <li>{@link com.stepflow.annotations.Entrypoint} – the step's logic; parameters carry {@link com.stepflow.annotations.Input}</li>
 *   <li>{@link com.stepflow.annotations.Outputs} / {@link com.stepflow.annotations.Output} – named outputs of multi-output entrypoints</li>
 *   <li>{@link com.stepflow.annotations.OneOf} – union types for inputs and single outputs</li>
 *   <li>{@link com.stepflow.annotations.Materializes} – default materializer for data types</li>
 *   <li>{@link com.stepflow.annotations.Required} – mandatory field of a step parameters class</li>
 * </ul>
 */
package com.stepflow.annotations;
