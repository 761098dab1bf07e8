/**
 * Materializers and their resolution.
 * <ul>
 *   <li>{@link com.stepflow.materializer.BaseMaterializer} – contract bound to one artifact location</li>
 *   <li>{@link com.stepflow.materializer.MaterializerRegistry} – global default materializer per data type</li>
 *   <li>{@link com.stepflow.materializer.MaterializerResolver} – output type to ordered materializer sources</li>
 * </ul>
 */
package com.stepflow.materializer;
