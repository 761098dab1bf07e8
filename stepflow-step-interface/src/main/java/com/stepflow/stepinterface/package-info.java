/**
 * Step interface analysis.
 * <ul>
 *   <li>{@link com.stepflow.stepinterface.StepInterfaceAnalyzer} – derives a {@link com.stepflow.stepinterface.StepInterface} from the {@code @Entrypoint} method</li>
 *   <li>{@link com.stepflow.stepinterface.DeclaredType} – closed set of declared type shapes (scalar, named, union, any, none)</li>
 *   <li>{@link com.stepflow.stepinterface.InputTypeChecker} / {@link com.stepflow.stepinterface.TypeCompatibility} – value and artifact checks against declared types</li>
 *   <li>{@link com.stepflow.stepinterface.StepflowException} – root of all library errors</li>
 * </ul>
 */
package com.stepflow.stepinterface;
