package com.stepflow.stepinterface;

/**
 * Base class of step parameter objects. An entrypoint may declare at most one parameter of a
 * subclass; its fields are filled from configured parameters or from the field defaults.
 * Subclasses need a public no-argument constructor and public fields or bean properties
 * (instances are built and read with Jackson). Mark mandatory fields with
 * {@link com.stepflow.annotations.Required}.
 */
public abstract class StepParameters {
}
