package com.stepflow.caching;

/**
 * Reads the implementation bytes whose hash identifies a class's code.
 */
@FunctionalInterface
public interface SourceCodeReader {

    /**
     * @throws com.stepflow.stepinterface.StepflowException if the code of the class cannot be read
     */
    byte[] read(Class<?> type);
}
