package com.stepflow.caching;

import com.stepflow.stepinterface.StepflowException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the compiled {@code .class} file of a type from its class loader. Nested classes are read
 * from their own class file.
 */
public final class ClassFileSourceCodeReader implements SourceCodeReader {

    @Override
    public byte[] read(Class<?> type) {
        String resource = "/" + type.getName().replace('.', '/') + ".class";
        try (InputStream in = type.getResourceAsStream(resource)) {
            if (in == null) {
                throw new StepflowException("Class file not found for " + type.getName() + " (" + resource + ")");
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StepflowException("Unable to read class file of " + type.getName(), e);
        }
    }
}
