package com.stepflow.materializer;

import com.stepflow.annotations.Materializes;

/**
 * Default materializer for strings, booleans, characters, numbers and null values.
 */
@Materializes(types = {
        String.class, Boolean.class, Character.class, Byte.class, Short.class,
        Integer.class, Long.class, Float.class, Double.class, Void.class
})
public class BuiltInMaterializer extends JsonFileMaterializer {

    public BuiltInMaterializer(String uri) {
        super(uri);
    }
}
