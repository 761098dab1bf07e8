package com.stepflow.materializer;

import com.stepflow.annotations.Materializes;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default materializer for maps, lists and sets of JSON-representable values.
 */
@Materializes(types = {Map.class, List.class, Set.class})
public class JsonContainerMaterializer extends JsonFileMaterializer {

    public JsonContainerMaterializer(String uri) {
        super(uri);
    }
}
