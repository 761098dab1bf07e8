package com.stepflow.materializer;

import com.stepflow.stepconfig.Source;
import com.stepflow.stepinterface.DeclaredType;
import com.stepflow.stepinterface.StepInterfaceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps an output's declared type to the ordered list of materializer sources. Explicitly
 * configured sources win; otherwise every union member is looked up in the
 * {@link MaterializerRegistry} in declaration order.
 */
public final class MaterializerResolver {

    private final MaterializerRegistry registry;

    public MaterializerResolver() {
        this(MaterializerRegistry.getInstance());
    }

    public MaterializerResolver(MaterializerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @throws StepInterfaceException              if an explicit source is not a materializer
     * @throws MaterializerRequiredException       if the type is Any and nothing was configured
     * @throws MaterializerNotFoundException       naming the first union member without a materializer
     */
    public List<Source> resolve(String stepName, String outputName, DeclaredType declaredType, List<Source> explicitSources) {
        if (explicitSources != null && !explicitSources.isEmpty()) {
            for (Source source : explicitSources) {
                loadMaterializerClass(source, "output '" + outputName + "' of step '" + stepName + "'");
            }
            return List.copyOf(explicitSources);
        }
        if (declaredType.isAny()) {
            throw new MaterializerRequiredException(stepName, outputName);
        }
        List<Source> resolved = new ArrayList<>();
        for (DeclaredType member : declaredType.members()) {
            Class<? extends BaseMaterializer> materializer = registry.find(member.javaType())
                    .orElseThrow(() -> new MaterializerNotFoundException(stepName, outputName, member.describe()));
            resolved.add(Source.fromClass(materializer));
        }
        return List.copyOf(resolved);
    }

    /**
     * Loads a configured materializer source.
     *
     * @throws StepInterfaceException if the source does not resolve to a {@link BaseMaterializer} subclass
     */
    public static Class<? extends BaseMaterializer> loadMaterializerClass(Source source, String usedFor) {
        if (!source.isSubclassOf(BaseMaterializer.class)) {
            throw new StepInterfaceException("Materializer source `" + source + "` for " + usedFor
                    + " does not resolve to a BaseMaterializer subclass.");
        }
        return source.load().asSubclass(BaseMaterializer.class);
    }
}
