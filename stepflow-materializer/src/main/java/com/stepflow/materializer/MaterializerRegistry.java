package com.stepflow.materializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Global registry of default materializers by data type. Lookups walk the superclass chain first,
 * then implemented interfaces breadth-first, so a subtype resolves to the closest registered type.
 * The built-in materializers are registered on creation.
 */
public final class MaterializerRegistry {

    private static final Logger log = LoggerFactory.getLogger(MaterializerRegistry.class);

    private static final MaterializerRegistry INSTANCE = new MaterializerRegistry();

    private final Map<Class<?>, Class<? extends BaseMaterializer>> byType = new ConcurrentHashMap<>();

    public static MaterializerRegistry getInstance() {
        return INSTANCE;
    }

    private MaterializerRegistry() {
        registerBuiltIns();
    }

    /**
     * Registers a materializer for every type listed in its {@link com.stepflow.annotations.Materializes}.
     *
     * @throws IllegalArgumentException if the class is not annotated or a type already has a materializer
     */
    public void register(Class<? extends BaseMaterializer> materializer) {
        Objects.requireNonNull(materializer, "materializer");
        List<Class<?>> types = BaseMaterializer.associatedTypes(materializer);
        if (types.isEmpty()) {
            throw new IllegalArgumentException("Materializer must be annotated with @Materializes listing at least one type: "
                    + materializer.getName());
        }
        for (Class<?> type : types) {
            Class<? extends BaseMaterializer> existing = byType.putIfAbsent(type, materializer);
            if (existing != null && existing != materializer) {
                throw new IllegalArgumentException("Materializer already registered for " + type.getName() + ": " + existing.getName());
            }
        }
        log.debug("Registered materializer {} for {}", materializer.getName(), types);
    }

    /** Registers or replaces the default materializer of one type. */
    public void registerForType(Class<?> type, Class<? extends BaseMaterializer> materializer) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(materializer, "materializer");
        Class<? extends BaseMaterializer> previous = byType.put(type, materializer);
        if (previous != null && previous != materializer) {
            log.debug("Replaced materializer for {}: {} -> {}", type.getName(), previous.getName(), materializer.getName());
        }
    }

    public boolean isRegistered(Class<?> type) {
        return find(type).isPresent();
    }

    /**
     * Default materializer for {@code type} or its closest registered supertype.
     *
     * @throws IllegalArgumentException if nothing is registered for the type hierarchy
     */
    public Class<? extends BaseMaterializer> lookup(Class<?> type) {
        return find(type).orElseThrow(() ->
                new IllegalArgumentException("No materializer registered for " + type.getName()));
    }

    public Optional<Class<? extends BaseMaterializer>> find(Class<?> type) {
        if (type == null) return Optional.empty();
        Class<?> key = box(type);
        for (Class<?> c = key; c != null; c = c.getSuperclass()) {
            Class<? extends BaseMaterializer> m = byType.get(c);
            if (m != null) return Optional.of(m);
        }
        Deque<Class<?>> queue = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        for (Class<?> c = key; c != null; c = c.getSuperclass()) {
            Collections.addAll(queue, c.getInterfaces());
        }
        while (!queue.isEmpty()) {
            Class<?> iface = queue.removeFirst();
            if (!seen.add(iface)) continue;
            Class<? extends BaseMaterializer> m = byType.get(iface);
            if (m != null) return Optional.of(m);
            Collections.addAll(queue, iface.getInterfaces());
        }
        return Optional.empty();
    }

    public Map<Class<?>, Class<? extends BaseMaterializer>> getAll() {
        return Collections.unmodifiableMap(byType);
    }

    /**
     * Clears all registrations and registers the built-ins again (mainly for tests).
     */
    public void reset() {
        byType.clear();
        registerBuiltIns();
    }

    private void registerBuiltIns() {
        register(BuiltInMaterializer.class);
        register(JsonContainerMaterializer.class);
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == void.class) return Void.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        if (type == byte.class) return Byte.class;
        if (type == short.class) return Short.class;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == float.class) return Float.class;
        return Double.class;
    }
}
