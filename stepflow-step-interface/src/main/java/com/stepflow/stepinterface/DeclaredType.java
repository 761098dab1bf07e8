package com.stepflow.stepinterface;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Declared type of a step input or output. A closed set of shapes built once during interface
 * analysis: {@link Scalar}, {@link Named}, {@link Union}, plus the unconstrained {@link AnyType}
 * and the null placeholder {@link NoneType}.
 */
public sealed interface DeclaredType {

    DeclaredType ANY = new AnyType();
    DeclaredType NONE = new NoneType();

    /** Human-readable form used in error messages (e.g. {@code Union[INTEGER, None]}). */
    String describe();

    /**
     * Class used as lookup key (e.g. in the materializer registry). {@code Void.class} for
     * {@link NoneType}, {@code Object.class} for {@link AnyType} and {@link Union}.
     */
    Class<?> javaType();

    /** Union members in declaration order; a single-element list for every other shape. */
    default List<DeclaredType> members() {
        return List.of(this);
    }

    default boolean isAny() {
        return this instanceof AnyType;
    }

    default boolean isUnion() {
        return this instanceof Union;
    }

    /**
     * Builds the declared type for a reflected Java type. Generic types collapse to their raw
     * class, except {@code Optional<T>} which becomes {@code Union[T, None]}.
     */
    static DeclaredType of(Type type) {
        if (type instanceof Class<?>) {
            return ofClass((Class<?>) type);
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType parameterized = (ParameterizedType) type;
            Type raw = parameterized.getRawType();
            if (raw == Optional.class) {
                Type[] args = parameterized.getActualTypeArguments();
                DeclaredType inner = args.length == 1 ? of(args[0]) : ANY;
                return union(List.of(inner, NONE));
            }
            return of(raw);
        }
        if (type instanceof GenericArrayType) {
            return new Named(Object[].class);
        }
        // type variables and wildcards carry no concrete type
        return ANY;
    }

    static DeclaredType ofClass(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (type == Object.class) return ANY;
        if (type == Void.class || type == void.class) return NONE;
        Optional<ScalarKind> kind = ScalarKind.forClass(type);
        if (kind.isPresent()) return new Scalar(kind.get());
        return new Named(type);
    }

    /** Union of the given classes ({@code Void.class} = null member), in order. */
    static DeclaredType unionOf(Class<?>... types) {
        return union(Arrays.stream(types).map(DeclaredType::ofClass).collect(Collectors.toList()));
    }

    /**
     * Builds a union, flattening nested unions and dropping duplicates. A union with a single
     * member is that member; a union containing {@code Any} is {@code Any}.
     */
    static DeclaredType union(List<DeclaredType> members) {
        List<DeclaredType> flat = new ArrayList<>();
        for (DeclaredType member : members) {
            for (DeclaredType m : member.members()) {
                if (m.isAny()) return ANY;
                if (!flat.contains(m)) flat.add(m);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("Union requires at least one member");
        }
        return flat.size() == 1 ? flat.get(0) : new Union(flat);
    }

    /** JSON-native scalar (string, boolean, character or number). */
    record Scalar(ScalarKind kind) implements DeclaredType {
        public Scalar {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String describe() {
            return kind.name();
        }

        @Override
        public Class<?> javaType() {
            return kind.boxedType();
        }
    }

    /** Any other class, identified by its fully qualified name. */
    record Named(Class<?> type) implements DeclaredType {
        public Named {
            Objects.requireNonNull(type, "type");
        }

        public String identifier() {
            return type.getName();
        }

        @Override
        public String describe() {
            return type.getName();
        }

        @Override
        public Class<?> javaType() {
            return type;
        }
    }

    /** One of several member types; members are never unions themselves. */
    record Union(List<DeclaredType> members) implements DeclaredType {
        public Union {
            members = List.copyOf(members);
        }

        @Override
        public String describe() {
            return members.stream().map(DeclaredType::describe).collect(Collectors.joining(", ", "Union[", "]"));
        }

        @Override
        public Class<?> javaType() {
            return Object.class;
        }
    }

    /** Unconstrained type; values and artifacts of any type are accepted. */
    record AnyType() implements DeclaredType {
        @Override
        public String describe() {
            return "Any";
        }

        @Override
        public Class<?> javaType() {
            return Object.class;
        }
    }

    /** Placeholder for an explicit null member of a union. */
    record NoneType() implements DeclaredType {
        @Override
        public String describe() {
            return "None";
        }

        @Override
        public Class<?> javaType() {
            return Void.class;
        }
    }
}
