package com.stepflow.stepinterface;

/**
 * Assignability between declared types, used to check artifacts wired into step inputs.
 */
public final class TypeCompatibility {

    private TypeCompatibility() {
    }

    /**
     * Whether an artifact declared as {@code source} may be passed where {@code target} is declared.
     * {@code Any} on either side is always compatible. A union source must fit the target with every
     * member; a union target accepts a source fitting any one member.
     */
    public static boolean isAssignable(DeclaredType target, DeclaredType source) {
        if (target.isAny() || source.isAny()) return true;
        if (source instanceof DeclaredType.Union) {
            for (DeclaredType member : source.members()) {
                if (!isAssignable(target, member)) return false;
            }
            return true;
        }
        if (target instanceof DeclaredType.Union) {
            for (DeclaredType member : target.members()) {
                if (isAssignable(member, source)) return true;
            }
            return false;
        }
        if (target instanceof DeclaredType.NoneType || source instanceof DeclaredType.NoneType) {
            return target.equals(source);
        }
        if (target instanceof DeclaredType.Scalar) {
            return source instanceof DeclaredType.Scalar
                    && ((DeclaredType.Scalar) target).kind().accepts(((DeclaredType.Scalar) source).kind());
        }
        // named target: plain class assignability, scalars through their boxed type
        return target.javaType().isAssignableFrom(source.javaType());
    }
}
